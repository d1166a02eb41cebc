package works.cairn;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.AbstractMap.SimpleEntry;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pcollections.HashTreePMap;
import works.cairn.exceptions.IllegalMutationException;
import works.cairn.exceptions.KeyNotFoundException;
import works.cairn.exceptions.UsageException;
import works.cairn.exceptions.ValidationException;
import works.cairn.hash.CanonicalHash;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrozenMappingTest {
	private final FrozenMapping<String, Object> spamEggs = FrozenMapping.of("spam", 1, "eggs", 2.3);

	static Stream<Object> equivalentSources() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("spam", 1);
		map.put("eggs", 2.3);
		return Stream.of(
			map,
			HashTreePMap.from(map),
			FrozenMapping.copyOf(map),
			List.of(List.of("spam", 1), List.of("eggs", 2.3)),
			List.of(new SimpleEntry<>("eggs", 2.3), new SimpleEntry<>("spam", 1)),
			map.entrySet(),
			Stream.of(List.of("spam", 1), List.of("eggs", 2.3))
		);
	}

	@ParameterizedTest
	@MethodSource("equivalentSources")
	void from_acceptsPairs(Object source) {
		FrozenMapping<Object, Object> actual = FrozenMapping.from(source);
		assertEquals(spamEggs, actual);
		assertEquals(spamEggs.digest(), actual.digest());
	}

	@Test
	void from_acceptsArrayOfArrays() {
		Object[][] pairs = { { "spam", 1 }, { "eggs", 2.3 } };
		assertEquals(spamEggs, FrozenMapping.from(pairs));
	}

	static Stream<Object> malformedSources() {
		return Stream.of(
			List.of("spam", "eggs"),
			List.of(List.of("spam", 1, 2)),
			List.of(List.of("spam")),
			"spam",
			42,
			null
		);
	}

	@ParameterizedTest
	@MethodSource("malformedSources")
	void from_rejectsMalformed(Object source) {
		assertThrows(ValidationException.class, () -> FrozenMapping.from(source));
	}

	@Test
	void nullKey_throws() {
		Map<String, Object> map = new HashMap<>();
		map.put(null, 1);
		assertThrows(ValidationException.class, () -> FrozenMapping.copyOf(map));
		assertThrows(ValidationException.class, () -> FrozenMapping.of(null, 1));
	}

	@Test
	void nullValue_allowed() {
		Map<String, Object> map = new HashMap<>();
		map.put("nothing", null);
		FrozenMapping<String, Object> mapping = FrozenMapping.copyOf(map);
		assertTrue(mapping.containsKey("nothing"));
		assertNull(mapping.get("nothing"));
	}

	@Test
	void duplicatePairs_lastWins() {
		assertEquals(FrozenMapping.of("a", 2), FrozenMapping.from(List.of(List.of("a", 1), List.of("a", 2))));
	}

	@Test
	void get_works() {
		assertEquals(1, spamEggs.get("spam"));
		assertEquals(2.3, spamEggs.get("eggs"));
	}

	@Test
	void getMissing_throws() {
		KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> spamEggs.get("foo"));
		assertEquals("foo", e.key());
		assertEquals("fallback", spamEggs.getOrDefault("foo", "fallback"));
	}

	@Test
	void readOperations_work() {
		assertTrue(spamEggs.containsKey("spam"));
		assertFalse(spamEggs.containsKey("foo"));
		assertEquals(Set.of("spam", "eggs"), spamEggs.keys());
		assertEquals(2, spamEggs.size());
		assertFalse(spamEggs.isEmpty());
		assertTrue(FrozenMapping.of().isEmpty());
		assertEquals(2, spamEggs.entries().size());
	}

	@Test
	void mapView_isReadOnly() {
		Map<String, Object> view = spamEggs.asMap();
		assertEquals(2.3, view.get("eggs"));
		assertThrows(IllegalMutationException.class, () -> view.put("eggs", 3));
		assertThrows(IllegalMutationException.class, () -> view.remove("eggs"));
		assertThrows(IllegalMutationException.class, view::clear);
		assertThrows(IllegalMutationException.class, () -> view.putAll(Map.of("x", 1)));
		assertThrows(IllegalMutationException.class, () -> view.computeIfAbsent("x", k -> 1));
		assertThrows(IllegalMutationException.class, () -> view.keySet().remove("eggs"));
		assertThrows(IllegalMutationException.class, () -> view.entrySet().iterator().next().setValue(5));
		assertEquals(2.3, spamEggs.get("eggs"));
	}

	@Test
	void copy_isIndependent() {
		HashMap<String, Object> copy = spamEggs.copy();
		copy.put("eggs", 3);
		assertEquals(3, copy.get("eggs"));
		assertEquals(2.3, spamEggs.get("eggs"));
	}

	@Test
	void copyOfView_returnsOriginal() {
		assertEquals(spamEggs, FrozenMapping.copyOf(spamEggs.asMap()));
	}

	@Test
	void plainMap_neverEqual() {
		Map<String, Object> plain = new HashMap<>(spamEggs.copy());
		assertNotEquals(spamEggs, plain);
		assertNotEquals(plain, spamEggs);
	}

	@Test
	void equality_ignoresOrder() {
		FrozenMapping<String, Object> reversed = FrozenMapping.of("eggs", 2.3, "spam", 1);
		assertEquals(spamEggs, reversed);
		assertEquals(spamEggs.hashCode(), reversed.hashCode());
		assertEquals(spamEggs.digest(), reversed.digest());
		assertNotEquals(spamEggs, FrozenMapping.of("spam", 1, "eggs", 2.4));
	}

	@Test
	void equality_isRepeatable() {
		FrozenMapping<String, Object> a = FrozenMapping.of("k", 1);
		FrozenMapping<String, Object> b = FrozenMapping.of("k", 1);
		assertEquals(a, b);
		assertEquals(a, b);
		assertEquals(b, a);
		assertEquals(1, a.get("k"));
		assertEquals(1, b.get("k"));
	}

	@Test
	void digest_matchesCanonicalHash() {
		assertEquals(CanonicalHash.of(spamEggs), spamEggs.digest());
		assertEquals(CanonicalHash.mapping(spamEggs.copy()), spamEggs.digest());
	}

	@Test
	void javaSerialization_roundTrips() throws IOException, ClassNotFoundException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
			out.writeObject(spamEggs);
		}
		Object deserialized;
		try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
			deserialized = in.readObject();
		}
		assertInstanceOf(FrozenMapping.class, deserialized);
		assertEquals(spamEggs, deserialized);
	}

	@Test
	void typed_coercesKeysAndValues() {
		FrozenMapping.Factory<String, Double> factory = FrozenMapping.typed(String.class, Double.class);
		FrozenMapping<String, Double> result = factory.coerce(Map.of("spam", 1, "eggs", 2.5));
		assertEquals(1.0, result.get("spam"));
		assertEquals(2.5, result.get("eggs"));
		assertEquals("FrozenMapping[String, Double]", factory.name());
	}

	@Test
	void typed_rejectsBadValues() {
		FrozenMapping.Factory<String, Long> factory = FrozenMapping.typed(String.class, Long.class);
		assertThrows(ValidationException.class, () -> factory.coerce(Map.of("spam", "1")));
		assertThrows(ValidationException.class, () -> factory.coerce(Map.of(1, 1)));
	}

	@Test
	void parameterize_requiresTwoTypes() {
		assertEquals(FrozenMapping.typed(String.class, Long.class), FrozenMapping.parameterize(String.class, Long.class));
		UsageException e = assertThrows(UsageException.class, () -> FrozenMapping.parameterize(String.class));
		assertThat(e.getMessage(), containsString("exactly 2"));
		assertThrows(UsageException.class, () -> FrozenMapping.parameterize(String.class, Long.class, Double.class));
	}
}
