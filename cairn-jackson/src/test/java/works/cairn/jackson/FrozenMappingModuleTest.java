package works.cairn.jackson;

import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.cairn.FrozenMapping;
import works.cairn.hash.CanonicalHash;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrozenMappingModuleTest {
	private ObjectMapper mapper;

	private static final TypeReference<FrozenMapping<String, Object>> STRING_TO_OBJECT = new TypeReference<>() { };
	private static final TypeReference<FrozenMapping<Integer, String>> INTEGER_TO_STRING = new TypeReference<>() { };
	private static final TypeReference<FrozenMapping<String, FrozenMapping<String, Integer>>> NESTED = new TypeReference<>() { };

	@BeforeEach
	void setupMapper() {
		mapper = JsonMapper.builder()
			.addModule(new FrozenMappingModule())
			.build();
	}

	@Test
	void write_singleEntry_isArrayOfPairs() {
		assertEquals("[[\"spam\",1]]", mapper.writeValueAsString(FrozenMapping.of("spam", 1)));
	}

	@Test
	void write_empty_isEmptyArray() {
		assertEquals("[]", mapper.writeValueAsString(FrozenMapping.of()));
	}

	@Test
	void write_nonStringKey_isWrittenAsValue() {
		assertEquals("[[1,\"one\"]]", mapper.writeValueAsString(FrozenMapping.of(1, "one")));
	}

	@Test
	void write_nullValue_isNull() {
		assertEquals("[[\"spam\",null]]", mapper.writeValueAsString(FrozenMapping.of("spam", null)));
	}

	static Stream<FrozenMapping<String, Object>> stringToObjectMappings() {
		return Stream.of(
			FrozenMapping.of(),
			FrozenMapping.of("spam", 1),
			FrozenMapping.of("spam", 1, "eggs", 2.3),
			FrozenMapping.of("spam", "text", "eggs", true, "ham", -4.5),
			FrozenMapping.of("spam", null)
		);
	}

	@ParameterizedTest
	@MethodSource("stringToObjectMappings")
	void roundTrip_preservesContentAndDigest(FrozenMapping<String, Object> original) {
		String json = mapper.writeValueAsString(original);
		FrozenMapping<String, Object> actual = mapper.readValue(json, STRING_TO_OBJECT);
		assertEquals(original, actual);
		assertEquals(CanonicalHash.of(original), CanonicalHash.of(actual));
	}

	@Test
	void read_typedKeys() {
		FrozenMapping<Integer, String> actual = mapper.readValue("[[1,\"one\"],[2,\"two\"]]", INTEGER_TO_STRING);
		assertEquals(FrozenMapping.of(1, "one", 2, "two"), actual);
		assertEquals("one", actual.get(1));
	}

	@Test
	void read_nested() {
		FrozenMapping<String, FrozenMapping<String, Integer>> actual = mapper.readValue("[[\"outer\",[[\"inner\",3]]]]", NESTED);
		FrozenMapping<String, Integer> inner = actual.get("outer");
		assertInstanceOf(FrozenMapping.class, inner);
		assertEquals(3, inner.get("inner"));
	}

	@Test
	void read_nullValue() {
		FrozenMapping<String, Object> actual = mapper.readValue("[[\"spam\",null]]", STRING_TO_OBJECT);
		assertTrue(actual.containsKey("spam"));
		assertNull(actual.getOrDefault("spam", "missing"));
	}

	@Test
	void read_untyped_usesObject() {
		FrozenMapping<?, ?> actual = mapper.readValue("[[\"spam\",1]]", FrozenMapping.class);
		assertEquals(FrozenMapping.of("spam", 1), actual);
	}

	@Test
	void read_nullKey_throws() {
		JacksonException e = assertThrows(JacksonException.class, () -> mapper.readValue("[[null,1]]", STRING_TO_OBJECT));
		assertThat(e.getMessage(), containsString("key can't be null"));
	}

	@Test
	void read_duplicateKey_throws() {
		JacksonException e = assertThrows(JacksonException.class, () -> mapper.readValue("[[\"spam\",1],[\"spam\",2]]", STRING_TO_OBJECT));
		assertThat(e.getMessage(), containsString("appears twice"));
	}

	@Test
	void read_wrongArity_throws() {
		assertThrows(JacksonException.class, () -> mapper.readValue("[[\"spam\",1,2]]", STRING_TO_OBJECT));
		assertThrows(JacksonException.class, () -> mapper.readValue("[[\"spam\"]]", STRING_TO_OBJECT));
	}

	@Test
	void read_object_throws() {
		assertThrows(JacksonException.class, () -> mapper.readValue("{\"spam\":1}", STRING_TO_OBJECT));
	}

	@Test
	void read_wrongValueType_throws() {
		assertThrows(JacksonException.class, () -> mapper.readValue("[[\"one\",\"two\"]]", INTEGER_TO_STRING));
	}
}
