package works.cairn.jackson;

import org.junit.jupiter.api.Test;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.cairn.FrozenMapping;
import works.cairn.hash.CanonicalHash;
import works.cairn.hash.Digest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DigestModuleTest {
	private final ObjectMapper mapper = JsonMapper.builder()
		.addModule(new DigestModule())
		.addModule(new FrozenMappingModule())
		.build();

	@Test
	void write_isHexString() {
		Digest digest = CanonicalHash.of("abc");
		assertEquals("\"f8ddcad11e4be46276e9d148797aa2e89804bb58\"", mapper.writeValueAsString(digest));
	}

	@Test
	void read_hexString() {
		Digest expected = CanonicalHash.of(1L);
		assertEquals(expected, mapper.readValue("\"" + expected.hex() + "\"", Digest.class));
	}

	@Test
	void roundTrip_asMappingValue() {
		FrozenMapping<String, Digest> original = FrozenMapping.of("key", CanonicalHash.of(FrozenMapping.of("spam", 1)));
		String json = mapper.writeValueAsString(original);
		assertEquals(original, mapper.readValue(json, new TypeReference<FrozenMapping<String, Digest>>() { }));
	}

	@Test
	void read_malformedHex_throws() {
		assertThrows(JacksonException.class, () -> mapper.readValue("\"not hex\"", Digest.class));
		assertThrows(JacksonException.class, () -> mapper.readValue("\"abcd\"", Digest.class));
	}

	@Test
	void read_nonString_throws() {
		assertThrows(JacksonException.class, () -> mapper.readValue("123", Digest.class));
	}
}
