package works.cairn.jackson;

import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.JacksonModule;

/**
 * Base class for Cairn's Jackson modules. Register them with a mapper as usual:
 *
 * <pre>
 * JsonMapper mapper = JsonMapper.builder()
 *     .addModule(new FrozenMappingModule())
 *     .addModule(new DigestModule())
 *     .build();
 * </pre>
 */
public abstract class CairnJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

}
