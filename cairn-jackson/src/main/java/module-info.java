/**
 * Jackson support for Cairn's value types.
 * <p>
 * See {@link works.cairn.jackson.CairnJacksonModule} for the main entry point.
 */
module works.cairn.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires transitive works.cairn.core;

	exports works.cairn.jackson;
}
