/**
 * Reads JSON text with Jackson and converts it to MessagePack.
 * <p>
 * See {@link works.jsonpack.jackson.JacksonJsonPackConverter} for the main entry point.
 */
module works.jsonpack.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.jsonpack.core;

	requires static lombok;

	exports works.jsonpack.jackson;
}
