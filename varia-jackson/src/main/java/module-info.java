/**
 * Conversion between JSON text and variant values, using the Jackson library.
 * <p>
 * See {@link works.varia.jackson.JsonBridge} for the main entry point.
 */
module works.varia.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.varia.core;

	exports works.varia.jackson;
}
