/**
 * Building, decoding, and validating variant values in the Parquet Variant binary encoding.
 * <p>
 * Start with {@link works.varia.VariantBuilder} to encode a value and {@link works.varia.Variant} to read one.
 * Untrusted bytes should pass through {@link works.varia.VariantValidator} first.
 * Bit-level layout helpers are in {@link works.varia.encoding},
 * and the error hierarchy is in {@link works.varia.exceptions}.
 */
module works.varia.core {
	requires org.slf4j;

	exports works.varia;
	exports works.varia.encoding;
	exports works.varia.exceptions;
}
