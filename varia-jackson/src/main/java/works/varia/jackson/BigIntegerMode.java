package works.varia.jackson;

/**
 * What {@link JsonBridge#fromJson} does with an integral literal outside the 64-bit range.
 */
public enum BigIntegerMode {
	/**
	 * Reject the input with a {@link works.varia.exceptions.JsonParseException}.
	 */
	FAIL,

	/**
	 * Store the number as a decimal with scale zero.
	 * Literals with more than 38 digits are still rejected.
	 */
	DECIMAL,
}
