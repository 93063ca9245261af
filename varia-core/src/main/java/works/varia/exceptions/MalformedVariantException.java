package works.varia.exceptions;

/**
 * The bytes violate a structural rule of the format not covered by a more specific exception, such as an unrecognized header, a decimal out of range, or out-of-order object fields.
 */
public final class MalformedVariantException extends VariantFormatException {
	public MalformedVariantException(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public MalformedVariantException(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
