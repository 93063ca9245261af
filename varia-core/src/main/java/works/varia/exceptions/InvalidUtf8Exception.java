package works.varia.exceptions;

/**
 * A dictionary entry or string value is not valid UTF-8.
 */
public final class InvalidUtf8Exception extends VariantFormatException {
	public InvalidUtf8Exception(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public InvalidUtf8Exception(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
