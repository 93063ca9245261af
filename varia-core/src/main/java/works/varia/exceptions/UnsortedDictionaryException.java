package works.varia.exceptions;

/**
 * A lookup requires sorted field names, but the dictionary or object is not sorted.
 */
public final class UnsortedDictionaryException extends VariantFormatException {
	public UnsortedDictionaryException(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public UnsortedDictionaryException(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
