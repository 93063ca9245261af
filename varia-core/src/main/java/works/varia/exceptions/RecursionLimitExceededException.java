package works.varia.exceptions;

/**
 * Nesting is deeper than the configured limit.
 */
public final class RecursionLimitExceededException extends VariantFormatException {
	public RecursionLimitExceededException(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public RecursionLimitExceededException(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
