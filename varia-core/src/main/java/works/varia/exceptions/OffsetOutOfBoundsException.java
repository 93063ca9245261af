package works.varia.exceptions;

/**
 * An offset, length, index, or dictionary id points outside the bytes it must stay within.
 */
public final class OffsetOutOfBoundsException extends VariantFormatException {
	public OffsetOutOfBoundsException(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public OffsetOutOfBoundsException(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
