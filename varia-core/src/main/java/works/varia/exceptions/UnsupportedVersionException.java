package works.varia.exceptions;

/**
 * The metadata header declares a format version this library does not understand.
 */
public final class UnsupportedVersionException extends VariantFormatException {
	public UnsupportedVersionException(String message, int byteOffset) {
		super(message, byteOffset);
	}

	public UnsupportedVersionException(String message, int byteOffset, Throwable cause) {
		super(message, byteOffset, cause);
	}
}
