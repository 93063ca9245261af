package works.varia.exceptions;

/**
 * Base class of every error raised while building, decoding, validating,
 * or converting variant values.
 */
public sealed abstract class VariantException extends RuntimeException permits
	VariantFormatException,
	VariantBuildException,
	TypeMismatchException,
	JsonParseException
{
	protected VariantException(String message) {
		super(message);
	}

	protected VariantException(String message, Throwable cause) {
		super(message, cause);
	}
}
