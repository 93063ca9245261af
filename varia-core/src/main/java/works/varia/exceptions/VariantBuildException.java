package works.varia.exceptions;

/**
 * A value could not be appended to a builder.
 * Throwing this aborts the composite scope that was being built:
 * none of its bytes are committed to the parent.
 */
public sealed class VariantBuildException extends VariantException permits DuplicateFieldException {
	public VariantBuildException(String message) {
		super(message);
	}

	public VariantBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
