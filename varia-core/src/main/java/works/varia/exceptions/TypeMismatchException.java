package works.varia.exceptions;

/**
 * A typed accessor was called on a value of a different kind.
 */
public final class TypeMismatchException extends VariantException {
	public TypeMismatchException(String message) {
		super(message);
	}
}
