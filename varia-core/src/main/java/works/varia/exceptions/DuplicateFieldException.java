package works.varia.exceptions;

/**
 * The same field name was appended twice to one object.
 */
public final class DuplicateFieldException extends VariantBuildException {
	private final String fieldName;

	public DuplicateFieldException(String fieldName) {
		super("Duplicate field \"" + fieldName + "\"");
		this.fieldName = fieldName;
	}

	public String fieldName() {
		return fieldName;
	}
}
