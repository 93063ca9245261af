package works.varia.encoding;

/**
 * The two low-order bits of every value header.
 */
public enum BasicType {
	PRIMITIVE,
	SHORT_STRING,
	OBJECT,
	ARRAY;

	private static final BasicType[] VALUES = values();

	public int id() {
		return ordinal();
	}

	public static BasicType fromHeader(int header) {
		return VALUES[header & VariantEncoding.BASIC_TYPE_MASK];
	}
}
