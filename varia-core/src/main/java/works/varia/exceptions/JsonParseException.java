package works.varia.exceptions;

/**
 * The input text is not valid JSON, or contains a value that cannot be represented as a variant.
 * <p>
 * The location is where the problem was noticed, with one-based line and column numbers,
 * or -1 where unknown.
 */
public final class JsonParseException extends VariantException {
	private final long charOffset;
	private final int line;
	private final int column;

	public JsonParseException(String message, long charOffset, int line, int column) {
		super(message + " (line " + line + ", column " + column + ")");
		this.charOffset = charOffset;
		this.line = line;
		this.column = column;
	}

	public JsonParseException(String message, long charOffset, int line, int column, Throwable cause) {
		super(message + " (line " + line + ", column " + column + ")", cause);
		this.charOffset = charOffset;
		this.line = line;
		this.column = column;
	}

	public long charOffset() {
		return charOffset;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
