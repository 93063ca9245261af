package works.varia.exceptions;

/**
 * The metadata or value bytes are not a well-formed variant.
 * <p>
 * {@link #byteOffset()} is the position, within the buffer being examined,
 * where the problem was detected, or {@link #UNKNOWN_OFFSET} if there is no
 * meaningful position.
 */
public sealed abstract class VariantFormatException extends VariantException permits
	UnsupportedVersionException,
	OffsetOutOfBoundsException,
	InvalidUtf8Exception,
	UnsortedDictionaryException,
	RecursionLimitExceededException,
	MalformedVariantException
{
	public static final int UNKNOWN_OFFSET = -1;

	private final int byteOffset;

	protected VariantFormatException(String message, int byteOffset) {
		super(byteOffset == UNKNOWN_OFFSET ? message : message + " (at byte " + byteOffset + ")");
		this.byteOffset = byteOffset;
	}

	protected VariantFormatException(String message, int byteOffset, Throwable cause) {
		super(byteOffset == UNKNOWN_OFFSET ? message : message + " (at byte " + byteOffset + ")", cause);
		this.byteOffset = byteOffset;
	}

	public int byteOffset() {
		return byteOffset;
	}
}
