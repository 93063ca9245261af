package works.varia.encoding;

import java.util.Optional;

/**
 * The primitive type ids carried in the upper six bits of a
 * {@link BasicType#PRIMITIVE PRIMITIVE} value header.
 * <p>
 * {@link #payloadSize} is the number of bytes following the header,
 * or {@link #VARIABLE} for the length-prefixed types.
 */
public enum PrimitiveType {
	NULL(0, 0),
	TRUE(1, 0),
	FALSE(2, 0),
	INT8(3, 1),
	INT16(4, 2),
	INT32(5, 4),
	INT64(6, 8),
	DOUBLE(7, 8),
	DECIMAL4(8, 1 + 4),
	DECIMAL8(9, 1 + 8),
	DECIMAL16(10, 1 + 16),
	DATE(11, 4),
	TIMESTAMP_MICROS(12, 8),
	TIMESTAMP_NTZ_MICROS(13, 8),
	FLOAT(14, 4),
	BINARY(15, -1),
	STRING(16, -1),
	TIME_NTZ_MICROS(17, 8),
	TIMESTAMP_NANOS(18, 8),
	TIMESTAMP_NTZ_NANOS(19, 8),
	UUID(20, 16);

	public static final int VARIABLE = -1;

	private final int id;
	private final int payloadSize;

	PrimitiveType(int id, int payloadSize) {
		this.id = id;
		this.payloadSize = payloadSize;
	}

	private static final PrimitiveType[] BY_ID = new PrimitiveType[values().length];
	static {
		for (PrimitiveType t: values()) {
			BY_ID[t.id] = t;
		}
	}

	public int id() {
		return id;
	}

	public int payloadSize() {
		return payloadSize;
	}

	public boolean hasVariableSize() {
		return payloadSize == VARIABLE;
	}

	public static Optional<PrimitiveType> fromId(int id) {
		if (id < 0 || id >= BY_ID.length) {
			return Optional.empty();
		}
		return Optional.ofNullable(BY_ID[id]);
	}
}
