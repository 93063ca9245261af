package works.varia;

import works.varia.encoding.BasicType;
import works.varia.encoding.PrimitiveType;

/**
 * The concrete kind of a variant value, as determined by its header byte alone.
 * <p>
 * {@link #BOOLEAN} covers both the {@code true} and {@code false} primitive headers.
 */
public enum VariantKind {
	NULL,
	BOOLEAN,
	INT8,
	INT16,
	INT32,
	INT64,
	FLOAT,
	DOUBLE,
	DECIMAL4,
	DECIMAL8,
	DECIMAL16,
	DATE,
	TIMESTAMP_MICROS,
	TIMESTAMP_NTZ_MICROS,
	TIMESTAMP_NANOS,
	TIMESTAMP_NTZ_NANOS,
	TIME_NTZ_MICROS,
	BINARY,
	UUID,
	SHORT_STRING,
	STRING,
	ARRAY,
	OBJECT;

	public boolean isInteger() {
		return this == INT8 || this == INT16 || this == INT32 || this == INT64;
	}

	public boolean isDecimal() {
		return this == DECIMAL4 || this == DECIMAL8 || this == DECIMAL16;
	}

	public boolean isString() {
		return this == SHORT_STRING || this == STRING;
	}

	public boolean isTimestamp() {
		return this == TIMESTAMP_MICROS || this == TIMESTAMP_NTZ_MICROS
			|| this == TIMESTAMP_NANOS || this == TIMESTAMP_NTZ_NANOS;
	}

	public boolean isComposite() {
		return this == ARRAY || this == OBJECT;
	}

	static VariantKind of(BasicType basicType, PrimitiveType primitiveType) {
		return switch (basicType) {
			case SHORT_STRING -> SHORT_STRING;
			case OBJECT -> OBJECT;
			case ARRAY -> ARRAY;
			case PRIMITIVE -> of(primitiveType);
		};
	}

	static VariantKind of(PrimitiveType primitiveType) {
		return switch (primitiveType) {
			case NULL -> NULL;
			case TRUE, FALSE -> BOOLEAN;
			case INT8 -> INT8;
			case INT16 -> INT16;
			case INT32 -> INT32;
			case INT64 -> INT64;
			case DOUBLE -> DOUBLE;
			case DECIMAL4 -> DECIMAL4;
			case DECIMAL8 -> DECIMAL8;
			case DECIMAL16 -> DECIMAL16;
			case DATE -> DATE;
			case TIMESTAMP_MICROS -> TIMESTAMP_MICROS;
			case TIMESTAMP_NTZ_MICROS -> TIMESTAMP_NTZ_MICROS;
			case FLOAT -> FLOAT;
			case BINARY -> BINARY;
			case STRING -> STRING;
			case TIME_NTZ_MICROS -> TIME_NTZ_MICROS;
			case TIMESTAMP_NANOS -> TIMESTAMP_NANOS;
			case TIMESTAMP_NTZ_NANOS -> TIMESTAMP_NTZ_NANOS;
			case UUID -> UUID;
		};
	}
}
