package works.varia;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.CharacterCodingException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.varia.encoding.ByteWriter;
import works.varia.encoding.PrimitiveType;
import works.varia.encoding.Utf8;
import works.varia.exceptions.VariantBuildException;

import static works.varia.encoding.VariantEncoding.MAX_DECIMAL16_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_DECIMAL4_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_DECIMAL8_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_SHORT_STRING_SIZE;
import static works.varia.encoding.VariantEncoding.MICROS_PER_DAY;
import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.primitiveHeader;
import static works.varia.encoding.VariantEncoding.shortStringHeader;

/**
 * Something a value can be appended to: the root {@link VariantBuilder},
 * an {@link ObjectBuilder} after a {@link ObjectBuilder#key key}, or an {@link ArrayBuilder}.
 * <p>
 * Each appender writes the narrowest encoding that represents the value exactly.
 * <p>
 * At most one nested scope, started by {@link #startObject} or {@link #startArray},
 * is open at a time. Its bytes reach this appender only when the nested builder's
 * {@code end()} is called. Appending anything else here while it is still open
 * discards it, as does {@link CompositeBuilder#close() closing} it without ending it.
 */
public abstract sealed class ValueAppender permits VariantBuilder, CompositeBuilder {
	final MetadataBuilder metadata;
	private CompositeBuilder openChild = null;

	ValueAppender(MetadataBuilder metadata) {
		this.metadata = metadata;
	}

	/**
	 * The buffer that receives the next value.
	 */
	abstract ByteWriter writer();

	/**
	 * Called before any bytes of a value are written.
	 * @throws IllegalStateException if a value is not allowed here now
	 */
	abstract void beginValue();

	/**
	 * Called once the value occupying <code>[start, writer().size())</code> is complete.
	 */
	abstract void endValue(int start);

	/**
	 * Called when a nested scope that started a value is discarded before its bytes were written.
	 */
	abstract void abandonValue();

	/**
	 * @throws IllegalStateException if this appender no longer accepts values
	 */
	abstract void checkOpen();

	/**
	 * Discards this appender's scope, if it has one, because a build error occurred inside it.
	 */
	abstract void abortScope();

	public void appendNull() {
		appendHeaderOnly(PrimitiveType.NULL);
	}

	public void appendBoolean(boolean value) {
		appendHeaderOnly(value ? PrimitiveType.TRUE : PrimitiveType.FALSE);
	}

	/**
	 * Writes the narrowest of {@code int8}, {@code int16}, {@code int32}, or {@code int64}
	 * that holds <code>value</code>.
	 */
	public void appendLong(long value) {
		PrimitiveType type;
		if (value == (byte) value) {
			type = PrimitiveType.INT8;
		} else if (value == (short) value) {
			type = PrimitiveType.INT16;
		} else if (value == (int) value) {
			type = PrimitiveType.INT32;
		} else {
			type = PrimitiveType.INT64;
		}
		appendFixed(type, value);
	}

	public void appendFloat(float value) {
		appendFixed(PrimitiveType.FLOAT, Float.floatToRawIntBits(value));
	}

	public void appendDouble(double value) {
		appendFixed(PrimitiveType.DOUBLE, Double.doubleToRawLongBits(value));
	}

	/**
	 * Writes the narrowest decimal width that holds the value.
	 * A negative scale is normalized to zero.
	 *
	 * @throws VariantBuildException if the value needs more than 38 digits
	 */
	public void appendDecimal(BigDecimal value) {
		BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
		appendDecimal(normalized.unscaledValue(), normalized.precision(), normalized.scale());
	}

	/**
	 * @param precision the declared number of digits; the width is chosen to hold
	 *                  this many digits at the given scale.
	 * @throws VariantBuildException if the unscaled value has more digits than <code>precision</code>,
	 *                               or the precision or scale exceeds 38
	 */
	public void appendDecimal(BigInteger unscaled, int precision, int scale) {
		int digits = unscaled.signum() == 0 ? 1 : unscaled.abs().toString().length();
		int required = Math.max(precision, scale);
		if (scale < 0) {
			throw buildError("Negative decimal scale " + scale);
		} else if (digits > precision) {
			throw buildError("Unscaled value " + unscaled + " has more than " + precision + " digits");
		} else if (required > MAX_DECIMAL16_PRECISION) {
			throw buildError("Decimal precision " + required + " exceeds " + MAX_DECIMAL16_PRECISION);
		}
		int start = begin();
		ByteWriter out = writer();
		if (required <= MAX_DECIMAL4_PRECISION) {
			out.writeByte(primitiveHeader(PrimitiveType.DECIMAL4));
			out.writeByte(scale);
			out.writeLittleEndianValue(unscaled.intValue(), 4);
		} else if (required <= MAX_DECIMAL8_PRECISION) {
			out.writeByte(primitiveHeader(PrimitiveType.DECIMAL8));
			out.writeByte(scale);
			out.writeLittleEndianValue(unscaled.longValue(), 8);
		} else {
			out.writeByte(primitiveHeader(PrimitiveType.DECIMAL16));
			out.writeByte(scale);
			out.writeLittleEndianValue(unscaled.longValue(), 8);
			out.writeLittleEndianValue(unscaled.shiftRight(64).longValue(), 8);
		}
		endValue(start);
	}

	public void appendDate(LocalDate date) {
		long epochDay = date.toEpochDay();
		if (epochDay != (int) epochDay) {
			throw buildError("Date out of range: " + date);
		}
		appendDate((int) epochDay);
	}

	public void appendDate(int daysSinceEpoch) {
		appendFixed(PrimitiveType.DATE, daysSinceEpoch);
	}

	/**
	 * @param utcAdjusted true for an instant on the UTC timeline;
	 *                    false for a wall-clock timestamp with no time zone.
	 */
	public void appendTimestampMicros(long microsSinceEpoch, boolean utcAdjusted) {
		appendFixed(utcAdjusted ? PrimitiveType.TIMESTAMP_MICROS : PrimitiveType.TIMESTAMP_NTZ_MICROS, microsSinceEpoch);
	}

	public void appendTimestampNanos(long nanosSinceEpoch, boolean utcAdjusted) {
		appendFixed(utcAdjusted ? PrimitiveType.TIMESTAMP_NANOS : PrimitiveType.TIMESTAMP_NTZ_NANOS, nanosSinceEpoch);
	}

	/**
	 * Writes a UTC-adjusted microsecond timestamp; sub-microsecond precision is truncated toward negative infinity.
	 */
	public void appendTimestamp(Instant instant) {
		appendTimestampMicros(toMicros(instant.getEpochSecond(), instant.getNano()), true);
	}

	/**
	 * Writes a microsecond timestamp with no time zone; sub-microsecond precision is truncated.
	 */
	public void appendTimestamp(LocalDateTime dateTime) {
		appendTimestampMicros(toMicros(dateTime.toEpochSecond(ZoneOffset.UTC), dateTime.getNano()), false);
	}

	public void appendTime(LocalTime time) {
		appendTimeMicros(time.toNanoOfDay() / 1_000);
	}

	/**
	 * @throws VariantBuildException unless <code>0 &lt;= microsSinceMidnight &lt; 86_400_000_000</code>
	 */
	public void appendTimeMicros(long microsSinceMidnight) {
		if (microsSinceMidnight < 0 || microsSinceMidnight >= MICROS_PER_DAY) {
			throw buildError("Time of day out of range: " + microsSinceMidnight + " microseconds");
		}
		appendFixed(PrimitiveType.TIME_NTZ_MICROS, microsSinceMidnight);
	}

	public void appendUuid(UUID uuid) {
		int start = begin();
		ByteWriter out = writer();
		out.writeByte(primitiveHeader(PrimitiveType.UUID));
		writeBigEndian(out, uuid.getMostSignificantBits());
		writeBigEndian(out, uuid.getLeastSignificantBits());
		endValue(start);
	}

	public void appendBinary(byte[] bytes) {
		appendBinary(bytes, 0, bytes.length);
	}

	public void appendBinary(byte[] bytes, int offset, int length) {
		int start = begin();
		ByteWriter out = writer();
		out.writeByte(primitiveHeader(PrimitiveType.BINARY));
		out.writeLittleEndianValue(length, U32_SIZE);
		out.writeBytes(bytes, offset, length);
		endValue(start);
	}

	/**
	 * Strings of up to 63 UTF-8 bytes are written as short strings;
	 * longer ones carry an explicit four-byte length.
	 *
	 * @throws VariantBuildException if <code>value</code> contains an unpaired surrogate
	 */
	public void appendString(String value) {
		byte[] utf8;
		try {
			utf8 = Utf8.encode(value);
		} catch (CharacterCodingException e) {
			throw buildError("String contains an unpaired surrogate", e);
		}
		int start = begin();
		ByteWriter out = writer();
		if (utf8.length <= MAX_SHORT_STRING_SIZE) {
			out.writeByte(shortStringHeader(utf8.length));
		} else {
			out.writeByte(primitiveHeader(PrimitiveType.STRING));
			out.writeLittleEndianValue(utf8.length, U32_SIZE);
		}
		out.writeBytes(utf8);
		endValue(start);
	}

	/**
	 * Copies a decoded value, possibly from another variant with a different dictionary.
	 * Object field names are re-added to this builder's dictionary.
	 */
	public void appendVariant(Variant value) {
		switch (value.kind()) {
			case NULL -> appendNull();
			case BOOLEAN -> appendBoolean(value.getBoolean());
			case INT8, INT16, INT32, INT64 -> appendLong(value.getLong());
			case FLOAT -> appendFloat(value.getFloat());
			case DOUBLE -> appendDouble(value.getDouble());
			case DECIMAL4, DECIMAL8, DECIMAL16 -> appendDecimal(value.getDecimal());
			case DATE -> appendDate(value.getEpochDay());
			case TIMESTAMP_MICROS, TIMESTAMP_NTZ_MICROS -> appendTimestampMicros(value.getTimestampMicros(), value.kind() == VariantKind.TIMESTAMP_MICROS);
			case TIMESTAMP_NANOS, TIMESTAMP_NTZ_NANOS -> appendTimestampNanos(value.getTimestampNanos(), value.kind() == VariantKind.TIMESTAMP_NANOS);
			case TIME_NTZ_MICROS -> appendTimeMicros(value.getTimeMicros());
			case BINARY -> appendBinary(value.getBinaryBytes());
			case UUID -> appendUuid(value.getUuid());
			case SHORT_STRING, STRING -> appendString(value.getString());
			case ARRAY -> {
				try (ArrayBuilder array = startArray()) {
					for (Variant element: value.getArray()) {
						array.appendVariant(element);
					}
					array.end();
				}
			}
			case OBJECT -> {
				try (ObjectBuilder object = startObject()) {
					for (VariantObject.Field field: value.getObject().fields()) {
						object.key(field.name());
						object.appendVariant(field.value());
					}
					object.end();
				}
			}
		}
	}

	/**
	 * Appends a {@link Map} of field names to values as an object, where each value is
	 * null, a {@link Boolean}, an integral {@link Number}, {@link Float}, {@link Double},
	 * {@link BigDecimal}, {@link String}, {@code byte[]}, {@link UUID}, {@link LocalDate},
	 * {@link Instant}, {@link LocalDateTime}, {@link LocalTime}, {@link Variant},
	 * another such {@link Map}, or an {@link Iterable} of such values.
	 *
	 * @throws IllegalArgumentException if a value has none of those types
	 */
	public void appendObject(Map<String, ?> fields) {
		try (ObjectBuilder object = startObject()) {
			for (Map.Entry<String, ?> entry: fields.entrySet()) {
				object.key(entry.getKey());
				object.appendJavaValue(entry.getValue());
			}
			object.end();
		}
	}

	/**
	 * Appends the elements as an array. Elements follow the rules of {@link #appendObject}.
	 */
	public void appendArray(Iterable<?> elements) {
		try (ArrayBuilder array = startArray()) {
			for (Object element: elements) {
				array.appendJavaValue(element);
			}
			array.end();
		}
	}

	void appendJavaValue(Object value) {
		if (value == null) {
			appendNull();
		} else if (value instanceof Boolean b) {
			appendBoolean(b);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			appendLong(((Number) value).longValue());
		} else if (value instanceof Float f) {
			appendFloat(f);
		} else if (value instanceof Double d) {
			appendDouble(d);
		} else if (value instanceof BigDecimal d) {
			appendDecimal(d);
		} else if (value instanceof BigInteger i) {
			appendDecimal(new BigDecimal(i));
		} else if (value instanceof String s) {
			appendString(s);
		} else if (value instanceof byte[] bytes) {
			appendBinary(bytes);
		} else if (value instanceof UUID uuid) {
			appendUuid(uuid);
		} else if (value instanceof LocalDate date) {
			appendDate(date);
		} else if (value instanceof Instant instant) {
			appendTimestamp(instant);
		} else if (value instanceof LocalDateTime dateTime) {
			appendTimestamp(dateTime);
		} else if (value instanceof LocalTime time) {
			appendTime(time);
		} else if (value instanceof Variant variant) {
			appendVariant(variant);
		} else if (value instanceof Map<?, ?> map) {
			@SuppressWarnings("unchecked")
			Map<String, ?> fields = (Map<String, ?>) map;
			appendObject(fields);
		} else if (value instanceof Iterable<?> elements) {
			appendArray(elements);
		} else {
			throw new IllegalArgumentException("Cannot append a " + value.getClass().getName() + " to a variant");
		}
	}

	/**
	 * Starts a nested object. Nothing reaches this appender until {@link ObjectBuilder#end()} is called.
	 */
	public ObjectBuilder startObject() {
		beginNested();
		ObjectBuilder result = new ObjectBuilder(this, metadata);
		openChild = result;
		return result;
	}

	/**
	 * Starts a nested array. Nothing reaches this appender until {@link ArrayBuilder#end()} is called.
	 */
	public ArrayBuilder startArray() {
		beginNested();
		ArrayBuilder result = new ArrayBuilder(this, metadata);
		openChild = result;
		return result;
	}

	private void beginNested() {
		checkOpen();
		discardOpenChild();
		beginValue();
	}

	/**
	 * Called by a nested builder's {@code end()}.
	 */
	void commitChild(CompositeBuilder child) {
		if (openChild != child) {
			throw new IllegalStateException("Nested builder is no longer the open scope of its parent");
		}
		openChild = null;
		int start = writer().size();
		child.encodeInto(writer());
		endValue(start);
	}

	/**
	 * Called by a nested builder that is discarded before it ended.
	 */
	void childDiscarded(CompositeBuilder child) {
		if (openChild == child) {
			openChild = null;
			abandonValue();
		}
	}

	void discardOpenChild() {
		if (openChild != null) {
			LOGGER.debug("Discarding unfinished {} because its parent was used", openChild.getClass().getSimpleName());
			openChild.discard();
		}
	}

	VariantBuildException buildError(String message) {
		abortScope();
		return new VariantBuildException(message);
	}

	VariantBuildException buildError(String message, Throwable cause) {
		abortScope();
		return new VariantBuildException(message, cause);
	}

	private int begin() {
		checkOpen();
		discardOpenChild();
		beginValue();
		return writer().size();
	}

	private void appendHeaderOnly(PrimitiveType type) {
		int start = begin();
		writer().writeByte(primitiveHeader(type));
		endValue(start);
	}

	private void appendFixed(PrimitiveType type, long value) {
		int start = begin();
		ByteWriter out = writer();
		out.writeByte(primitiveHeader(type));
		out.writeLittleEndianValue(value, type.payloadSize());
		endValue(start);
	}

	private long toMicros(long epochSecond, int nanos) {
		try {
			return Math.addExact(Math.multiplyExact(epochSecond, 1_000_000L), nanos / 1_000);
		} catch (ArithmeticException e) {
			throw buildError("Timestamp out of range for microsecond precision", e);
		}
	}

	private static void writeBigEndian(ByteWriter out, long value) {
		for (int shift = 56; shift >= 0; shift -= 8) {
			out.writeByte((int) (value >>> shift));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValueAppender.class);
}
