package works.varia;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import works.varia.encoding.BasicType;
import works.varia.encoding.PrimitiveType;
import works.varia.encoding.Utf8;
import works.varia.exceptions.MalformedVariantException;
import works.varia.exceptions.OffsetOutOfBoundsException;
import works.varia.exceptions.TypeMismatchException;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.readSigned;
import static works.varia.encoding.VariantEncoding.readUnsigned;
import static works.varia.encoding.VariantEncoding.typeInfo;

/**
 * A read-only view of one value within a variant's value buffer.
 * <p>
 * Nothing is copied or decoded up front: {@link #kind()} reads only the header byte,
 * and navigating into an {@link #getObject() object} or {@link #getArray() array}
 * returns further views over sub-ranges of the same buffer.
 * <p>
 * The decoder assumes the buffers were produced by {@link VariantBuilder} or
 * have passed {@link VariantValidator}. On other input it still never reads outside
 * the buffers, throwing {@link OffsetOutOfBoundsException} instead,
 * but lookups may give wrong answers.
 * <p>
 * Instances are immutable and may be shared between threads,
 * provided nobody modifies the underlying arrays.
 */
public final class Variant {
	private final VariantMetadata metadata;
	private final byte[] value;
	private final int start;
	private final int end;

	Variant(VariantMetadata metadata, byte[] value, int start, int end) {
		if (start < 0 || start >= end || end > value.length) {
			throw new OffsetOutOfBoundsException("Value span [" + start + ", " + end + ") is empty or outside a " + value.length + "-byte buffer", start);
		}
		this.metadata = metadata;
		this.value = value;
		this.start = start;
		this.end = end;
	}

	/**
	 * Wraps the buffers without copying them.
	 * The metadata header and dictionary are checked eagerly; the value is not.
	 *
	 * @see VariantMetadata#of
	 */
	public static Variant of(byte[] metadata, byte[] value) {
		return of(VariantMetadata.of(metadata), value);
	}

	public static Variant of(VariantMetadata metadata, byte[] value) {
		return new Variant(metadata, value, 0, value.length);
	}

	public VariantMetadata metadata() {
		return metadata;
	}

	/**
	 * The number of bytes spanned by this value, header included.
	 */
	public int sizeInBytes() {
		return end - start;
	}

	/**
	 * A copy of the bytes spanned by this value.
	 */
	public byte[] toByteArray() {
		return Arrays.copyOfRange(value, start, end);
	}

	/**
	 * @throws MalformedVariantException if the header is not a recognized primitive type
	 */
	public VariantKind kind() {
		int header = header();
		BasicType basicType = BasicType.fromHeader(header);
		if (basicType == BasicType.PRIMITIVE) {
			return VariantKind.of(primitiveType(header));
		} else {
			return VariantKind.of(basicType, null);
		}
	}

	public boolean isNull() {
		return kind() == VariantKind.NULL;
	}

	public boolean getBoolean() {
		int header = header();
		if (BasicType.fromHeader(header) == BasicType.PRIMITIVE) {
			int type = typeInfo(header);
			if (type == PrimitiveType.TRUE.id()) {
				return true;
			} else if (type == PrimitiveType.FALSE.id()) {
				return false;
			}
		}
		throw mismatch("boolean");
	}

	/**
	 * Any of the integer kinds, widened to a long.
	 */
	public long getLong() {
		return switch (kind()) {
			case INT8 -> readSigned(value, payload(1), 1);
			case INT16 -> readSigned(value, payload(2), 2);
			case INT32 -> readSigned(value, payload(4), 4);
			case INT64 -> readSigned(value, payload(8), 8);
			default -> throw mismatch("integer");
		};
	}

	/**
	 * @throws TypeMismatchException unless the value is an integer that fits in an int
	 */
	public int getInt() {
		long result = getLong();
		if (result != (int) result) {
			throw new TypeMismatchException("Integer " + result + " does not fit in an int");
		}
		return (int) result;
	}

	public float getFloat() {
		requireKind(VariantKind.FLOAT, "float");
		return Float.intBitsToFloat((int) readSigned(value, payload(4), 4));
	}

	public double getDouble() {
		requireKind(VariantKind.DOUBLE, "double");
		return Double.longBitsToDouble(readSigned(value, payload(8), 8));
	}

	/**
	 * Any of the three decimal widths. The precision of the result is that of the decoded number.
	 */
	public BigDecimal getDecimal() {
		int width = switch (kind()) {
			case DECIMAL4 -> 4;
			case DECIMAL8 -> 8;
			case DECIMAL16 -> 16;
			default -> throw mismatch("decimal");
		};
		int pos = payload(1 + width);
		int scale = value[pos] & 0xFF;
		BigInteger unscaled;
		if (width == 16) {
			byte[] bigEndian = new byte[16];
			for (int i = 0; i < 16; i++) {
				bigEndian[i] = value[pos + 16 - i];
			}
			unscaled = new BigInteger(bigEndian);
		} else {
			unscaled = BigInteger.valueOf(readSigned(value, pos + 1, width));
		}
		return new BigDecimal(unscaled, scale);
	}

	public int getEpochDay() {
		requireKind(VariantKind.DATE, "date");
		return (int) readSigned(value, payload(4), 4);
	}

	public LocalDate getDate() {
		return LocalDate.ofEpochDay(getEpochDay());
	}

	/**
	 * Microseconds since the epoch, for either microsecond timestamp kind.
	 */
	public long getTimestampMicros() {
		VariantKind kind = kind();
		if (kind != VariantKind.TIMESTAMP_MICROS && kind != VariantKind.TIMESTAMP_NTZ_MICROS) {
			throw mismatch("microsecond timestamp");
		}
		return readSigned(value, payload(8), 8);
	}

	/**
	 * Nanoseconds since the epoch, for either nanosecond timestamp kind.
	 */
	public long getTimestampNanos() {
		VariantKind kind = kind();
		if (kind != VariantKind.TIMESTAMP_NANOS && kind != VariantKind.TIMESTAMP_NTZ_NANOS) {
			throw mismatch("nanosecond timestamp");
		}
		return readSigned(value, payload(8), 8);
	}

	/**
	 * True if this is a timestamp on the UTC timeline, as opposed to a wall-clock timestamp.
	 */
	public boolean isUtcAdjusted() {
		VariantKind kind = kind();
		if (!kind.isTimestamp()) {
			throw mismatch("timestamp");
		}
		return kind == VariantKind.TIMESTAMP_MICROS || kind == VariantKind.TIMESTAMP_NANOS;
	}

	/**
	 * For the UTC-adjusted timestamp kinds.
	 */
	public Instant getInstant() {
		VariantKind kind = kind();
		if (kind == VariantKind.TIMESTAMP_MICROS) {
			long micros = getTimestampMicros();
			return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
		} else if (kind == VariantKind.TIMESTAMP_NANOS) {
			long nanos = getTimestampNanos();
			return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
		} else {
			throw mismatch("UTC-adjusted timestamp");
		}
	}

	/**
	 * For the timestamp kinds with no time zone.
	 */
	public LocalDateTime getLocalDateTime() {
		VariantKind kind = kind();
		if (kind == VariantKind.TIMESTAMP_NTZ_MICROS) {
			long micros = getTimestampMicros();
			return LocalDateTime.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), (int) Math.floorMod(micros, 1_000_000L) * 1_000, ZoneOffset.UTC);
		} else if (kind == VariantKind.TIMESTAMP_NTZ_NANOS) {
			long nanos = getTimestampNanos();
			return LocalDateTime.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), (int) Math.floorMod(nanos, 1_000_000_000L), ZoneOffset.UTC);
		} else {
			throw mismatch("timestamp without time zone");
		}
	}

	public long getTimeMicros() {
		requireKind(VariantKind.TIME_NTZ_MICROS, "time");
		return readSigned(value, payload(8), 8);
	}

	public LocalTime getTime() {
		return LocalTime.ofNanoOfDay(getTimeMicros() * 1_000L);
	}

	public UUID getUuid() {
		requireKind(VariantKind.UUID, "UUID");
		int pos = payload(16);
		return new UUID(readBigEndian(pos), readBigEndian(pos + 8));
	}

	/**
	 * A read-only view of the binary payload; nothing is copied.
	 */
	public ByteBuffer getBinary() {
		requireKind(VariantKind.BINARY, "binary");
		int length = variableLength();
		return ByteBuffer.wrap(value, start + 1 + U32_SIZE, length).slice().asReadOnlyBuffer();
	}

	public byte[] getBinaryBytes() {
		requireKind(VariantKind.BINARY, "binary");
		int length = variableLength();
		int from = start + 1 + U32_SIZE;
		return Arrays.copyOfRange(value, from, from + length);
	}

	/**
	 * For either the short or long string kind.
	 */
	public String getString() {
		int header = header();
		BasicType basicType = BasicType.fromHeader(header);
		if (basicType == BasicType.SHORT_STRING) {
			int length = typeInfo(header);
			int pos = payload(length);
			return Utf8.decode(value, pos, length, pos);
		} else if (kind() == VariantKind.STRING) {
			int length = variableLength();
			int pos = start + 1 + U32_SIZE;
			return Utf8.decode(value, pos, length, pos);
		} else {
			throw mismatch("string");
		}
	}

	public VariantObject getObject() {
		if (BasicType.fromHeader(header()) != BasicType.OBJECT) {
			throw mismatch("object");
		}
		return new VariantObject(metadata, value, start, end);
	}

	public VariantArray getArray() {
		if (BasicType.fromHeader(header()) != BasicType.ARRAY) {
			throw mismatch("array");
		}
		return new VariantArray(metadata, value, start, end);
	}

	/**
	 * Follows <code>path</code> one step at a time.
	 *
	 * @return empty if a field is missing, an index is out of range,
	 * or a step is applied to a value of the wrong kind.
	 */
	public Optional<Variant> getPath(VariantPath path) {
		Variant current = this;
		for (VariantPath.Segment segment: path.segments()) {
			Optional<Variant> next;
			if (segment instanceof VariantPath.Field field) {
				if (current.kind() != VariantKind.OBJECT) {
					return Optional.empty();
				}
				next = current.getObject().get(field.name());
			} else if (segment instanceof VariantPath.Index index) {
				if (current.kind() != VariantKind.ARRAY) {
					return Optional.empty();
				}
				next = current.getArray().get(index.index());
			} else {
				throw new AssertionError("Unexpected path segment " + segment);
			}
			if (next.isEmpty()) {
				return next;
			}
			current = next.get();
		}
		return Optional.of(current);
	}

	/**
	 * @see VariantPath#parse
	 */
	public Optional<Variant> getPath(String path) {
		return getPath(VariantPath.parse(path));
	}

	@Override
	public String toString() {
		return "Variant(" + kind() + ", " + sizeInBytes() + " bytes)";
	}

	private int header() {
		return value[start] & 0xFF;
	}

	private PrimitiveType primitiveType(int header) {
		int id = typeInfo(header);
		return PrimitiveType.fromId(id)
			.orElseThrow(() -> new MalformedVariantException("Unrecognized primitive type " + id, start));
	}

	private void requireKind(VariantKind expected, String description) {
		if (kind() != expected) {
			throw mismatch(description);
		}
	}

	private TypeMismatchException mismatch(String expected) {
		return new TypeMismatchException("Expected " + expected + " but found " + kind());
	}

	/**
	 * @return the position of the first payload byte, after checking that <code>size</code> bytes are available.
	 */
	private int payload(int size) {
		int pos = start + 1;
		if (pos + (long) size > end) {
			throw new OffsetOutOfBoundsException("Value needs " + size + " payload bytes but only " + (end - pos) + " remain", start);
		}
		return pos;
	}

	private int variableLength() {
		long length = readUnsigned(value, payload(U32_SIZE), U32_SIZE);
		if (start + 1L + U32_SIZE + length > end) {
			throw new OffsetOutOfBoundsException("Length " + length + " runs past the end of the value", start + 1);
		}
		return (int) length;
	}

	private long readBigEndian(int pos) {
		long result = 0;
		for (int i = 0; i < 8; i++) {
			result = (result << 8) | (value[pos + i] & 0xFF);
		}
		return result;
	}
}
