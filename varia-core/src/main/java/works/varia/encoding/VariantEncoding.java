package works.varia.encoding;

import java.util.Arrays;

/**
 * Bit-level constants of the variant binary format (version 1),
 * plus the little-endian helpers shared by the builder, decoder and validator.
 * <p>
 * Metadata header: bits 0-3 hold the version, bit 4 is the sorted flag,
 * and bits 6-7 hold {@code offset_size - 1}.
 * <p>
 * Value header: bits 0-1 hold the {@link BasicType}, and the remaining six bits
 * ("type info") hold a {@link PrimitiveType} id, a short string length,
 * or the size selectors of an object or array:
 * <ul>
 *     <li>object: bits 0-1 {@code field_offset_size - 1}, bits 2-3 {@code field_id_size - 1}, bit 4 {@code is_large}</li>
 *     <li>array: bits 0-1 {@code field_offset_size - 1}, bit 2 {@code is_large}</li>
 * </ul>
 */
public final class VariantEncoding {
	private VariantEncoding() {}

	public static final int VERSION = 1;
	public static final int VERSION_MASK = 0x0F;
	public static final int SORTED_STRINGS = 0x10;
	public static final int OFFSET_SIZE_SHIFT = 6;

	public static final int BASIC_TYPE_BITS = 2;
	public static final int BASIC_TYPE_MASK = 0x03;
	public static final int TYPE_INFO_MASK = 0x3F;

	public static final int MAX_SHORT_STRING_SIZE = 0x3F;

	public static final int U8_MAX = 0xFF;
	public static final int U16_MAX = 0xFFFF;
	public static final int U24_MAX = 0xFFFFFF;
	public static final int U32_SIZE = 4;

	public static final int MAX_DECIMAL4_PRECISION = 9;
	public static final int MAX_DECIMAL8_PRECISION = 18;
	public static final int MAX_DECIMAL16_PRECISION = 38;

	public static final long MICROS_PER_DAY = 86_400_000_000L;

	public static int typeInfo(int header) {
		return (header >>> BASIC_TYPE_BITS) & TYPE_INFO_MASK;
	}

	public static byte primitiveHeader(PrimitiveType type) {
		return (byte) (type.id() << BASIC_TYPE_BITS | BasicType.PRIMITIVE.id());
	}

	public static byte shortStringHeader(int size) {
		assert 0 <= size && size <= MAX_SHORT_STRING_SIZE;
		return (byte) (size << BASIC_TYPE_BITS | BasicType.SHORT_STRING.id());
	}

	public static byte objectHeader(boolean isLarge, int idSize, int offsetSize) {
		return (byte) (((isLarge ? 1 : 0) << (BASIC_TYPE_BITS + 4))
			| ((idSize - 1) << (BASIC_TYPE_BITS + 2))
			| ((offsetSize - 1) << BASIC_TYPE_BITS)
			| BasicType.OBJECT.id());
	}

	public static byte arrayHeader(boolean isLarge, int offsetSize) {
		return (byte) (((isLarge ? 1 : 0) << (BASIC_TYPE_BITS + 2))
			| ((offsetSize - 1) << BASIC_TYPE_BITS)
			| BasicType.ARRAY.id());
	}

	public static byte metadataHeader(boolean sorted, int offsetSize) {
		return (byte) (VERSION
			| (sorted ? SORTED_STRINGS : 0)
			| ((offsetSize - 1) << OFFSET_SIZE_SHIFT));
	}

	public static int objectOffsetSize(int header) {
		return (typeInfo(header) & 0x03) + 1;
	}

	public static int objectIdSize(int header) {
		return ((typeInfo(header) >>> 2) & 0x03) + 1;
	}

	public static boolean objectIsLarge(int header) {
		return (typeInfo(header) & 0x10) != 0;
	}

	public static int arrayOffsetSize(int header) {
		return (typeInfo(header) & 0x03) + 1;
	}

	public static boolean arrayIsLarge(int header) {
		return (typeInfo(header) & 0x04) != 0;
	}

	/**
	 * @return the smallest number of bytes, from 1 to 4, that can hold the unsigned value <code>max</code>.
	 */
	public static int sizeFor(long max) {
		if (max < 0) {
			throw new IllegalArgumentException("Negative size: " + max);
		} else if (max <= U8_MAX) {
			return 1;
		} else if (max <= U16_MAX) {
			return 2;
		} else if (max <= U24_MAX) {
			return 3;
		} else if (max <= 0xFFFF_FFFFL) {
			return 4;
		} else {
			throw new IllegalArgumentException("Size does not fit in four bytes: " + max);
		}
	}

	/**
	 * Reads a little-endian unsigned integer of 1 to 4 bytes.
	 * The result is a long because a four-byte value may exceed {@link Integer#MAX_VALUE}.
	 */
	public static long readUnsigned(byte[] bytes, int pos, int size) {
		long result = 0;
		for (int i = 0; i < size; i++) {
			result |= (long) (bytes[pos + i] & 0xFF) << (8 * i);
		}
		return result;
	}

	/**
	 * Reads a little-endian two's-complement integer of 1 to 8 bytes.
	 */
	public static long readSigned(byte[] bytes, int pos, int size) {
		long result = 0;
		for (int i = 0; i < size; i++) {
			result |= (long) (bytes[pos + i] & 0xFF) << (8 * i);
		}
		int unused = 64 - 8 * size;
		return (result << unused) >> unused;
	}

	public static void writeLittleEndian(byte[] bytes, int pos, long value, int size) {
		for (int i = 0; i < size; i++) {
			bytes[pos + i] = (byte) (value >>> (8 * i));
		}
	}

	/**
	 * Compares two byte ranges as unsigned bytes, lexicographically,
	 * which for UTF-8 is the same as comparing code points.
	 */
	public static int compareUnsigned(byte[] a, int aFrom, int aTo, byte[] b, int bFrom, int bTo) {
		return Arrays.compareUnsigned(a, aFrom, aTo, b, bFrom, bTo);
	}

	public static int compareUnsigned(byte[] a, byte[] b) {
		return Arrays.compareUnsigned(a, b);
	}
}
