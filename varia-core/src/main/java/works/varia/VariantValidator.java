package works.varia;

import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.varia.encoding.BasicType;
import works.varia.encoding.PrimitiveType;
import works.varia.encoding.Utf8;
import works.varia.exceptions.InvalidUtf8Exception;
import works.varia.exceptions.MalformedVariantException;
import works.varia.exceptions.OffsetOutOfBoundsException;
import works.varia.exceptions.RecursionLimitExceededException;
import works.varia.exceptions.UnsortedDictionaryException;
import works.varia.exceptions.UnsupportedVersionException;
import works.varia.exceptions.VariantFormatException;

import static works.varia.encoding.VariantEncoding.MAX_DECIMAL16_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_DECIMAL4_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_DECIMAL8_PRECISION;
import static works.varia.encoding.VariantEncoding.MAX_SHORT_STRING_SIZE;
import static works.varia.encoding.VariantEncoding.MICROS_PER_DAY;
import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.arrayIsLarge;
import static works.varia.encoding.VariantEncoding.arrayOffsetSize;
import static works.varia.encoding.VariantEncoding.objectIdSize;
import static works.varia.encoding.VariantEncoding.objectIsLarge;
import static works.varia.encoding.VariantEncoding.objectOffsetSize;
import static works.varia.encoding.VariantEncoding.readSigned;
import static works.varia.encoding.VariantEncoding.readUnsigned;
import static works.varia.encoding.VariantEncoding.typeInfo;

/**
 * Checks untrusted metadata and value buffers in full,
 * so that any {@link Variant} read from them afterward behaves consistently.
 * <p>
 * Validation fails fast with the first problem found. Every exception is a
 * {@link VariantFormatException} whose {@link VariantFormatException#byteOffset() byte offset}
 * is relative to the buffer in which the problem lies.
 * <p>
 * Rules checked, beyond what {@link VariantMetadata#of} checks:
 * <ul>
 *     <li>A dictionary flagged as sorted has strictly increasing entries.</li>
 *     <li>Neither buffer has bytes beyond what its structure accounts for.</li>
 *     <li>Every header is recognized, and every value fits exactly within its enclosing span.</li>
 *     <li>Composite offset tables start at zero and strictly increase.</li>
 *     <li>Object field ids are in range, and their names strictly increase.</li>
 *     <li>Strings are valid UTF-8.</li>
 *     <li>Decimal scales and unscaled values are within the precision of their width.</li>
 *     <li>Nesting is no deeper than {@link ValidationSettings#maxDepth()}.</li>
 * </ul>
 * Instances are stateless apart from their settings and may be shared between threads.
 */
public final class VariantValidator {
	private static final BigInteger MAX_DECIMAL16_EXCLUSIVE = BigInteger.TEN.pow(MAX_DECIMAL16_PRECISION);

	private final ValidationSettings settings;

	public VariantValidator() {
		this(ValidationSettings.DEFAULT);
	}

	public VariantValidator(ValidationSettings settings) {
		this.settings = settings;
	}

	/**
	 * @return the decoded root value
	 * @throws UnsupportedVersionException if the metadata version is not 1
	 * @throws OffsetOutOfBoundsException if a size, offset or id points outside its buffer or table
	 * @throws InvalidUtf8Exception if a dictionary entry or string value is not valid UTF-8
	 * @throws UnsortedDictionaryException if the dictionary is flagged as sorted but isn't
	 * @throws RecursionLimitExceededException if nesting exceeds the configured depth
	 * @throws MalformedVariantException for any other structural problem
	 */
	public Variant validate(byte[] metadata, byte[] value) {
		try {
			VariantMetadata dictionary = VariantMetadata.of(metadata);
			validateDictionary(dictionary);
			if (value.length == 0) {
				throw new OffsetOutOfBoundsException("Value is empty", 0);
			}
			new Walk(dictionary, value).value(0, value.length, 0);
			LOGGER.trace("Validated variant: {} metadata bytes, {} value bytes", metadata.length, value.length);
			return Variant.of(dictionary, value);
		} catch (VariantFormatException e) {
			LOGGER.debug("Rejected variant: {}", e.getMessage());
			throw e;
		}
	}

	private static void validateDictionary(VariantMetadata dictionary) {
		byte[] bytes = dictionary.bytes();
		int size = dictionary.size();
		int offsetSize = dictionary.offsetSize();
		long firstOffset = readUnsigned(bytes, dictionary.offsetPosition(0), offsetSize);
		if (firstOffset != 0) {
			throw new MalformedVariantException("First dictionary offset is " + firstOffset + ", not zero", dictionary.offsetPosition(0));
		}
		int stringsStart = dictionary.offsetPosition(size + 1);
		long stringsEnd = stringsStart + readUnsigned(bytes, dictionary.offsetPosition(size), offsetSize);
		if (stringsEnd != bytes.length) {
			throw new MalformedVariantException("Metadata has " + (bytes.length - stringsEnd) + " trailing bytes", (int) stringsEnd);
		}
		if (dictionary.isSorted()) {
			for (int id = 1; id < size; id++) {
				if (dictionary.compareEntries(id - 1, id) >= 0) {
					throw new UnsortedDictionaryException("Dictionary is flagged as sorted, but entry " + id + " \"" + dictionary.get(id)
						+ "\" does not follow \"" + dictionary.get(id - 1) + "\"", dictionary.offsetPosition(id));
				}
			}
		}
	}

	private final class Walk {
		final VariantMetadata dictionary;
		final byte[] bytes;

		Walk(VariantMetadata dictionary, byte[] bytes) {
			this.dictionary = dictionary;
			this.bytes = bytes;
		}

		/**
		 * Validates the value occupying exactly <code>[start, end)</code>.
		 */
		void value(int start, int end, int depth) {
			int header = bytes[start] & 0xFF;
			switch (BasicType.fromHeader(header)) {
				case SHORT_STRING -> {
					int length = typeInfo(header);
					requireSize(start, end, 1L + length, "short string");
					Utf8.decode(bytes, start + 1, length, start);
				}
				case PRIMITIVE -> primitive(start, end, header);
				case OBJECT -> object(start, end, header, enter(start, depth));
				case ARRAY -> array(start, end, header, enter(start, depth));
			}
		}

		private int enter(int start, int depth) {
			int nested = depth + 1;
			if (nested > settings.maxDepth()) {
				throw new RecursionLimitExceededException("Nesting exceeds maximum depth " + settings.maxDepth(), start);
			}
			return nested;
		}

		private void primitive(int start, int end, int header) {
			int id = typeInfo(header);
			PrimitiveType type = PrimitiveType.fromId(id)
				.orElseThrow(() -> new MalformedVariantException("Unrecognized primitive type " + id, start));
			if (type.hasVariableSize()) {
				requireAvailable(start + 1, U32_SIZE, end, "length of " + type);
				long length = readUnsigned(bytes, start + 1, U32_SIZE);
				requireSize(start, end, 1L + U32_SIZE + length, type.name());
				if (type == PrimitiveType.STRING) {
					if (length <= MAX_SHORT_STRING_SIZE) {
						throw new MalformedVariantException("String of " + length + " bytes must use the short string encoding", start);
					}
					Utf8.decode(bytes, start + 1 + U32_SIZE, (int) length, start);
				}
				return;
			}
			requireSize(start, end, 1L + type.payloadSize(), type.name());
			switch (type) {
				case DECIMAL4 -> decimal(start, MAX_DECIMAL4_PRECISION, Math.abs(readSigned(bytes, start + 2, 4)) >= 1_000_000_000L);
				case DECIMAL8 -> {
					long unscaled = readSigned(bytes, start + 2, 8);
					decimal(start, MAX_DECIMAL8_PRECISION, unscaled <= -1_000_000_000_000_000_000L || unscaled >= 1_000_000_000_000_000_000L);
				}
				case DECIMAL16 -> {
					byte[] bigEndian = new byte[16];
					for (int i = 0; i < 16; i++) {
						bigEndian[i] = bytes[start + 17 - i];
					}
					decimal(start, MAX_DECIMAL16_PRECISION, new BigInteger(bigEndian).abs().compareTo(MAX_DECIMAL16_EXCLUSIVE) >= 0);
				}
				case TIME_NTZ_MICROS -> {
					long micros = readSigned(bytes, start + 1, 8);
					if (micros < 0 || micros >= MICROS_PER_DAY) {
						throw new MalformedVariantException("Time of day out of range: " + micros + " microseconds", start + 1);
					}
				}
				default -> { }
			}
		}

		private void decimal(int start, int maxPrecision, boolean unscaledTooLarge) {
			int scale = bytes[start + 1] & 0xFF;
			if (scale > maxPrecision) {
				throw new MalformedVariantException("Decimal scale " + scale + " exceeds precision " + maxPrecision, start + 1);
			}
			if (unscaledTooLarge) {
				throw new MalformedVariantException("Decimal unscaled value exceeds " + maxPrecision + " digits", start + 2);
			}
		}

		private void object(int start, int end, int header, int depth) {
			int countSize = objectIsLarge(header) ? U32_SIZE : 1;
			int idSize = objectIdSize(header);
			int offsetSize = objectOffsetSize(header);
			requireAvailable(start + 1, countSize, end, "object field count");
			long count = readUnsigned(bytes, start + 1, countSize);
			int idsStart = start + 1 + countSize;
			long offsetsStart = idsStart + count * idSize;
			long dataStart = offsetsStart + (count + 1) * offsetSize;
			requireAvailable(idsStart, dataStart - idsStart, end, "object with " + count + " fields");

			int previousId = -1;
			for (int i = 0; i < count; i++) {
				int position = idsStart + i * idSize;
				long id = readUnsigned(bytes, position, idSize);
				if (id >= dictionary.size()) {
					throw new OffsetOutOfBoundsException("Field id " + id + " out of range for dictionary of size " + dictionary.size(), position);
				}
				if (previousId >= 0 && dictionary.compareEntries(previousId, (int) id) >= 0) {
					throw new MalformedVariantException("Object field \"" + dictionary.get((int) id)
						+ "\" is not in increasing order after \"" + dictionary.get(previousId) + "\"", position);
				}
				previousId = (int) id;
			}
			children((int) offsetsStart, (int) count, offsetSize, (int) dataStart, end, depth);
		}

		private void array(int start, int end, int header, int depth) {
			int countSize = arrayIsLarge(header) ? U32_SIZE : 1;
			int offsetSize = arrayOffsetSize(header);
			requireAvailable(start + 1, countSize, end, "array element count");
			long count = readUnsigned(bytes, start + 1, countSize);
			int offsetsStart = start + 1 + countSize;
			long dataStart = offsetsStart + (count + 1) * offsetSize;
			requireAvailable(offsetsStart, dataStart - offsetsStart, end, "array with " + count + " elements");
			children(offsetsStart, (int) count, offsetSize, (int) dataStart, end, depth);
		}

		private void children(int offsetsStart, int count, int offsetSize, int dataStart, int end, int depth) {
			long previous = readUnsigned(bytes, offsetsStart, offsetSize);
			if (previous != 0) {
				throw new MalformedVariantException("First child offset is " + previous + ", not zero", offsetsStart);
			}
			for (int i = 0; i < count; i++) {
				int position = offsetsStart + (i + 1) * offsetSize;
				long next = readUnsigned(bytes, position, offsetSize);
				if (next <= previous) {
					throw new MalformedVariantException("Child offset " + (i + 1) + " is " + next + ", not greater than " + previous, position);
				} else if (dataStart + next > end) {
					throw new OffsetOutOfBoundsException("Child offset " + (i + 1) + " is " + next + ", past the end of its " + (end - dataStart) + "-byte data", position);
				}
				value(dataStart + (int) previous, dataStart + (int) next, depth);
				previous = next;
			}
			if (dataStart + previous != end) {
				throw new MalformedVariantException((end - dataStart - previous) + " trailing bytes after last child", dataStart + (int) previous);
			}
		}

		/**
		 * The value starting at <code>start</code> has encoded size <code>size</code>;
		 * it must end exactly at <code>end</code>.
		 */
		private void requireSize(int start, int end, long size, String what) {
			if (start + size > end) {
				throw new OffsetOutOfBoundsException(what + " of " + size + " bytes extends past the end of its " + (end - start) + "-byte span", start);
			} else if (start + size < end) {
				throw new MalformedVariantException(what + " of " + size + " bytes is followed by " + (end - start - size) + " trailing bytes", (int) (start + size));
			}
		}

		private void requireAvailable(long position, long length, int end, String what) {
			if (position + length > end) {
				throw new OffsetOutOfBoundsException("Not enough bytes for " + what, (int) Math.min(position, end));
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VariantValidator.class);
}
