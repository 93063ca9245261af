package works.varia;

import java.nio.charset.CharacterCodingException;
import java.util.OptionalInt;
import works.varia.encoding.Utf8;
import works.varia.exceptions.InvalidUtf8Exception;
import works.varia.exceptions.OffsetOutOfBoundsException;
import works.varia.exceptions.UnsortedDictionaryException;
import works.varia.exceptions.UnsupportedVersionException;

import static works.varia.encoding.VariantEncoding.OFFSET_SIZE_SHIFT;
import static works.varia.encoding.VariantEncoding.SORTED_STRINGS;
import static works.varia.encoding.VariantEncoding.VERSION;
import static works.varia.encoding.VariantEncoding.VERSION_MASK;
import static works.varia.encoding.VariantEncoding.compareUnsigned;
import static works.varia.encoding.VariantEncoding.readUnsigned;

/**
 * Read access to a metadata buffer: the dictionary of field names
 * shared by every object in one variant.
 * <p>
 * Construction checks the header version, that the offset table lies within the buffer
 * and is non-decreasing, and that every entry is valid UTF-8,
 * so that the accessors never fail on a constructed instance.
 * It does not check the {@link #isSorted() sorted} flag against the actual order;
 * that's the {@link VariantValidator validator}'s job.
 * <p>
 * The buffer is not copied, and must not be modified while this object is in use.
 * Instances are immutable and safe to share between threads.
 */
public final class VariantMetadata {
	private final byte[] bytes;
	private final boolean sorted;
	private final int offsetSize;
	private final int dictionarySize;
	private final int offsetsStart;
	private final int stringsStart;
	private final String[] names;

	private VariantMetadata(byte[] bytes) {
		this.bytes = bytes;
		if (bytes.length < 1) {
			throw new OffsetOutOfBoundsException("Metadata is empty", 0);
		}
		int header = bytes[0] & 0xFF;
		int version = header & VERSION_MASK;
		if (version != VERSION) {
			throw new UnsupportedVersionException("Unsupported metadata version " + version, 0);
		}
		this.sorted = (header & SORTED_STRINGS) != 0;
		this.offsetSize = ((header >>> OFFSET_SIZE_SHIFT) & 0x03) + 1;

		requireAvailable(1, offsetSize, "dictionary size");
		long declaredSize = readUnsigned(bytes, 1, offsetSize);
		this.offsetsStart = 1 + offsetSize;
		long offsetTableLength = (declaredSize + 1) * offsetSize;
		requireAvailable(offsetsStart, offsetTableLength, "offset table");
		this.dictionarySize = (int) declaredSize;
		this.stringsStart = (int) (offsetsStart + offsetTableLength);

		this.names = new String[dictionarySize];
		long available = bytes.length - (long) stringsStart;
		long previous = offset(0);
		if (previous > available) {
			throw new OffsetOutOfBoundsException("First dictionary offset " + previous + " exceeds " + available + " string bytes", offsetsStart);
		}
		for (int i = 0; i < dictionarySize; i++) {
			long next = offset(i + 1);
			int offsetPosition = offsetsStart + (i + 1) * offsetSize;
			if (next < previous) {
				throw new OffsetOutOfBoundsException("Dictionary offset " + (i + 1) + " decreases from " + previous + " to " + next, offsetPosition);
			} else if (next > available) {
				throw new OffsetOutOfBoundsException("Dictionary offset " + (i + 1) + " is " + next + " but only " + available + " string bytes exist", offsetPosition);
			}
			int start = stringsStart + (int) previous;
			names[i] = Utf8.decode(bytes, start, (int) (next - previous), start);
			previous = next;
		}
	}

	/**
	 * @throws UnsupportedVersionException if the header declares an unknown version
	 * @throws OffsetOutOfBoundsException if the offset table is inconsistent with the buffer
	 * @throws InvalidUtf8Exception if any entry is not valid UTF-8
	 */
	public static VariantMetadata of(byte[] bytes) {
		return new VariantMetadata(bytes);
	}

	public int size() {
		return dictionarySize;
	}

	public boolean isSorted() {
		return sorted;
	}

	/**
	 * @throws OffsetOutOfBoundsException if <code>id</code> is not a valid dictionary id
	 */
	public String get(int id) {
		checkId(id);
		return names[id];
	}

	/**
	 * Binary search for <code>name</code>.
	 *
	 * @throws UnsortedDictionaryException if the dictionary is not flagged as sorted
	 */
	public OptionalInt find(String name) {
		if (!sorted) {
			throw new UnsortedDictionaryException("Cannot binary search an unsorted dictionary for \"" + name + "\"", 0);
		}
		byte[] key;
		try {
			key = Utf8.encode(name);
		} catch (CharacterCodingException e) {
			// Entries are valid UTF-8, so this name can't match
			return OptionalInt.empty();
		}
		int low = 0;
		int high = dictionarySize - 1;
		while (low <= high) {
			int mid = (low + high) >>> 1;
			int cmp = compareEntry(mid, key);
			if (cmp < 0) {
				low = mid + 1;
			} else if (cmp > 0) {
				high = mid - 1;
			} else {
				return OptionalInt.of(mid);
			}
		}
		return OptionalInt.empty();
	}

	/**
	 * Compares the UTF-8 bytes of entry <code>id</code> with <code>key</code>, as unsigned bytes.
	 */
	public int compareEntry(int id, byte[] key) {
		checkId(id);
		return compareUnsigned(bytes, entryStart(id), entryEnd(id), key, 0, key.length);
	}

	/**
	 * Compares two entries by their UTF-8 bytes.
	 */
	public int compareEntries(int id1, int id2) {
		checkId(id1);
		checkId(id2);
		return compareUnsigned(bytes, entryStart(id1), entryEnd(id1), bytes, entryStart(id2), entryEnd(id2));
	}

	/**
	 * The underlying buffer, not copied.
	 */
	public byte[] bytes() {
		return bytes;
	}

	int offsetSize() {
		return offsetSize;
	}

	/**
	 * Position of entry <code>id</code>'s offset within {@link #bytes()}.
	 */
	int offsetPosition(int id) {
		return offsetsStart + id * offsetSize;
	}

	int entryStart(int id) {
		return stringsStart + (int) offset(id);
	}

	int entryEnd(int id) {
		return stringsStart + (int) offset(id + 1);
	}

	private long offset(int i) {
		return readUnsigned(bytes, offsetsStart + i * offsetSize, offsetSize);
	}

	private void checkId(int id) {
		if (id < 0 || id >= dictionarySize) {
			throw new OffsetOutOfBoundsException("Dictionary id " + id + " out of range for dictionary of size " + dictionarySize, OffsetOutOfBoundsException.UNKNOWN_OFFSET);
		}
	}

	private void requireAvailable(long start, long length, String what) {
		if (start + length > bytes.length) {
			throw new OffsetOutOfBoundsException("Metadata too short for " + what + ": need " + (start + length) + " bytes, have " + bytes.length, (int) Math.min(start, bytes.length));
		}
	}

	@Override
	public String toString() {
		return "VariantMetadata(size=" + dictionarySize + ", sorted=" + sorted + ")";
	}
}
