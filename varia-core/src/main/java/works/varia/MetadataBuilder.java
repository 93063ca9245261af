package works.varia;

import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.varia.encoding.Utf8;
import works.varia.exceptions.VariantBuildException;

import static works.varia.encoding.VariantEncoding.compareUnsigned;
import static works.varia.encoding.VariantEncoding.metadataHeader;
import static works.varia.encoding.VariantEncoding.sizeFor;
import static works.varia.encoding.VariantEncoding.writeLittleEndian;

/**
 * Accumulates the distinct field names of one variant and serializes them as a metadata buffer.
 * <p>
 * Ids returned by {@link #addKey} are insertion ids.
 * When the dictionary is sorted on {@link #finish}, names move to new positions,
 * and {@link Finished#positionOf} maps each insertion id to its final dictionary id.
 * <p>
 * One instance belongs to one document. It is not thread-safe.
 */
public final class MetadataBuilder {
	private final Map<String, Integer> idsByName = new HashMap<>();
	private final List<String> names = new ArrayList<>();
	private final List<byte[]> utf8Names = new ArrayList<>();

	/**
	 * @return the id of <code>name</code>, assigning the next id if it's new.
	 * @throws VariantBuildException if <code>name</code> has no UTF-8 encoding
	 */
	public int addKey(String name) {
		Integer existing = idsByName.get(name);
		if (existing != null) {
			return existing;
		}
		byte[] utf8;
		try {
			utf8 = Utf8.encode(name);
		} catch (CharacterCodingException e) {
			throw new VariantBuildException("Field name contains an unpaired surrogate", e);
		}
		int id = names.size();
		idsByName.put(name, id);
		names.add(name);
		utf8Names.add(utf8);
		return id;
	}

	public int size() {
		return names.size();
	}

	public String name(int id) {
		return names.get(id);
	}

	byte[] utf8Name(int id) {
		return utf8Names.get(id);
	}

	/**
	 * Forgets every name whose id is at least <code>newSize</code>.
	 * Used to roll back names added by an abandoned build scope.
	 */
	void truncate(int newSize) {
		for (int id = names.size() - 1; id >= newSize; id--) {
			idsByName.remove(names.remove(id));
			utf8Names.remove(id);
		}
	}

	/**
	 * @param sort if true, entries are written in increasing byte order and the sorted flag is set.
	 *             If false, entries keep insertion order, and the sorted flag is set only if
	 *             that order happens to be strictly increasing.
	 */
	public Finished finish(boolean sort) {
		int count = names.size();
		Integer[] order = new Integer[count];
		for (int i = 0; i < count; i++) {
			order[i] = i;
		}
		boolean sorted;
		if (sort) {
			Arrays.sort(order, (a, b) -> compareUnsigned(utf8Names.get(a), utf8Names.get(b)));
			sorted = true;
		} else {
			sorted = isStrictlyIncreasing();
		}

		int[] positions = new int[count];
		long stringBytes = 0;
		for (int position = 0; position < count; position++) {
			positions[order[position]] = position;
			stringBytes += utf8Names.get(order[position]).length;
		}

		int offsetSize = sizeFor(Math.max(stringBytes, count));
		long totalSize = 1 + offsetSize + (long) (count + 1) * offsetSize + stringBytes;
		if (totalSize > Integer.MAX_VALUE - 8) {
			throw new IllegalStateException("Metadata too large: " + totalSize + " bytes");
		}
		byte[] result = new byte[(int) totalSize];
		result[0] = metadataHeader(sorted, offsetSize);
		writeLittleEndian(result, 1, count, offsetSize);
		int offsetPos = 1 + offsetSize;
		int stringPos = offsetPos + (count + 1) * offsetSize;
		int current = 0;
		for (int position = 0; position < count; position++) {
			writeLittleEndian(result, offsetPos + position * offsetSize, current, offsetSize);
			byte[] name = utf8Names.get(order[position]);
			System.arraycopy(name, 0, result, stringPos + current, name.length);
			current += name.length;
		}
		writeLittleEndian(result, offsetPos + count * offsetSize, current, offsetSize);

		LOGGER.debug("Finished metadata: {} names, {} bytes, offsetSize={}, sorted={}", count, totalSize, offsetSize, sorted);
		return new Finished(result, positions);
	}

	private boolean isStrictlyIncreasing() {
		for (int i = 1; i < utf8Names.size(); i++) {
			if (compareUnsigned(utf8Names.get(i - 1), utf8Names.get(i)) >= 0) {
				return false;
			}
		}
		return true;
	}

	/**
	 * A serialized dictionary, plus the remap table from insertion ids to final ids.
	 */
	public static final class Finished {
		private final byte[] bytes;
		private final int[] positions;

		Finished(byte[] bytes, int[] positions) {
			this.bytes = bytes;
			this.positions = positions;
		}

		public byte[] bytes() {
			return bytes;
		}

		public int positionOf(int insertionId) {
			return positions[insertionId];
		}

		/**
		 * @return true if every name kept its insertion id.
		 */
		public boolean isIdentity() {
			for (int i = 0; i < positions.length; i++) {
				if (positions[i] != i) {
					return false;
				}
			}
			return true;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MetadataBuilder.class);
}
