package works.varia;

import java.nio.charset.CharacterCodingException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import works.varia.encoding.Utf8;
import works.varia.exceptions.OffsetOutOfBoundsException;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.objectIdSize;
import static works.varia.encoding.VariantEncoding.objectIsLarge;
import static works.varia.encoding.VariantEncoding.objectOffsetSize;
import static works.varia.encoding.VariantEncoding.readUnsigned;

/**
 * A view of an object value.
 * Fields are stored, and iterated, in increasing byte order of their names.
 */
public final class VariantObject {
	private final VariantMetadata metadata;
	private final byte[] value;
	private final int end;
	private final int count;
	private final int idSize;
	private final int offsetSize;
	private final int idsStart;
	private final int offsetsStart;
	private final int dataStart;

	VariantObject(VariantMetadata metadata, byte[] value, int start, int end) {
		this.metadata = metadata;
		this.value = value;
		this.end = end;
		int header = value[start] & 0xFF;
		int countSize = objectIsLarge(header) ? U32_SIZE : 1;
		this.idSize = objectIdSize(header);
		this.offsetSize = objectOffsetSize(header);
		if (start + 1L + countSize > end) {
			throw new OffsetOutOfBoundsException("Object too short for its element count", start);
		}
		long declaredCount = readUnsigned(value, start + 1, countSize);
		this.idsStart = start + 1 + countSize;
		long dataStart = idsStart + declaredCount * idSize + (declaredCount + 1) * offsetSize;
		if (dataStart > end) {
			throw new OffsetOutOfBoundsException("Object header declares " + declaredCount + " fields, which do not fit", start);
		}
		this.count = (int) declaredCount;
		this.offsetsStart = idsStart + count * idSize;
		this.dataStart = (int) dataStart;
	}

	public int size() {
		return count;
	}

	/**
	 * The dictionary id of the field at position <code>index</code>.
	 */
	public int fieldId(int index) {
		checkIndex(index);
		return (int) readUnsigned(value, idsStart + index * idSize, idSize);
	}

	public String fieldName(int index) {
		return metadata.get(fieldId(index));
	}

	public Variant fieldValue(int index) {
		checkIndex(index);
		long from = dataStart + offset(index);
		long to = dataStart + offset(index + 1);
		if (to > end || from >= to) {
			throw new OffsetOutOfBoundsException("Field " + index + " spans [" + from + ", " + to + ") outside its object", offsetsStart + index * offsetSize);
		}
		return new Variant(metadata, value, (int) from, (int) to);
	}

	/**
	 * Binary search for the field called <code>name</code>.
	 * With a sorted dictionary, the name is resolved to an id once and ids are compared;
	 * otherwise each probe compares dictionary bytes.
	 */
	public Optional<Variant> get(String name) {
		OptionalInt index = indexOf(name);
		return index.isPresent() ? Optional.of(fieldValue(index.getAsInt())) : Optional.empty();
	}

	public boolean containsKey(String name) {
		return indexOf(name).isPresent();
	}

	/**
	 * The position of the field called <code>name</code>, found by binary search.
	 */
	public OptionalInt indexOf(String name) {
		if (metadata.isSorted()) {
			OptionalInt id = metadata.find(name);
			if (id.isEmpty()) {
				return OptionalInt.empty();
			}
			int target = id.getAsInt();
			return binarySearch(mid -> Integer.compare(fieldId(mid), target));
		} else {
			byte[] key;
			try {
				key = Utf8.encode(name);
			} catch (CharacterCodingException e) {
				// Stored names are valid UTF-8, so this one can't match
				return OptionalInt.empty();
			}
			return binarySearch(mid -> metadata.compareEntry(fieldId(mid), key));
		}
	}

	/**
	 * The fields in stored order. Each call to {@link Iterable#iterator()} starts again from the first field.
	 */
	public Iterable<Field> fields() {
		return FieldIterator::new;
	}

	public Stream<Field> stream() {
		return StreamSupport.stream(Spliterators.spliterator(new FieldIterator(), count, Spliterator.ORDERED | Spliterator.SIZED), false);
	}

	public record Field(String name, Variant value) { }

	private interface Probe {
		int compareAt(int index);
	}

	private OptionalInt binarySearch(Probe probe) {
		int low = 0;
		int high = count - 1;
		while (low <= high) {
			int mid = (low + high) >>> 1;
			int cmp = probe.compareAt(mid);
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

	private long offset(int i) {
		return readUnsigned(value, offsetsStart + i * offsetSize, offsetSize);
	}

	private void checkIndex(int index) {
		if (index < 0 || index >= count) {
			throw new IndexOutOfBoundsException("Field index " + index + " out of range for object of size " + count);
		}
	}

	private final class FieldIterator implements Iterator<Field> {
		int next = 0;

		@Override
		public boolean hasNext() {
			return next < count;
		}

		@Override
		public Field next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			int index = next++;
			return new Field(fieldName(index), fieldValue(index));
		}
	}

	@Override
	public String toString() {
		return "VariantObject(" + count + " fields)";
	}
}
