package works.varia;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import works.varia.exceptions.OffsetOutOfBoundsException;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.arrayIsLarge;
import static works.varia.encoding.VariantEncoding.arrayOffsetSize;
import static works.varia.encoding.VariantEncoding.readUnsigned;

/**
 * A view of an array value. Iteration can be restarted any number of times.
 */
public final class VariantArray implements Iterable<Variant> {
	private final VariantMetadata metadata;
	private final byte[] value;
	private final int end;
	private final int count;
	private final int offsetSize;
	private final int offsetsStart;
	private final int dataStart;

	VariantArray(VariantMetadata metadata, byte[] value, int start, int end) {
		this.metadata = metadata;
		this.value = value;
		this.end = end;
		int header = value[start] & 0xFF;
		int countSize = arrayIsLarge(header) ? U32_SIZE : 1;
		this.offsetSize = arrayOffsetSize(header);
		if (start + 1L + countSize > end) {
			throw new OffsetOutOfBoundsException("Array too short for its element count", start);
		}
		long declaredCount = readUnsigned(value, start + 1, countSize);
		this.offsetsStart = start + 1 + countSize;
		long dataStart = offsetsStart + (declaredCount + 1) * offsetSize;
		if (dataStart > end) {
			throw new OffsetOutOfBoundsException("Array header declares " + declaredCount + " elements, which do not fit", start);
		}
		this.count = (int) declaredCount;
		this.dataStart = (int) dataStart;
	}

	public int size() {
		return count;
	}

	/**
	 * @return empty if <code>index</code> is out of range
	 */
	public Optional<Variant> get(int index) {
		if (index < 0 || index >= count) {
			return Optional.empty();
		}
		return Optional.of(element(index));
	}

	@Override
	public Iterator<Variant> iterator() {
		return new Iterator<>() {
			int next = 0;

			@Override
			public boolean hasNext() {
				return next < count;
			}

			@Override
			public Variant next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				return element(next++);
			}
		};
	}

	public Stream<Variant> stream() {
		return StreamSupport.stream(Spliterators.spliterator(iterator(), count, Spliterator.ORDERED | Spliterator.SIZED), false);
	}

	private Variant element(int index) {
		long from = dataStart + offset(index);
		long to = dataStart + offset(index + 1);
		if (to > end || from >= to) {
			throw new OffsetOutOfBoundsException("Element " + index + " spans [" + from + ", " + to + ") outside its array", offsetsStart + index * offsetSize);
		}
		return new Variant(metadata, value, (int) from, (int) to);
	}

	private long offset(int i) {
		return readUnsigned(value, offsetsStart + i * offsetSize, offsetSize);
	}

	@Override
	public String toString() {
		return "VariantArray(" + count + " elements)";
	}
}
