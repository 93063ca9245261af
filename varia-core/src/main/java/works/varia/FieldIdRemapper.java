package works.varia;

import java.util.ArrayDeque;
import java.util.Deque;
import works.varia.encoding.BasicType;
import works.varia.encoding.ByteWriter;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.U8_MAX;
import static works.varia.encoding.VariantEncoding.arrayHeader;
import static works.varia.encoding.VariantEncoding.arrayIsLarge;
import static works.varia.encoding.VariantEncoding.arrayOffsetSize;
import static works.varia.encoding.VariantEncoding.objectHeader;
import static works.varia.encoding.VariantEncoding.objectIdSize;
import static works.varia.encoding.VariantEncoding.objectIsLarge;
import static works.varia.encoding.VariantEncoding.objectOffsetSize;
import static works.varia.encoding.VariantEncoding.readUnsigned;
import static works.varia.encoding.VariantEncoding.sizeFor;

/**
 * Rewrites a value built against insertion ids so that its objects refer to final dictionary ids.
 * <p>
 * Field order within each object is unchanged, since it depends only on the names.
 * Id and offset widths are recomputed, so every composite is re-encoded;
 * primitives and strings are copied as-is.
 * <p>
 * The input must have been produced by this package's builders.
 */
final class FieldIdRemapper {
	private final byte[] source;
	private final MetadataBuilder.Finished dictionary;

	private FieldIdRemapper(byte[] source, MetadataBuilder.Finished dictionary) {
		this.source = source;
		this.dictionary = dictionary;
	}

	static byte[] remap(byte[] value, int length, MetadataBuilder.Finished dictionary) {
		ByteWriter out = new ByteWriter(length + 16);
		new FieldIdRemapper(value, dictionary).rewrite(0, length, out);
		return out.toByteArray();
	}

	/**
	 * Depth-first, with an explicit stack so that deep nesting can't overflow the thread's stack.
	 */
	private void rewrite(int start, int end, ByteWriter out) {
		Deque<Composite> stack = new ArrayDeque<>();
		visit(start, end, out, stack);
		while (!stack.isEmpty()) {
			Composite current = stack.peek();
			if (current.hasNextChild()) {
				int childStart = current.childStart();
				int childEnd = current.childEnd();
				current.offsets[current.next++] = current.children.size();
				visit(childStart, childEnd, current.children, stack);
			} else {
				stack.pop();
				current.finish();
			}
		}
	}

	private void visit(int start, int end, ByteWriter out, Deque<Composite> stack) {
		int header = source[start] & 0xFF;
		switch (BasicType.fromHeader(header)) {
			case OBJECT -> stack.push(new Composite(start, header, true, out));
			case ARRAY -> stack.push(new Composite(start, header, false, out));
			default -> out.writeBytes(source, start, end - start);
		}
	}

	/**
	 * An object or array whose children are being rewritten into {@link #children}.
	 */
	private final class Composite {
		final boolean isObject;
		final ByteWriter out;
		final int count;
		final int offsetSize;
		final int offsetsStart;
		final int dataStart;
		final int[] ids;
		final int maxId;
		final int[] offsets;
		final ByteWriter children = new ByteWriter();
		int next = 0;

		Composite(int start, int header, boolean isObject, ByteWriter out) {
			this.isObject = isObject;
			this.out = out;
			int countSize = (isObject ? objectIsLarge(header) : arrayIsLarge(header)) ? U32_SIZE : 1;
			this.offsetSize = isObject ? objectOffsetSize(header) : arrayOffsetSize(header);
			this.count = (int) readUnsigned(source, start + 1, countSize);
			int idsStart = start + 1 + countSize;
			if (isObject) {
				int idSize = objectIdSize(header);
				ids = new int[count];
				int max = 0;
				for (int i = 0; i < count; i++) {
					ids[i] = dictionary.positionOf((int) readUnsigned(source, idsStart + i * idSize, idSize));
					max = Math.max(max, ids[i]);
				}
				maxId = max;
				offsetsStart = idsStart + count * idSize;
			} else {
				ids = null;
				maxId = 0;
				offsetsStart = idsStart;
			}
			this.dataStart = offsetsStart + (count + 1) * offsetSize;
			this.offsets = new int[count + 1];
		}

		boolean hasNextChild() {
			return next < count;
		}

		int childStart() {
			return dataStart + (int) readUnsigned(source, offsetsStart + next * offsetSize, offsetSize);
		}

		int childEnd() {
			return dataStart + (int) readUnsigned(source, offsetsStart + (next + 1) * offsetSize, offsetSize);
		}

		void finish() {
			offsets[count] = children.size();
			boolean isLarge = count > U8_MAX;
			int newOffsetSize = sizeFor(children.size());
			if (isObject) {
				int newIdSize = sizeFor(maxId);
				out.writeByte(objectHeader(isLarge, newIdSize, newOffsetSize));
				out.writeLittleEndianValue(count, isLarge ? U32_SIZE : 1);
				for (int id: ids) {
					out.writeLittleEndianValue(id, newIdSize);
				}
			} else {
				out.writeByte(arrayHeader(isLarge, newOffsetSize));
				out.writeLittleEndianValue(count, isLarge ? U32_SIZE : 1);
			}
			for (int offset: offsets) {
				out.writeLittleEndianValue(offset, newOffsetSize);
			}
			out.writeBytes(children.array(), 0, children.size());
		}
	}
}
