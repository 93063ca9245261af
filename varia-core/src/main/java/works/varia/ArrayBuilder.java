package works.varia;

import java.util.function.Consumer;
import works.varia.encoding.ByteWriter;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.U8_MAX;
import static works.varia.encoding.VariantEncoding.arrayHeader;
import static works.varia.encoding.VariantEncoding.sizeFor;

/**
 * Builds one array value from the elements appended to it, in order.
 */
public final class ArrayBuilder extends CompositeBuilder {
	private int[] starts = new int[8];
	private int count = 0;
	private int limit = Integer.MAX_VALUE;

	ArrayBuilder(ValueAppender parent, MetadataBuilder metadata) {
		super(parent, metadata);
	}

	/**
	 * Appends the element produced by <code>element</code>,
	 * which must append exactly one value to the appender it is given.
	 */
	public ArrayBuilder element(Consumer<? super ValueAppender> element) {
		checkOpen();
		int before = count;
		limit = before + 1;
		try {
			element.accept(this);
			discardOpenChild();
		} finally {
			limit = Integer.MAX_VALUE;
		}
		if (count == before) {
			throw new IllegalStateException("No value appended for array element " + before);
		}
		return this;
	}

	public int size() {
		return count;
	}

	@Override
	void beginValue() {
		if (count >= limit) {
			throw new IllegalStateException("Only one value may be appended per array element");
		}
	}

	@Override
	void endValue(int start) {
		if (count == starts.length) {
			int[] grown = new int[starts.length * 2];
			System.arraycopy(starts, 0, grown, 0, count);
			starts = grown;
		}
		starts[count++] = start;
	}

	@Override
	void abandonValue() {
	}

	@Override
	void encodeInto(ByteWriter out) {
		boolean isLarge = count > U8_MAX;
		int offsetSize = sizeFor(data.size());
		out.writeByte(arrayHeader(isLarge, offsetSize));
		out.writeLittleEndianValue(count, isLarge ? U32_SIZE : 1);
		for (int i = 0; i < count; i++) {
			out.writeLittleEndianValue(starts[i], offsetSize);
		}
		out.writeLittleEndianValue(data.size(), offsetSize);
		out.writeBytes(data.array(), 0, data.size());
	}
}
