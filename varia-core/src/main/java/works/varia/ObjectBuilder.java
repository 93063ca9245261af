package works.varia;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import works.varia.encoding.ByteWriter;
import works.varia.exceptions.DuplicateFieldException;
import works.varia.exceptions.VariantBuildException;

import static works.varia.encoding.VariantEncoding.U32_SIZE;
import static works.varia.encoding.VariantEncoding.U8_MAX;
import static works.varia.encoding.VariantEncoding.compareUnsigned;
import static works.varia.encoding.VariantEncoding.objectHeader;
import static works.varia.encoding.VariantEncoding.sizeFor;

/**
 * Builds one object value. Each field is a {@link #key} followed by exactly one value.
 * <p>
 * Fields may be appended in any order; {@link #end()} writes them sorted by name.
 */
public final class ObjectBuilder extends CompositeBuilder {
	private final List<FieldSpan> fields = new ArrayList<>();
	private final Set<Integer> fieldIds = new HashSet<>();
	private int pendingId = -1;
	private int pendingMark;

	ObjectBuilder(ValueAppender parent, MetadataBuilder metadata) {
		super(parent, metadata);
	}

	/**
	 * Names the field whose value will be appended next.
	 *
	 * @throws DuplicateFieldException if this object already has a field with this name.
	 *                                 The object is discarded.
	 */
	public ObjectBuilder key(String name) {
		checkOpen();
		discardOpenChild();
		if (pendingId >= 0) {
			String pendingName = metadata.name(pendingId);
			dropPendingKey();
			throw new IllegalStateException("Field \"" + pendingName + "\" has no value yet");
		}
		int mark = metadata.size();
		int id;
		try {
			id = metadata.addKey(name);
		} catch (VariantBuildException e) {
			abortScope();
			throw e;
		}
		if (fieldIds.contains(id)) {
			abortScope();
			throw new DuplicateFieldException(name);
		}
		pendingId = id;
		pendingMark = mark;
		return this;
	}

	/**
	 * Appends a field whose value is produced by <code>value</code>,
	 * which must append exactly one value to the appender it is given.
	 */
	public ObjectBuilder field(String name, Consumer<? super ValueAppender> value) {
		key(name);
		int before = fields.size();
		value.accept(this);
		discardOpenChild();
		if (fields.size() == before) {
			dropPendingKey();
			throw new IllegalStateException("No value appended for field \"" + name + "\"");
		}
		return this;
	}

	public int fieldCount() {
		return fields.size();
	}

	@Override
	void beginValue() {
		if (pendingId < 0) {
			throw new IllegalStateException("Call key() before appending a field value");
		}
	}

	@Override
	void endValue(int start) {
		fields.add(new FieldSpan(pendingId, metadata.utf8Name(pendingId), start, data.size() - start));
		fieldIds.add(pendingId);
		pendingId = -1;
	}

	@Override
	void abandonValue() {
		dropPendingKey();
	}

	@Override
	void checkComplete() {
		if (pendingId >= 0) {
			throw new IllegalStateException("Field \"" + metadata.name(pendingId) + "\" has no value");
		}
	}

	/**
	 * Forgets the pending key, along with its dictionary entry if the key added it.
	 */
	private void dropPendingKey() {
		if (pendingId >= 0) {
			pendingId = -1;
			metadata.truncate(pendingMark);
		}
	}

	@Override
	void encodeInto(ByteWriter out) {
		List<FieldSpan> sorted = new ArrayList<>(fields);
		sorted.sort((a, b) -> compareUnsigned(a.utf8Name, b.utf8Name));
		int count = sorted.size();
		int maxId = 0;
		for (FieldSpan f: sorted) {
			maxId = Math.max(maxId, f.id);
		}
		boolean isLarge = count > U8_MAX;
		int idSize = sizeFor(maxId);
		int offsetSize = sizeFor(data.size());

		out.writeByte(objectHeader(isLarge, idSize, offsetSize));
		out.writeLittleEndianValue(count, isLarge ? U32_SIZE : 1);
		for (FieldSpan f: sorted) {
			out.writeLittleEndianValue(f.id, idSize);
		}
		int offset = 0;
		for (FieldSpan f: sorted) {
			out.writeLittleEndianValue(offset, offsetSize);
			offset += f.length;
		}
		out.writeLittleEndianValue(offset, offsetSize);
		for (FieldSpan f: sorted) {
			out.writeBytes(data.array(), f.start, f.length);
		}
	}

	private record FieldSpan(int id, byte[] utf8Name, int start, int length) { }
}
