package works.varia;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.varia.encoding.ByteWriter;

/**
 * A nested object or array scope.
 * <p>
 * Child values accumulate in this scope's own buffer.
 * {@link #end()} encodes the scope and hands the bytes to the parent;
 * it is the only way anything reaches the parent.
 * Use try-with-resources so that an exception, or an early return,
 * discards the partial scope:
 *
 * <pre>
 * try (ObjectBuilder object = builder.startObject()) {
 *     object.key("a");
 *     object.appendLong(1);
 *     object.end();
 * }
 * </pre>
 *
 * Discarding also forgets any dictionary names first added inside the scope.
 */
public abstract sealed class CompositeBuilder extends ValueAppender implements AutoCloseable permits ObjectBuilder, ArrayBuilder {
	private enum State { OPEN, ENDED, DISCARDED }

	private final ValueAppender parent;
	private final int metadataMark;
	final ByteWriter data = new ByteWriter();
	private State state = State.OPEN;

	CompositeBuilder(ValueAppender parent, MetadataBuilder metadata) {
		super(metadata);
		this.parent = parent;
		this.metadataMark = metadata.size();
	}

	/**
	 * Writes the complete encoding of this scope, header included.
	 */
	abstract void encodeInto(ByteWriter out);

	@Override
	final ByteWriter writer() {
		return data;
	}

	@Override
	final void checkOpen() {
		switch (state) {
			case ENDED -> throw new IllegalStateException(getClass().getSimpleName() + " has already ended");
			case DISCARDED -> throw new IllegalStateException(getClass().getSimpleName() + " was discarded");
			case OPEN -> { }
		}
	}

	@Override
	final void abortScope() {
		discard();
	}

	/**
	 * Finalizes this scope and commits its bytes to the parent.
	 */
	public void end() {
		checkOpen();
		discardOpenChild();
		checkComplete();
		parent.commitChild(this);
		state = State.ENDED;
	}

	/**
	 * @throws IllegalStateException if the scope is not in a state that can be ended
	 */
	void checkComplete() {
	}

	/**
	 * Discards this scope if {@link #end()} has not been called; otherwise does nothing.
	 */
	@Override
	public void close() {
		if (state == State.OPEN) {
			LOGGER.debug("Discarding {} closed without end()", getClass().getSimpleName());
			discard();
		}
	}

	public boolean isOpen() {
		return state == State.OPEN;
	}

	void discard() {
		if (state != State.OPEN) {
			return;
		}
		discardOpenChild();
		state = State.DISCARDED;
		metadata.truncate(metadataMark);
		parent.childDiscarded(this);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompositeBuilder.class);
}
