package works.varia;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.varia.encoding.ByteWriter;

/**
 * Builds one variant: a single root value plus the dictionary of field names it uses.
 *
 * <pre>
 * VariantBuilder builder = new VariantBuilder();
 * try (ObjectBuilder object = builder.startObject()) {
 *     object.key("a").appendLong(1);
 *     object.key("b").appendString("x");
 *     object.end();
 * }
 * EncodedVariant encoded = builder.finish();
 * </pre>
 *
 * A builder is used by one thread, for one document, and {@link #finish()} is called once.
 */
public final class VariantBuilder extends ValueAppender {
	private final Settings settings;
	private final ByteWriter value = new ByteWriter();
	private boolean hasValue = false;
	private boolean finished = false;

	public VariantBuilder() {
		this(Settings.DEFAULT);
	}

	public VariantBuilder(Settings settings) {
		super(new MetadataBuilder());
		this.settings = settings;
	}

	/**
	 * @param sortedDictionary if true, the dictionary is written in sorted order,
	 *                         enabling binary search by name. If false, names keep
	 *                         the order in which they were first added.
	 */
	public record Settings(boolean sortedDictionary) {
		public static final Settings DEFAULT = new Settings(true);

		public Settings withSortedDictionary(boolean sortedDictionary) {
			return new Settings(sortedDictionary);
		}
	}

	/**
	 * The dictionary being accumulated for this variant.
	 */
	public MetadataBuilder metadata() {
		return metadata;
	}

	/**
	 * Serializes the dictionary and the root value.
	 * Any nested scope still open is discarded first.
	 *
	 * @throws IllegalStateException if no root value was appended, or this builder already finished
	 */
	public EncodedVariant finish() {
		checkOpen();
		discardOpenChild();
		if (!hasValue) {
			throw new IllegalStateException("No root value was appended");
		}
		finished = true;
		MetadataBuilder.Finished dictionary = metadata.finish(settings.sortedDictionary());
		byte[] valueBytes;
		if (dictionary.isIdentity()) {
			valueBytes = value.toByteArray();
		} else {
			LOGGER.debug("Remapping field ids of {}-byte value to sorted dictionary positions", value.size());
			valueBytes = FieldIdRemapper.remap(value.array(), value.size(), dictionary);
		}
		return new EncodedVariant(dictionary.bytes(), valueBytes);
	}

	@Override
	ByteWriter writer() {
		return value;
	}

	@Override
	void beginValue() {
		if (hasValue) {
			throw new IllegalStateException("A variant has exactly one root value");
		}
	}

	@Override
	void endValue(int start) {
		hasValue = true;
	}

	@Override
	void abandonValue() {
	}

	@Override
	void checkOpen() {
		if (finished) {
			throw new IllegalStateException("VariantBuilder has already finished");
		}
	}

	@Override
	void abortScope() {
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VariantBuilder.class);
}
