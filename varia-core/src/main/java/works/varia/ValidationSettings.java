package works.varia;

/**
 * Limits applied by {@link VariantValidator}.
 *
 * @param maxDepth the greatest nesting of objects and arrays accepted.
 *                 A scalar at the top level has depth zero; each enclosing composite adds one.
 */
public record ValidationSettings(int maxDepth) {
	public static final int DEFAULT_MAX_DEPTH = 128;
	public static final ValidationSettings DEFAULT = new ValidationSettings(DEFAULT_MAX_DEPTH);

	public ValidationSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
		}
	}

	public ValidationSettings withMaxDepth(int maxDepth) {
		return new ValidationSettings(maxDepth);
	}
}
