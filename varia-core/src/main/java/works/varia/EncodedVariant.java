package works.varia;

import java.util.Arrays;

/**
 * The two buffers that make up one serialized variant.
 * <p>
 * The arrays are not copied; treat them as immutable.
 */
public record EncodedVariant(byte[] metadata, byte[] value) {
	/**
	 * A decoder over these buffers.
	 * Intended for buffers this process produced; use {@link #validate()} first otherwise.
	 */
	public Variant toVariant() {
		return Variant.of(metadata, value);
	}

	/**
	 * Validates with {@link ValidationSettings#DEFAULT default settings}, then decodes.
	 */
	public Variant validate() {
		return validate(ValidationSettings.DEFAULT);
	}

	public Variant validate(ValidationSettings settings) {
		new VariantValidator(settings).validate(metadata, value);
		return toVariant();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof EncodedVariant other) {
			return Arrays.equals(metadata, other.metadata) && Arrays.equals(value, other.value);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(metadata) + Arrays.hashCode(value);
	}

	@Override
	public String toString() {
		return "EncodedVariant(metadata=" + metadata.length + " bytes, value=" + value.length + " bytes)";
	}
}
