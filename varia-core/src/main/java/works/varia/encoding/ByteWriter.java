package works.varia.encoding;

import java.util.Arrays;

import static works.varia.encoding.VariantEncoding.writeLittleEndian;

/**
 * A growable byte buffer with little-endian writers.
 * Not thread-safe; each build scope owns its own writer.
 */
public final class ByteWriter {
	private byte[] buffer;
	private int size;

	public ByteWriter() {
		this(64);
	}

	public ByteWriter(int initialCapacity) {
		this.buffer = new byte[Math.max(initialCapacity, 8)];
	}

	public int size() {
		return size;
	}

	/**
	 * The backing array. Only the first {@link #size()} bytes are meaningful,
	 * and the array is replaced whenever the writer grows.
	 */
	public byte[] array() {
		return buffer;
	}

	public void writeByte(int b) {
		ensureCapacity(1);
		buffer[size++] = (byte) b;
	}

	public void writeLittleEndianValue(long value, int numBytes) {
		ensureCapacity(numBytes);
		writeLittleEndian(buffer, size, value, numBytes);
		size += numBytes;
	}

	public void writeBytes(byte[] bytes) {
		writeBytes(bytes, 0, bytes.length);
	}

	public void writeBytes(byte[] bytes, int offset, int length) {
		ensureCapacity(length);
		System.arraycopy(bytes, offset, buffer, size, length);
		size += length;
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(buffer, size);
	}

	private void ensureCapacity(int additional) {
		long required = (long) size + additional;
		if (required > buffer.length) {
			if (required > Integer.MAX_VALUE - 8) {
				throw new IllegalStateException("Buffer would exceed maximum array size: " + required);
			}
			int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(required, 2L * buffer.length));
			buffer = Arrays.copyOf(buffer, newCapacity);
		}
	}

	@Override
	public String toString() {
		return "ByteWriter(" + size + " bytes)";
	}
}
