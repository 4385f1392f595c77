package works.bosk.jsonbuilder.io;

import java.util.Arrays;

/**
 * A growable byte buffer that is written once and then frozen into a {@link ByteRope}.
 * <p>
 * After {@link #toRope()}, the buffer's array belongs to the rope,
 * and any further write throws {@link IllegalStateException}.
 */
public final class ByteSink {
	private byte[] buffer;
	private int size = 0;
	private boolean frozen = false;

	public ByteSink(int initialCapacity) {
		this.buffer = new byte[Math.max(initialCapacity, MIN_CAPACITY)];
	}

	public int size() {
		return size;
	}

	public ByteSink write(int b) {
		ensureCapacity(1);
		buffer[size++] = (byte) b;
		return this;
	}

	public ByteSink write(byte[] bytes, int offset, int length) {
		ensureCapacity(length);
		System.arraycopy(bytes, offset, buffer, size, length);
		size += length;
		return this;
	}

	public ByteSink write(byte[] bytes) {
		return write(bytes, 0, bytes.length);
	}

	/**
	 * @param text must contain only 7-bit ASCII characters
	 */
	public ByteSink writeAscii(CharSequence text) {
		int length = text.length();
		ensureCapacity(length);
		for (int i = 0; i < length; i++) {
			char c = text.charAt(i);
			assert c < 0x80: "ASCII characters only: " + Character.getName(c);
			buffer[size++] = (byte) c;
		}
		return this;
	}

	/**
	 * Writes the UTF-8 encoding of a Unicode scalar value.
	 */
	public ByteSink writeCodePoint(int codePoint) {
		ensureCapacity(4);
		if (codePoint < 0x80) {
			buffer[size++] = (byte) codePoint;
		} else if (codePoint < 0x800) {
			buffer[size++] = (byte) (0xC0 | (codePoint >> 6));
			buffer[size++] = (byte) (0x80 | (codePoint & 0x3F));
		} else if (codePoint < 0x10000) {
			assert !Character.isSurrogate((char) codePoint): "Surrogates are not scalar values";
			buffer[size++] = (byte) (0xE0 | (codePoint >> 12));
			buffer[size++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
			buffer[size++] = (byte) (0x80 | (codePoint & 0x3F));
		} else {
			assert codePoint <= Character.MAX_CODE_POINT;
			buffer[size++] = (byte) (0xF0 | (codePoint >> 18));
			buffer[size++] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
			buffer[size++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
			buffer[size++] = (byte) (0x80 | (codePoint & 0x3F));
		}
		return this;
	}

	public ByteRope toRope() {
		frozen = true;
		return ByteRope.of(new ByteChunk(buffer, 0, size));
	}

	private void ensureCapacity(int additional) {
		if (frozen) {
			throw new IllegalStateException("ByteSink has already been turned into a rope");
		}
		int required = size + additional;
		if (required < 0) {
			throw new OutOfMemoryError("Required buffer size exceeds the maximum array length");
		}
		if (required > buffer.length) {
			int newCapacity = Math.max(required, buffer.length + (buffer.length >> 1));
			buffer = Arrays.copyOf(buffer, newCapacity);
		}
	}

	private static final int MIN_CAPACITY = 16;
}
