package works.bosk.jsonbuilder.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.checkFromIndexSize;

/**
 * A read-only slice of a byte array.
 * <p>
 * The array itself is never handed out: bytes leave a chunk only by copying,
 * or through a {@link #asReadOnlyBuffer() read-only buffer}.
 * Chunks reachable from a {@link ByteRope} are therefore never modified once the rope exists,
 * provided whoever created the chunk leaves the array alone.
 * <p>
 * Equality is identity; use {@link ByteRope#contentEquals} to compare bytes.
 */
public final class ByteChunk {
	private final byte[] bytes;
	private final int start;
	private final int stop;

	/**
	 * @param bytes the array containing the chunk data; the caller gives up the right to modify it
	 * @param start the index of the first byte in the chunk
	 * @param stop  the index one past the last byte in the chunk
	 */
	public ByteChunk(byte[] bytes, int start, int stop) {
		if (start < 0 || stop < start || stop > bytes.length) {
			throw new IndexOutOfBoundsException("Invalid chunk [" + start + ", " + stop + ") of array with length " + bytes.length);
		}
		this.bytes = bytes;
		this.start = start;
		this.stop = stop;
	}

	/**
	 * Wraps the whole array without copying.
	 * The caller gives up the right to modify it.
	 */
	public static ByteChunk wrap(byte[] bytes) {
		return new ByteChunk(bytes, 0, bytes.length);
	}

	/**
	 * @param text must contain only 7-bit ASCII characters
	 */
	public static ByteChunk ascii(String text) {
		return wrap(text.getBytes(US_ASCII));
	}

	public int length() {
		return stop - start;
	}

	public byte byteAt(int index) {
		return bytes[start + index];
	}

	/**
	 * @return the bytes from {@code offset} to the end of this chunk, sharing the same array
	 */
	public ByteChunk tail(int offset) {
		return new ByteChunk(bytes, start + offset, stop);
	}

	public ByteBuffer asReadOnlyBuffer() {
		return ByteBuffer.wrap(bytes, start, length()).slice().asReadOnlyBuffer();
	}

	public byte[] toByteArray() {
		byte[] result = new byte[length()];
		copyTo(result, 0);
		return result;
	}

	public void copyTo(byte[] destination, int destinationPos) {
		System.arraycopy(bytes, start, destination, destinationPos, length());
	}

	/**
	 * Copies {@code length} bytes starting {@code offset} bytes into this chunk.
	 */
	public void copyTo(int offset, byte[] destination, int destinationPos, int length) {
		checkFromIndexSize(offset, length, length());
		System.arraycopy(bytes, start + offset, destination, destinationPos, length);
	}

	public void writeTo(OutputStream out) throws IOException {
		out.write(bytes, start, length());
	}

	@Override
	public String toString() {
		return "ByteChunk(" + length() + " bytes)";
	}
}
