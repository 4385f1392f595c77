package works.bosk.jsonbuilder;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.util.Iterator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jsonbuilder.escape.Escaped;
import works.bosk.jsonbuilder.io.ByteChunk;
import works.bosk.jsonbuilder.io.ByteRope;
import works.bosk.jsonbuilder.io.ChunkCoalescer;
import works.bosk.jsonbuilder.io.RopeInputStream;

import static java.util.Objects.requireNonNull;

/**
 * A complete JSON value, as UTF-8 bytes.
 * <p>
 * Immutable. Nothing is flattened or copied until the bytes are requested,
 * so embedding a {@code Json} in a larger structure is cheap,
 * and the same instance can be embedded in many structures.
 * <p>
 * Equality is byte equality.
 */
public final class Json implements JsonValue {
	private final ByteRope bytes;

	Json(ByteRope bytes) {
		assert !bytes.isEmpty(): "Every JSON value has at least one byte";
		this.bytes = bytes;
	}

	public static final Json NULL = ascii("null");
	public static final Json TRUE = ascii("true");
	public static final Json FALSE = ascii("false");

	/**
	 * The buffer size used by {@link #writeTo(OutputStream)}, {@link #writeTo(WritableByteChannel)}
	 * and {@link #coalescedChunks()}.
	 */
	public static final int DEFAULT_CHUNK_SIZE = 8192;

	// Factories for common cases, using JsonEncoders.standard() policies

	public static Json bool(boolean value) {
		return value ? TRUE : FALSE;
	}

	public static Json number(long value) {
		return ascii(Long.toString(value));
	}

	public static Json number(BigInteger value) {
		return ascii(value.toString());
	}

	public static Json number(BigDecimal value) {
		return ascii(value.toString());
	}

	/**
	 * @throws works.bosk.jsonbuilder.exceptions.NonFiniteNumberException if {@code value} is not finite
	 */
	public static Json number(double value) {
		return JsonEncoders.standard().doubles().encode(value);
	}

	public static Json string(CharSequence value) {
		return JsonEncoders.standard().strings().encode(value);
	}

	public static Json string(Escaped value) {
		return new Json(QUOTE.plus(value.bytes()).plus(QUOTE));
	}

	public static <T> Json encode(T value, JsonEncoder<? super T> encoder) {
		return requireNonNull(encoder.encode(value));
	}

	/**
	 * Encodes a value according to its runtime class.
	 *
	 * @see JsonEncoders#dynamic()
	 */
	public static Json of(@Nullable Object value) {
		return JsonEncoders.standard().dynamic().encode(value);
	}

	/**
	 * @param asciiText must be valid JSON containing only 7-bit ASCII characters
	 */
	static Json ascii(String asciiText) {
		return new Json(ByteRope.ascii(asciiText));
	}

	ByteRope bytes() {
		return bytes;
	}

	@Override
	public Json toJson() {
		return this;
	}

	// Outbound

	/**
	 * @return the number of bytes of UTF-8
	 */
	public long length() {
		return bytes.length();
	}

	public byte[] toBytes() {
		return bytes.toByteArray();
	}

	/**
	 * @return the JSON text
	 */
	@Override
	public String toString() {
		return bytes.decodeUtf8();
	}

	/**
	 * @return the bytes as read-only buffers, produced lazily, in order.
	 * Buffers correspond to the pieces the value was built from, and can be very small;
	 * see {@link #coalescedChunks()} for IO.
	 */
	public Iterator<ByteBuffer> chunks() {
		Iterator<ByteChunk> chunks = bytes.chunks();
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return chunks.hasNext();
			}

			@Override
			public ByteBuffer next() {
				return chunks.next().asReadOnlyBuffer();
			}
		};
	}

	/**
	 * @return the bytes as read-only buffers of at most {@link #DEFAULT_CHUNK_SIZE} bytes each,
	 * except that larger pieces are returned whole
	 */
	public Iterator<ByteBuffer> coalescedChunks() {
		return coalescedChunks(DEFAULT_CHUNK_SIZE);
	}

	public Iterator<ByteBuffer> coalescedChunks(int chunkSize) {
		return new ChunkCoalescer(bytes, chunkSize);
	}

	/**
	 * @return a stream that reads the bytes lazily
	 */
	public InputStream toInputStream() {
		return new RopeInputStream(bytes);
	}

	/**
	 * Writes the bytes and flushes. Does not close {@code out}.
	 */
	public void writeTo(OutputStream out) throws IOException {
		LOGGER.debug("Writing {} bytes of JSON to {}", bytes.length(), out.getClass().getSimpleName());
		BufferedOutputStream buffered = new BufferedOutputStream(out, DEFAULT_CHUNK_SIZE);
		for (Iterator<ByteChunk> iter = bytes.chunks(); iter.hasNext(); ) {
			iter.next().writeTo(buffered);
		}
		buffered.flush();
	}

	/**
	 * Writes all the bytes, looping if the channel accepts fewer than offered.
	 * Does not close {@code channel}.
	 */
	public void writeTo(WritableByteChannel channel) throws IOException {
		LOGGER.debug("Writing {} bytes of JSON to {}", bytes.length(), channel.getClass().getSimpleName());
		for (Iterator<ByteBuffer> iter = coalescedChunks(); iter.hasNext(); ) {
			ByteBuffer buffer = iter.next();
			while (buffer.hasRemaining()) {
				channel.write(buffer);
			}
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Json other && ByteRope.contentEquals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return ByteRope.contentHashCode(bytes);
	}

	static final ByteRope QUOTE = ByteRope.ascii("\"");

	private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);
}
