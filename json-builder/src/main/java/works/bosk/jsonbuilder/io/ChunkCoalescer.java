package works.bosk.jsonbuilder.io;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the chunks of a {@link ByteRope} into buffers of a useful size for IO.
 * <p>
 * A rope of JSON is mostly tiny chunks (a comma, a brace, a short number),
 * so consecutive small chunks are copied together into buffers of {@code chunkSize} bytes.
 * A chunk at least that large is passed through without copying.
 * Every buffer returned is read-only and is never reused.
 */
public final class ChunkCoalescer implements Iterator<ByteBuffer> {
	private final Iterator<ByteChunk> chunks;
	private final int chunkSize;

	/**
	 * A chunk, or the unread tail of one, to be processed first on the following call.
	 */
	private ByteChunk deferred;

	public ChunkCoalescer(ByteRope rope, int chunkSize) {
		if (chunkSize <= 0) {
			throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
		}
		this.chunks = rope.chunks();
		this.chunkSize = chunkSize;
	}

	@Override
	public boolean hasNext() {
		return deferred != null || chunks.hasNext();
	}

	@Override
	public ByteBuffer next() {
		ByteChunk first;
		if (deferred != null) {
			first = deferred;
			deferred = null;
		} else if (chunks.hasNext()) {
			first = chunks.next();
		} else {
			throw new NoSuchElementException();
		}
		if (first.length() >= chunkSize) {
			return first.asReadOnlyBuffer();
		}

		byte[] buffer = new byte[chunkSize];
		first.copyTo(buffer, 0);
		int size = first.length();
		int pieces = 1;
		while (chunks.hasNext()) {
			ByteChunk chunk = chunks.next();
			if (chunk.length() >= chunkSize) {
				deferred = chunk;
				break;
			}
			int n = Math.min(chunk.length(), chunkSize - size);
			chunk.copyTo(0, buffer, size, n);
			size += n;
			pieces++;
			if (n < chunk.length()) {
				// Buffer is full; the rest of this chunk goes first next time
				deferred = chunk.tail(n);
				break;
			} else if (size == chunkSize) {
				break;
			}
		}
		LOGGER.trace("Coalesced {} chunks into {} bytes", pieces, size);
		return ByteBuffer.wrap(buffer, 0, size).slice().asReadOnlyBuffer();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ChunkCoalescer.class);
}
