package works.bosk.jsonbuilder.io;

import java.io.InputStream;
import java.util.Iterator;

import static java.util.Objects.checkFromIndexSize;

/**
 * Reads the bytes of a {@link ByteRope} lazily, one chunk at a time.
 * Nothing is copied except into the caller's buffer.
 */
public final class RopeInputStream extends InputStream {
	private final Iterator<ByteChunk> chunks;
	private ByteChunk current;
	private int currentPos;
	private long remaining;

	public RopeInputStream(ByteRope rope) {
		this.chunks = rope.chunks();
		this.remaining = rope.length();
	}

	@Override
	public int read() {
		if (!ensureCurrent()) {
			return -1;
		}
		remaining--;
		return current.byteAt(currentPos++) & 0xFF;
	}

	@Override
	public int read(byte[] b, int off, int len) {
		checkFromIndexSize(off, len, b.length);
		if (len == 0) {
			return 0;
		}
		int total = 0;
		while (total < len && ensureCurrent()) {
			int n = Math.min(len - total, current.length() - currentPos);
			current.copyTo(currentPos, b, off + total, n);
			currentPos += n;
			total += n;
		}
		remaining -= total;
		return (total == 0) ? -1 : total;
	}

	@Override
	public int available() {
		return (int) Math.min(remaining, Integer.MAX_VALUE);
	}

	private boolean ensureCurrent() {
		while (current == null || currentPos == current.length()) {
			if (!chunks.hasNext()) {
				return false;
			}
			current = chunks.next();
			currentPos = 0;
		}
		return true;
	}
}
