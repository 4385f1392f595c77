package works.bosk.jsonbuilder.io;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import works.bosk.jsonbuilder.exceptions.JsonProcessingException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An immutable sequence of bytes represented as a binary tree of {@link ByteChunk}s.
 * <p>
 * Concatenation is constant-time and never copies bytes,
 * which lets JSON fragments be glued together in any grouping
 * before anything is written out.
 * Iteration visits the chunks left to right using an explicit stack,
 * so ropes built by long left or right folds can be traversed
 * without recursion.
 * <p>
 * Equality is byte equality regardless of tree shape, consistent with {@link #contentEquals}.
 * Neither equality, hashing, nor {@code toString} recurse into the tree.
 */
public sealed interface ByteRope permits ByteRope.Empty, ByteRope.Leaf, ByteRope.Concat {
	/**
	 * @return the total number of bytes
	 */
	long length();

	default boolean isEmpty() {
		return length() == 0;
	}

	static ByteRope empty() {
		return Empty.INSTANCE;
	}

	static ByteRope of(ByteChunk chunk) {
		if (chunk.length() == 0) {
			return Empty.INSTANCE;
		} else {
			return new Leaf(chunk);
		}
	}

	/**
	 * @param text must contain only 7-bit ASCII characters
	 */
	static ByteRope ascii(String text) {
		return of(ByteChunk.ascii(text));
	}

	static ByteRope concat(ByteRope... parts) {
		ByteRope result = Empty.INSTANCE;
		for (ByteRope part : parts) {
			result = result.plus(part);
		}
		return result;
	}

	default ByteRope plus(ByteRope other) {
		requireNonNull(other);
		if (this.isEmpty()) {
			return other;
		} else if (other.isEmpty()) {
			return this;
		} else {
			return new Concat(this, other, this.length() + other.length());
		}
	}

	/**
	 * @return the non-empty chunks of this rope, in order.
	 * The chunks share this rope's storage but expose it only through copies and read-only views.
	 */
	default Iterator<ByteChunk> chunks() {
		return new ChunkIterator(this);
	}

	default void forEachChunk(Consumer<? super ByteChunk> action) {
		for (Iterator<ByteChunk> iter = chunks(); iter.hasNext(); ) {
			action.accept(iter.next());
		}
	}

	default byte[] toByteArray() {
		long length = length();
		if (length > MAX_ARRAY_LENGTH) {
			throw new JsonProcessingException("Rope of " + length + " bytes is too large for an array");
		}
		byte[] result = new byte[(int) length];
		int pos = 0;
		for (Iterator<ByteChunk> iter = chunks(); iter.hasNext(); ) {
			ByteChunk chunk = iter.next();
			chunk.copyTo(result, pos);
			pos += chunk.length();
		}
		assert pos == result.length;
		return result;
	}

	default String decodeUtf8() {
		return new String(toByteArray(), UTF_8);
	}

	/**
	 * Compares the bytes of two ropes without flattening either of them.
	 */
	static boolean contentEquals(ByteRope a, ByteRope b) {
		if (a == b) {
			return true;
		}
		if (a.length() != b.length()) {
			return false;
		}
		Iterator<ByteChunk> ai = a.chunks();
		Iterator<ByteChunk> bi = b.chunks();
		ByteChunk ac = null, bc = null;
		int ap = 0, bp = 0;
		while (true) {
			if (ac == null || ap == ac.length()) {
				if (!ai.hasNext()) {
					// Lengths are equal, so b must be finished too
					return true;
				}
				ac = ai.next();
				ap = 0;
			}
			if (bc == null || bp == bc.length()) {
				bc = bi.next();
				bp = 0;
			}
			int n = Math.min(ac.length() - ap, bc.length() - bp);
			for (int i = 0; i < n; i++) {
				if (ac.byteAt(ap + i) != bc.byteAt(bp + i)) {
					return false;
				}
			}
			ap += n;
			bp += n;
		}
	}

	/**
	 * Consistent with {@link #contentEquals}.
	 */
	static int contentHashCode(ByteRope rope) {
		int result = 1;
		for (Iterator<ByteChunk> iter = rope.chunks(); iter.hasNext(); ) {
			ByteChunk chunk = iter.next();
			for (int i = 0; i < chunk.length(); i++) {
				result = 31 * result + chunk.byteAt(i);
			}
		}
		return result;
	}

	enum Empty implements ByteRope {
		INSTANCE;

		@Override
		public long length() {
			return 0;
		}
	}

	record Leaf(ByteChunk chunk) implements ByteRope {
		public Leaf {
			assert chunk.length() > 0: "Use ByteRope.empty() instead";
		}

		@Override
		public long length() {
			return chunk.length();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ByteRope other && ByteRope.contentEquals(this, other);
		}

		@Override
		public int hashCode() {
			return ByteRope.contentHashCode(this);
		}

		@Override
		public String toString() {
			return "Leaf(" + length() + " bytes)";
		}
	}

	record Concat(ByteRope left, ByteRope right, long length) implements ByteRope {
		public Concat {
			assert length == left.length() + right.length();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ByteRope other && ByteRope.contentEquals(this, other);
		}

		@Override
		public int hashCode() {
			return ByteRope.contentHashCode(this);
		}

		@Override
		public String toString() {
			return "Concat(" + length + " bytes)";
		}
	}

	int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

	final class ChunkIterator implements Iterator<ByteChunk> {
		private final ArrayDeque<ByteRope> pending = new ArrayDeque<>();
		private ByteChunk next;

		ChunkIterator(ByteRope root) {
			pending.push(root);
			advance();
		}

		@Override
		public boolean hasNext() {
			return next != null;
		}

		@Override
		public ByteChunk next() {
			if (next == null) {
				throw new NoSuchElementException();
			}
			ByteChunk result = next;
			advance();
			return result;
		}

		private void advance() {
			while (!pending.isEmpty()) {
				ByteRope top = pending.pop();
				if (top instanceof Concat c) {
					pending.push(c.right());
					pending.push(c.left());
				} else if (top instanceof Leaf l) {
					next = l.chunk();
					return;
				}
			}
			next = null;
		}
	}
}
