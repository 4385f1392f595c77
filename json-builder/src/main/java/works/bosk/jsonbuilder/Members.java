package works.bosk.jsonbuilder;

import works.bosk.jsonbuilder.io.ByteRope;

import static java.util.Objects.requireNonNull;

/**
 * Zero or more comma-joined members of an object or array, not yet wrapped in delimiters.
 * <p>
 * {@code isEmpty} says whether any member has been emitted,
 * which decides whether the next concatenation needs a comma.
 * Concatenation is associative with {@link #EMPTY} as its identity,
 * so members can be joined in any grouping with the same result.
 *
 * @param bytes the joined members
 * @param isEmpty true iff there are no members
 */
record Members(ByteRope bytes, boolean isEmpty) {
	Members {
		requireNonNull(bytes);
		assert isEmpty == bytes.isEmpty(): "Every member has at least one byte";
	}

	static final Members EMPTY = new Members(ByteRope.empty(), true);

	static Members single(ByteRope member) {
		return new Members(member, false);
	}

	Members plus(Members other) {
		if (this.isEmpty) {
			return other;
		} else if (other.isEmpty) {
			return this;
		} else {
			return new Members(bytes.plus(COMMA).plus(other.bytes), false);
		}
	}

	ByteRope wrap(ByteRope open, ByteRope close) {
		return open.plus(bytes).plus(close);
	}

	boolean contentEquals(Members other) {
		return this.isEmpty == other.isEmpty && ByteRope.contentEquals(this.bytes, other.bytes);
	}

	int contentHashCode() {
		return ByteRope.contentHashCode(bytes);
	}

	private static final ByteRope COMMA = ByteRope.ascii(",");
}
