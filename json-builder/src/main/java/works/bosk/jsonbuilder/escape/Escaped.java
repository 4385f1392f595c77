package works.bosk.jsonbuilder.escape;

import works.bosk.jsonbuilder.Json;
import works.bosk.jsonbuilder.JsonValue;
import works.bosk.jsonbuilder.io.ByteRope;

import static java.util.Objects.requireNonNull;

/**
 * The body of a JSON string literal: escaped UTF-8, without the surrounding quotes.
 * <p>
 * Instances come only from {@link JsonEscaper}, so the bytes are always
 * well-formed UTF-8 that can be placed between quotes as-is.
 * Renders as a JSON string.
 */
public final class Escaped implements JsonValue {
	private final ByteRope body;

	Escaped(ByteRope body) {
		this.body = requireNonNull(body);
	}

	public static Escaped empty() {
		return EMPTY;
	}

	/**
	 * @return the escaped bytes, without quotes
	 */
	public ByteRope bytes() {
		return body;
	}

	public long length() {
		return body.length();
	}

	public boolean isEmpty() {
		return body.isEmpty();
	}

	/**
	 * Escaping commutes with concatenation, so this is the escaped form
	 * of the two source texts joined together.
	 */
	public Escaped plus(Escaped other) {
		if (other.isEmpty()) {
			return this;
		} else if (this.isEmpty()) {
			return other;
		} else {
			return new Escaped(body.plus(other.body));
		}
	}

	@Override
	public Json toJson() {
		return Json.string(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Escaped other && ByteRope.contentEquals(body, other.body);
	}

	@Override
	public int hashCode() {
		return ByteRope.contentHashCode(body);
	}

	/**
	 * @return the escaped text, decoded, as it would appear between the quotes
	 */
	@Override
	public String toString() {
		return body.decodeUtf8();
	}

	private static final Escaped EMPTY = new Escaped(ByteRope.empty());
}
