package works.bosk.jsonbuilder;

import java.nio.ByteBuffer;
import java.util.function.Function;
import works.bosk.jsonbuilder.escape.Escaped;
import works.bosk.jsonbuilder.escape.JsonEscaper;

/**
 * Capability to render a value as the body of a JSON string.
 * Used for object member names, and anywhere else text is needed.
 * <p>
 * Each text representation has its own implementation.
 * The no-argument factories use {@link JsonEscaper#standard()};
 * the others use the given escaper's {@link works.bosk.jsonbuilder.escape.MalformedTextPolicy policy}.
 *
 * @param <K> the text representation
 */
@FunctionalInterface
public interface JsonText<K> {
	Escaped escape(K text);

	/**
	 * @return a text capability for {@code U} that escapes the {@code K} that {@code representation} returns
	 */
	default <U> JsonText<U> from(Function<? super U, ? extends K> representation) {
		return u -> escape(representation.apply(u));
	}

	/**
	 * @return an encoder that renders the text as a quoted JSON string
	 */
	default JsonEncoder<K> asEncoder() {
		return k -> escape(k).toJson();
	}

	static JsonText<CharSequence> charSequence() {
		return charSequence(JsonEscaper.standard());
	}

	static JsonText<CharSequence> charSequence(JsonEscaper escaper) {
		return escaper::escape;
	}

	/**
	 * Native text supplied in pieces, escaped as though concatenated.
	 */
	static JsonText<Iterable<? extends CharSequence>> charSequenceChunks(JsonEscaper escaper) {
		return escaper::escapeChunks;
	}

	/**
	 * @see #utf8(JsonEscaper)
	 */
	static JsonText<byte[]> utf8() {
		return utf8(JsonEscaper.standard());
	}

	/**
	 * UTF-8 text in a byte array.
	 * The array is read when {@link #escape} is called, and not retained.
	 */
	static JsonText<byte[]> utf8(JsonEscaper escaper) {
		return escaper::escapeUtf8;
	}

	/**
	 * UTF-8 text in the {@link ByteBuffer#remaining() remaining} bytes of a buffer.
	 * The buffer's position is not changed.
	 */
	static JsonText<ByteBuffer> utf8Buffer(JsonEscaper escaper) {
		return escaper::escapeUtf8;
	}

	/**
	 * UTF-8 text supplied in pieces, escaped as though concatenated.
	 * A multi-byte sequence may be split across pieces.
	 */
	static JsonText<Iterable<byte[]>> utf8Chunks(JsonEscaper escaper) {
		return escaper::escapeUtf8Chunks;
	}

	/**
	 * Uses the constant's {@link Enum#name() name}.
	 */
	static <E extends Enum<E>> JsonText<E> enumName() {
		return e -> JsonEscaper.standard().escape(e.name());
	}

	static JsonText<Escaped> escaped() {
		return e -> e;
	}
}
