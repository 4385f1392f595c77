package works.bosk.jsonbuilder;

import java.util.function.Function;

/**
 * Capability to encode values of type {@code T} as JSON.
 * <p>
 * This is the way to give a JSON encoding to types that can't implement {@link JsonValue},
 * such as {@link Integer} or {@link java.util.List}.
 * Built-in encoders come from {@link JsonEncoders}.
 * <p>
 * Implementations must be total and deterministic:
 * every value the encoder accepts must have an encoding,
 * unless a {@link JsonBuilderSettings policy} says otherwise.
 * Implementations need not accept {@code null}; see {@link #nullable()}.
 *
 * @param <T> the in-memory representation
 */
@FunctionalInterface
public interface JsonEncoder<T> {
	Json encode(T value);

	/**
	 * Describes one type's encoding in terms of another's.
	 *
	 * @return an encoder that encodes the {@code T} that {@code representation} returns
	 */
	default <U> JsonEncoder<U> from(Function<? super U, ? extends T> representation) {
		return u -> encode(representation.apply(u));
	}

	/**
	 * @return an encoder that renders {@code null} as JSON {@code null}
	 * and delegates everything else to this encoder
	 */
	default JsonEncoder<T> nullable() {
		return value -> (value == null) ? Json.NULL : encode(value);
	}
}
