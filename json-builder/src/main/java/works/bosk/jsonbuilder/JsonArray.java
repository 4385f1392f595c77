package works.bosk.jsonbuilder;

import java.util.Iterator;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import works.bosk.jsonbuilder.io.ByteRope;

import static java.util.Objects.requireNonNull;

/**
 * The elements of a JSON array under construction.
 * <p>
 * Start with {@link #element} for a single element, or {@link #empty()},
 * and join arrays with {@link #plus}.
 * Joining is associative, with {@link #empty()} as its identity:
 * however the pieces are grouped, the result has exactly one comma between adjacent elements
 * and none before the first or after the last.
 * Argument order determines element order.
 * <p>
 * Immutable. {@link #toJson()} wraps the elements in brackets.
 */
public final class JsonArray implements ToJsonArray {
	private final Members members;

	private JsonArray(Members members) {
		this.members = members;
	}

	public static JsonArray empty() {
		return EMPTY;
	}

	public static JsonArray element(JsonValue value) {
		return new JsonArray(Members.single(value.toJson().bytes()));
	}

	public static JsonArray element(CharSequence value) {
		return element(Json.string(value));
	}

	public static JsonArray element(long value) {
		return element(Json.number(value));
	}

	/**
	 * @throws works.bosk.jsonbuilder.exceptions.NonFiniteNumberException if {@code value} is not finite
	 */
	public static JsonArray element(double value) {
		return element(Json.number(value));
	}

	public static JsonArray element(boolean value) {
		return element(Json.bool(value));
	}

	public static <T> JsonArray element(T value, JsonEncoder<? super T> encoder) {
		return element(encoder.encode(value));
	}

	/**
	 * @return one element per item of {@code items}, in iteration order
	 */
	public static <T> JsonArray of(Iterable<? extends T> items, JsonEncoder<? super T> encoder) {
		JsonArray result = EMPTY;
		for (T item : items) {
			result = result.plus(element(encoder.encode(item)));
		}
		return result;
	}

	/**
	 * @return one element per item of {@code items}, in encounter order
	 */
	public static <T> JsonArray of(Stream<? extends T> items, JsonEncoder<? super T> encoder) {
		JsonArray result = EMPTY;
		for (Iterator<? extends T> iter = items.iterator(); iter.hasNext(); ) {
			result = result.plus(element(encoder.encode(iter.next())));
		}
		return result;
	}

	public static JsonArray ofValues(Iterable<? extends JsonValue> values) {
		JsonArray result = EMPTY;
		for (JsonValue value : values) {
			result = result.plus(element(value));
		}
		return result;
	}

	public static JsonArray concat(ToJsonArray... parts) {
		JsonArray result = EMPTY;
		for (ToJsonArray part : parts) {
			result = result.plus(part);
		}
		return result;
	}

	public static JsonArray concat(Iterable<? extends ToJsonArray> parts) {
		JsonArray result = EMPTY;
		for (ToJsonArray part : parts) {
			result = result.plus(part);
		}
		return result;
	}

	/**
	 * Joins the arrays of a stream, in encounter order.
	 * Safe for parallel streams.
	 */
	public static Collector<ToJsonArray, ?, JsonArray> collector() {
		return Collectors.reducing(EMPTY, ToJsonArray::toJsonArray, JsonArray::plus);
	}

	public JsonArray plus(ToJsonArray other) {
		JsonArray that = requireNonNull(other.toJsonArray());
		Members joined = this.members.plus(that.members);
		if (joined == this.members) {
			return this;
		} else if (joined == that.members) {
			return that;
		} else {
			return new JsonArray(joined);
		}
	}

	public boolean isEmpty() {
		return members.isEmpty();
	}

	@Override
	public JsonArray toJsonArray() {
		return this;
	}

	@Override
	public Json toJson() {
		return new Json(members.wrap(OPEN, CLOSE));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonArray other && members.contentEquals(other.members);
	}

	@Override
	public int hashCode() {
		return members.contentHashCode();
	}

	/**
	 * @return the rendered JSON text
	 */
	@Override
	public String toString() {
		return toJson().toString();
	}

	private static final JsonArray EMPTY = new JsonArray(Members.EMPTY);
	private static final ByteRope OPEN = ByteRope.ascii("[");
	private static final ByteRope CLOSE = ByteRope.ascii("]");
}
