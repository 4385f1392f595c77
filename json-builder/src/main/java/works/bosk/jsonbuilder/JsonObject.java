package works.bosk.jsonbuilder;

import java.util.Map;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import works.bosk.jsonbuilder.escape.Escaped;
import works.bosk.jsonbuilder.exceptions.JsonContentException;
import works.bosk.jsonbuilder.exceptions.JsonException;
import works.bosk.jsonbuilder.io.ByteRope;

import static java.util.Objects.requireNonNull;

/**
 * The members of a JSON object under construction.
 * <p>
 * Start with {@link #row} for a single member, or {@link #empty()},
 * and join objects with {@link #plus}.
 * Joining is associative, with {@link #empty()} as its identity:
 * however the pieces are grouped, the result has exactly one comma between adjacent members
 * and none before the first or after the last.
 * Argument order determines member order.
 * <p>
 * Immutable. {@link #toJson()} wraps the members in braces.
 * Duplicate member names are not detected.
 */
public final class JsonObject implements ToJsonObject {
	private final Members members;

	private JsonObject(Members members) {
		this.members = members;
	}

	public static JsonObject empty() {
		return EMPTY;
	}

	/**
	 * @return an object with the single member {@code "key":value}
	 */
	public static JsonObject row(Escaped key, JsonValue value) {
		ByteRope member = Json.QUOTE
			.plus(key.bytes())
			.plus(QUOTE_COLON)
			.plus(value.toJson().bytes());
		return new JsonObject(Members.single(member));
	}

	public static JsonObject row(CharSequence key, JsonValue value) {
		return row(escapeKey(key), value);
	}

	public static JsonObject row(CharSequence key, CharSequence value) {
		return row(key, value, JsonEncoders.standard().strings());
	}

	public static JsonObject row(CharSequence key, long value) {
		return row(escapeKey(key), Json.number(value));
	}

	/**
	 * @throws works.bosk.jsonbuilder.exceptions.NonFiniteNumberException if {@code value} is not finite
	 */
	public static JsonObject row(CharSequence key, double value) {
		return row(key, value, JsonEncoders.standard().doubles());
	}

	public static JsonObject row(CharSequence key, boolean value) {
		return row(escapeKey(key), Json.bool(value));
	}

	/**
	 * Errors from {@code encoder} name the member.
	 */
	public static <V> JsonObject row(CharSequence key, V value, JsonEncoder<? super V> encoder) {
		Escaped escapedKey = escapeKey(key);
		return row(escapedKey, encodeMember(escapedKey, value, encoder));
	}

	/**
	 * @return the rows for the entries of {@code map}, in its iteration order
	 */
	public static <K, V> JsonObject of(Map<? extends K, ? extends V> map, JsonText<? super K> keyText, JsonEncoder<? super V> valueEncoder) {
		return ofEntries(map.entrySet(), keyText, valueEncoder);
	}

	public static JsonObject of(Map<? extends CharSequence, ? extends JsonValue> map) {
		JsonObject result = EMPTY;
		for (Map.Entry<? extends CharSequence, ? extends JsonValue> entry : map.entrySet()) {
			result = result.plus(row(entry.getKey(), entry.getValue()));
		}
		return result;
	}

	/**
	 * Like {@link #of(Map, JsonText, JsonEncoder) of}, but accepts any sequence of entries,
	 * and emits every one of them even if keys repeat.
	 */
	public static <K, V> JsonObject ofEntries(
		Iterable<? extends Map.Entry<? extends K, ? extends V>> entries,
		JsonText<? super K> keyText,
		JsonEncoder<? super V> valueEncoder
	) {
		JsonObject result = EMPTY;
		for (Map.Entry<? extends K, ? extends V> entry : entries) {
			Escaped key = keyText.escape(entry.getKey());
			result = result.plus(row(key, encodeMember(key, entry.getValue(), valueEncoder)));
		}
		return result;
	}

	/**
	 * Encodes a member value, adding the member name to any error message.
	 */
	static <V> Json encodeMember(Escaped key, V value, JsonEncoder<? super V> valueEncoder) {
		try {
			return valueEncoder.encode(value);
		} catch (JsonContentException e) {
			throw JsonException.wrap(e, "Member \"" + key + "\"");
		}
	}

	public static JsonObject concat(ToJsonObject... parts) {
		JsonObject result = EMPTY;
		for (ToJsonObject part : parts) {
			result = result.plus(part);
		}
		return result;
	}

	public static JsonObject concat(Iterable<? extends ToJsonObject> parts) {
		JsonObject result = EMPTY;
		for (ToJsonObject part : parts) {
			result = result.plus(part);
		}
		return result;
	}

	/**
	 * Joins the objects of a stream, in encounter order.
	 * Safe for parallel streams.
	 */
	public static Collector<ToJsonObject, ?, JsonObject> collector() {
		return Collectors.reducing(EMPTY, ToJsonObject::toJsonObject, JsonObject::plus);
	}

	public JsonObject plus(ToJsonObject other) {
		JsonObject that = requireNonNull(other.toJsonObject());
		Members joined = this.members.plus(that.members);
		if (joined == this.members) {
			return this;
		} else if (joined == that.members) {
			return that;
		} else {
			return new JsonObject(joined);
		}
	}

	public boolean isEmpty() {
		return members.isEmpty();
	}

	@Override
	public JsonObject toJsonObject() {
		return this;
	}

	@Override
	public Json toJson() {
		return new Json(members.wrap(OPEN, CLOSE));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonObject other && members.contentEquals(other.members);
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

	private static Escaped escapeKey(CharSequence key) {
		return JsonEncoders.standard().escaper().escape(key);
	}

	private static final JsonObject EMPTY = new JsonObject(Members.EMPTY);
	private static final ByteRope QUOTE_COLON = ByteRope.ascii("\":");
	private static final ByteRope OPEN = ByteRope.ascii("{");
	private static final ByteRope CLOSE = ByteRope.ascii("}");
}
