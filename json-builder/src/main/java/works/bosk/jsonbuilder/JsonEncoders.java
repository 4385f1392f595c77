package works.bosk.jsonbuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jsonbuilder.escape.Escaped;
import works.bosk.jsonbuilder.escape.JsonEscaper;
import works.bosk.jsonbuilder.exceptions.NonFiniteNumberException;
import works.bosk.jsonbuilder.exceptions.UnsupportedValueException;

import static java.util.Objects.requireNonNull;

/**
 * The built-in {@link JsonEncoder}s, configured by {@link JsonBuilderSettings}.
 * <p>
 * Every encoder here is total for non-null input,
 * except where the settings call for rejecting a value
 * (non-finite numbers, ill-formed text).
 * Numbers are rendered in decimal; integers have no leading zeros and no {@code +}.
 * Floating-point numbers use {@link Double#toString(double)} and {@link Float#toString(float)},
 * whose output parses back to exactly the same value.
 */
public final class JsonEncoders {
	private final JsonBuilderSettings settings;
	private final JsonEscaper escaper;

	private JsonEncoders(JsonBuilderSettings settings) {
		this.settings = requireNonNull(settings);
		this.escaper = JsonEscaper.using(settings.getMalformedText());
	}

	public static JsonEncoders standard() {
		return STANDARD;
	}

	public static JsonEncoders using(JsonBuilderSettings settings) {
		if (settings.equals(STANDARD.settings)) {
			return STANDARD;
		}
		LOGGER.debug("Creating encoders using {}", settings);
		return new JsonEncoders(settings);
	}

	public JsonBuilderSettings settings() {
		return settings;
	}

	public JsonEscaper escaper() {
		return escaper;
	}

	/**
	 * @return the capability to use {@link CharSequence}s as member names
	 */
	public JsonText<CharSequence> text() {
		return JsonText.charSequence(escaper);
	}

	// Scalars

	/**
	 * @return an encoder that ignores its argument and emits {@code null}
	 */
	public JsonEncoder<Object> alwaysNull() {
		return x -> Json.NULL;
	}

	public JsonEncoder<Boolean> booleans() {
		return Json::bool;
	}

	public JsonEncoder<Byte> byteNumbers() {
		return b -> Json.number(b.longValue());
	}

	public JsonEncoder<Short> shorts() {
		return s -> Json.number(s.longValue());
	}

	public JsonEncoder<Integer> ints() {
		return i -> Json.number(i.longValue());
	}

	public JsonEncoder<Long> longs() {
		return Json::number;
	}

	/**
	 * Treats the 8 bits as an unsigned number from 0 to 255.
	 */
	public JsonEncoder<Byte> unsignedBytes() {
		return b -> Json.number(Byte.toUnsignedInt(b));
	}

	/**
	 * Treats the 16 bits as an unsigned number from 0 to 65535.
	 */
	public JsonEncoder<Short> unsignedShorts() {
		return s -> Json.number(Short.toUnsignedInt(s));
	}

	/**
	 * Treats the 32 bits as an unsigned number from 0 to 2<sup>32</sup>-1.
	 */
	public JsonEncoder<Integer> unsignedInts() {
		return i -> Json.ascii(Integer.toUnsignedString(i));
	}

	/**
	 * Treats the 64 bits as an unsigned number from 0 to 2<sup>64</sup>-1.
	 */
	public JsonEncoder<Long> unsignedLongs() {
		return l -> Json.ascii(Long.toUnsignedString(l));
	}

	public JsonEncoder<BigInteger> bigIntegers() {
		return Json::number;
	}

	public JsonEncoder<Float> floats() {
		return f -> Float.isFinite(f)
			? Json.ascii(Float.toString(f))
			: nonFinite(f);
	}

	public JsonEncoder<Double> doubles() {
		return d -> Double.isFinite(d)
			? Json.ascii(Double.toString(d))
			: nonFinite(d);
	}

	public JsonEncoder<BigDecimal> bigDecimals() {
		return Json::number;
	}

	public JsonEncoder<CharSequence> strings() {
		return s -> escaper.escape(s).toJson();
	}

	public JsonEncoder<Character> chars() {
		return c -> escaper.escape(String.valueOf(c.charValue())).toJson();
	}

	/**
	 * A {@code char[]} is text, so it becomes one string, not an array.
	 */
	public JsonEncoder<char[]> charArrays() {
		return c -> escaper.escape(CharBuffer.wrap(c)).toJson();
	}

	/**
	 * UTF-8 text in a byte array.
	 */
	public JsonEncoder<byte[]> utf8() {
		return JsonText.utf8(escaper).asEncoder();
	}

	public JsonEncoder<ByteBuffer> utf8Buffers() {
		return JsonText.utf8Buffer(escaper).asEncoder();
	}

	/**
	 * Native text in pieces, encoded as one string.
	 */
	public JsonEncoder<Iterable<? extends CharSequence>> stringChunks() {
		return JsonText.charSequenceChunks(escaper).asEncoder();
	}

	/**
	 * UTF-8 text in pieces, encoded as one string.
	 */
	public JsonEncoder<Iterable<byte[]>> utf8Chunks() {
		return JsonText.utf8Chunks(escaper).asEncoder();
	}

	/**
	 * Encodes enum constants as their {@link Enum#name() name}.
	 */
	public <E extends Enum<E>> JsonEncoder<E> enumNames() {
		return e -> Json.string(escaper.escape(e.name()));
	}

	public JsonEncoder<JsonValue> jsonValues() {
		return JsonValue::toJson;
	}

	// Containers

	/**
	 * @return an encoder that emits {@code null} for an empty {@link Optional}
	 */
	public <T> JsonEncoder<Optional<? extends T>> optionalOf(JsonEncoder<? super T> encoder) {
		requireNonNull(encoder);
		return opt -> opt.isPresent()
			? encoder.encode(opt.get())
			: Json.NULL;
	}

	public <T> JsonEncoder<Iterable<? extends T>> arrayOf(JsonEncoder<? super T> elementEncoder) {
		requireNonNull(elementEncoder);
		return items -> JsonArray.of(items, elementEncoder).toJson();
	}

	/**
	 * The stream is consumed.
	 */
	public <T> JsonEncoder<Stream<? extends T>> streamOf(JsonEncoder<? super T> elementEncoder) {
		requireNonNull(elementEncoder);
		return items -> JsonArray.of(items, elementEncoder).toJson();
	}

	public <T> JsonEncoder<T[]> objectArrayOf(JsonEncoder<? super T> elementEncoder) {
		requireNonNull(elementEncoder);
		return items -> {
			JsonArray result = JsonArray.empty();
			for (T item : items) {
				result = result.plus(JsonArray.element(elementEncoder.encode(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<boolean[]> booleanArrays() {
		return items -> {
			JsonArray result = JsonArray.empty();
			for (boolean item : items) {
				result = result.plus(JsonArray.element(Json.bool(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<short[]> shortArrays() {
		return items -> {
			JsonArray result = JsonArray.empty();
			for (short item : items) {
				result = result.plus(JsonArray.element(Json.number(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<int[]> intArrays() {
		return items -> {
			JsonArray result = JsonArray.empty();
			for (int item : items) {
				result = result.plus(JsonArray.element(Json.number(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<long[]> longArrays() {
		return items -> {
			JsonArray result = JsonArray.empty();
			for (long item : items) {
				result = result.plus(JsonArray.element(Json.number(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<float[]> floatArrays() {
		JsonEncoder<Float> floats = floats();
		return items -> {
			JsonArray result = JsonArray.empty();
			for (float item : items) {
				result = result.plus(JsonArray.element(floats.encode(item)));
			}
			return result.toJson();
		};
	}

	public JsonEncoder<double[]> doubleArrays() {
		JsonEncoder<Double> doubles = doubles();
		return items -> {
			JsonArray result = JsonArray.empty();
			for (double item : items) {
				result = result.plus(JsonArray.element(doubles.encode(item)));
			}
			return result.toJson();
		};
	}

	/**
	 * Members appear in the map's iteration order.
	 */
	public <K, V> JsonEncoder<Map<? extends K, ? extends V>> mapOf(JsonText<? super K> keyText, JsonEncoder<? super V> valueEncoder) {
		requireNonNull(keyText);
		requireNonNull(valueEncoder);
		return map -> JsonObject.of(map, keyText, valueEncoder).toJson();
	}

	public <V> JsonEncoder<Map<? extends CharSequence, ? extends V>> stringMapOf(JsonEncoder<? super V> valueEncoder) {
		return mapOf(text(), valueEncoder);
	}

	/**
	 * Like {@link #mapOf}, but emits every entry even if keys repeat.
	 */
	public <K, V> JsonEncoder<Iterable<? extends Map.Entry<? extends K, ? extends V>>> entriesOf(JsonText<? super K> keyText, JsonEncoder<? super V> valueEncoder) {
		requireNonNull(keyText);
		requireNonNull(valueEncoder);
		return entries -> JsonObject.ofEntries(entries, keyText, valueEncoder).toJson();
	}

	// Runtime dispatch

	/**
	 * Chooses an encoding based on each value's runtime class:
	 *
	 * <ul>
	 *     <li>{@code null} and empty {@link Optional}s as {@code null};</li>
	 *     <li>{@link JsonValue}s as themselves;</li>
	 *     <li>{@link CharSequence}s, {@link Character}s, {@code char[]}s, enums, and UTF-8 {@code byte[]}s as strings;</li>
	 *     <li>{@link Boolean}s, and {@link Byte}, {@link Short}, {@link Integer}, {@link Long},
	 *         {@link BigInteger}, {@link Float}, {@link Double} and {@link BigDecimal} numbers, as themselves;</li>
	 *     <li>{@link Map}s whose keys are any of the string types above, as objects;</li>
	 *     <li>{@link Iterable}s, {@link Stream}s, object arrays, and arrays of
	 *         {@code boolean}, {@code short}, {@code int}, {@code long}, {@code float} and {@code double}, as arrays.</li>
	 * </ul>
	 *
	 * Anything else causes {@link UnsupportedValueException}.
	 */
	public JsonEncoder<Object> dynamic() {
		return this::encodeDynamic;
	}

	private Json encodeDynamic(@Nullable Object value) {
		if (value == null) {
			return Json.NULL;
		} else if (value instanceof JsonValue v) {
			return v.toJson();
		} else if (value instanceof CharSequence s) {
			return escaper.escape(s).toJson();
		} else if (value instanceof Boolean b) {
			return Json.bool(b);
		} else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return Json.number(((Number) value).longValue());
		} else if (value instanceof Double d) {
			return doubles().encode(d);
		} else if (value instanceof Float f) {
			return floats().encode(f);
		} else if (value instanceof BigInteger n) {
			return Json.number(n);
		} else if (value instanceof BigDecimal n) {
			return Json.number(n);
		} else if (value instanceof Character c) {
			return chars().encode(c);
		} else if (value instanceof Enum<?> e) {
			return Json.string(escaper.escape(e.name()));
		} else if (value instanceof byte[] utf8) {
			return escaper.escapeUtf8(utf8).toJson();
		} else if (value instanceof Optional<?> opt) {
			return encodeDynamic(opt.orElse(null));
		} else if (value instanceof Map<?, ?> map) {
			JsonObject result = JsonObject.empty();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				Escaped key = dynamicKey(entry.getKey());
				result = result.plus(JsonObject.row(key, JsonObject.encodeMember(key, entry.getValue(), this::encodeDynamic)));
			}
			return result.toJson();
		} else if (value instanceof Iterable<?> items) {
			return JsonArray.of(items, this::encodeDynamic).toJson();
		} else if (value instanceof Stream<?> items) {
			return JsonArray.of(items, this::encodeDynamic).toJson();
		} else if (value instanceof Object[] items) {
			return objectArrayOf(this::encodeDynamic).encode(items);
		} else if (value instanceof char[] text) {
			return charArrays().encode(text);
		} else if (value instanceof boolean[] items) {
			return booleanArrays().encode(items);
		} else if (value instanceof short[] items) {
			return shortArrays().encode(items);
		} else if (value instanceof int[] items) {
			return intArrays().encode(items);
		} else if (value instanceof long[] items) {
			return longArrays().encode(items);
		} else if (value instanceof float[] items) {
			return floatArrays().encode(items);
		} else if (value instanceof double[] items) {
			return doubleArrays().encode(items);
		} else {
			throw new UnsupportedValueException(value.getClass());
		}
	}

	private Escaped dynamicKey(@Nullable Object key) {
		if (key instanceof CharSequence s) {
			return escaper.escape(s);
		} else if (key instanceof Character c) {
			return escaper.escape(String.valueOf(c.charValue()));
		} else if (key instanceof Enum<?> e) {
			return escaper.escape(e.name());
		} else if (key instanceof byte[] utf8) {
			return escaper.escapeUtf8(utf8);
		} else if (key instanceof Escaped e) {
			return e;
		} else {
			throw new UnsupportedValueException("Map key must be text, not " + ((key == null) ? "null" : key.getClass().getName()));
		}
	}

	private Json nonFinite(double value) {
		return switch (settings.getNonFiniteNumbers()) {
			case REJECT -> throw new NonFiniteNumberException(value);
			case NULL -> Json.NULL;
		};
	}

	@Override
	public String toString() {
		return "JsonEncoders(" + settings + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoders.class);
	private static final JsonEncoders STANDARD = new JsonEncoders(JsonBuilderSettings.defaults());
}
