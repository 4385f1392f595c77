package works.bosk.jsonbuilder;

import java.nio.ReadOnlyBufferException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import works.bosk.jsonbuilder.escape.Escaped;
import works.bosk.jsonbuilder.escape.JsonEscaper;
import works.bosk.jsonbuilder.exceptions.MalformedTextException;
import works.bosk.jsonbuilder.exceptions.NonFiniteNumberException;
import works.bosk.jsonbuilder.io.ByteChunk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonObjectTest {

	@Test
	void empty() {
		assertEquals("{}", JsonObject.empty().toJson().toString());
		assertTrue(JsonObject.empty().isEmpty());
	}

	@Test
	void rowsOfEachKind() {
		JsonObject object = JsonObject.row("s", "text")
			.plus(JsonObject.row("n", 42))
			.plus(JsonObject.row("d", 1.5))
			.plus(JsonObject.row("b", true))
			.plus(JsonObject.row("j", Json.NULL))
			.plus(JsonObject.row("e", Thread.State.NEW, JsonEncoders.standard().enumNames()))
			.plus(JsonObject.row(JsonEscaper.standard().escape("pre-escaped"), Json.number(0)));
		assertEquals("{\"s\":\"text\",\"n\":42,\"d\":1.5,\"b\":true,\"j\":null,\"e\":\"NEW\",\"pre-escaped\":0}",
			object.toString());
		assertFalse(object.isEmpty());
	}

	@Test
	void keysAreEscaped() {
		assertEquals("{\"a\\\"b\\n\":1}", JsonObject.row("a\"b\n", 1).toString());
	}

	@Test
	void emptyIsIdentity() {
		JsonObject a = JsonObject.row("a", 1);
		assertSame(a, a.plus(JsonObject.empty()));
		assertSame(a, JsonObject.empty().plus(a));
		assertEquals(JsonObject.empty(), JsonObject.empty().plus(JsonObject.empty()));
	}

	@Test
	void associativeOverEveryGrouping() {
		List<JsonObject> parts = List.of(
			JsonObject.row("a", 1),
			JsonObject.empty(),
			JsonObject.row("b", 2).plus(JsonObject.row("c", 3)),
			JsonObject.empty(),
			JsonObject.row("d", 4));
		Json expected = Json.ascii("{\"a\":1,\"b\":2,\"c\":3,\"d\":4}");
		List<JsonObject> groupings = allGroupings(parts);
		assertEquals(14, groupings.size());
		for (JsonObject grouping : groupings) {
			assertEquals(expected, grouping.toJson());
			assertEquals(expected.toString(), grouping.toString());
		}
	}

	@Test
	void concatSkipsEmpties() {
		JsonObject result = JsonObject.concat(
			JsonObject.empty(),
			JsonObject.row("x", 1),
			JsonObject.empty(),
			JsonObject.empty(),
			JsonObject.row("y", 2),
			JsonObject.empty());
		assertEquals("{\"x\":1,\"y\":2}", result.toString());
		assertEquals(JsonObject.empty(), JsonObject.concat());
		assertEquals(result, JsonObject.concat(List.of(JsonObject.row("x", 1), JsonObject.row("y", 2))));
	}

	@Test
	void toJsonObjectImplementations() {
		ToJsonObject point = () -> JsonObject.row("x", 3).plus(JsonObject.row("y", 4));
		ToJsonObject label = () -> JsonObject.row("label", "origin");
		assertEquals("{\"x\":3,\"y\":4,\"label\":\"origin\"}", JsonObject.concat(point, label).toString());
		assertEquals("{\"x\":3,\"y\":4}", point.toJson().toString());
	}

	@Test
	void commaCount() {
		for (int n = 0; n <= 5; n++) {
			JsonObject object = JsonObject.empty();
			for (int i = 0; i < n; i++) {
				object = object.plus(JsonObject.row("k" + i, i));
			}
			long commas = object.toString().chars().filter(c -> c == ',').count();
			assertEquals(Math.max(0, n - 1), commas);
		}
	}

	@Test
	void parallelCollectorPreservesOrder() {
		JsonObject parallel = IntStream.range(0, 1000)
			.parallel()
			.mapToObj(i -> JsonObject.row("k" + i, i))
			.collect(JsonObject.collector());
		JsonObject sequential = IntStream.range(0, 1000)
			.mapToObj(i -> JsonObject.row("k" + i, i))
			.collect(JsonObject.collector());
		assertEquals(sequential, parallel);
		assertTrue(parallel.toString().startsWith("{\"k0\":0,\"k1\":1,"));
	}

	@Test
	void fromMap() {
		Map<String, Integer> map = new LinkedHashMap<>();
		map.put("one", 1);
		map.put("two", 2);
		assertEquals("{\"one\":1,\"two\":2}",
			JsonObject.of(map, JsonText.charSequence(), JsonEncoders.standard().ints()).toString());

		Map<String, JsonValue> values = new LinkedHashMap<>();
		values.put("t", Json.TRUE);
		values.put("a", JsonArray.element(1));
		assertEquals("{\"t\":true,\"a\":[1]}", JsonObject.of(values).toString());

		assertEquals("{}", JsonObject.of(Map.of(), JsonText.charSequence(), JsonEncoders.standard().ints()).toString());
	}

	@Test
	void duplicateKeysAreKept() {
		List<Map.Entry<String, Integer>> entries = List.of(Map.entry("k", 1), Map.entry("k", 2));
		assertEquals("{\"k\":1,\"k\":2}",
			JsonObject.ofEntries(entries, JsonText.charSequence(), JsonEncoders.standard().ints()).toString());
	}

	@Test
	void nonFiniteRowIsRejected() {
		NonFiniteNumberException e = assertThrows(NonFiniteNumberException.class, () -> JsonObject.row("x", Double.NaN));
		assertEquals("Member \"x\": JSON cannot represent NaN", e.getMessage());
	}

	@Test
	void encoderErrorsNameTheMember() {
		NonFiniteNumberException e = assertThrows(NonFiniteNumberException.class,
			() -> JsonObject.row("ratio", Double.POSITIVE_INFINITY, JsonEncoders.standard().doubles()));
		assertEquals("Member \"ratio\": JSON cannot represent Infinity", e.getMessage());

		MalformedTextException malformed = assertThrows(MalformedTextException.class,
			() -> JsonObject.row("name", "ab\uD800"));
		assertEquals(2, malformed.offset());
		assertTrue(malformed.getMessage().startsWith("Member \"name\": "));
	}

	@Test
	void embeddedKeyCannotBeRewritten() {
		Escaped key = JsonEscaper.standard().escape("ab");
		JsonObject row = JsonObject.row(key, Json.number(1));
		ByteChunk chunk = key.bytes().chunks().next();
		chunk.toByteArray()[0] = '"';
		assertThrows(ReadOnlyBufferException.class, () -> chunk.asReadOnlyBuffer().put(0, (byte) '"'));
		assertEquals("{\"ab\":1}", row.toString());
	}

	@Test
	void equalityIsByContent() {
		JsonObject a = JsonObject.row("a", 1).plus(JsonObject.row("b", 2));
		JsonObject b = JsonObject.concat(JsonObject.row("a", 1), JsonObject.row("b", 2));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	static List<JsonObject> allGroupings(List<JsonObject> parts) {
		if (parts.size() == 1) {
			return List.of(parts.get(0));
		}
		List<JsonObject> result = new ArrayList<>();
		for (int split = 1; split < parts.size(); split++) {
			for (JsonObject left : allGroupings(parts.subList(0, split))) {
				for (JsonObject right : allGroupings(parts.subList(split, parts.size()))) {
					result.add(left.plus(right));
				}
			}
		}
		return result;
	}
}
