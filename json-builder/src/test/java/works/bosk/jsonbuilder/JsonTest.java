package works.bosk.jsonbuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import works.bosk.jsonbuilder.escape.JsonEscaper;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end: builds values, writes them out, and checks the result with an independent parser.
 */
class JsonTest {
	final ObjectMapper mapper = new ObjectMapper();
	final JsonEncoders enc = JsonEncoders.standard();

	@Test
	void scalars() {
		assertEquals("null", Json.NULL.toString());
		assertEquals("true", Json.bool(true).toString());
		assertEquals("false", Json.FALSE.toString());
		assertEquals("-12", Json.number(-12).toString());
		assertEquals("\"\"", Json.string("").toString());
		assertEquals("\"é\"", Json.string(JsonEscaper.standard().escape("é")).toString());
	}

	@Test
	void scenarios() {
		Map<String, Integer> ab = new LinkedHashMap<>();
		ab.put("a", 1);
		ab.put("b", 2);
		assertEquals("{\"a\":1,\"b\":2}", enc.stringMapOf(enc.ints()).encode(ab).toString());

		JsonArray oneTwoThree = JsonArray.element(1).plus(JsonArray.element(2)).plus(JsonArray.element(3));
		assertEquals("[1,2,3]", oneTwoThree.toJson().toString());

		assertEquals("{}", enc.stringMapOf(enc.ints()).encode(Map.of()).toString());
		assertEquals("[]", enc.arrayOf(enc.ints()).encode(List.of()).toString());

		assertEquals("\"say \\\"hi\\\"\\n\"", Json.string("say \"hi\"\n").toString());

		assertEquals("null", enc.optionalOf(enc.ints()).encode(Optional.empty()).toString());
		assertEquals("5", enc.optionalOf(enc.ints()).encode(Optional.of(5)).toString());

		assertEquals("{\"xs\":[1,2]}",
			JsonObject.row("xs", List.of(1, 2), enc.arrayOf(enc.ints())).toString());
	}

	@Test
	void everyCharacterSurvivesAParser() {
		StringBuilder all = new StringBuilder();
		for (int c = 0; c < 0x800; c++) {
			all.append((char) c);
		}
		all.append("😎\uFFFF");
		String text = all.toString();
		assertEquals(text, mapper.readValue(Json.string(text).toString(), String.class));
		assertEquals(text, mapper.readValue(Json.string(text).toBytes(), String.class));
	}

	@Test
	void nestedStructureMatchesParser() {
		JsonObject person = JsonObject.row("name", "Ada \"the first\"")
			.plus(JsonObject.row("born", 1815))
			.plus(JsonObject.row("tags", JsonArray.element("math").plus(JsonArray.element("poetry\n"))))
			.plus(JsonObject.row("spouse", Json.NULL))
			.plus(JsonObject.row("ratio", 0.75));
		JsonArray people = JsonArray.element(person).plus(JsonArray.element(JsonObject.empty()));

		JsonNode expected = mapper.readTree("""
			[
				{
					"name": "Ada \\"the first\\"",
					"born": 1815,
					"tags": ["math", "poetry\\n"],
					"spouse": null,
					"ratio": 0.75
				},
				{}
			]
			""");
		assertEquals(expected, mapper.readTree(people.toString()));
	}

	@Test
	void fragmentsAreReusable() {
		Json shared = JsonObject.row("k", "v").toJson();
		JsonArray array = JsonArray.element(shared).plus(JsonArray.element(shared));
		JsonObject object = JsonObject.row("a", shared).plus(JsonObject.row("b", array));
		assertEquals("{\"a\":{\"k\":\"v\"},\"b\":[{\"k\":\"v\"},{\"k\":\"v\"}]}", object.toString());
		assertEquals("{\"k\":\"v\"}", shared.toString());
	}

	@Test
	void outboundFormsAgree() throws IOException {
		Json json = largeValue();
		byte[] expected = json.toBytes();
		assertEquals(expected.length, json.length());

		ByteArrayOutputStream stream = new ByteArrayOutputStream();
		json.writeTo(stream);
		assertArrayEquals(expected, stream.toByteArray());

		ByteArrayOutputStream channelTarget = new ByteArrayOutputStream();
		try (WritableByteChannel channel = Channels.newChannel(channelTarget)) {
			json.writeTo(channel);
		}
		assertArrayEquals(expected, channelTarget.toByteArray());

		try (InputStream in = json.toInputStream()) {
			assertArrayEquals(expected, in.readAllBytes());
		}

		assertArrayEquals(expected, drain(json.chunks()));
		assertArrayEquals(expected, drain(json.coalescedChunks()));
		assertArrayEquals(expected, drain(json.coalescedChunks(7)));

		try (InputStream in = json.toInputStream()) {
			JsonNode parsed = mapper.readTree(in);
			assertEquals(10_000, parsed.size());
		}
		LOGGER.debug("Wrote {} bytes", expected.length);
	}

	@Test
	void coalescedChunksAreBounded() {
		Json json = largeValue();
		for (Iterator<ByteBuffer> iter = json.coalescedChunks(); iter.hasNext(); ) {
			ByteBuffer buffer = iter.next();
			assertTrue(buffer.isReadOnly());
			assertTrue(buffer.remaining() <= Json.DEFAULT_CHUNK_SIZE);
		}
	}

	@Test
	void equality() {
		assertEquals(Json.string("ab"), Json.string(JsonEscaper.standard().escapeChunks(List.of("a", "b"))));
		assertEquals(Json.string("ab").hashCode(), Json.string(JsonEscaper.standard().escapeChunks(List.of("a", "b"))).hashCode());
		assertEquals(Json.number(1), JsonEncoders.standard().ints().encode(1));
		assertNotEquals(Json.number(1), Json.string("1"));
		assertEquals(JsonArray.element(1).toJson(), Json.of(List.of(1)));
	}

	static Json largeValue() {
		return IntStream.range(0, 10_000)
			.mapToObj(i -> JsonArray.element(JsonObject.row("i", i).plus(JsonObject.row("s", "é" + i))))
			.collect(JsonArray.collector())
			.toJson();
	}

	static byte[] drain(Iterator<ByteBuffer> buffers) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		while (buffers.hasNext()) {
			ByteBuffer buffer = buffers.next();
			byte[] bytes = new byte[buffer.remaining()];
			buffer.get(bytes);
			out.write(bytes, 0, bytes.length);
		}
		return out.toByteArray();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonTest.class);
}
