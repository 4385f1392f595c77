package works.bosk.jsonbuilder.io;

import java.nio.ReadOnlyBufferException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ByteRopeTest {

	@Test
	void emptyIsIdentity() {
		ByteRope abc = ByteRope.ascii("abc");
		assertSame(abc, abc.plus(ByteRope.empty()));
		assertSame(abc, ByteRope.empty().plus(abc));
		assertSame(ByteRope.empty(), ByteRope.ascii(""));
		assertSame(ByteRope.empty(), ByteRope.of(new ByteChunk(new byte[5], 2, 2)));
		assertTrue(ByteRope.empty().isEmpty());
		assertFalse(ByteRope.empty().chunks().hasNext());
	}

	@Test
	void concatPreservesOrder() {
		ByteRope rope = ByteRope.concat(ByteRope.ascii("ab"), ByteRope.empty(), ByteRope.ascii("c"), ByteRope.ascii("de"));
		assertEquals(5, rope.length());
		assertEquals("abcde", rope.decodeUtf8());

		List<String> pieces = new ArrayList<>();
		rope.forEachChunk(c -> pieces.add(new String(c.toByteArray(), UTF_8)));
		assertEquals(List.of("ab", "c", "de"), pieces);
	}

	@Test
	void chunksRespectSliceBounds() {
		byte[] array = "0123456789".getBytes(UTF_8);
		ByteRope rope = ByteRope.of(new ByteChunk(array, 2, 5))
			.plus(ByteRope.of(new ByteChunk(array, 7, 8)));
		assertArrayEquals("2347".getBytes(UTF_8), rope.toByteArray());
	}

	@Test
	void deepLeftFoldDoesNotOverflowTheStack() {
		ByteRope rope = ByteRope.empty();
		for (int i = 0; i < 200_000; i++) {
			rope = rope.plus(ByteRope.ascii("x"));
		}
		assertEquals(200_000, rope.length());
		assertEquals(200_000, rope.toByteArray().length);
	}

	@Test
	void deepRightFoldDoesNotOverflowTheStack() {
		ByteRope rope = ByteRope.empty();
		for (int i = 0; i < 200_000; i++) {
			rope = ByteRope.ascii("x").plus(rope);
		}
		long count = 0;
		for (Iterator<ByteChunk> iter = rope.chunks(); iter.hasNext(); ) {
			count += iter.next().length();
		}
		assertEquals(200_000, count);
	}

	@Test
	void contentEqualsIgnoresShape() {
		ByteRope a = ByteRope.concat(ByteRope.ascii("he"), ByteRope.ascii("llo"));
		ByteRope b = ByteRope.concat(ByteRope.ascii("h"), ByteRope.ascii("ell"), ByteRope.ascii("o"));
		ByteRope c = ByteRope.ascii("hello");
		assertTrue(ByteRope.contentEquals(a, b));
		assertTrue(ByteRope.contentEquals(b, c));
		assertEquals(ByteRope.contentHashCode(a), ByteRope.contentHashCode(c));

		assertFalse(ByteRope.contentEquals(a, ByteRope.ascii("hellO")));
		assertFalse(ByteRope.contentEquals(a, ByteRope.ascii("hell")));
		assertTrue(ByteRope.contentEquals(ByteRope.empty(), ByteRope.ascii("")));

		assertEquals(a, b);
		assertEquals(a, c);
		assertEquals(a.hashCode(), c.hashCode());
		assertNotEquals(a, ByteRope.ascii("hellO"));
		assertNotEquals(ByteRope.empty(), c);
	}

	@Test
	void deepRopesHaveFlatToStringAndEquality() {
		ByteRope left = ByteRope.empty();
		ByteRope right = ByteRope.empty();
		for (int i = 0; i < 200_000; i++) {
			left = left.plus(ByteRope.ascii("x"));
			right = ByteRope.ascii("x").plus(right);
		}
		assertEquals("Concat(200000 bytes)", left.toString());
		assertEquals(left, right);
		assertEquals(left.hashCode(), right.hashCode());
	}

	@Test
	void chunksDoNotExposeTheirArray() {
		byte[] array = "0123456789".getBytes(UTF_8);
		ByteChunk chunk = new ByteChunk(array, 2, 6);
		ByteRope rope = ByteRope.of(chunk);

		byte[] copy = chunk.toByteArray();
		copy[0] = 'X';
		assertThrows(ReadOnlyBufferException.class, () -> chunk.asReadOnlyBuffer().put(0, (byte) 'X'));
		assertEquals("2345", rope.decodeUtf8());

		assertEquals("45", new String(chunk.tail(2).toByteArray(), UTF_8));
		byte[] destination = new byte[3];
		chunk.copyTo(1, destination, 0, 3);
		assertArrayEquals("345".getBytes(UTF_8), destination);
		assertThrows(IndexOutOfBoundsException.class, () -> chunk.copyTo(2, destination, 0, 3));
	}

	@Test
	void iteratorIsExhaustible() {
		Iterator<ByteChunk> iter = ByteRope.ascii("a").chunks();
		iter.next();
		assertThrows(java.util.NoSuchElementException.class, iter::next);
	}

	@Test
	void invalidChunkBounds() {
		byte[] array = new byte[4];
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(array, -1, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(array, 3, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(array, 0, 5));
	}
}
