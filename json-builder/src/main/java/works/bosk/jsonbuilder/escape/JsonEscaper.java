package works.bosk.jsonbuilder.escape;

import java.nio.ByteBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jsonbuilder.exceptions.MalformedTextException;
import works.bosk.jsonbuilder.io.ByteChunk;
import works.bosk.jsonbuilder.io.ByteSink;

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

/**
 * Turns text into the body of a JSON string literal.
 * <p>
 * Escapes exactly these characters:
 * backslash and double quote as {@code \\} and {@code \"};
 * backspace, form feed, line feed, carriage return and tab as
 * {@code \b}, {@code \f}, {@code \n}, {@code \r} and {@code \t};
 * and every other code point below 0x20 as <code>&#92;u00XX</code> with lowercase hex digits.
 * Everything else, including {@code /}, passes through.
 * <p>
 * Each input is scanned once. Runs of characters that need no escaping are copied in bulk,
 * and scanning resumes immediately after each escaped character.
 * Byte input must be UTF-8; it is decoded just enough to find sequence boundaries,
 * and a multi-byte sequence is never split.
 * <p>
 * The chunked variants produce exactly the same bytes as escaping the concatenation of the chunks,
 * even when a UTF-8 sequence or a surrogate pair straddles a chunk boundary.
 * <p>
 * Ill-formed text is handled according to the {@link MalformedTextPolicy}.
 * Instances are immutable and thread-safe.
 */
public final class JsonEscaper {
	private final MalformedTextPolicy malformedTextPolicy;

	private JsonEscaper(MalformedTextPolicy malformedTextPolicy) {
		this.malformedTextPolicy = requireNonNull(malformedTextPolicy);
	}

	public static JsonEscaper using(MalformedTextPolicy malformedTextPolicy) {
		return switch (malformedTextPolicy) {
			case REJECT -> STANDARD;
			case REPLACE -> REPLACING;
		};
	}

	/**
	 * @return an escaper that rejects ill-formed text
	 */
	public static JsonEscaper standard() {
		return STANDARD;
	}

	public MalformedTextPolicy malformedTextPolicy() {
		return malformedTextPolicy;
	}

	// Native text

	public Escaped escape(CharSequence text) {
		ByteSink out = new ByteSink(text.length() + 16);
		Session session = new Session(out);
		session.escapeChars(text, true);
		return session.finish();
	}

	/**
	 * Escapes the concatenation of {@code chunks}.
	 */
	public Escaped escapeChunks(Iterable<? extends CharSequence> chunks) {
		Session session = new Session(new ByteSink(64));
		for (CharSequence chunk : chunks) {
			session.escapeChars(chunk, false);
		}
		return session.finish();
	}

	// UTF-8

	public Escaped escapeUtf8(byte[] utf8) {
		return escapeUtf8(utf8, 0, utf8.length);
	}

	public Escaped escapeUtf8(byte[] utf8, int offset, int length) {
		checkFromIndexSize(offset, length, utf8.length);
		Session session = new Session(new ByteSink(length + 16));
		session.escapeBytes(utf8, offset, offset + length, true);
		return session.finish();
	}

	/**
	 * Escapes the {@link ByteBuffer#remaining() remaining} bytes
	 * without changing the buffer's position.
	 */
	public Escaped escapeUtf8(ByteBuffer utf8) {
		if (utf8.hasArray()) {
			return escapeUtf8(utf8.array(), utf8.arrayOffset() + utf8.position(), utf8.remaining());
		} else {
			byte[] copy = new byte[utf8.remaining()];
			utf8.duplicate().get(copy);
			return escapeUtf8(copy);
		}
	}

	/**
	 * Escapes the concatenation of {@code chunks}.
	 */
	public Escaped escapeUtf8Chunks(Iterable<byte[]> chunks) {
		Session session = new Session(new ByteSink(64));
		for (byte[] chunk : chunks) {
			session.escapeBytes(chunk, 0, chunk.length, false);
		}
		return session.finish();
	}

	/**
	 * Escapes the concatenation of {@code chunks}.
	 * Each chunk is copied before it is scanned.
	 */
	public Escaped escapeUtf8Slices(Iterable<ByteChunk> chunks) {
		Session session = new Session(new ByteSink(64));
		for (ByteChunk chunk : chunks) {
			byte[] copy = chunk.toByteArray();
			session.escapeBytes(copy, 0, copy.length, false);
		}
		return session.finish();
	}

	@Override
	public String toString() {
		return "JsonEscaper(" + malformedTextPolicy + ")";
	}

	/**
	 * The state of one escaping operation, which may span several input chunks.
	 * Only one kind of input (chars or bytes) is used per session.
	 */
	private final class Session {
		final ByteSink out;

		/**
		 * Count of input units (chars or bytes) consumed in earlier chunks.
		 * Used only for error reporting.
		 */
		long consumed = 0;

		/**
		 * The leading bytes of a UTF-8 sequence cut off by the end of a chunk.
		 */
		final byte[] carryBytes = new byte[4];
		int carryLength = 0;
		long carryOffset;

		/**
		 * A high surrogate cut off by the end of a chunk, or zero.
		 */
		char carryHighSurrogate = 0;

		Session(ByteSink out) {
			this.out = out;
		}

		Escaped finish() {
			if (carryLength != 0) {
				// Valid prefix with nothing after it is one maximal subpart
				malformed("Truncated UTF-8 sequence", carryOffset);
				carryLength = 0;
			}
			if (carryHighSurrogate != 0) {
				malformed("Unpaired high surrogate", consumed - 1);
				carryHighSurrogate = 0;
			}
			return new Escaped(out.toRope());
		}

		void escapeChars(CharSequence text, boolean isLast) {
			int length = text.length();
			int pos = 0;
			if (carryHighSurrogate != 0 && length > 0) {
				char low = text.charAt(0);
				if (Character.isLowSurrogate(low)) {
					out.writeCodePoint(Character.toCodePoint(carryHighSurrogate, low));
					pos = 1;
				} else {
					malformed("Unpaired high surrogate", consumed - 1);
				}
				carryHighSurrogate = 0;
			}

			int runStart = pos;
			while (pos < length) {
				char c = text.charAt(pos);
				if (c < 0x80) {
					if (needsEscape(c)) {
						writeChars(text, runStart, pos);
						writeEscape(c);
						runStart = ++pos;
					} else {
						pos++;
					}
				} else if (Character.isHighSurrogate(c)) {
					if (pos + 1 < length) {
						if (Character.isLowSurrogate(text.charAt(pos + 1))) {
							pos += 2;
						} else {
							writeChars(text, runStart, pos);
							malformed("Unpaired high surrogate", consumed + pos);
							runStart = ++pos;
						}
					} else {
						writeChars(text, runStart, pos);
						if (isLast) {
							malformed("Unpaired high surrogate", consumed + pos);
						} else {
							carryHighSurrogate = c;
						}
						runStart = ++pos;
					}
				} else if (Character.isLowSurrogate(c)) {
					writeChars(text, runStart, pos);
					malformed("Unpaired low surrogate", consumed + pos);
					runStart = ++pos;
				} else {
					pos++;
				}
			}
			writeChars(text, runStart, pos);
			consumed += length;
		}

		/**
		 * Transcodes a run already known to need no escaping and to be well-formed.
		 */
		private void writeChars(CharSequence text, int start, int stop) {
			int i = start;
			while (i < stop) {
				char c = text.charAt(i);
				if (c < 0x80) {
					out.write(c);
					i++;
				} else {
					int codePoint = Character.codePointAt(text, i);
					out.writeCodePoint(codePoint);
					i += Character.charCount(codePoint);
				}
			}
		}

		void escapeBytes(byte[] bytes, int start, int stop, boolean isLast) {
			int pos = start;

			// Finish any sequence left over from the previous chunk
			while (carryLength != 0 && pos < stop) {
				carryBytes[carryLength++] = bytes[pos++];
				int n = Utf8.sequenceLength(carryBytes, 0, carryLength);
				if (n == Utf8.INCOMPLETE) {
					continue;
				}
				if (n > 0) {
					assert n == carryLength;
					out.write(carryBytes, 0, n);
				} else {
					malformed("Invalid UTF-8 sequence", carryOffset);
					// The carried bytes were a valid prefix, so only the byte just added can follow the ill-formed part
					pos -= carryLength + n;
				}
				carryLength = 0;
			}

			int runStart = pos;
			while (pos < stop) {
				int b = bytes[pos] & 0xFF;
				if (b < 0x80) {
					if (needsEscape(b)) {
						out.write(bytes, runStart, pos - runStart);
						writeEscape(b);
						runStart = ++pos;
					} else {
						pos++;
					}
				} else {
					int n = Utf8.sequenceLength(bytes, pos, stop);
					if (n > 0) {
						pos += n;
						continue;
					}
					out.write(bytes, runStart, pos - runStart);
					if (n == Utf8.INCOMPLETE) {
						if (!isLast) {
							carryOffset = consumed + (pos - start);
							carryLength = stop - pos;
							System.arraycopy(bytes, pos, carryBytes, 0, carryLength);
							pos = stop;
							runStart = stop;
							break;
						}
						malformed("Truncated UTF-8 sequence", consumed + (pos - start));
						pos = stop;
					} else {
						malformed("Invalid UTF-8 sequence", consumed + (pos - start));
						pos -= n;
					}
					runStart = pos;
				}
			}
			out.write(bytes, runStart, pos - runStart);
			consumed += stop - start;
		}

		private void writeEscape(int c) {
			out.write('\\');
			switch (c) {
				case '\\' -> out.write('\\');
				case '"' -> out.write('"');
				case '\b' -> out.write('b');
				case '\f' -> out.write('f');
				case '\n' -> out.write('n');
				case '\r' -> out.write('r');
				case '\t' -> out.write('t');
				default -> out
					.write('u')
					.write('0')
					.write('0')
					.write(hexDigit(c >> 4))
					.write(hexDigit(c & 0xF));
			}
		}

		private void malformed(String description, long offset) {
			switch (malformedTextPolicy) {
				case REJECT -> throw new MalformedTextException(description, offset);
				case REPLACE -> {
					LOGGER.debug("{} at offset {}; substituting U+FFFD", description, offset);
					out.write(Utf8.REPLACEMENT);
				}
			}
		}
	}

	static boolean needsEscape(int asciiChar) {
		return asciiChar < 0x20 || asciiChar == '"' || asciiChar == '\\';
	}

	static int hexDigit(int nibble) {
		return (nibble < 10) ? ('0' + nibble) : ('a' + nibble - 10);
	}

	private static final JsonEscaper STANDARD = new JsonEscaper(MalformedTextPolicy.REJECT);
	private static final JsonEscaper REPLACING = new JsonEscaper(MalformedTextPolicy.REPLACE);

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonEscaper.class);
}
