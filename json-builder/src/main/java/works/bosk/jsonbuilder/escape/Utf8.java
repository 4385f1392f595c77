package works.bosk.jsonbuilder.escape;

/**
 * Just enough UTF-8 decoding to find sequence boundaries.
 * <p>
 * Validation follows the well-formed byte sequence table of the Unicode standard,
 * so overlong forms, encoded surrogates, and values above U+10FFFF are all rejected.
 */
public final class Utf8 {
	private Utf8() {}

	/**
	 * Returned by {@link #sequenceLength} when a valid prefix runs into {@code limit}.
	 */
	public static final int INCOMPLETE = 0;

	/**
	 * The UTF-8 encoding of U+FFFD REPLACEMENT CHARACTER.
	 */
	static final byte[] REPLACEMENT = { (byte) 0xEF, (byte) 0xBF, (byte) 0xBD };

	/**
	 * @return the length of the well-formed sequence starting at {@code pos};
	 * or {@link #INCOMPLETE} if the bytes before {@code limit} are a valid but unfinished prefix;
	 * or the negated length of the maximal ill-formed subpart starting at {@code pos}.
	 */
	public static int sequenceLength(byte[] bytes, int pos, int limit) {
		int lead = bytes[pos] & 0xFF;
		if (lead < 0x80) {
			return 1;
		}

		// Allowed range of the second byte depends on the lead byte; later bytes are always 80..BF.
		int needed;
		int lo = 0x80;
		int hi = 0xBF;
		if (lead < 0xC2) {
			// Continuation byte, or lead of an overlong two-byte form
			return -1;
		} else if (lead < 0xE0) {
			needed = 2;
		} else if (lead < 0xF0) {
			needed = 3;
			if (lead == 0xE0) {
				lo = 0xA0; // overlong
			} else if (lead == 0xED) {
				hi = 0x9F; // surrogates
			}
		} else if (lead < 0xF5) {
			needed = 4;
			if (lead == 0xF0) {
				lo = 0x90; // overlong
			} else if (lead == 0xF4) {
				hi = 0x8F; // beyond U+10FFFF
			}
		} else {
			return -1;
		}

		for (int i = 1; i < needed; i++) {
			if (pos + i >= limit) {
				return INCOMPLETE;
			}
			int b = bytes[pos + i] & 0xFF;
			if (b < lo || b > hi) {
				return -i;
			}
			lo = 0x80;
			hi = 0xBF;
		}
		return needed;
	}
}
