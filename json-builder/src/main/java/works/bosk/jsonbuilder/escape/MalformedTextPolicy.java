package works.bosk.jsonbuilder.escape;

/**
 * What to do with text that is not well-formed Unicode:
 * invalid UTF-8 in byte input, or an unpaired surrogate in native text.
 */
public enum MalformedTextPolicy {
	/**
	 * Throw {@link works.bosk.jsonbuilder.exceptions.MalformedTextException}.
	 */
	REJECT,

	/**
	 * Emit U+FFFD REPLACEMENT CHARACTER for each maximal ill-formed subsequence
	 * and carry on.
	 */
	REPLACE,
}
