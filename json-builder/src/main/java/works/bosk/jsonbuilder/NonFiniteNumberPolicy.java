package works.bosk.jsonbuilder;

/**
 * What to do with {@code NaN} and the infinities, which JSON cannot represent.
 */
public enum NonFiniteNumberPolicy {
	/**
	 * Throw {@link works.bosk.jsonbuilder.exceptions.NonFiniteNumberException}.
	 */
	REJECT,

	/**
	 * Emit {@code null} in place of the number.
	 */
	NULL,
}
