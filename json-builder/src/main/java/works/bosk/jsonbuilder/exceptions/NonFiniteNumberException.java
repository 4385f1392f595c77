package works.bosk.jsonbuilder.exceptions;

/**
 * JSON has no representation for {@code NaN} or the infinities.
 * <p>
 * Thrown only under {@link works.bosk.jsonbuilder.NonFiniteNumberPolicy#REJECT REJECT}.
 */
public final class NonFiniteNumberException extends JsonContentException {
	public NonFiniteNumberException(double value) {
		super("JSON cannot represent " + value);
	}

	NonFiniteNumberException(String message, Throwable cause) {
		super(message, cause);
	}
}
