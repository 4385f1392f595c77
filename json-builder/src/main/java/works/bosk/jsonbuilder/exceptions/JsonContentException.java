package works.bosk.jsonbuilder.exceptions;

/**
 * A value cannot be represented as JSON under the configured policies.
 */
public sealed abstract class JsonContentException extends JsonException permits
	MalformedTextException,
	NonFiniteNumberException,
	UnsupportedValueException
{
	protected JsonContentException(String message) {
		super(message);
	}

	protected JsonContentException(String message, Throwable cause) {
		super(message, cause);
	}
}
