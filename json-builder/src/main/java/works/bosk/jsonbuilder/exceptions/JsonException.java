package works.bosk.jsonbuilder.exceptions;

/**
 * Base of every exception thrown by json-builder.
 * Unchecked, because the only failures are policy decisions about values
 * that have no JSON representation, and bugs.
 */
public sealed abstract class JsonException extends RuntimeException permits JsonContentException, JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(Throwable cause) {
		super(cause);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception}
	 * whose message is prefixed with {@code context}.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends JsonException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof MalformedTextException e) {
			return (T) new MalformedTextException(newMessage, e.offset(), e);
		} else if (exception instanceof NonFiniteNumberException e) {
			return (T) new NonFiniteNumberException(newMessage, e);
		} else if (exception instanceof UnsupportedValueException e) {
			return (T) new UnsupportedValueException(newMessage, e);
		} else if (exception instanceof JsonProcessingException e) {
			return (T) new JsonProcessingException(newMessage, e);
		} else {
			throw new JsonProcessingException("Unexpected exception type: " + exception.getClass(), exception);
		}
	}
}
