package works.bosk.jsonbuilder.exceptions;

/**
 * An unexpected error has occurred while building or writing JSON.
 * <p>
 * This does not indicate a problem with the values being encoded,
 * but rather that something inside the library has gone wrong.
 * A correct encoder would not throw this exception.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(Throwable cause) {
		super(cause);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
