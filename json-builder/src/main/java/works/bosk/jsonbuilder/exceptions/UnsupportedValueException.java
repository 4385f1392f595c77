package works.bosk.jsonbuilder.exceptions;

/**
 * Runtime dispatch found no encoding for a value's class.
 */
public final class UnsupportedValueException extends JsonContentException {
	public UnsupportedValueException(Class<?> valueClass) {
		super("No JSON encoding for " + valueClass.getName());
	}

	public UnsupportedValueException(String message) {
		super(message);
	}

	UnsupportedValueException(String message, Throwable cause) {
		super(message, cause);
	}
}
