package works.bosk.jsonbuilder.exceptions;

/**
 * The text to be escaped is not well-formed:
 * invalid UTF-8 in byte input, or an unpaired surrogate in native text.
 * <p>
 * Thrown only under {@link works.bosk.jsonbuilder.escape.MalformedTextPolicy#REJECT REJECT}.
 */
public final class MalformedTextException extends JsonContentException {
	private final long offset;

	public MalformedTextException(String message, long offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	MalformedTextException(String message, long offset, Throwable cause) {
		super(message, cause);
		this.offset = offset;
	}

	/**
	 * @return the index of the offending byte (for UTF-8 input) or char (for native text),
	 * counted from the start of the whole text, across chunks.
	 */
	public long offset() {
		return offset;
	}
}
