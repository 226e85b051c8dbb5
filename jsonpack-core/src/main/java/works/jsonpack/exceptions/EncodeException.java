package works.jsonpack.exceptions;

/**
 * A document could not be converted to MessagePack.
 * <p>
 * Conversion stops at the first such failure, and no output is produced.
 */
public abstract class EncodeException extends Exception {
	protected EncodeException(String message) {
		super(message);
	}

	protected EncodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
