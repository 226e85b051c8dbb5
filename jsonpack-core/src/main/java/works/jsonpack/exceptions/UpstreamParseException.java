package works.jsonpack.exceptions;

/**
 * The input text could not be parsed as JSON.
 * The parser's own exception is the cause.
 */
public class UpstreamParseException extends EncodeException {
	public UpstreamParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public UpstreamParseException(String message) {
		super(message);
	}
}
