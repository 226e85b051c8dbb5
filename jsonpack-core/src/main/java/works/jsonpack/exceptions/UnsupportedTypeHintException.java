package works.jsonpack.exceptions;

/**
 * A type hint named a tag that is not one of the supported numeric types.
 */
public class UnsupportedTypeHintException extends EncodeException {
	private final String key;
	private final String tag;

	public UnsupportedTypeHintException(String key, String tag) {
		super("Unsupported numeric type hint " + key + "=" + tag);
		this.key = key;
		this.tag = tag;
	}

	/**
	 * @return the hint key that selected the tag; empty for the positional hint
	 */
	public String key() {
		return key;
	}

	public String tag() {
		return tag;
	}
}
