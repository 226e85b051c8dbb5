package works.jsonpack.exceptions;

import works.jsonpack.TypeTag;

/**
 * With strict numeric range checking enabled,
 * a number did not fit the type its hint selected.
 */
public class NumericRangeException extends EncodeException {
	private final String key;
	private final TypeTag tag;
	private final double value;

	public NumericRangeException(String key, TypeTag tag, double value) {
		super("Numeric value " + value + " does not fit type hint " + key + "=" + tag.tagName());
		this.key = key;
		this.tag = tag;
		this.value = value;
	}

	public String key() {
		return key;
	}

	public TypeTag tag() {
		return tag;
	}

	public double value() {
		return value;
	}
}
