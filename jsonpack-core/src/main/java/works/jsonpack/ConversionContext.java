package works.jsonpack;

import static java.util.Objects.requireNonNull;

/**
 * What the converter remembers while walking a document, for the purpose of finding type hints.
 * <p>
 * Encoding a value takes a context and returns the context that follows it,
 * so this state flows through the walk in document order
 * without being shared or mutated.
 *
 * @param currentKey the most recently written object member name, wherever it was.
 *                   It is not restored when an object ends,
 *                   so it can apply to values after (and outside) that object.
 * @param currentHint the position within the most recently started array.
 *                    Starting any array resets it to zero, and it is not restored when the array ends.
 */
public record ConversionContext(String currentKey, int currentHint) {
	private static final ConversionContext INITIAL = new ConversionContext("", 0);

	public ConversionContext {
		requireNonNull(currentKey);
	}

	/**
	 * The context at the start of a document:
	 * no member name has been seen, which is the same as having seen the empty one.
	 */
	public static ConversionContext initial() {
		return INITIAL;
	}

	public ConversionContext withKey(String key) {
		return new ConversionContext(key, currentHint);
	}

	public ConversionContext enteringArray() {
		return new ConversionContext(currentKey, 0);
	}

	public ConversionContext nextElement() {
		return new ConversionContext(currentKey, currentHint + 1);
	}
}
