package works.jsonpack;

/**
 * Recognizes strings that are identifiers in some external, checksummed format.
 * <p>
 * Such strings are always written as strings,
 * even when they happen to be valid base64 as well.
 */
@FunctionalInterface
public interface IdentifierValidator {
	boolean isValid(String candidate);

	/**
	 * @return a validator that recognizes nothing
	 */
	static IdentifierValidator none() {
		return candidate -> false;
	}

	/**
	 * @return a validator that recognizes what either {@code this} or {@code other} does
	 */
	default IdentifierValidator or(IdentifierValidator other) {
		return candidate -> this.isValid(candidate) || other.isValid(candidate);
	}
}
