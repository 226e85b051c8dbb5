package works.jsonpack;

import static java.util.Objects.requireNonNull;

public final class ConverterConfig {
	private final IdentifierValidator identifierValidator;
	private final boolean strictNumericRange;

	private ConverterConfig(
		IdentifierValidator identifierValidator,
		boolean strictNumericRange
	) {
		this.identifierValidator = identifierValidator;
		this.strictNumericRange = strictNumericRange;
	}

	/**
	 * No identifier recognition, and hinted numbers narrowed without complaint.
	 */
	public static ConverterConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public IdentifierValidator identifierValidator() {
		return identifierValidator;
	}

	/**
	 * @return whether a hinted number that doesn't fit its type is an error
	 * rather than being narrowed like a cast
	 */
	public boolean strictNumericRange() {
		return strictNumericRange;
	}

	@Override
	public String toString() {
		return "ConverterConfig(identifierValidator=" + identifierValidator + ", strictNumericRange=" + strictNumericRange + ")";
	}

	public static class Builder {
		private IdentifierValidator identifierValidator;
		private boolean strictNumericRange;

		Builder() {
			identifierValidator = IdentifierValidator.none();
			strictNumericRange = false;
		}

		public Builder identifierValidator(IdentifierValidator identifierValidator) {
			this.identifierValidator = requireNonNull(identifierValidator);
			return this;
		}

		public Builder strictNumericRange(boolean strictNumericRange) {
			this.strictNumericRange = strictNumericRange;
			return this;
		}

		public ConverterConfig build() {
			return new ConverterConfig(this.identifierValidator, this.strictNumericRange);
		}

		@Override
		public String toString() {
			return "ConverterConfig.Builder(identifierValidator=" + this.identifierValidator + ", strictNumericRange=" + this.strictNumericRange + ")";
		}
	}

	private static final ConverterConfig DEFAULTS = new ConverterConfig(IdentifierValidator.none(), false);
}
