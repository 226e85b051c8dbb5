package works.jsonpack.value;

/**
 * A JSON number. Integral or not, it is held as a {@code double},
 * so integers beyond 2<sup>53</sup> may already have lost precision.
 */
public record NumberValue(double value) implements Value {
	public static NumberValue of(double value) {
		return new NumberValue(value);
	}

	@Override
	public String kind() {
		return "number";
	}

	@Override
	public String toString() {
		return Double.toString(value);
	}
}
