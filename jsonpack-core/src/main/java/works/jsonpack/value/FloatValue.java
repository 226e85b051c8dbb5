package works.jsonpack.value;

/**
 * A single-precision float, written as MessagePack {@code float 32}.
 * <p>
 * Double-precision numbers have no native counterpart:
 * a {@code double} is exactly what a JSON number already is,
 * so it is represented by {@link NumberValue} and goes through the same type resolution.
 */
public record FloatValue(float value) implements NativeValue {
	@Override
	public String kind() {
		return "float";
	}

	@Override
	public String toString() {
		return value + "f";
	}
}
