package works.jsonpack.exceptions;

/**
 * A number had no type hint and is not exactly representable as a 64-bit signed integer.
 * <p>
 * Such numbers are not silently written as floats:
 * other occurrences of the same field might be integral,
 * and a field whose encoding varies with its value cannot be decoded reliably.
 * Supply a {@code float32} or {@code float64} hint instead.
 */
public class UnsupportedNumericValueException extends EncodeException {
	private final double value;

	public UnsupportedNumericValueException(double value) {
		super("Unsupported numeric value " + value);
		this.value = value;
	}

	public double value() {
		return value;
	}
}
