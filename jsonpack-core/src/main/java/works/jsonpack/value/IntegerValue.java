package works.jsonpack.value;

/**
 * A 64-bit integer.
 *
 * @param bits the two's-complement bit pattern of the value
 * @param unsigned whether {@code bits} is to be read as an unsigned number.
 *                 Signed values use MessagePack's signed integer family,
 *                 and unsigned values its unsigned family.
 */
public record IntegerValue(long bits, boolean unsigned) implements NativeValue {
	public static IntegerValue signed(long value) {
		return new IntegerValue(value, false);
	}

	public static IntegerValue unsigned(long bits) {
		return new IntegerValue(bits, true);
	}

	@Override
	public String kind() {
		return unsigned ? "unsigned integer" : "integer";
	}

	@Override
	public String toString() {
		return unsigned ? Long.toUnsignedString(bits) : Long.toString(bits);
	}
}
