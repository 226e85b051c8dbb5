package works.jsonpack;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import works.jsonpack.msgpack.MessagePackWriter;

import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * The numeric types a type hint can ask for.
 * <p>
 * Writing a number as one of these types narrows it the way a cast would:
 * the fractional part is dropped, the integer is reduced to its low-order bits,
 * and nobody checks whether anything was lost.
 * Values beyond the 64-bit range saturate before narrowing.
 * {@link #fits} tells whether a value survives the trip, for callers that want to check.
 */
public enum TypeTag {
	BYTE("byte", Family.UNSIGNED, 8),
	INT8("int8", Family.SIGNED, 8),
	INT16("int16", Family.SIGNED, 16),
	INT32("int32", Family.SIGNED, 32),
	INT64("int64", Family.SIGNED, 64),
	INT("int", Family.SIGNED, 64),
	UINT8("uint8", Family.UNSIGNED, 8),
	UINT16("uint16", Family.UNSIGNED, 16),
	UINT32("uint32", Family.UNSIGNED, 32),
	UINT64("uint64", Family.UNSIGNED, 64),
	UINT("uint", Family.UNSIGNED, 64),
	FLOAT32("float32", Family.FLOAT, 32),
	FLOAT64("float64", Family.FLOAT, 64),
	;

	private final String tagName;
	private final Family family;
	private final int bits;

	TypeTag(String tagName, Family family, int bits) {
		this.tagName = tagName;
		this.family = family;
		this.bits = bits;
	}

	enum Family { SIGNED, UNSIGNED, FLOAT }

	/**
	 * @return the name used for this type in hint tables, like {@code "uint64"}
	 */
	public String tagName() {
		return tagName;
	}

	public int bits() {
		return bits;
	}

	public static Optional<TypeTag> fromTagName(String tagName) {
		return Optional.ofNullable(BY_TAG_NAME.get(tagName));
	}

	/**
	 * Appends {@code value}, narrowed to this type, to {@code out}.
	 */
	public void write(double value, MessagePackWriter out) {
		switch (family) {
			case SIGNED:
				out.writeSigned(narrowSigned(truncate(value)));
				break;
			case UNSIGNED:
				out.writeUnsigned(narrowUnsigned(truncate(value)));
				break;
			case FLOAT:
				if (bits == 32) {
					out.writeFloat32((float) value);
				} else {
					out.writeFloat64(value);
				}
				break;
		}
	}

	/**
	 * @return true if {@link #write} would represent {@code value} without losing anything
	 * but, for {@link #FLOAT32}, precision
	 */
	public boolean fits(double value) {
		switch (family) {
			case SIGNED:
				return isIntegral(value)
					&& value >= -Math.scalb(1.0, bits - 1)
					&& value < Math.scalb(1.0, bits - 1);
			case UNSIGNED:
				return isIntegral(value)
					&& value >= 0
					&& value < Math.scalb(1.0, bits);
			case FLOAT:
				return bits == 64
					|| !Double.isFinite(value)
					|| Float.isFinite((float) value);
			default:
				throw new AssertionError("Unexpected family " + family);
		}
	}

	private static boolean isIntegral(double value) {
		return Double.isFinite(value) && value == Math.rint(value);
	}

	/**
	 * The 64-bit two's-complement pattern of the integer part of {@code value}.
	 * Numbers in [2<sup>63</sup>, 2<sup>64</sup>) keep their unsigned bit pattern,
	 * so that {@code uint64} hints can reach the top half of their range.
	 * NaN becomes zero.
	 */
	static long truncate(double value) {
		if (value >= TWO_TO_THE_63) {
			return (long) (value - TWO_TO_THE_63) ^ Long.MIN_VALUE;
		} else {
			return (long) value;
		}
	}

	private long narrowSigned(long bits64) {
		switch (bits) {
			case 8: return (byte) bits64;
			case 16: return (short) bits64;
			case 32: return (int) bits64;
			default: return bits64;
		}
	}

	private long narrowUnsigned(long bits64) {
		switch (bits) {
			case 8: return bits64 & 0xFFL;
			case 16: return bits64 & 0xFFFFL;
			case 32: return bits64 & 0xFFFF_FFFFL;
			default: return bits64;
		}
	}

	@Override
	public String toString() {
		return tagName;
	}

	private static final double TWO_TO_THE_63 = 0x1p63;

	private static final Map<String, TypeTag> BY_TAG_NAME = Stream.of(values())
		.collect(toUnmodifiableMap(TypeTag::tagName, Function.identity()));
}
