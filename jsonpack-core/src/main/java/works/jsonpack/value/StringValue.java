package works.jsonpack.value;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A JSON string, held as the bytes it would occupy on the wire.
 * <p>
 * Strings that come from a JSON parser, or from {@link #of(String)}, are always valid UTF-8.
 * {@link #ofBytes} can produce a string whose bytes are not UTF-8 at all;
 * such a string is carried through to MessagePack untouched, as a byte string.
 */
public final class StringValue implements Value {
	@NotNull
	private final byte[] bytes;

	private StringValue(@NotNull byte[] bytes) {
		this.bytes = bytes;
	}

	/**
	 * Unpaired surrogates in {@code text} become U+FFFD.
	 */
	public static StringValue of(String text) {
		return new StringValue(utf8(text));
	}

	public static StringValue ofBytes(byte[] bytes) {
		return new StringValue(requireNonNull(bytes).clone());
	}

	/**
	 * @return a copy of the raw bytes of this string
	 */
	public byte[] bytes() {
		return bytes.clone();
	}

	/**
	 * Lenient decoding: malformed sequences become U+FFFD.
	 * Use this for display, not for deciding anything.
	 */
	public String text() {
		return new String(bytes, UTF_8);
	}

	/**
	 * Encodes {@code text} as UTF-8, writing U+FFFD for each unpaired surrogate.
	 */
	public static byte[] utf8(String text) {
		return wellFormed(text).getBytes(UTF_8);
	}

	private static String wellFormed(String text) {
		StringBuilder result = null;
		int length = text.length();
		for (int i = 0; i < length; i++) {
			char c = text.charAt(i);
			boolean unpaired;
			if (Character.isHighSurrogate(c)) {
				unpaired = i + 1 == length || !Character.isLowSurrogate(text.charAt(i + 1));
				if (!unpaired) {
					if (result != null) {
						result.append(c).append(text.charAt(i + 1));
					}
					i++;
					continue;
				}
			} else {
				unpaired = Character.isLowSurrogate(c);
			}
			if (unpaired && result == null) {
				result = new StringBuilder(length).append(text, 0, i);
			}
			if (result != null) {
				result.append(unpaired ? REPLACEMENT_CHARACTER : c);
			}
		}
		return result == null ? text : result.toString();
	}

	private static final char REPLACEMENT_CHARACTER = '\uFFFD';

	@Override
	public String kind() {
		return "string";
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return Arrays.equals(bytes, ((StringValue) o).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "\"" + text() + "\"";
	}
}
