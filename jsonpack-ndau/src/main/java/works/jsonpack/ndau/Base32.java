package works.jsonpack.ndau;

import java.util.Arrays;

/**
 * The ndau variant of base32: lowercase, without the easily confused {@code l}, {@code o}, {@code 0} and {@code 1},
 * and without padding.
 */
public final class Base32 {
	private Base32() { }

	public static final String ALPHABET = "abcdefghijkmnpqrstuvwxyz23456789";

	/**
	 * Leftover bits at the end are padded with zeros to make a final character.
	 */
	public static String encode(byte[] bytes) {
		StringBuilder sb = new StringBuilder((bytes.length * 8 + 4) / 5);
		int buffer = 0;
		int bitsInBuffer = 0;
		for (byte b : bytes) {
			buffer = (buffer << 8) | (b & 0xFF);
			bitsInBuffer += 8;
			while (bitsInBuffer >= 5) {
				bitsInBuffer -= 5;
				sb.append(ALPHABET.charAt((buffer >>> bitsInBuffer) & 0x1F));
			}
		}
		if (bitsInBuffer > 0) {
			sb.append(ALPHABET.charAt((buffer << (5 - bitsInBuffer)) & 0x1F));
		}
		return sb.toString();
	}

	/**
	 * Leftover bits that don't make a whole byte are discarded.
	 *
	 * @throws IllegalArgumentException if {@code text} contains a character outside {@link #ALPHABET}
	 */
	public static byte[] decode(CharSequence text) {
		byte[] result = new byte[text.length() * 5 / 8];
		int buffer = 0;
		int bitsInBuffer = 0;
		int size = 0;
		for (int i = 0; i < text.length(); i++) {
			int value = valueOf(text.charAt(i));
			if (value < 0) {
				throw new IllegalArgumentException("Invalid base32 character '" + text.charAt(i) + "' at position " + i);
			}
			buffer = (buffer << 5) | value;
			bitsInBuffer += 5;
			if (bitsInBuffer >= 8) {
				bitsInBuffer -= 8;
				result[size++] = (byte) (buffer >>> bitsInBuffer);
			}
		}
		return result;
	}

	public static boolean isBase32(CharSequence text) {
		for (int i = 0; i < text.length(); i++) {
			if (valueOf(text.charAt(i)) < 0) {
				return false;
			}
		}
		return true;
	}

	private static int valueOf(char c) {
		return c < DECODING.length ? DECODING[c] : -1;
	}

	private static final int[] DECODING = new int[128];

	static {
		Arrays.fill(DECODING, -1);
		for (int i = 0; i < ALPHABET.length(); i++) {
			DECODING[ALPHABET.charAt(i)] = i;
		}
	}
}
