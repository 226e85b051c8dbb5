package works.jsonpack;

import java.util.Arrays;
import java.util.HexFormat;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * What a JSON string turns out to be: text, or bytes in disguise.
 */
public sealed interface ClassifiedString {
	/**
	 * @return the bytes to write after the MessagePack header
	 */
	byte[] bytes();

	/**
	 * Written as MessagePack {@code str}.
	 */
	record Text(byte[] utf8) implements ClassifiedString {
		@Override
		public byte[] bytes() {
			return utf8;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Text other && Arrays.equals(utf8, other.utf8);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(utf8);
		}

		@Override
		public String toString() {
			return "Text(" + new String(utf8, UTF_8) + ")";
		}
	}

	/**
	 * Written as MessagePack {@code bin}.
	 */
	record Blob(byte[] bytes) implements ClassifiedString {
		@Override
		public boolean equals(Object o) {
			return o instanceof Blob other && Arrays.equals(bytes, other.bytes);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(bytes);
		}

		@Override
		public String toString() {
			return "Blob(" + HexFormat.of().formatHex(bytes) + ")";
		}
	}
}
