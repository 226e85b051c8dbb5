package works.jsonpack.ndau;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import works.jsonpack.IdentifierValidator;

/**
 * An address on the ndau blockchain, like {@code ndaegwggj8qv7tqccvz6ffrthkbnmencp9t2y4mn89gdq3yk}.
 * <p>
 * An address is 48 {@link Base32} characters encoding 30 bytes:
 * a two-byte header that spells {@code nd} followed by the {@link Kind} character,
 * a 26-byte payload, and a big-endian {@link Crc16} of the preceding 28 bytes.
 */
public final class NdauAddress {
	public static final int LENGTH = 48;
	public static final int PAYLOAD_LENGTH = 26;

	/**
	 * Recognizes ndau addresses, for {@link works.jsonpack.ConverterConfig.Builder#identifierValidator}.
	 */
	public static final IdentifierValidator VALIDATOR = NdauAddress::isValid;

	@NotNull
	private final String value;
	@NotNull
	private final Kind kind;

	private NdauAddress(@NotNull String value, @NotNull Kind kind) {
		this.value = value;
		this.kind = kind;
	}

	public enum Kind {
		USER('a'),
		NDAU('n'),
		ENDOWMENT('e'),
		EXCHANGE('x'),
		BPC('b'),
		MARKET_MAKER('m');

		private final char character;

		Kind(char character) {
			this.character = character;
		}

		public char character() {
			return character;
		}

		public static Optional<Kind> fromCharacter(char c) {
			for (Kind kind : values()) {
				if (kind.character == c) {
					return Optional.of(kind);
				}
			}
			return Optional.empty();
		}
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is not a valid address; the message says why
	 */
	public static NdauAddress from(String value) {
		if (value.length() != LENGTH) {
			throw new IllegalArgumentException("Address must be " + LENGTH + " characters; found " + value.length());
		} else if (!value.startsWith(PREFIX)) {
			throw new IllegalArgumentException("Address must start with \"" + PREFIX + "\"");
		}
		Kind kind = Kind.fromCharacter(value.charAt(PREFIX.length()))
			.orElseThrow(() -> new IllegalArgumentException("Unknown address kind '" + value.charAt(PREFIX.length()) + "'"));
		if (!Base32.isBase32(value)) {
			throw new IllegalArgumentException("Address contains characters outside the base32 alphabet");
		}
		byte[] bytes = Base32.decode(value);
		int expected = Crc16.checksum(bytes, 0, CHECKSUMMED_LENGTH);
		int actual = ((bytes[CHECKSUMMED_LENGTH] & 0xFF) << 8) | (bytes[CHECKSUMMED_LENGTH + 1] & 0xFF);
		if (expected != actual) {
			throw new IllegalArgumentException("Address checksum mismatch");
		}
		return new NdauAddress(value, kind);
	}

	public static boolean isValid(String value) {
		if (value.length() != LENGTH || !value.startsWith(PREFIX)) {
			return false;
		}
		try {
			from(value);
			return true;
		} catch (IllegalArgumentException e) {
			return false;
		}
	}

	/**
	 * Builds the address with the given kind and payload, computing its checksum.
	 */
	public static NdauAddress fromPayload(Kind kind, byte[] payload) {
		if (payload.length != PAYLOAD_LENGTH) {
			throw new IllegalArgumentException("Payload must be " + PAYLOAD_LENGTH + " bytes; found " + payload.length);
		}
		byte[] bytes = new byte[CHECKSUMMED_LENGTH + 2];
		int header = (Base32.ALPHABET.indexOf('n') << 11)
			| (Base32.ALPHABET.indexOf('d') << 6)
			| (Base32.ALPHABET.indexOf(kind.character()) << 1);
		bytes[0] = (byte) (header >>> 8);
		bytes[1] = (byte) header;
		System.arraycopy(payload, 0, bytes, 2, PAYLOAD_LENGTH);
		int checksum = Crc16.checksum(bytes, 0, CHECKSUMMED_LENGTH);
		bytes[CHECKSUMMED_LENGTH] = (byte) (checksum >>> 8);
		bytes[CHECKSUMMED_LENGTH + 1] = (byte) checksum;
		return new NdauAddress(Base32.encode(bytes), kind);
	}

	public Kind kind() {
		return kind;
	}

	public byte[] payload() {
		return Arrays.copyOfRange(Base32.decode(value), 2, 2 + PAYLOAD_LENGTH);
	}

	@Override
	public String toString() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return Objects.equals(value, ((NdauAddress) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	private static final String PREFIX = "nd";
	private static final int CHECKSUMMED_LENGTH = 28;
}
