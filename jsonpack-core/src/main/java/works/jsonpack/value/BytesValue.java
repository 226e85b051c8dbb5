package works.jsonpack.value;

import java.util.Arrays;
import java.util.HexFormat;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * An opaque byte string, written as MessagePack {@code bin}.
 */
public final class BytesValue implements NativeValue {
	@NotNull
	private final byte[] bytes;

	private BytesValue(@NotNull byte[] bytes) {
		this.bytes = bytes;
	}

	public static BytesValue of(byte[] bytes) {
		return new BytesValue(requireNonNull(bytes).clone());
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	@Override
	public String kind() {
		return "bytes";
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return Arrays.equals(bytes, ((BytesValue) o).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "bytes(" + HexFormat.of().formatHex(bytes) + ")";
	}
}
