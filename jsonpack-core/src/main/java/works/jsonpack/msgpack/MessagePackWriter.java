package works.jsonpack.msgpack;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * An append-only buffer of MessagePack data.
 * <p>
 * Not thread-safe. A writer belongs to a single conversion.
 */
public final class MessagePackWriter {
	private byte[] buffer;
	private int size;

	public MessagePackWriter() {
		this(64);
	}

	public MessagePackWriter(int initialCapacity) {
		if (initialCapacity < 1) {
			throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
		}
		this.buffer = new byte[initialCapacity];
	}

	public int size() {
		return size;
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(buffer, size);
	}

	public void writeTo(OutputStream out) throws IOException {
		out.write(buffer, 0, size);
	}

	//
	// Scalars
	//

	public void writeNil() {
		put(NIL);
	}

	public void writeBoolean(boolean value) {
		put(value ? TRUE : FALSE);
	}

	/**
	 * Uses only the signed integer formats, in the narrowest one that holds {@code value}.
	 */
	public void writeSigned(long value) {
		if (value >= 0) {
			if (value <= MAX_POSITIVE_FIXINT) {
				put((byte) value);
			} else if (value <= Short.MAX_VALUE) {
				put(INT16);
				putShort((short) value);
			} else if (value <= Integer.MAX_VALUE) {
				put(INT32);
				putInt((int) value);
			} else {
				put(INT64);
				putLong(value);
			}
		} else if (value >= MIN_NEGATIVE_FIXINT) {
			put((byte) value);
		} else if (value >= Byte.MIN_VALUE) {
			put(INT8);
			put((byte) value);
		} else if (value >= Short.MIN_VALUE) {
			put(INT16);
			putShort((short) value);
		} else if (value >= Integer.MIN_VALUE) {
			put(INT32);
			putInt((int) value);
		} else {
			put(INT64);
			putLong(value);
		}
	}

	/**
	 * Uses only the unsigned integer formats, in the narrowest one that holds {@code bits}.
	 *
	 * @param bits interpreted as an unsigned 64-bit number
	 */
	public void writeUnsigned(long bits) {
		if (Long.compareUnsigned(bits, MAX_POSITIVE_FIXINT) <= 0) {
			put((byte) bits);
		} else if (Long.compareUnsigned(bits, 0xFFL) <= 0) {
			put(UINT8);
			put((byte) bits);
		} else if (Long.compareUnsigned(bits, 0xFFFFL) <= 0) {
			put(UINT16);
			putShort((short) bits);
		} else if (Long.compareUnsigned(bits, 0xFFFF_FFFFL) <= 0) {
			put(UINT32);
			putInt((int) bits);
		} else {
			put(UINT64);
			putLong(bits);
		}
	}

	public void writeFloat32(float value) {
		put(FLOAT32);
		putInt(Float.floatToRawIntBits(value));
	}

	public void writeFloat64(double value) {
		put(FLOAT64);
		putLong(Double.doubleToRawLongBits(value));
	}

	/**
	 * @param utf8 the encoded string. Not checked: the caller vouches that it is UTF-8.
	 */
	public void writeString(byte[] utf8) {
		int length = utf8.length;
		if (length <= MAX_FIXSTR_LENGTH) {
			put((byte) (FIXSTR_PREFIX | length));
		} else if (length <= 0xFF) {
			put(STR8);
			put((byte) length);
		} else if (length <= 0xFFFF) {
			put(STR16);
			putShort((short) length);
		} else {
			put(STR32);
			putInt(length);
		}
		put(utf8);
	}

	public void writeBinary(byte[] bytes) {
		int length = bytes.length;
		if (length <= 0xFF) {
			put(BIN8);
			put((byte) length);
		} else if (length <= 0xFFFF) {
			put(BIN16);
			putShort((short) length);
		} else {
			put(BIN32);
			putInt(length);
		}
		put(bytes);
	}

	//
	// Containers
	//

	/**
	 * The caller must follow this with exactly {@code count} values.
	 */
	public void writeArrayHeader(int count) {
		writeContainerHeader(count, FIXARRAY_PREFIX, ARRAY16, ARRAY32);
	}

	/**
	 * The caller must follow this with exactly {@code count} key-value pairs.
	 */
	public void writeMapHeader(int count) {
		writeContainerHeader(count, FIXMAP_PREFIX, MAP16, MAP32);
	}

	private void writeContainerHeader(int count, byte fixPrefix, byte format16, byte format32) {
		if (count < 0) {
			throw new IllegalArgumentException("Negative element count: " + count);
		} else if (count <= MAX_FIX_CONTAINER_SIZE) {
			put((byte) (fixPrefix | count));
		} else if (count <= 0xFFFF) {
			put(format16);
			putShort((short) count);
		} else {
			put(format32);
			putInt(count);
		}
	}

	//
	// Raw appends, big-endian
	//

	private void put(byte b) {
		ensureCapacity(1);
		buffer[size++] = b;
	}

	private void put(byte[] bytes) {
		ensureCapacity(bytes.length);
		System.arraycopy(bytes, 0, buffer, size, bytes.length);
		size += bytes.length;
	}

	private void putShort(short value) {
		ensureCapacity(2);
		buffer[size++] = (byte) (value >> 8);
		buffer[size++] = (byte) value;
	}

	private void putInt(int value) {
		ensureCapacity(4);
		buffer[size++] = (byte) (value >> 24);
		buffer[size++] = (byte) (value >> 16);
		buffer[size++] = (byte) (value >> 8);
		buffer[size++] = (byte) value;
	}

	private void putLong(long value) {
		putInt((int) (value >> 32));
		putInt((int) value);
	}

	private void ensureCapacity(int extra) {
		int required = size + extra;
		if (required < 0) {
			throw new IllegalStateException("MessagePack output exceeds the maximum array size");
		}
		if (required > buffer.length) {
			int newCapacity = Math.max(required, buffer.length * 2);
			if (newCapacity < 0) {
				newCapacity = Integer.MAX_VALUE - 8;
			}
			buffer = Arrays.copyOf(buffer, newCapacity);
		}
	}

	private static final int MAX_POSITIVE_FIXINT = 0x7F;
	private static final int MIN_NEGATIVE_FIXINT = -32;
	private static final int MAX_FIXSTR_LENGTH = 31;
	private static final int MAX_FIX_CONTAINER_SIZE = 15;

	private static final byte FIXMAP_PREFIX = (byte) 0x80;
	private static final byte FIXARRAY_PREFIX = (byte) 0x90;
	private static final byte FIXSTR_PREFIX = (byte) 0xA0;
	private static final byte NIL = (byte) 0xC0;
	private static final byte FALSE = (byte) 0xC2;
	private static final byte TRUE = (byte) 0xC3;
	private static final byte BIN8 = (byte) 0xC4;
	private static final byte BIN16 = (byte) 0xC5;
	private static final byte BIN32 = (byte) 0xC6;
	private static final byte FLOAT32 = (byte) 0xCA;
	private static final byte FLOAT64 = (byte) 0xCB;
	private static final byte UINT8 = (byte) 0xCC;
	private static final byte UINT16 = (byte) 0xCD;
	private static final byte UINT32 = (byte) 0xCE;
	private static final byte UINT64 = (byte) 0xCF;
	private static final byte INT8 = (byte) 0xD0;
	private static final byte INT16 = (byte) 0xD1;
	private static final byte INT32 = (byte) 0xD2;
	private static final byte INT64 = (byte) 0xD3;
	private static final byte STR8 = (byte) 0xD9;
	private static final byte STR16 = (byte) 0xDA;
	private static final byte STR32 = (byte) 0xDB;
	private static final byte ARRAY16 = (byte) 0xDC;
	private static final byte ARRAY32 = (byte) 0xDD;
	private static final byte MAP16 = (byte) 0xDE;
	private static final byte MAP32 = (byte) 0xDF;
}
