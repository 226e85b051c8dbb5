package works.jsonpack.ndau;

/**
 * CRC-16 with polynomial {@code 0x1021} and initial value {@code 0x1D0F},
 * unreflected and with no final XOR (sometimes called CRC-16/AUG-CCITT).
 */
public final class Crc16 {
	private Crc16() { }

	public static int checksum(byte[] data) {
		return checksum(data, 0, data.length);
	}

	/**
	 * @return the checksum in the low 16 bits
	 */
	public static int checksum(byte[] data, int offset, int length) {
		int crc = INITIAL;
		for (int i = offset; i < offset + length; i++) {
			crc = ((crc << 8) ^ TABLE[((crc >>> 8) ^ data[i]) & 0xFF]) & 0xFFFF;
		}
		return crc;
	}

	private static final int POLYNOMIAL = 0x1021;
	private static final int INITIAL = 0x1D0F;

	private static final int[] TABLE = new int[256];

	static {
		for (int b = 0; b < 256; b++) {
			int crc = b << 8;
			for (int bit = 0; bit < 8; bit++) {
				crc = ((crc & 0x8000) != 0) ? (crc << 1) ^ POLYNOMIAL : crc << 1;
			}
			TABLE[b] = crc & 0xFFFF;
		}
	}
}
