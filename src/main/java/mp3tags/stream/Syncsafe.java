package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;

import java.util.Locale;

/**
 * Syncsafe-Ganzzahlen: 28 Bit verteilt auf 4 Bytes zu je 7 Bit, das höchste Bit jedes Bytes ist immer 0.
 */
public final class Syncsafe {

    public static final int MAX_VALUE = (1 << 28) - 1;

    private Syncsafe() {}

    public static int decode(byte[] bytes, int offset) throws Id3Exception {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            int b = bytes[offset + i] & 0xFF;
            if ((b & 0x80) != 0) {
                throw new Id3Exception(ErrorKind.PARSING,
                        String.format(Locale.ROOT, "Ungültige Syncsafe-Zahl: Byte %d ist 0x%02X", i, b));
            }
            value = (value << 7) | b;
        }
        return value;
    }

    public static byte[] encode(int value) throws Id3Exception {
        byte[] out = new byte[4];
        encodeInto(value, out, 0);
        return out;
    }

    public static void encodeInto(int value, byte[] target, int offset) throws Id3Exception {
        if (value < 0 || value > MAX_VALUE) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT, "Wert passt nicht in 28 Bit: " + value);
        }
        target[offset] = (byte) ((value >> 21) & 0x7F);
        target[offset + 1] = (byte) ((value >> 14) & 0x7F);
        target[offset + 2] = (byte) ((value >> 7) & 0x7F);
        target[offset + 3] = (byte) (value & 0x7F);
    }
}
