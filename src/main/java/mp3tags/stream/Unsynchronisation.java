package mp3tags.stream;

import mp3tags.Version;

import java.io.ByteArrayOutputStream;

/**
 * Unsynchronisation: nach {@code 0xFF} wird ein {@code 0x00} eingefügt, damit im Tag keine falschen
 * MPEG-Syncs entstehen.
 */
public final class Unsynchronisation {

    private Unsynchronisation() {}

    /** Ersetzt jedes {@code FF 00} durch {@code FF}. */
    public static byte[] decode(byte[] data) {
        return decode(data, 0, data.length);
    }

    public static byte[] decode(byte[] data, int offset, int length) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(length);
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            out.write(data[i]);
            if ((data[i] & 0xFF) == 0xFF && i + 1 < end && data[i + 1] == 0) {
                i++;
            }
        }
        return out.toByteArray();
    }

    /**
     * Fügt nach jedem {@code FF} ein {@code 00} ein, dem {@code 00} oder ein Byte {@code >= E0} folgt.
     *
     * <p>v2.2/v2.3 wenden das Verfahren auf das ganze Tag an, ein {@code FF} am Ende bekommt daher ebenfalls ein
     * {@code 00}. In v2.4 gilt es pro Frame und dem letzten Byte folgt eine Frame-Kennung oder Padding.
     */
    public static byte[] encode(byte[] data, Version version) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + data.length / 16 + 1);
        for (int i = 0; i < data.length; i++) {
            out.write(data[i]);
            if ((data[i] & 0xFF) != 0xFF) {
                continue;
            }
            if (i + 1 < data.length) {
                int next = data[i + 1] & 0xFF;
                if (next == 0x00 || next >= 0xE0) {
                    out.write(0);
                }
            } else if (version != Version.ID3V24) {
                out.write(0);
            }
        }
        return out.toByteArray();
    }

    /** Prüft, ob {@link #encode} für diese Daten überhaupt etwas ändern würde. */
    public static boolean isRequired(byte[] data, Version version) {
        for (int i = 0; i < data.length; i++) {
            if ((data[i] & 0xFF) != 0xFF) {
                continue;
            }
            if (i + 1 == data.length) {
                return version != Version.ID3V24;
            }
            int next = data[i + 1] & 0xFF;
            if (next == 0x00 || next >= 0xE0) {
                return true;
            }
        }
        return false;
    }
}
