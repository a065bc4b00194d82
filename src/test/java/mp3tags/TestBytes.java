package mp3tags;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/** Hilfen zum Zusammenbauen von Testdateien aus Bytes. */
public final class TestBytes {

    private TestBytes() {}

    public static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    public static byte[] latin1(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    public static byte[] filled(int length, int value) {
        byte[] out = new byte[length];
        Arrays.fill(out, (byte) value);
        return out;
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    /** ID3v1.1-Block mit Titel, Tracknummer und Genre-Code. */
    public static byte[] id3v1(String title, int track, int genre) {
        byte[] block = new byte[128];
        System.arraycopy(latin1("TAG"), 0, block, 0, 3);
        byte[] titleBytes = latin1(title);
        System.arraycopy(titleBytes, 0, block, 3, Math.min(30, titleBytes.length));
        block[125] = 0;
        block[126] = (byte) track;
        block[127] = (byte) genre;
        return block;
    }

    public static Path write(Path file, byte[]... parts) throws IOException {
        Files.write(file, concat(parts));
        return file;
    }

    public static byte[] sha256(byte[] data, int from, int to) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(data, from, to - from);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
