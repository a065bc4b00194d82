package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Version;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Die vier Textkodierungen von ID3v2. Das Kodierungsbyte steht am Anfang der meisten Text-Frames.
 */
public enum Encoding {
    LATIN1(0, StandardCharsets.ISO_8859_1),
    /** UTF-16 mit Byte Order Mark. Geschrieben wird Little Endian ({@code FF FE}). */
    UTF16(1, StandardCharsets.UTF_16LE),
    UTF16BE(2, StandardCharsets.UTF_16BE),
    UTF8(3, StandardCharsets.UTF_8);

    private static final byte[] BOM_LE = {(byte) 0xFF, (byte) 0xFE};

    private final int code;
    private final Charset charset;

    Encoding(int code, Charset charset) {
        this.code = code;
        this.charset = charset;
    }

    public int code() {
        return code;
    }

    public static Encoding fromCode(int code) throws Id3Exception {
        for (Encoding encoding : values()) {
            if (encoding.code == code) {
                return encoding;
            }
        }
        throw new Id3Exception(ErrorKind.PARSING, "Ungültiges Kodierungsbyte: " + code);
    }

    public boolean isSixteenBit() {
        return this == UTF16 || this == UTF16BE;
    }

    public byte[] terminator() {
        return isSixteenBit() ? new byte[2] : new byte[1];
    }

    /** v2.2 und v2.3 kennen nur Latin1 und UTF-16 mit BOM. */
    public boolean isSupportedBy(Version version) {
        return version == Version.ID3V24 || this == LATIN1 || this == UTF16;
    }

    /**
     * Wählt die Kodierung, mit der Texte für die Zielversion geschrieben werden.
     *
     * @param preferred gewünschte Kodierung oder {@code null}
     * @param strings alle Texte des Frames
     */
    public static Encoding forVersion(Encoding preferred, Version version, String... strings) {
        if (preferred != null) {
            return preferred.isSupportedBy(version) ? preferred : UTF16;
        }
        if (version == Version.ID3V24) {
            return UTF8;
        }
        for (String s : strings) {
            if (s != null && !LATIN1.canEncode(s)) {
                return UTF16;
            }
        }
        return LATIN1;
    }

    public boolean canEncode(String s) {
        return charset.newEncoder().canEncode(s);
    }

    public String decode(byte[] data) throws Id3Exception {
        return decode(data, 0, data.length);
    }

    public String decode(byte[] data, int offset, int length) throws Id3Exception {
        if (length == 0) {
            return "";
        }
        Charset target = charset;
        if (this == UTF16) {
            if (length < 2) {
                throw new Id3Exception(ErrorKind.STRING_DECODING, "UTF-16 ohne Byte Order Mark");
            }
            int b0 = data[offset] & 0xFF;
            int b1 = data[offset + 1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) {
                target = StandardCharsets.UTF_16LE;
            } else if (b0 == 0xFE && b1 == 0xFF) {
                target = StandardCharsets.UTF_16BE;
            } else {
                throw new Id3Exception(ErrorKind.STRING_DECODING,
                        String.format("Unbekannte Byte Order Mark: %02X %02X", b0, b1));
            }
            offset += 2;
            length -= 2;
        }
        if (isSixteenBit() && length % 2 != 0) {
            throw new Id3Exception(ErrorKind.STRING_DECODING, "UTF-16 mit ungerader Länge: " + length);
        }
        try {
            return target.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, offset, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new Id3Exception(ErrorKind.STRING_DECODING, "Ungültige " + this + "-Bytefolge", e);
        }
    }

    public byte[] encode(String s) throws Id3Exception {
        byte[] body;
        try {
            ByteBuffer encoded = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(s));
            body = Arrays.copyOfRange(encoded.array(), encoded.position(), encoded.limit());
        } catch (CharacterCodingException e) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT, "Text lässt sich nicht als " + this + " kodieren: " + s, e);
        }
        if (this != UTF16) {
            return body;
        }
        byte[] withBom = new byte[body.length + 2];
        System.arraycopy(BOM_LE, 0, withBom, 0, 2);
        System.arraycopy(body, 0, withBom, 2, body.length);
        return withBom;
    }

    /**
     * Sucht das Textende ab {@code from}. 16-Bit-Terminatoren zählen nur auf geraden Positionen relativ zu
     * {@code from}.
     *
     * @return Index des Terminators oder {@code -1}
     */
    public int indexOfTerminator(byte[] data, int from, int limit) {
        if (!isSixteenBit()) {
            for (int i = from; i < limit; i++) {
                if (data[i] == 0) {
                    return i;
                }
            }
            return -1;
        }
        for (int i = from; i + 1 < limit; i += 2) {
            if (data[i] == 0 && data[i + 1] == 0) {
                return i;
            }
        }
        return -1;
    }
}
