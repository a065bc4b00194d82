package mp3tags.v1;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * ID3v1 und v1.1: 128 Bytes am Dateiende.
 *
 * <pre>
 * "TAG" Titel(30) Künstler(30) Album(30) Jahr(4) Kommentar(30) Genre(1)
 * </pre>
 * In v1.1 ist Byte 28 des Kommentars 0 und Byte 29 die Tracknummer.
 */
public final class Id3v1Codec {
    private static final Logger LOGGER = Logger.getLogger(Id3v1Codec.class.getName());

    public static final int TAG_SIZE = 128;
    private static final byte[] IDENTIFIER = "TAG".getBytes(StandardCharsets.ISO_8859_1);
    private static final int NO_GENRE = 0xFF;

    private Id3v1Codec() {}

    public static boolean isCandidate(SeekableByteChannel channel) throws Id3Exception {
        return readBlock(channel) != null;
    }

    public static Id3v1Tag read(SeekableByteChannel channel) throws Id3Exception {
        ByteBuffer block = readBlock(channel);
        if (block == null) {
            throw new Id3Exception(ErrorKind.NO_TAG, "Kein ID3v1-Tag gefunden");
        }
        return decode(block);
    }

    /** @return {@code true}, wenn ein Tag entfernt wurde */
    public static boolean removeFrom(SeekableByteChannel channel) throws Id3Exception {
        if (readBlock(channel) == null) {
            return false;
        }
        try {
            long size = channel.size();
            channel.truncate(size - TAG_SIZE);
            LOGGER.fine(() -> "ID3v1-Tag entfernt, neue Größe: " + (size - TAG_SIZE));
            return true;
        } catch (IOException e) {
            throw Id3Exception.io("Entfernen des ID3v1-Tags fehlgeschlagen", e);
        }
    }

    static Id3v1Tag decode(ByteBuffer block) {
        block.position(IDENTIFIER.length);
        String title = readString(block, 30);
        String artist = readString(block, 30);
        String album = readString(block, 30);
        String year = readString(block, 4);
        byte[] comment = new byte[30];
        block.get(comment);
        int genre = block.get() & 0xFF;

        Integer track = null;
        int commentLength = comment.length;
        if (comment[28] == 0 && comment[29] != 0) {
            track = comment[29] & 0xFF;
            commentLength = 28;
        }
        return new Id3v1Tag(title, artist, album, year,
                trim(comment, commentLength), track, genre == NO_GENRE ? null : genre);
    }

    /** Die letzten 128 Bytes, falls sie mit {@code TAG} beginnen. */
    private static ByteBuffer readBlock(SeekableByteChannel channel) throws Id3Exception {
        try {
            if (channel.size() < TAG_SIZE) {
                return null;
            }
            ByteBuffer buffer = ByteBuffer.allocate(TAG_SIZE);
            channel.position(channel.size() - TAG_SIZE);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    return null;
                }
            }
            buffer.flip();
            byte[] identifier = new byte[IDENTIFIER.length];
            buffer.get(identifier);
            return Arrays.equals(identifier, IDENTIFIER) ? buffer : null;
        } catch (IOException e) {
            throw Id3Exception.io("Lesen des ID3v1-Tags fehlgeschlagen", e);
        }
    }

    private static String readString(ByteBuffer buffer, int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return trim(bytes, length);
    }

    /** Bis zum ersten NUL, ohne Leerzeichen am Ende. */
    private static String trim(byte[] bytes, int length) {
        int end = 0;
        while (end < length && bytes[end] != 0) {
            end++;
        }
        while (end > 0 && bytes[end - 1] == ' ') {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.ISO_8859_1);
    }
}
