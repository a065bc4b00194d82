package mp3tags.storage;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.stream.TagCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.logging.Logger;

/**
 * Findet das Tag am Anfang eines Kanals und passt den Bereich an eine neue Tag-Größe an, ohne die Audiodaten
 * dahinter zu verändern.
 *
 * <p>Das Verschieben geschieht direkt in der Datei. Bricht es ab, ist die Datei beschädigt.
 */
public class FileStorage {
    private static final Logger LOGGER = Logger.getLogger(FileStorage.class.getName());

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final SeekableByteChannel channel;
    private final int chunkSize;

    public FileStorage(SeekableByteChannel channel) {
        this(channel, DEFAULT_CHUNK_SIZE);
    }

    public FileStorage(SeekableByteChannel channel, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize muss positiv sein: " + chunkSize);
        }
        this.channel = channel;
        this.chunkSize = chunkSize;
    }

    /** Prüft nur die Kennung {@code ID3} am Anfang. */
    public boolean hasMagic() throws Id3Exception {
        byte[] bytes = new byte[3];
        return readAt(0, bytes) == bytes.length && TagCodec.hasMagic(bytes);
    }

    /** @return die Lage des Tags, oder {@code null} wenn der Kanal nicht mit {@code ID3} beginnt */
    public TagRegion locate() throws Id3Exception {
        byte[] bytes = new byte[TagCodec.HEADER_LENGTH];
        int read = readAt(0, bytes);
        if (read < TagCodec.HEADER_LENGTH || !TagCodec.hasMagic(bytes)) {
            return null;
        }
        TagCodec.Header header = TagCodec.decodeHeader(bytes);
        TagRegion region = new TagRegion(header.version(), header.flags(), header.totalLength());
        LOGGER.fine(() -> "Tag gefunden: " + region);
        return region;
    }

    /** Liest die Bytes {@code [0, end)} des Tags. */
    public byte[] read(TagRegion region) throws Id3Exception {
        byte[] bytes = new byte[(int) region.end()];
        int read = readAt(0, bytes);
        if (read < bytes.length) {
            throw new Id3Exception(ErrorKind.PARSING,
                    "Datei endet nach " + read + " Bytes, das Tag ist " + bytes.length + " Bytes lang");
        }
        return bytes;
    }

    /**
     * Schreibt das neue Tag an den Anfang.
     *
     * <p>Ist es nicht größer als der alte Bereich, wird der Rest bis {@code oldEnd} mit Nullen gefüllt und alles
     * dahinter bleibt unberührt. Sonst wird die Datei verlängert, der Inhalt ab {@code oldEnd} von hinten nach
     * vorne verschoben und zuletzt das Tag geschrieben.
     */
    public void write(byte[] tagBytes, long oldEnd) throws Id3Exception {
        try {
            if (tagBytes.length <= oldEnd) {
                LOGGER.fine(() -> String.format("Tag passt in den alten Bereich: %d von %d Bytes",
                        tagBytes.length, oldEnd));
                writeAt(0, tagBytes, tagBytes.length);
                fillZeros(tagBytes.length, oldEnd);
                return;
            }
            long size = channel.size();
            long delta = tagBytes.length - oldEnd;
            LOGGER.fine(() -> String.format("Tag wächst um %d Bytes, verschiebe %d Bytes",
                    delta, Math.max(0, size - oldEnd)));

            // Datei zuerst verlängern, dann verschieben
            writeAt(size + delta - 1, new byte[1], 1);
            byte[] buffer = new byte[chunkSize];
            long position = size;
            while (position > oldEnd) {
                int n = (int) Math.min(chunkSize, position - oldEnd);
                position -= n;
                readFully(position, buffer, n);
                writeAt(position + delta, buffer, n);
            }
            writeAt(0, tagBytes, tagBytes.length);
        } catch (IOException e) {
            throw Id3Exception.io("Schreiben des Tags fehlgeschlagen", e);
        }
    }

    /** Entfernt das Tag: alles ab {@code region.end()} rückt an den Anfang, dann wird gekürzt. */
    public void remove(TagRegion region) throws Id3Exception {
        try {
            long size = channel.size();
            long end = Math.min(region.end(), size);
            LOGGER.fine(() -> String.format("Entferne Tag mit %d Bytes", end));
            byte[] buffer = new byte[chunkSize];
            long position = end;
            while (position < size) {
                int n = (int) Math.min(chunkSize, size - position);
                readFully(position, buffer, n);
                writeAt(position - end, buffer, n);
                position += n;
            }
            channel.truncate(size - end);
        } catch (IOException e) {
            throw Id3Exception.io("Entfernen des Tags fehlgeschlagen", e);
        }
    }

    private void fillZeros(long from, long to) throws IOException {
        byte[] zeros = new byte[(int) Math.min(chunkSize, Math.max(0, to - from))];
        long position = from;
        while (position < to) {
            int n = (int) Math.min(zeros.length, to - position);
            writeAt(position, zeros, n);
            position += n;
        }
    }

    /** Liest ab {@code position}, bis {@code target} voll ist oder die Datei endet. */
    private int readAt(long position, byte[] target) throws Id3Exception {
        try {
            channel.position(position);
            ByteBuffer buffer = ByteBuffer.wrap(target);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            return buffer.position();
        } catch (IOException e) {
            throw Id3Exception.io("Lesen fehlgeschlagen", e);
        }
    }

    private void readFully(long position, byte[] target, int length) throws IOException {
        channel.position(position);
        ByteBuffer buffer = ByteBuffer.wrap(target, 0, length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new Id3Exception(ErrorKind.IO, "Unerwartetes Dateiende bei Position " + position);
            }
        }
    }

    private void writeAt(long position, byte[] source, int length) throws IOException {
        channel.position(position);
        ByteBuffer buffer = ByteBuffer.wrap(source, 0, length);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
