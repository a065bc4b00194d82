package mp3tags;

import mp3tags.storage.FileStorage;
import mp3tags.storage.TagRegion;
import mp3tags.stream.TagCodec;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;

/**
 * Einstellungen zum Schreiben eines Tags.
 *
 * <pre>
 * byte[] bytes = new Encoder().version(Version.ID3V23).padding(512).encode(tag);
 * </pre>
 */
public class Encoder {
    private static final Logger LOGGER = Logger.getLogger(Encoder.class.getName());

    private Version version = Version.ID3V24;
    private boolean unsynchronisation;
    private boolean compression;
    private boolean fileAltered;
    private int padding;
    private boolean footer;

    public Encoder() {
    }

    private Encoder(Encoder other) {
        this.version = other.version;
        this.unsynchronisation = other.unsynchronisation;
        this.compression = other.compression;
        this.fileAltered = other.fileAltered;
        this.padding = other.padding;
        this.footer = other.footer;
    }

    public Encoder version(Version value) {
        this.version = value;
        return this;
    }

    /** Unsynchronisation: v2.2/v2.3 für das ganze Tag, v2.4 für jeden Frame. */
    public Encoder unsynchronisation(boolean value) {
        this.unsynchronisation = value;
        return this;
    }

    /** Alle Frames komprimieren (ab v2.3). */
    public Encoder compression(boolean value) {
        this.compression = value;
        return this;
    }

    /** Die Audiodaten wurden verändert: Frames mit gesetztem File-Alter-Flag werden weggelassen. */
    public Encoder fileAltered(boolean value) {
        this.fileAltered = value;
        return this;
    }

    /** Anzahl Null-Bytes hinter dem letzten Frame. Wird bei einem Footer ignoriert. */
    public Encoder padding(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("padding darf nicht negativ sein: " + value);
        }
        this.padding = value;
        return this;
    }

    /** Footer schreiben, nur in v2.4. */
    public Encoder footer(boolean value) {
        this.footer = value;
        return this;
    }

    public Version getVersion() {
        return version;
    }

    public boolean isUnsynchronisation() {
        return unsynchronisation;
    }

    public boolean isCompression() {
        return compression;
    }

    public boolean isFileAltered() {
        return fileAltered;
    }

    public int getPadding() {
        return padding;
    }

    public boolean isFooter() {
        return footer;
    }

    public byte[] encode(Tag tag) throws Id3Exception {
        return TagCodec.encode(tag, this);
    }

    /**
     * Ersetzt das Tag am Anfang des Kanals oder schreibt ein neues. Ein kleineres Tag füllt den alten Bereich
     * mit Padding auf, sodass die Audiodaten nicht verschoben werden müssen.
     */
    public void writeTo(SeekableByteChannel channel, Tag tag) throws Id3Exception {
        FileStorage storage = new FileStorage(channel);
        TagRegion region = storage.locate();
        long oldEnd = region == null ? 0 : region.end();

        byte[] bytes = encode(tag);
        if (bytes.length < oldEnd && !(footer && version == Version.ID3V24)) {
            long fill = oldEnd - bytes.length;
            bytes = new Encoder(this).padding((int) (padding + fill)).encode(tag);
        }
        int length = bytes.length;
        LOGGER.fine(() -> String.format("Schreibe %s mit %d Bytes (vorher %d)", version, length, oldEnd));
        storage.write(bytes, oldEnd);
    }

    public void writeTo(Path path, Tag tag) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE)) {
            writeTo(channel, tag);
        } catch (IOException e) {
            throw Id3Exception.io("Schreiben nach " + path + " fehlgeschlagen", e);
        }
    }
}
