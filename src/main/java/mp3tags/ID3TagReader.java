package mp3tags;

import mp3tags.v1.Id3v1Codec;
import mp3tags.v1.Id3v1Tag;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

// Beispiel für das Lesen von Tags:
// java -cp target/mp3-fat.jar mp3tags.ID3TagReader resources/Distant_Wonders.mp3

public class ID3TagReader {
    private static final Logger LOGGER = Logger.getLogger(ID3TagReader.class.getName());

    private final Path filePath;

    public ID3TagReader(String filePath) {
        this(Path.of(filePath));
    }

    public ID3TagReader(Path filePath) {
        this.filePath = filePath;
    }

    /** Welche Tags eine Datei trägt. */
    public enum FormatVersion {
        NONE, ID3V1, ID3V2, BOTH;

        static FormatVersion of(boolean id3v1, boolean id3v2) {
            if (id3v1 && id3v2) return BOTH;
            if (id3v2) return ID3V2;
            if (id3v1) return ID3V1;
            return NONE;
        }
    }

    public record TagResult(FormatVersion type, Id3v1Tag id3v1Tag, Tag id3v2Tag) {
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("ID3 Tag Information:\n");
            if (id3v2Tag != null) {
                sb.append("\n=== ID3v2 Tags ===\n").append(id3v2Tag);
            }
            if (id3v1Tag != null) {
                sb.append("\n=== ID3v1 Tags ===\n").append(id3v1Tag);
            }
            if (id3v2Tag == null && id3v1Tag == null) {
                sb.append("Keine ID3 Tags gefunden.");
            }
            return sb.toString();
        }
    }

    /** Liest beide Tags. Ein ID3v2-Tag mit fehlerhaften Frames wird mit den lesbaren Frames geliefert. */
    public TagResult readTags() throws IOException {
        validateFile();

        try (FileChannel channel = FileChannel.open(filePath, StandardOpenOption.READ)) {
            Tag id3v2Tag = Id3Exception.noTagOk(() -> Id3Exception.partialTagOk(() -> Tag.readFrom(channel)));
            Id3v1Tag id3v1Tag = Id3v1Codec.isCandidate(channel) ? Id3v1Codec.read(channel) : null;

            if (id3v1Tag == null && id3v2Tag == null) {
                LOGGER.info(() -> "Keine ID3 Tags gefunden in: " + filePath);
            }
            return new TagResult(FormatVersion.of(id3v1Tag != null, id3v2Tag != null), id3v1Tag, id3v2Tag);
        }
    }

    private void validateFile() throws IOException {
        if (!Files.exists(filePath) || !Files.isReadable(filePath)) {
            throw new Id3Exception(ErrorKind.IO, "Ungültige Datei: " + filePath);
        }
    }

    /** Prüft nur die Kennungen, ohne die Tags zu lesen. */
    public static FormatVersion detect(Path path) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return FormatVersion.of(Id3v1Codec.isCandidate(channel), Tag.isCandidate(channel));
        } catch (IOException e) {
            throw Id3Exception.io("Lesen von " + path + " fehlgeschlagen", e);
        }
    }

    /**
     * Das ID3v2-Tag der Datei, sonst das ID3v1-Tag als ID3v2.4-Tag.
     *
     * @throws Id3Exception {@link ErrorKind#NO_TAG}, wenn die Datei keins von beiden hat
     */
    public static Tag readFrom(Path path) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            Tag tag = Id3Exception.noTagOk(() -> Tag.readFrom(channel));
            if (tag != null) {
                return tag;
            }
            if (Id3v1Codec.isCandidate(channel)) {
                LOGGER.fine(() -> "Kein ID3v2-Tag, verwende ID3v1 aus " + path);
                return Id3v1Codec.read(channel).toTag();
            }
            throw new Id3Exception(ErrorKind.NO_TAG, "Keine ID3 Tags gefunden in: " + path);
        } catch (IOException e) {
            throw Id3Exception.io("Lesen von " + path + " fehlgeschlagen", e);
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            LOGGER.severe("Bitte geben Sie den Pfad zur MP3-Datei als Argument an.");
            System.exit(1);
        }

        try {
            ID3TagReader reader = new ID3TagReader(args[0]);
            System.out.println(reader.readTags());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Fehler beim Lesen der MP3-Datei", e);
            System.exit(2);
        }
    }
}
