package mp3tags;

import mp3tags.ID3TagReader.FormatVersion;
import mp3tags.frame.Comment;
import mp3tags.v1.Id3v1Codec;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

// Beispiel für das Schreiben von Tags:
// java -cp target/mp3-fat.jar mp3tags.MP3TagWriter --version=2.3 resources/Distant_Wonders.mp3 artist="Test Artist"

public class MP3TagWriter {
    private static final Logger LOGGER = Logger.getLogger(MP3TagWriter.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE = "Verwendung: java -cp target/mp3-fat.jar mp3tags.MP3TagWriter "
            + "[--version=2.2|2.3|2.4] <MP3-Dateipfad> feld=wert...\n"
            + "Felder: title, artist, album, albumartist, year, genre, track, comment";

    /** Schreibt das ID3v2-Tag und entfernt danach ein vorhandenes ID3v1-Tag. */
    public static void writeTo(Path path, Tag tag, Version version) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            new Encoder().version(version).writeTo(channel, tag);
            if (Id3v1Codec.removeFrom(channel)) {
                LOGGER.fine(() -> "ID3v1-Tag aus " + path + " entfernt");
            }
        } catch (IOException e) {
            throw Id3Exception.io("Schreiben nach " + path + " fehlgeschlagen", e);
        }
    }

    /**
     * Entfernt beide Tags.
     *
     * @return welche Tags vorher vorhanden waren
     */
    public static FormatVersion removeFrom(Path path) throws Id3Exception {
        FormatVersion before = ID3TagReader.detect(path);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            Tag.removeFrom(channel);
            Id3v1Codec.removeFrom(channel);
        } catch (IOException e) {
            throw Id3Exception.io("Entfernen aus " + path + " fehlgeschlagen", e);
        }
        return before;
    }

    /** @return Exit-Code: 0 bei Erfolg, 1 bei falschen Argumenten, 2 bei Lese- oder Schreibfehlern */
    static int run(String[] args) {
        Version version = null;
        String filePath = null;
        Map<String, String> fields = new LinkedHashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--version=")) {
                try {
                    version = Version.parse(arg.substring("--version=".length()));
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
            } else if (filePath == null) {
                filePath = arg;
            } else {
                int eq = arg.indexOf('=');
                if (eq <= 0) {
                    System.err.println("Ungültiges Feld: " + arg);
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
                fields.put(arg.substring(0, eq).toLowerCase(Locale.ROOT), arg.substring(eq + 1));
            }
        }
        if (filePath == null || fields.isEmpty()) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        Path path = Path.of(filePath);
        if (!Files.exists(path)) {
            System.err.println("Die Datei " + filePath + " wurde nicht gefunden.");
            return EXIT_FAILURE;
        }

        try {
            // Nur vollständig gelesene Tags werden zurückgeschrieben.
            Tag tag = Id3Exception.noTagOk(() -> ID3TagReader.readFrom(path));
            if (tag == null) {
                tag = new Tag();
            }
            String error = apply(tag, fields);
            if (error != null) {
                System.err.println(error);
                System.err.println(USAGE);
                return EXIT_USAGE;
            }
            writeTo(path, tag, version != null ? version : tag.version());
            System.out.println("ID3-Tags erfolgreich zu " + filePath + " hinzugefügt.");
            return EXIT_OK;
        } catch (Id3Exception e) {
            if (e.partialTag() != null) {
                System.err.println("Das vorhandene Tag enthält " + e.frameErrors().size()
                        + " nicht lesbare(n) Frame(s), die Datei bleibt unverändert.");
            }
            LOGGER.log(Level.SEVERE, "Fehler beim Schreiben der ID3-Tags", e);
            System.err.println("Fehler beim Schreiben der ID3-Tags: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** @return Fehlermeldung, oder {@code null} wenn alle Felder übernommen wurden */
    private static String apply(Tag tag, Map<String, String> fields) {
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String value = field.getValue();
            switch (field.getKey()) {
                case "title":
                    tag.setTitle(value);
                    break;
                case "artist":
                    tag.setArtist(value);
                    break;
                case "album":
                    tag.setAlbum(value);
                    break;
                case "albumartist":
                    tag.setAlbumArtist(value);
                    break;
                case "genre":
                    tag.setGenre(value);
                    break;
                case "comment":
                    tag.addComment(new Comment("eng", "", value));
                    break;
                case "year":
                    if (!value.matches("\\d{4}")) {
                        return "Ungültiges Jahr: " + value;
                    }
                    tag.setYear(Integer.parseInt(value));
                    break;
                case "track":
                    if (!value.matches("\\d+(/\\d+)?")) {
                        return "Ungültige Tracknummer: " + value;
                    }
                    tag.setText("TRCK", value);
                    break;
                default:
                    return "Unbekanntes Feld: " + field.getKey();
            }
        }
        return null;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
