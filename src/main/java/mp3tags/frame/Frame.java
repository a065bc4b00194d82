package mp3tags.frame;

import mp3tags.stream.Encoding;

import java.util.Objects;

/**
 * Ein Frame eines ID3v2-Tags.
 *
 * @param id kanonische Kennung mit 4 Zeichen; v2.2-Kennungen ohne Entsprechung behalten ihre 3 Zeichen
 * @param encoding Kodierung, mit der gelesen wurde bzw. geschrieben werden soll; {@code null} wählt je nach
 *                 Zielversion
 */
public record Frame(String id, Content content, FrameFlags flags, Encoding encoding) {

    public Frame {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(flags, "flags");
        if (id.length() != 3 && id.length() != 4) {
            throw new IllegalArgumentException("Frame-Kennung muss 3 oder 4 Zeichen haben: " + id);
        }
    }

    public static Frame of(String id, Content content) {
        return new Frame(id, content, FrameFlags.NONE, null);
    }

    public static Frame text(String id, String... values) {
        return of(id, Text.of(values));
    }

    public Frame withEncoding(Encoding value) {
        return new Frame(id, content, flags, value);
    }

    public Frame withFlags(FrameFlags value) {
        return new Frame(id, content, value, encoding);
    }

    /** Erster Textwert, falls es ein Text-Frame ist. */
    public String textValue() {
        return content instanceof Text ? ((Text) content).first() : null;
    }

    /**
     * Schlüssel, unter dem ein Frame im Tag nur einmal vorkommen darf. Zwei Frames mit gleichem Schlüssel
     * ersetzen einander; {@code null} heißt, der Frame darf beliebig oft vorkommen.
     */
    public String uniquenessKey() {
        switch (content.type()) {
            case TEXT:
            case LINK:
            case TIMESTAMP:
                return id;
            case EXTENDED_TEXT:
                return id + '\0' + ((ExtendedText) content).description();
            case EXTENDED_LINK:
                return id + '\0' + ((ExtendedLink) content).description();
            case COMMENT: {
                Comment comment = (Comment) content;
                return id + '\0' + comment.lang() + '\0' + comment.description();
            }
            case LYRICS: {
                Lyrics lyrics = (Lyrics) content;
                return id + '\0' + lyrics.lang() + '\0' + lyrics.description();
            }
            case PICTURE:
                return id + '\0' + ((Picture) content).pictureType();
            case POPULARIMETER:
                return id + '\0' + ((Popularimeter) content).user();
            case UNIQUE_FILE_IDENTIFIER:
                return id + '\0' + ((UniqueFileIdentifier) content).ownerIdentifier();
            case ENCAPSULATED_OBJECT:
                return id + '\0' + ((EncapsulatedObject) content).description();
            default:
                return null;
        }
    }
}
