package mp3tags.frame;

import java.util.Objects;

/**
 * Kommentar ({@code COMM}).
 *
 * @param lang dreistelliger Sprachcode nach ISO-639-2, z.B. {@code "deu"}
 */
public record Comment(String lang, String description, String text) implements Content {

    public Comment {
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public ContentType type() {
        return ContentType.COMMENT;
    }
}
