package mp3tags.frame;

import java.util.Objects;

/** Benutzerdefinierter Text ({@code TXXX}). */
public record ExtendedText(String description, String value) implements Content {

    public ExtendedText {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public ContentType type() {
        return ContentType.EXTENDED_TEXT;
    }
}
