package mp3tags.frame;

import java.util.Objects;

/** Benutzerdefinierter Link ({@code WXXX}). */
public record ExtendedLink(String description, String link) implements Content {

    public ExtendedLink {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(link, "link");
    }

    @Override
    public ContentType type() {
        return ContentType.EXTENDED_LINK;
    }
}
