package mp3tags.frame;

import java.util.Objects;

/** Unsynchronisierter Liedtext ({@code USLT}). Gleicher Aufbau wie {@link Comment}. */
public record Lyrics(String lang, String description, String text) implements Content {

    public Lyrics {
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public ContentType type() {
        return ContentType.LYRICS;
    }
}
