package mp3tags.frame;

import java.util.List;
import java.util.Objects;

/** Inhalt der Text-Frames ({@code T***}). Mehrere Werte sind erst ab v2.4 vorgesehen. */
public record Text(List<String> values) implements Content {

    public Text {
        values = List.copyOf(Objects.requireNonNull(values, "values"));
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Ein Text-Frame braucht mindestens einen Wert");
        }
    }

    public static Text of(String... values) {
        return new Text(List.of(values));
    }

    public String first() {
        return values.get(0);
    }

    /** Alle Werte, mit {@code separator} verbunden. */
    public String joined(String separator) {
        return String.join(separator, values);
    }

    @Override
    public ContentType type() {
        return ContentType.TEXT;
    }
}
