package mp3tags.frame;

import java.util.Objects;

/**
 * Bewertung und Abspielzähler eines Benutzers ({@code POPM}).
 *
 * @param rating 0 (unbekannt) bis 255
 */
public record Popularimeter(String user, int rating, long counter) implements Content {

    public Popularimeter {
        Objects.requireNonNull(user, "user");
        if (rating < 0 || rating > 0xFF) {
            throw new IllegalArgumentException("Bewertung muss zwischen 0 und 255 liegen: " + rating);
        }
        if (counter < 0) {
            throw new IllegalArgumentException("Zähler darf nicht negativ sein: " + counter);
        }
    }

    @Override
    public ContentType type() {
        return ContentType.POPULARIMETER;
    }
}
