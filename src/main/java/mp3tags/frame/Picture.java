package mp3tags.frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * Eingebettetes Bild ({@code APIC}, in v2.2 {@code PIC}).
 *
 * @param pictureType Rohwert des Bildtyp-Bytes; unbekannte Werte bleiben erhalten
 * @param data Bilddaten, deren Format (JPEG, PNG, ...) hier nicht ausgewertet wird
 */
public record Picture(String mimeType, int pictureType, String description, byte[] data) implements Content {

    public Picture {
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(data, "data");
        if (pictureType < 0 || pictureType > 0xFF) {
            throw new IllegalArgumentException("Bildtyp muss ein Byte sein: " + pictureType);
        }
    }

    public Picture(String mimeType, PictureType pictureType, String description, byte[] data) {
        this(mimeType, pictureType.code(), description, data);
    }

    /** @return der Bildtyp, oder {@code null} für nicht standardisierte Werte */
    public PictureType knownType() {
        return PictureType.fromCode(pictureType);
    }

    @Override
    public ContentType type() {
        return ContentType.PICTURE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Picture)) return false;
        Picture other = (Picture) o;
        return pictureType == other.pictureType
                && mimeType.equals(other.mimeType)
                && description.equals(other.description)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mimeType, pictureType, description) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Picture[mimeType=" + mimeType + ", pictureType=" + pictureType
                + ", description=" + description + ", data=" + data.length + " Bytes]";
    }
}
