package mp3tags.frame;

import java.util.Arrays;
import java.util.Objects;

/** Beliebige eingebettete Datei ({@code GEOB}). */
public record EncapsulatedObject(String mimeType, String filename, String description, byte[] data) implements Content {

    public EncapsulatedObject {
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(data, "data");
    }

    @Override
    public ContentType type() {
        return ContentType.ENCAPSULATED_OBJECT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncapsulatedObject)) return false;
        EncapsulatedObject other = (EncapsulatedObject) o;
        return mimeType.equals(other.mimeType)
                && filename.equals(other.filename)
                && description.equals(other.description)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mimeType, filename, description) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "EncapsulatedObject[mimeType=" + mimeType + ", filename=" + filename
                + ", description=" + description + ", data=" + data.length + " Bytes]";
    }
}
