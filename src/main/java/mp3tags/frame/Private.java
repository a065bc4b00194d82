package mp3tags.frame;

import java.util.Arrays;
import java.util.Objects;

/** Herstellerspezifische Daten ({@code PRIV}). */
public record Private(String ownerIdentifier, byte[] data) implements Content {

    public Private {
        Objects.requireNonNull(ownerIdentifier, "ownerIdentifier");
        Objects.requireNonNull(data, "data");
    }

    @Override
    public ContentType type() {
        return ContentType.PRIVATE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Private)) return false;
        Private other = (Private) o;
        return ownerIdentifier.equals(other.ownerIdentifier) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return ownerIdentifier.hashCode() * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Private[ownerIdentifier=" + ownerIdentifier + ", data=" + data.length + " Bytes]";
    }
}
