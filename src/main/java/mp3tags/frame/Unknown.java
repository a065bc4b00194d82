package mp3tags.frame;

import java.util.Arrays;
import java.util.Objects;

/** Rohdaten eines Frames, dessen Kennung nicht ausgewertet wird. Wird Byte für Byte zurückgeschrieben. */
public record Unknown(byte[] data) implements Content {

    public Unknown {
        Objects.requireNonNull(data, "data");
    }

    @Override
    public ContentType type() {
        return ContentType.UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Unknown && Arrays.equals(data, ((Unknown) o).data));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Unknown[" + data.length + " Bytes]";
    }
}
