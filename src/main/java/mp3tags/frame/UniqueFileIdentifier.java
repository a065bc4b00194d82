package mp3tags.frame;

import java.util.Arrays;
import java.util.Objects;

/** Eindeutige Kennung der Datei in einer Datenbank ({@code UFID}), z.B. eine MusicBrainz-ID. */
public record UniqueFileIdentifier(String ownerIdentifier, byte[] identifier) implements Content {

    public UniqueFileIdentifier {
        Objects.requireNonNull(ownerIdentifier, "ownerIdentifier");
        Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public ContentType type() {
        return ContentType.UNIQUE_FILE_IDENTIFIER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniqueFileIdentifier)) return false;
        UniqueFileIdentifier other = (UniqueFileIdentifier) o;
        return ownerIdentifier.equals(other.ownerIdentifier) && Arrays.equals(identifier, other.identifier);
    }

    @Override
    public int hashCode() {
        return ownerIdentifier.hashCode() * 31 + Arrays.hashCode(identifier);
    }

    @Override
    public String toString() {
        return "UniqueFileIdentifier[ownerIdentifier=" + ownerIdentifier + ", identifier=" + identifier.length + " Bytes]";
    }
}
