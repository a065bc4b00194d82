package mp3tags;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fehler beim Lesen oder Schreiben eines ID3-Tags.
 *
 * <p>Wurden beim Lesen nur einzelne Frames übersprungen, trägt die Exception das
 * Teil-Tag ({@link #partialTag()}) und die Fehler der übersprungenen Frames.
 */
public class Id3Exception extends IOException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final transient Tag partialTag;
    private final List<Id3Exception> frameErrors;

    public Id3Exception(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public Id3Exception(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.partialTag = null;
        this.frameErrors = Collections.emptyList();
    }

    private Id3Exception(Id3Exception first, Tag partialTag, List<Id3Exception> frameErrors) {
        super(first.getMessage() + " (" + frameErrors.size() + " Frame(s) übersprungen)", first);
        this.kind = first.kind;
        this.partialTag = partialTag;
        this.frameErrors = Collections.unmodifiableList(new ArrayList<>(frameErrors));
    }

    /** Fasst die Fehler einzelner Frames zu einem Fehler mit Teil-Tag zusammen. */
    public static Id3Exception partial(Tag partialTag, List<Id3Exception> frameErrors) {
        if (frameErrors.isEmpty()) {
            throw new IllegalArgumentException("frameErrors darf nicht leer sein");
        }
        return new Id3Exception(frameErrors.get(0), partialTag, frameErrors);
    }

    /** Verpackt einen I/O-Fehler des Kanals. */
    public static Id3Exception io(String message, IOException cause) {
        if (cause instanceof Id3Exception) {
            return (Id3Exception) cause;
        }
        return new Id3Exception(ErrorKind.IO, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Die sauber gelesenen Frames, oder {@code null} wenn der Fehler das ganze Tag betrifft. */
    public Tag partialTag() {
        return partialTag;
    }

    public List<Id3Exception> frameErrors() {
        return frameErrors;
    }

    public boolean isKind(ErrorKind other) {
        return kind == other;
    }

    @FunctionalInterface
    public interface TagSource {
        Tag read() throws Id3Exception;
    }

    /** Fehlendes Tag ist kein Fehler: liefert {@code null} bei {@link ErrorKind#NO_TAG}. */
    public static Tag noTagOk(TagSource source) throws Id3Exception {
        try {
            return source.read();
        } catch (Id3Exception e) {
            if (e.kind == ErrorKind.NO_TAG) {
                return null;
            }
            throw e;
        }
    }

    /** Liefert das Teil-Tag, wenn nur einzelne Frames fehlerhaft waren. */
    public static Tag partialTagOk(TagSource source) throws Id3Exception {
        try {
            return source.read();
        } catch (Id3Exception e) {
            if (e.partialTag != null) {
                return e.partialTag;
            }
            throw e;
        }
    }
}
