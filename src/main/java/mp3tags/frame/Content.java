package mp3tags.frame;

/** Typisierter Inhalt eines Frames. */
public interface Content {

    ContentType type();
}
