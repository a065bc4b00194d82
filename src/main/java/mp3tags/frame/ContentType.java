package mp3tags.frame;

/** Form des Frame-Inhalts. Ergibt sich allein aus der Frame-Kennung. */
public enum ContentType {
    TEXT,
    EXTENDED_TEXT,
    LINK,
    EXTENDED_LINK,
    COMMENT,
    LYRICS,
    PICTURE,
    POPULARIMETER,
    TIMESTAMP,
    ENCAPSULATED_OBJECT,
    PRIVATE,
    UNIQUE_FILE_IDENTIFIER,
    UNKNOWN
}
