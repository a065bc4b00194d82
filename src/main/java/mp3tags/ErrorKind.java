package mp3tags;

public enum ErrorKind {
    /** Fehler des darunterliegenden Kanals, z.B. kein Platz mehr beim Verschieben. */
    IO,
    /** Bytes passen nicht zur angegebenen Textkodierung. */
    STRING_DECODING,
    /** Keine ID3-Kennung gefunden. */
    NO_TAG,
    /** Header, Frame oder Frame-Inhalt sind fehlerhaft. */
    PARSING,
    /** Vom Aufrufer übergebene Werte lassen sich nicht schreiben. */
    INVALID_INPUT,
    /** Verschlüsselte Frames oder Inhalte ohne Entsprechung in der Zielversion. */
    UNSUPPORTED_FEATURE,
    /** Unbekannte Haupt- oder Unterversion. */
    UNSUPPORTED_VERSION
}
