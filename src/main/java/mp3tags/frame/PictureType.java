package mp3tags.frame;

public enum PictureType {
    OTHER,
    ICON,
    OTHER_ICON,
    COVER_FRONT,
    COVER_BACK,
    LEAFLET,
    MEDIA,
    LEAD_ARTIST,
    ARTIST,
    CONDUCTOR,
    BAND,
    COMPOSER,
    LYRICIST,
    RECORDING_LOCATION,
    DURING_RECORDING,
    DURING_PERFORMANCE,
    SCREEN_CAPTURE,
    BRIGHT_FISH,
    ILLUSTRATION,
    BAND_LOGO,
    PUBLISHER_LOGO;

    /** Der Bytewert im Frame. */
    public int code() {
        return ordinal();
    }

    /** @return der Typ, oder {@code null} für nicht standardisierte Werte */
    public static PictureType fromCode(int code) {
        PictureType[] all = values();
        return code >= 0 && code < all.length ? all[code] : null;
    }
}
