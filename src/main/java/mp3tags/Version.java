package mp3tags;

public enum Version {
    ID3V22(2),
    ID3V23(3),
    ID3V24(4);

    private final int major;

    Version(int major) {
        this.major = major;
    }

    public int major() {
        return major;
    }

    /** Länge der Frame-Kennung: 3 Zeichen in v2.2, sonst 4. */
    public int frameIdLength() {
        return this == ID3V22 ? 3 : 4;
    }

    public int frameHeaderLength() {
        return this == ID3V22 ? 6 : 10;
    }

    public static Version fromMajor(int major) throws Id3Exception {
        for (Version version : values()) {
            if (version.major == major) {
                return version;
            }
        }
        throw new Id3Exception(ErrorKind.UNSUPPORTED_VERSION, "Nicht unterstützte ID3v2-Version: 2." + major);
    }

    /** Akzeptiert "2.2", "2.3", "2.4" sowie "22", "23", "24". */
    public static Version parse(String text) {
        switch (text.trim()) {
            case "2.2":
            case "22":
                return ID3V22;
            case "2.3":
            case "23":
                return ID3V23;
            case "2.4":
            case "24":
                return ID3V24;
            default:
                throw new IllegalArgumentException("Unbekannte Version: " + text);
        }
    }

    @Override
    public String toString() {
        return "ID3v2." + major;
    }
}
