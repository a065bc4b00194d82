package mp3tags.frame;

import mp3tags.Version;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Statische Tabelle der Frame-Kennungen: v2.2-Kennungen (3 Zeichen) zu kanonischen Kennungen (4 Zeichen) und
 * die Inhaltsform jeder kanonischen Kennung.
 */
public final class FrameIds {

    private static final Map<String, String> LEGACY_TO_CANONICAL;
    private static final Map<String, String> CANONICAL_TO_LEGACY;
    private static final Map<String, ContentType> CONTENT_TYPES;

    static {
        Map<String, String> legacy = new HashMap<>();
        String[][] pairs = {
                {"BUF", "RBUF"}, {"CNT", "PCNT"}, {"COM", "COMM"}, {"CRA", "AENC"},
                {"ETC", "ETCO"}, {"EQU", "EQUA"}, {"GEO", "GEOB"}, {"IPL", "IPLS"},
                {"LNK", "LINK"}, {"MCI", "MCDI"}, {"MLL", "MLLT"}, {"PIC", "APIC"},
                {"POP", "POPM"}, {"REV", "RVRB"}, {"RVA", "RVAD"}, {"SLT", "SYLT"},
                {"STC", "SYTC"}, {"TAL", "TALB"}, {"TBP", "TBPM"}, {"TCM", "TCOM"},
                {"TCO", "TCON"}, {"TCR", "TCOP"}, {"TDA", "TDAT"}, {"TDY", "TDLY"},
                {"TEN", "TENC"}, {"TFT", "TFLT"}, {"TIM", "TIME"}, {"TKE", "TKEY"},
                {"TLA", "TLAN"}, {"TLE", "TLEN"}, {"TMT", "TMED"}, {"TOA", "TOPE"},
                {"TOF", "TOFN"}, {"TOL", "TOLY"}, {"TOR", "TORY"}, {"TOT", "TOAL"},
                {"TP1", "TPE1"}, {"TP2", "TPE2"}, {"TP3", "TPE3"}, {"TP4", "TPE4"},
                {"TPA", "TPOS"}, {"TPB", "TPUB"}, {"TRC", "TSRC"}, {"TRD", "TRDA"},
                {"TRK", "TRCK"}, {"TSI", "TSIZ"}, {"TSS", "TSSE"}, {"TT1", "TIT1"},
                {"TT2", "TIT2"}, {"TT3", "TIT3"}, {"TXT", "TEXT"}, {"TXX", "TXXX"},
                {"TYE", "TYER"}, {"UFI", "UFID"}, {"ULT", "USLT"}, {"WAF", "WOAF"},
                {"WAR", "WOAR"}, {"WAS", "WOAS"}, {"WCM", "WCOM"}, {"WCP", "WCOP"},
                {"WPB", "WPUB"}, {"WXX", "WXXX"},
                // iTunes-Erweiterungen
                {"TCP", "TCMP"}, {"TST", "TSOT"}, {"TSP", "TSOP"}, {"TSA", "TSOA"},
                {"TS2", "TSO2"}, {"TSC", "TSOC"}, {"PCS", "PCST"}, {"TDS", "TDES"},
                {"TID", "TGID"}, {"WFD", "WFED"}, {"MVN", "MVNM"}, {"MVI", "MVIN"},
                {"GP1", "GRP1"},
        };
        Map<String, String> canonical = new HashMap<>();
        for (String[] pair : pairs) {
            legacy.put(pair[0], pair[1]);
            canonical.put(pair[1], pair[0]);
        }
        LEGACY_TO_CANONICAL = Collections.unmodifiableMap(legacy);
        CANONICAL_TO_LEGACY = Collections.unmodifiableMap(canonical);

        Map<String, ContentType> types = new HashMap<>();
        types.put("TXXX", ContentType.EXTENDED_TEXT);
        types.put("WXXX", ContentType.EXTENDED_LINK);
        types.put("COMM", ContentType.COMMENT);
        types.put("USLT", ContentType.LYRICS);
        types.put("APIC", ContentType.PICTURE);
        types.put("POPM", ContentType.POPULARIMETER);
        types.put("GEOB", ContentType.ENCAPSULATED_OBJECT);
        types.put("PRIV", ContentType.PRIVATE);
        types.put("UFID", ContentType.UNIQUE_FILE_IDENTIFIER);
        for (String id : new String[] {"TDRC", "TDRL", "TDOR", "TDEN", "TDTG"}) {
            types.put(id, ContentType.TIMESTAMP);
        }
        // Binäre Frames, deren Aufbau hier nicht ausgewertet wird
        for (String id : new String[] {"PCNT", "AENC", "ETCO", "EQUA", "EQU2", "IPLS", "LINK", "MCDI", "MLLT",
                "RBUF", "RVAD", "RVA2", "RVRB", "SYLT", "SYTC", "CHAP", "CTOC", "COMR", "ENCR", "GRID", "OWNE",
                "POSS", "SEEK", "SIGN", "ASPI", "USER"}) {
            types.put(id, ContentType.UNKNOWN);
        }
        CONTENT_TYPES = Collections.unmodifiableMap(types);
    }

    private FrameIds() {}

    /** @return kanonische Kennung, oder {@code null} wenn es keine gibt */
    public static String toCanonical(String legacyId) {
        return LEGACY_TO_CANONICAL.get(legacyId);
    }

    /** @return v2.2-Kennung, oder {@code null} wenn es keine gibt */
    public static String toLegacy(String canonicalId) {
        return CANONICAL_TO_LEGACY.get(canonicalId);
    }

    /** Kennung für die Zielversion, oder {@code null}, wenn der Frame dort nicht darstellbar ist. */
    public static String idForVersion(String id, Version version) {
        if (version == Version.ID3V22) {
            return id.length() == 3 ? id : toLegacy(id);
        }
        return id.length() == 4 ? id : null;
    }

    /** Kennung nach dem Lesen: v2.2-Kennungen werden in die kanonische Form gebracht, soweit möglich. */
    public static String normalize(String id, Version version) {
        if (version != Version.ID3V22) {
            return id;
        }
        String canonical = toCanonical(id);
        return canonical != null ? canonical : id;
    }

    public static ContentType contentType(String id) {
        ContentType type = CONTENT_TYPES.get(id);
        if (type != null) {
            return type;
        }
        if (id.length() == 4 && id.charAt(0) == 'T') {
            return ContentType.TEXT;
        }
        if (id.length() == 4 && id.charAt(0) == 'W') {
            return ContentType.LINK;
        }
        return ContentType.UNKNOWN;
    }

    /** Großbuchstaben und Ziffern, 3 Zeichen in v2.2 und 4 sonst. */
    public static boolean isValid(String id, Version version) {
        if (id.length() != version.frameIdLength()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
                return false;
            }
        }
        return true;
    }
}
