package mp3tags.frame;

import org.jaudiotagger.tag.reference.GenreTypes;

import java.util.ArrayList;
import java.util.List;

/**
 * Genre-Nummern aus ID3v1 und deren Verweise in {@code TCON}. Die Tabelle selbst kommt aus jaudiotagger.
 */
public final class Genres {

    private Genres() {}

    /** @return Name zum Genre-Code, oder {@code null} für unbekannte Codes */
    public static String nameOf(int code) {
        if (code < 0 || code > 0xFF) {
            return null;
        }
        return GenreTypes.getInstanceOf().getValueForId(code);
    }

    /** @return Code zum Genre-Namen, oder {@code null} wenn der Name nicht in der Tabelle steht */
    public static Integer codeOf(String name) {
        return GenreTypes.getInstanceOf().getIdForValue(name);
    }

    /**
     * Löst den Inhalt von {@code TCON} auf: {@code "(31)"} und {@code "31"} werden zu {@code "Trance"},
     * {@code "(RX)"} zu {@code "Remix"}, {@code "(CR)"} zu {@code "Cover"}. Text nach einem Verweis verfeinert
     * ihn und ersetzt den Namen, {@code "(("} leitet eine echte Klammer ein.
     */
    public static List<String> parse(String tcon) {
        List<String> genres = new ArrayList<>();
        String rest = tcon.trim();
        if (isNumber(rest)) {
            genres.add(resolveCode(rest));
            return genres;
        }
        while (rest.startsWith("(")) {
            if (rest.startsWith("((")) {
                genres.add(rest.substring(1));
                return genres;
            }
            int close = rest.indexOf(')');
            if (close < 0) {
                break;
            }
            genres.add(resolveCode(rest.substring(1, close)));
            rest = rest.substring(close + 1);
            if (!rest.isEmpty() && !rest.startsWith("(")) {
                // Verfeinerung ersetzt den Verweis davor
                genres.set(genres.size() - 1, rest);
                rest = "";
            }
        }
        if (!rest.isEmpty()) {
            genres.add(rest);
        }
        return genres;
    }

    private static String resolveCode(String code) {
        if ("RX".equals(code)) {
            return "Remix";
        }
        if ("CR".equals(code)) {
            return "Cover";
        }
        if (isNumber(code)) {
            String name = nameOf(Integer.parseInt(code));
            if (name != null) {
                return name;
            }
        }
        return code;
    }

    private static boolean isNumber(String s) {
        if (s.isEmpty() || s.length() > 3) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) < '0' || s.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }
}
