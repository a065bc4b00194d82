package mp3tags.frame;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zeitpunkt nach ISO-8601 mit beliebiger Genauigkeit, z.B. {@code 2024}, {@code 2024-05} oder
 * {@code 2024-05-17T20:15}. Fehlende Teile sind {@code null}, nicht 0.
 */
public record Timestamp(int year, Integer month, Integer day, Integer hour, Integer minute, Integer second)
        implements Content {

    private static final Pattern ISO = Pattern.compile(
            "(\\d{4})(?:-(\\d{2})(?:-(\\d{2})(?:T(\\d{2})(?::(\\d{2})(?::(\\d{2}))?)?)?)?)?");
    private static final Pattern DIGITS_4 = Pattern.compile("\\d{4}");

    public Timestamp {
        if (year < 0 || year > 9999) {
            throw new IllegalArgumentException("Jahr außerhalb 0..9999: " + year);
        }
        checkChain(month, day, "Tag ohne Monat");
        checkChain(day, hour, "Stunde ohne Tag");
        checkChain(hour, minute, "Minute ohne Stunde");
        checkChain(minute, second, "Sekunde ohne Minute");
        checkRange(month, 1, 12, "Monat");
        checkRange(day, 1, 31, "Tag");
        checkRange(hour, 0, 23, "Stunde");
        checkRange(minute, 0, 59, "Minute");
        checkRange(second, 0, 59, "Sekunde");
    }

    public static Timestamp ofYear(int year) {
        return new Timestamp(year, null, null, null, null, null);
    }

    public static Timestamp ofDate(int year, int month, int day) {
        return new Timestamp(year, month, day, null, null, null);
    }

    public static Timestamp parse(String text) throws Id3Exception {
        Matcher m = ISO.matcher(text.trim());
        if (!m.matches()) {
            throw new Id3Exception(ErrorKind.PARSING, "Ungültiger Zeitstempel: " + text);
        }
        try {
            return new Timestamp(Integer.parseInt(m.group(1)), group(m, 2), group(m, 3),
                    group(m, 4), group(m, 5), group(m, 6));
        } catch (IllegalArgumentException e) {
            throw new Id3Exception(ErrorKind.PARSING, "Ungültiger Zeitstempel: " + text, e);
        }
    }

    /**
     * Setzt einen Zeitpunkt aus den v2.3-Frames {@code TYER} ({@code yyyy}), {@code TDAT} ({@code DDMM}) und
     * {@code TIME} ({@code HHMM}) zusammen.
     *
     * @return {@code null}, wenn das Jahr fehlt oder ungültig ist
     */
    public static Timestamp fromLegacy(String tyer, String tdat, String time) {
        if (tyer == null || !DIGITS_4.matcher(tyer.trim()).matches()) {
            return null;
        }
        int year = Integer.parseInt(tyer.trim());
        try {
            if (tdat == null || !DIGITS_4.matcher(tdat.trim()).matches()) {
                return ofYear(year);
            }
            int day = Integer.parseInt(tdat.trim().substring(0, 2));
            int month = Integer.parseInt(tdat.trim().substring(2, 4));
            if (time == null || !DIGITS_4.matcher(time.trim()).matches()) {
                return ofDate(year, month, day);
            }
            int hour = Integer.parseInt(time.trim().substring(0, 2));
            int minute = Integer.parseInt(time.trim().substring(2, 4));
            return new Timestamp(year, month, day, hour, minute, null);
        } catch (IllegalArgumentException e) {
            return ofYear(year);
        }
    }

    /** Inhalt für {@code TDAT} ({@code DDMM}), oder {@code null} ohne Tag. */
    public String legacyDate() {
        return day == null ? null : String.format(Locale.ROOT, "%02d%02d", day, month);
    }

    /** Inhalt für {@code TIME} ({@code HHMM}), oder {@code null} ohne Minute. */
    public String legacyTime() {
        return minute == null ? null : String.format(Locale.ROOT, "%02d%02d", hour, minute);
    }

    @Override
    public ContentType type() {
        return ContentType.TIMESTAMP;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "%04d", year));
        if (month != null) sb.append(String.format(Locale.ROOT, "-%02d", month));
        if (day != null) sb.append(String.format(Locale.ROOT, "-%02d", day));
        if (hour != null) sb.append(String.format(Locale.ROOT, "T%02d", hour));
        if (minute != null) sb.append(String.format(Locale.ROOT, ":%02d", minute));
        if (second != null) sb.append(String.format(Locale.ROOT, ":%02d", second));
        return sb.toString();
    }

    private static Integer group(Matcher m, int index) {
        String g = m.group(index);
        return g == null ? null : Integer.valueOf(g);
    }

    private static void checkChain(Integer outer, Integer inner, String message) {
        if (outer == null && inner != null) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void checkRange(Integer value, int min, int max, String name) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(name + " außerhalb " + min + ".." + max + ": " + value);
        }
    }
}
