package mp3tags;

import mp3tags.frame.Comment;
import mp3tags.frame.ExtendedLink;
import mp3tags.frame.ExtendedText;
import mp3tags.frame.Frame;
import mp3tags.frame.Genres;
import mp3tags.frame.Lyrics;
import mp3tags.frame.Picture;
import mp3tags.frame.Popularimeter;
import mp3tags.frame.Text;
import mp3tags.frame.Timestamp;
import mp3tags.storage.FileStorage;
import mp3tags.storage.TagRegion;
import mp3tags.stream.TagCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Ein ID3v2-Tag: die Frames in Dateireihenfolge und die Version, in der es gelesen wurde.
 *
 * <pre>
 * Tag tag = Tag.readFrom(path);
 * tag.setArtist("High Contrast");
 * tag.writeTo(path, Version.ID3V24);
 * </pre>
 */
public class Tag {

    private final Version version;
    private final List<Frame> frames = new ArrayList<>();
    private byte[] extendedHeader;

    public Tag() {
        this(Version.ID3V24);
    }

    public Tag(Version version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    public Version version() {
        return version;
    }

    /** Rohbytes des erweiterten Headers, falls das gelesene Tag einen hatte. Er wird nicht zurückgeschrieben. */
    public byte[] extendedHeader() {
        return extendedHeader == null ? null : extendedHeader.clone();
    }

    public void setExtendedHeader(byte[] value) {
        this.extendedHeader = value == null ? null : value.clone();
    }

    // Frames

    /**
     * Fügt einen Frame hinzu. Gibt es schon einen Frame mit gleichem Schlüssel ({@link Frame#uniquenessKey()}),
     * wird er an seiner Stelle ersetzt.
     *
     * @return der ersetzte Frame, oder {@code null}
     */
    public Frame addFrame(Frame frame) {
        Objects.requireNonNull(frame, "frame");
        String key = frame.uniquenessKey();
        if (key != null) {
            for (int i = 0; i < frames.size(); i++) {
                if (key.equals(frames.get(i).uniquenessKey())) {
                    return frames.set(i, frame);
                }
            }
        }
        frames.add(frame);
        return null;
    }

    public List<Frame> frames() {
        return Collections.unmodifiableList(new ArrayList<>(frames));
    }

    /** Erster Frame mit dieser Kennung. */
    public Frame get(String id) {
        for (Frame frame : frames) {
            if (frame.id().equals(id)) {
                return frame;
            }
        }
        return null;
    }

    public List<Frame> getAll(String id) {
        List<Frame> result = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.id().equals(id)) {
                result.add(frame);
            }
        }
        return result;
    }

    /** @return Anzahl entfernter Frames */
    public int removeFrames(String id) {
        return removeFramesIf(frame -> frame.id().equals(id));
    }

    public int removeFramesIf(Predicate<Frame> filter) {
        int before = frames.size();
        frames.removeIf(filter);
        return before - frames.size();
    }

    public int frameCount() {
        return frames.size();
    }

    // Text-Frames

    public String text(String id) {
        Frame frame = get(id);
        return frame == null ? null : frame.textValue();
    }

    public void setText(String id, String value) {
        addFrame(Frame.text(id, value));
    }

    public String title() {
        return text("TIT2");
    }

    public void setTitle(String value) {
        setText("TIT2", value);
    }

    public void removeTitle() {
        removeFrames("TIT2");
    }

    public String artist() {
        return text("TPE1");
    }

    public void setArtist(String value) {
        setText("TPE1", value);
    }

    public void removeArtist() {
        removeFrames("TPE1");
    }

    public String albumArtist() {
        return text("TPE2");
    }

    public void setAlbumArtist(String value) {
        setText("TPE2", value);
    }

    public void removeAlbumArtist() {
        removeFrames("TPE2");
    }

    public String album() {
        return text("TALB");
    }

    public void setAlbum(String value) {
        setText("TALB", value);
    }

    public void removeAlbum() {
        removeFrames("TALB");
    }

    /** Inhalt von {@code TCON} wie gespeichert, z.B. {@code "(31)"}. */
    public String genre() {
        return text("TCON");
    }

    /** Erstes Genre mit aufgelösten Verweisen, z.B. {@code "Trance"} für {@code "(31)"}. */
    public String genreParsed() {
        List<String> genres = genres();
        return genres.isEmpty() ? null : genres.get(0);
    }

    public List<String> genres() {
        Frame frame = get("TCON");
        if (frame == null || !(frame.content() instanceof Text)) {
            return Collections.emptyList();
        }
        List<String> genres = new ArrayList<>();
        for (String value : ((Text) frame.content()).values()) {
            genres.addAll(Genres.parse(value));
        }
        return genres;
    }

    public void setGenre(String value) {
        setText("TCON", value);
    }

    public void removeGenre() {
        removeFrames("TCON");
    }

    // Nummern

    public Integer track() {
        return pairPart(text("TRCK"), 0);
    }

    public Integer totalTracks() {
        return pairPart(text("TRCK"), 1);
    }

    public void setTrack(int track) {
        setPair("TRCK", track, totalTracks());
    }

    public void setTotalTracks(int total) {
        setPair("TRCK", track(), total);
    }

    public void removeTrack() {
        removeFrames("TRCK");
    }

    public Integer disc() {
        return pairPart(text("TPOS"), 0);
    }

    public Integer totalDiscs() {
        return pairPart(text("TPOS"), 1);
    }

    public void setDisc(int disc) {
        setPair("TPOS", disc, totalDiscs());
    }

    public void setTotalDiscs(int total) {
        setPair("TPOS", disc(), total);
    }

    public void removeDisc() {
        removeFrames("TPOS");
    }

    /** Dauer in Millisekunden aus {@code TLEN}. */
    public Long duration() {
        String value = text("TLEN");
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public void setDuration(long millis) {
        setText("TLEN", Long.toString(millis));
    }

    public void removeDuration() {
        removeFrames("TLEN");
    }

    // Datumsangaben

    /** {@code TDRC}, bei v2.3-Tags aus {@code TYER}, {@code TDAT} und {@code TIME} zusammengesetzt. */
    public Timestamp dateRecorded() {
        Timestamp timestamp = timestamp("TDRC");
        if (timestamp != null) {
            return timestamp;
        }
        return Timestamp.fromLegacy(text("TYER"), text("TDAT"), text("TIME"));
    }

    /** Ersetzt auch {@code TYER}, {@code TDAT} und {@code TIME}. */
    public void setDateRecorded(Timestamp value) {
        removeFrames("TYER");
        removeFrames("TDAT");
        removeFrames("TIME");
        addFrame(Frame.of("TDRC", value));
    }

    public void removeDateRecorded() {
        removeFrames("TDRC");
        removeFrames("TYER");
        removeFrames("TDAT");
        removeFrames("TIME");
    }

    public Timestamp dateReleased() {
        return timestamp("TDRL");
    }

    public void setDateReleased(Timestamp value) {
        addFrame(Frame.of("TDRL", value));
    }

    public void removeDateReleased() {
        removeFrames("TDRL");
    }

    public Timestamp originalDateReleased() {
        Timestamp timestamp = timestamp("TDOR");
        return timestamp != null ? timestamp : Timestamp.fromLegacy(text("TORY"), null, null);
    }

    public void setOriginalDateReleased(Timestamp value) {
        removeFrames("TORY");
        addFrame(Frame.of("TDOR", value));
    }

    public void removeOriginalDateReleased() {
        removeFrames("TDOR");
        removeFrames("TORY");
    }

    /** Jahr aus dem Aufnahmedatum. */
    public Integer year() {
        Timestamp recorded = dateRecorded();
        return recorded == null ? null : recorded.year();
    }

    public void setYear(int year) {
        setDateRecorded(Timestamp.ofYear(year));
    }

    public void removeYear() {
        removeDateRecorded();
    }

    // Frames mit mehreren Einträgen

    public List<Comment> comments() {
        return contents("COMM", Comment.class);
    }

    public void addComment(Comment comment) {
        addFrame(Frame.of("COMM", comment));
    }

    /** Entfernt Kommentare mit passender Beschreibung und, falls angegeben, passendem Text. */
    public int removeComment(String description, String text) {
        return removeFramesIf(frame -> frame.content() instanceof Comment
                && (description == null || description.equals(((Comment) frame.content()).description()))
                && (text == null || text.equals(((Comment) frame.content()).text())));
    }

    public List<Lyrics> lyrics() {
        return contents("USLT", Lyrics.class);
    }

    public void addLyrics(Lyrics lyrics) {
        addFrame(Frame.of("USLT", lyrics));
    }

    public void removeAllLyrics() {
        removeFrames("USLT");
    }

    public List<Picture> pictures() {
        return contents("APIC", Picture.class);
    }

    public void addPicture(Picture picture) {
        addFrame(Frame.of("APIC", picture));
    }

    public int removePicture(int pictureType) {
        return removeFramesIf(frame -> frame.content() instanceof Picture
                && ((Picture) frame.content()).pictureType() == pictureType);
    }

    public void removeAllPictures() {
        removeFrames("APIC");
    }

    public List<ExtendedText> extendedTexts() {
        return contents("TXXX", ExtendedText.class);
    }

    public void addExtendedText(String description, String value) {
        addFrame(Frame.of("TXXX", new ExtendedText(description, value)));
    }

    public int removeExtendedText(String description) {
        return removeFramesIf(frame -> frame.content() instanceof ExtendedText
                && ((ExtendedText) frame.content()).description().equals(description));
    }

    public List<ExtendedLink> extendedLinks() {
        return contents("WXXX", ExtendedLink.class);
    }

    public void addExtendedLink(String description, String link) {
        addFrame(Frame.of("WXXX", new ExtendedLink(description, link)));
    }

    public int removeExtendedLink(String description) {
        return removeFramesIf(frame -> frame.content() instanceof ExtendedLink
                && ((ExtendedLink) frame.content()).description().equals(description));
    }

    /** Erste Bewertung im Tag. */
    public Popularimeter popularimeter() {
        List<Popularimeter> ratings = contents("POPM", Popularimeter.class);
        return ratings.isEmpty() ? null : ratings.get(0);
    }

    public void setPopularimeter(Popularimeter value) {
        addFrame(Frame.of("POPM", value));
    }

    public void removePopularimeter() {
        removeFrames("POPM");
    }

    // Lesen und Schreiben

    public static Tag readFrom(Path path) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return readFrom(channel);
        } catch (IOException e) {
            throw Id3Exception.io("Lesen von " + path + " fehlgeschlagen", e);
        }
    }

    public static Tag readFrom(SeekableByteChannel channel) throws Id3Exception {
        FileStorage storage = new FileStorage(channel);
        TagRegion region = storage.locate();
        if (region == null) {
            throw new Id3Exception(ErrorKind.NO_TAG, "Kein ID3v2-Tag gefunden");
        }
        return TagCodec.decode(storage.read(region));
    }

    /** Liest das Tag am Anfang des Streams. Der Stream steht danach hinter dem Tag. */
    public static Tag readFrom(InputStream in) throws Id3Exception {
        try {
            byte[] header = in.readNBytes(TagCodec.HEADER_LENGTH);
            TagCodec.Header parsed = TagCodec.decodeHeader(header);
            int rest = (int) (parsed.totalLength() - TagCodec.HEADER_LENGTH);
            byte[] body = in.readNBytes(rest);
            if (body.length < rest) {
                throw new Id3Exception(ErrorKind.PARSING,
                        "Stream endet nach " + body.length + " von " + rest + " Bytes des Tags");
            }
            byte[] bytes = new byte[header.length + body.length];
            System.arraycopy(header, 0, bytes, 0, header.length);
            System.arraycopy(body, 0, bytes, header.length, body.length);
            return TagCodec.decode(bytes);
        } catch (IOException e) {
            throw Id3Exception.io("Lesen aus dem Stream fehlgeschlagen", e);
        }
    }

    public static Tag readFrom(byte[] bytes) throws Id3Exception {
        return TagCodec.decode(bytes);
    }

    /** Prüft nur, ob die Datei mit {@code ID3} beginnt. */
    public static boolean isCandidate(Path path) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return isCandidate(channel);
        } catch (IOException e) {
            throw Id3Exception.io("Lesen von " + path + " fehlgeschlagen", e);
        }
    }

    public static boolean isCandidate(SeekableByteChannel channel) throws Id3Exception {
        return new FileStorage(channel).hasMagic();
    }

    /** @return {@code true}, wenn ein Tag entfernt wurde */
    public static boolean removeFrom(Path path) throws Id3Exception {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            return removeFrom(channel);
        } catch (IOException e) {
            throw Id3Exception.io("Entfernen aus " + path + " fehlgeschlagen", e);
        }
    }

    public static boolean removeFrom(SeekableByteChannel channel) throws Id3Exception {
        FileStorage storage = new FileStorage(channel);
        TagRegion region = storage.locate();
        if (region == null) {
            return false;
        }
        storage.remove(region);
        return true;
    }

    public void writeTo(Path path, Version target) throws Id3Exception {
        new Encoder().version(target).writeTo(path, this);
    }

    public void writeTo(SeekableByteChannel channel, Version target) throws Id3Exception {
        new Encoder().version(target).writeTo(channel, this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append("Version: ").append(version).append('\n')
                .append("Frames: ").append(frames.size()).append('\n');
        for (Frame frame : frames) {
            Object value = frame.content() instanceof Text ? ((Text) frame.content()).joined(" / ") : frame.content();
            sb.append(frame.id()).append(": ").append(value).append('\n');
        }
        return sb.toString();
    }

    private Timestamp timestamp(String id) {
        Frame frame = get(id);
        if (frame == null) {
            return null;
        }
        if (frame.content() instanceof Timestamp) {
            return (Timestamp) frame.content();
        }
        if (frame.content() instanceof Text) {
            try {
                return Timestamp.parse(((Text) frame.content()).first());
            } catch (Id3Exception e) {
                return null;
            }
        }
        return null;
    }

    private <T> List<T> contents(String id, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.id().equals(id) && type.isInstance(frame.content())) {
                result.add(type.cast(frame.content()));
            }
        }
        return result;
    }

    private void setPair(String id, Integer first, Integer second) {
        StringBuilder value = new StringBuilder();
        if (first != null) {
            value.append(first);
        }
        if (second != null) {
            value.append('/').append(second);
        }
        setText(id, value.toString());
    }

    private static Integer pairPart(String value, int index) {
        if (value == null) {
            return null;
        }
        String[] parts = value.split("/", -1);
        if (index >= parts.length) {
            return null;
        }
        try {
            return Integer.parseInt(parts[index].trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
