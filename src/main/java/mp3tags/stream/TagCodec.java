package mp3tags.stream;

import mp3tags.Encoder;
import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Tag;
import mp3tags.Version;
import mp3tags.frame.Frame;
import mp3tags.frame.Text;
import mp3tags.frame.Timestamp;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Liest und schreibt ein komplettes ID3v2-Tag: Header, erweiterter Header, Frames, Padding und Footer.
 */
public final class TagCodec {
    private static final Logger LOGGER = Logger.getLogger(TagCodec.class.getName());

    public static final int HEADER_LENGTH = 10;
    public static final int FOOTER_LENGTH = 10;

    static final byte[] MAGIC = "ID3".getBytes(StandardCharsets.ISO_8859_1);
    static final byte[] FOOTER_MAGIC = "3DI".getBytes(StandardCharsets.ISO_8859_1);

    // Header-Flags
    public static final int FLAG_UNSYNCHRONISATION = 0x80;
    public static final int FLAG_EXTENDED_HEADER = 0x40;
    /** v2.2 verwendet Bit 6 für Kompression statt für den erweiterten Header. */
    public static final int FLAG_V22_COMPRESSION = 0x40;
    public static final int FLAG_EXPERIMENTAL = 0x20;
    public static final int FLAG_FOOTER = 0x10;

    private TagCodec() {}

    /** Die festen 10 Bytes am Anfang eines Tags. */
    public record Header(Version version, int revision, int flags, int size) {

        public boolean unsynchronisation() {
            return (flags & FLAG_UNSYNCHRONISATION) != 0;
        }

        public boolean extendedHeader() {
            return version != Version.ID3V22 && (flags & FLAG_EXTENDED_HEADER) != 0;
        }

        public boolean experimental() {
            return (flags & FLAG_EXPERIMENTAL) != 0;
        }

        public boolean footer() {
            return version == Version.ID3V24 && (flags & FLAG_FOOTER) != 0;
        }

        /** Länge des ganzen Tags in der Datei, samt Header und Footer. */
        public long totalLength() {
            return HEADER_LENGTH + (long) size + (footer() ? FOOTER_LENGTH : 0);
        }
    }

    public static boolean hasMagic(byte[] bytes) {
        return bytes.length >= MAGIC.length && Arrays.equals(bytes, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
    }

    public static Header decodeHeader(byte[] bytes) throws Id3Exception {
        if (bytes.length < HEADER_LENGTH || !hasMagic(bytes)) {
            throw new Id3Exception(ErrorKind.NO_TAG, "Kein ID3v2-Tag gefunden");
        }
        int major = bytes[3] & 0xFF;
        int revision = bytes[4] & 0xFF;
        if (revision == 0xFF) {
            throw new Id3Exception(ErrorKind.UNSUPPORTED_VERSION, "Ungültige Revision: 2." + major + ".255");
        }
        Version version = Version.fromMajor(major);
        int flags = bytes[5] & 0xFF;
        int size = Syncsafe.decode(bytes, 6);
        return new Header(version, revision, flags, size);
    }

    /**
     * Liest ein Tag aus {@code bytes}, beginnend mit dem Header.
     *
     * <p>Fehlerhafte Frames werden übersprungen. Gab es welche, fliegt am Ende eine {@link Id3Exception} mit
     * dem Teil-Tag.
     */
    public static Tag decode(byte[] bytes) throws Id3Exception {
        Header header = decodeHeader(bytes);
        Version version = header.version();
        if (version == Version.ID3V22 && (header.flags() & FLAG_V22_COMPRESSION) != 0) {
            throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE, "Komprimierte ID3v2.2-Tags werden nicht unterstützt");
        }
        if (bytes.length < HEADER_LENGTH + header.size()) {
            throw new Id3Exception(ErrorKind.PARSING, String.format(Locale.ROOT,
                    "Tag ist abgeschnitten: %d Bytes angegeben, %d vorhanden",
                    header.size(), bytes.length - HEADER_LENGTH));
        }

        byte[] body = Arrays.copyOfRange(bytes, HEADER_LENGTH, HEADER_LENGTH + header.size());
        if (header.unsynchronisation() && version != Version.ID3V24) {
            body = Unsynchronisation.decode(body);
        }

        Tag tag = new Tag(version);
        int offset = 0;
        if (header.extendedHeader()) {
            byte[] extended = readExtendedHeader(body, version);
            tag.setExtendedHeader(extended);
            offset = extended.length;
        }
        if (header.footer()) {
            checkFooter(bytes, header);
        }

        ByteBuffer frames = ByteBuffer.wrap(body, offset, body.length - offset);
        boolean unsynchronisedFrames = header.unsynchronisation() && version == Version.ID3V24;
        List<Id3Exception> errors = new ArrayList<>();
        while (true) {
            Frame frame;
            try {
                frame = FrameCodec.decode(frames, version, unsynchronisedFrames);
            } catch (Id3Exception e) {
                LOGGER.warning(() -> "Frame übersprungen: " + e.getMessage());
                errors.add(e);
                continue;
            }
            if (frame == null) {
                break;
            }
            tag.addFrame(frame);
        }
        if (!errors.isEmpty()) {
            throw Id3Exception.partial(tag, errors);
        }
        return tag;
    }

    private static byte[] readExtendedHeader(byte[] body, Version version) throws Id3Exception {
        if (body.length < 4) {
            throw new Id3Exception(ErrorKind.PARSING, "Erweiterter Header ist abgeschnitten");
        }
        long length;
        if (version == Version.ID3V23) {
            // Größe ohne die 4 Bytes des Größenfelds
            length = (ByteBuffer.wrap(body, 0, 4).getInt() & 0xFFFFFFFFL) + 4;
        } else {
            length = Syncsafe.decode(body, 0);
        }
        if (length < 4 || length > body.length) {
            throw new Id3Exception(ErrorKind.PARSING, "Ungültige Größe des erweiterten Headers: " + length);
        }
        return Arrays.copyOfRange(body, 0, (int) length);
    }

    private static void checkFooter(byte[] bytes, Header header) {
        int at = HEADER_LENGTH + header.size();
        if (bytes.length < at + FOOTER_LENGTH
                || !Arrays.equals(bytes, at, at + FOOTER_MAGIC.length, FOOTER_MAGIC, 0, FOOTER_MAGIC.length)) {
            LOGGER.warning("Footer-Flag gesetzt, aber kein gültiger Footer gefunden; wird ignoriert");
        }
    }

    /** Schreibt das Tag mit den Einstellungen des Encoders. Jeder Fehler bricht ab. */
    public static byte[] encode(Tag tag, Encoder encoder) throws Id3Exception {
        Version version = encoder.getVersion();
        boolean footer = encoder.isFooter() && version == Version.ID3V24;
        int padding = footer ? 0 : encoder.getPadding();

        ByteArrayOutputStream frames = new ByteArrayOutputStream();
        for (Frame frame : framesFor(tag, version, encoder.isFileAltered())) {
            frames.writeBytes(FrameCodec.encode(frame, version,
                    encoder.isUnsynchronisation() && version == Version.ID3V24, encoder.isCompression()));
        }
        byte[] data = frames.toByteArray();

        int flags = 0;
        if (encoder.isUnsynchronisation()) {
            if (version == Version.ID3V24) {
                flags |= FLAG_UNSYNCHRONISATION;
            } else if (Unsynchronisation.isRequired(data, version)) {
                data = Unsynchronisation.encode(data, version);
                flags |= FLAG_UNSYNCHRONISATION;
            }
        }
        if (footer) {
            flags |= FLAG_FOOTER;
        }

        long size = (long) data.length + padding;
        if (size > Syncsafe.MAX_VALUE) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT, "Tag ist zu groß: " + size + " Bytes");
        }
        byte[] header = new byte[HEADER_LENGTH];
        System.arraycopy(MAGIC, 0, header, 0, MAGIC.length);
        header[3] = (byte) version.major();
        header[4] = 0;
        header[5] = (byte) flags;
        Syncsafe.encodeInto((int) size, header, 6);

        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_LENGTH + (int) size + FOOTER_LENGTH);
        out.writeBytes(header);
        out.writeBytes(data);
        out.writeBytes(new byte[padding]);
        if (footer) {
            System.arraycopy(FOOTER_MAGIC, 0, header, 0, FOOTER_MAGIC.length);
            out.writeBytes(header);
        }
        return out.toByteArray();
    }

    /**
     * Frames in der Form, die die Zielversion kennt: Zeitstempel werden für v2.2/v2.3 auf {@code TYER},
     * {@code TDAT}, {@code TIME} und {@code TORY} verteilt und für v2.4 wieder zusammengesetzt.
     */
    static List<Frame> framesFor(Tag tag, Version version, boolean fileAltered) throws Id3Exception {
        Tag target = new Tag(version);
        // Ein vorhandenes TDRC/TDOR ersetzt die alten Datumsframes vollständig.
        boolean recorded = tag.get("TDRC") != null;
        boolean original = tag.get("TDOR") != null;
        for (Frame frame : tag.frames()) {
            if (fileAltered && frame.flags().fileAlterPreservation()) {
                continue;
            }
            if (version == Version.ID3V24) {
                target.addFrame(frame);
                continue;
            }
            switch (frame.id()) {
                case "TDRC": {
                    Timestamp timestamp = timestampOf(frame);
                    target.addFrame(Frame.text("TYER", String.format(Locale.ROOT, "%04d", timestamp.year())));
                    if (timestamp.legacyDate() != null) {
                        target.addFrame(Frame.text("TDAT", timestamp.legacyDate()));
                    }
                    if (timestamp.legacyTime() != null) {
                        target.addFrame(Frame.text("TIME", timestamp.legacyTime()));
                    }
                    break;
                }
                case "TYER":
                case "TDAT":
                case "TIME":
                    if (!recorded) {
                        target.addFrame(frame);
                    }
                    break;
                case "TORY":
                    if (!original) {
                        target.addFrame(frame);
                    }
                    break;
                case "TDOR":
                    target.addFrame(Frame.text("TORY", String.format(Locale.ROOT, "%04d", timestampOf(frame).year())));
                    break;
                case "TDRL":
                case "TDEN":
                case "TDTG":
                    throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE,
                            "Frame " + frame.id() + " gibt es erst ab ID3v2.4");
                default:
                    target.addFrame(frame);
                    break;
            }
        }
        if (version == Version.ID3V24) {
            upgradeLegacyDates(target);
        }
        return target.frames();
    }

    private static Timestamp timestampOf(Frame frame) throws Id3Exception {
        if (frame.content() instanceof Timestamp) {
            return (Timestamp) frame.content();
        }
        if (frame.content() instanceof Text) {
            return Timestamp.parse(((Text) frame.content()).first());
        }
        throw new Id3Exception(ErrorKind.INVALID_INPUT, "Frame " + frame.id() + " enthält keinen Zeitstempel");
    }

    private static void upgradeLegacyDates(Tag tag) {
        if (tag.get("TDRC") == null) {
            Timestamp recorded = Timestamp.fromLegacy(textOf(tag, "TYER"), textOf(tag, "TDAT"), textOf(tag, "TIME"));
            if (recorded != null) {
                tag.addFrame(Frame.of("TDRC", recorded));
            }
        }
        if (tag.get("TDRC") != null) {
            tag.removeFrames("TYER");
            tag.removeFrames("TDAT");
            tag.removeFrames("TIME");
        }
        if (tag.get("TDOR") == null) {
            Timestamp original = Timestamp.fromLegacy(textOf(tag, "TORY"), null, null);
            if (original != null) {
                tag.addFrame(Frame.of("TDOR", original));
            }
        }
        if (tag.get("TDOR") != null) {
            tag.removeFrames("TORY");
        }
    }

    private static String textOf(Tag tag, String id) {
        Frame frame = tag.get(id);
        return frame == null ? null : frame.textValue();
    }
}
