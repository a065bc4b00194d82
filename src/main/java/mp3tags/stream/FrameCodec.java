package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Version;
import mp3tags.frame.Frame;
import mp3tags.frame.FrameFlags;
import mp3tags.frame.FrameIds;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Frame-Header und Flags für v2.2, v2.3 und v2.4.
 *
 * <pre>
 * v2.2: Kennung(3) Größe(3, Big Endian)
 * v2.3: Kennung(4) Größe(4, Big Endian) Flags(2)
 * v2.4: Kennung(4) Größe(4, Syncsafe)   Flags(2)
 * </pre>
 */
public final class FrameCodec {

    // v2.3
    private static final int V23_TAG_ALTER = 0x8000;
    private static final int V23_FILE_ALTER = 0x4000;
    private static final int V23_READ_ONLY = 0x2000;
    private static final int V23_COMPRESSION = 0x0080;
    private static final int V23_ENCRYPTION = 0x0040;
    private static final int V23_GROUPING = 0x0020;

    // v2.4
    private static final int V24_TAG_ALTER = 0x4000;
    private static final int V24_FILE_ALTER = 0x2000;
    private static final int V24_READ_ONLY = 0x1000;
    private static final int V24_GROUPING = 0x0040;
    private static final int V24_COMPRESSION = 0x0008;
    private static final int V24_ENCRYPTION = 0x0004;
    private static final int V24_UNSYNCHRONISATION = 0x0002;
    private static final int V24_DATA_LENGTH_INDICATOR = 0x0001;

    private static final int INFLATE_BUFFER = 8192;

    private FrameCodec() {}

    /**
     * Liest den nächsten Frame ab der aktuellen Position.
     *
     * <p>Der Frame ist beim Werfen bereits verbraucht, sodass der Aufrufer mit dem nächsten Frame weitermachen
     * kann. Passt die angegebene Größe nicht mehr in den Puffer, steht die Position danach am Ende.
     *
     * @param unsynchronisedTag v2.4: das Tag-Flag markiert jeden Frame als unsynchronisiert
     * @return der Frame, oder {@code null} wenn Padding oder das Ende erreicht ist
     */
    public static Frame decode(ByteBuffer in, Version version, boolean unsynchronisedTag) throws Id3Exception {
        int headerLength = version.frameHeaderLength();
        if (in.remaining() < headerLength || in.get(in.position()) == 0) {
            return null;
        }
        byte[] idBytes = new byte[version.frameIdLength()];
        in.get(idBytes);
        String rawId = new String(idBytes, StandardCharsets.ISO_8859_1);

        long size;
        int flagBits = 0;
        switch (version) {
            case ID3V22:
                size = ((in.get() & 0xFF) << 16) | ((in.get() & 0xFF) << 8) | (in.get() & 0xFF);
                break;
            case ID3V23:
                size = in.getInt() & 0xFFFFFFFFL;
                flagBits = in.getShort() & 0xFFFF;
                break;
            default:
                byte[] sizeBytes = new byte[4];
                in.get(sizeBytes);
                try {
                    size = Syncsafe.decode(sizeBytes, 0);
                } catch (Id3Exception e) {
                    in.position(in.limit());
                    throw new Id3Exception(ErrorKind.PARSING, "Frame " + rawId + ": " + e.getMessage(), e);
                }
                flagBits = in.getShort() & 0xFFFF;
                break;
        }
        if (size > in.remaining()) {
            int remaining = in.remaining();
            in.position(in.limit());
            throw new Id3Exception(ErrorKind.PARSING,
                    "Frame " + rawId + ": Größe " + size + " übersteigt die verbleibenden " + remaining + " Bytes");
        }
        byte[] data = new byte[(int) size];
        in.get(data);

        if (!FrameIds.isValid(rawId, version)) {
            throw new Id3Exception(ErrorKind.PARSING, "Ungültige Frame-Kennung: " + rawId);
        }
        FrameFlags flags = decodeFlags(flagBits, version);
        if (version == Version.ID3V24 && (flags.unsynchronisation() || unsynchronisedTag)) {
            data = Unsynchronisation.decode(data);
        }

        int pos = 0;
        long expectedLength = -1;
        Integer group = null;
        try {
            if (version == Version.ID3V23) {
                if (flags.compression()) {
                    expectedLength = ByteBuffer.wrap(data, pos, 4).getInt() & 0xFFFFFFFFL;
                    pos += 4;
                }
                if (flags.encryption()) {
                    pos++;
                }
                if (flagBits != 0 && (flagBits & V23_GROUPING) != 0) {
                    group = data[pos++] & 0xFF;
                }
            } else if (version == Version.ID3V24) {
                if ((flagBits & V24_GROUPING) != 0) {
                    group = data[pos++] & 0xFF;
                }
                if (flags.encryption()) {
                    pos++;
                }
                if (flags.dataLengthIndicator()) {
                    expectedLength = Syncsafe.decode(data, pos);
                    pos += 4;
                }
            }
        } catch (IndexOutOfBoundsException e) {
            throw new Id3Exception(ErrorKind.PARSING, "Frame " + rawId + ": Zusatzdaten des Headers abgeschnitten", e);
        }
        flags = flags.withGroupingIdentifier(group);

        if (flags.encryption()) {
            throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE, "Frame " + rawId + " ist verschlüsselt");
        }
        byte[] body = Arrays.copyOfRange(data, pos, data.length);
        if (flags.compression()) {
            body = inflate(rawId, body, expectedLength);
        }

        String id = FrameIds.normalize(rawId, version);
        ContentCodec.Decoded decoded = ContentCodec.decode(id, version, body);
        return new Frame(id, decoded.content(), flags, decoded.encoding());
    }

    /**
     * Schreibt einen Frame samt Header.
     *
     * @param unsynchronisation v2.4: Unsynchronisation pro Frame anwenden (v2.2/v2.3 machen das für das ganze Tag)
     * @param compression alle Frames komprimieren, nicht nur die mit gesetztem Flag (ab v2.3)
     */
    public static byte[] encode(Frame frame, Version version, boolean unsynchronisation, boolean compression)
            throws Id3Exception {
        String id = FrameIds.idForVersion(frame.id(), version);
        if (id == null) {
            throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE,
                    "Frame " + frame.id() + " lässt sich in " + version + " nicht darstellen");
        }
        if (!FrameIds.isValid(id, version)) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT, "Ungültige Frame-Kennung: " + id);
        }
        FrameFlags flags = frame.flags();
        if (flags.encryption()) {
            throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE,
                    "Frame " + frame.id() + " soll verschlüsselt werden, das wird nicht unterstützt");
        }
        byte[] body = ContentCodec.encode(frame.id(), frame.content(), frame.encoding(), version);
        byte[] idBytes = id.getBytes(StandardCharsets.ISO_8859_1);

        switch (version) {
            case ID3V22: {
                if (body.length > 0xFFFFFF) {
                    throw new Id3Exception(ErrorKind.INVALID_INPUT, "Frame " + id + " ist zu groß für ID3v2.2");
                }
                ByteBuffer out = ByteBuffer.allocate(6 + body.length);
                out.put(idBytes);
                out.put((byte) (body.length >> 16)).put((byte) (body.length >> 8)).put((byte) body.length);
                out.put(body);
                return out.array();
            }
            case ID3V23: {
                boolean compress = flags.compression() || compression;
                ByteArrayOutputStream data = new ByteArrayOutputStream();
                int bits = statusBits(flags, V23_TAG_ALTER, V23_FILE_ALTER, V23_READ_ONLY);
                if (compress) {
                    bits |= V23_COMPRESSION;
                    data.writeBytes(ByteBuffer.allocate(4).putInt(body.length).array());
                }
                if (flags.groupingIdentifier() != null) {
                    bits |= V23_GROUPING;
                    data.write(flags.groupingIdentifier());
                }
                data.writeBytes(compress ? deflate(body) : body);
                return header(idBytes, ByteBuffer.allocate(4).putInt(data.size()).array(), bits, data.toByteArray());
            }
            default: {
                boolean compress = flags.compression() || compression;
                boolean unsync = flags.unsynchronisation() || unsynchronisation;
                boolean dataLength = compress || flags.dataLengthIndicator();
                ByteArrayOutputStream data = new ByteArrayOutputStream();
                int bits = statusBits(flags, V24_TAG_ALTER, V24_FILE_ALTER, V24_READ_ONLY);
                if (flags.groupingIdentifier() != null) {
                    bits |= V24_GROUPING;
                    data.write(flags.groupingIdentifier());
                }
                if (dataLength) {
                    bits |= V24_DATA_LENGTH_INDICATOR;
                    data.writeBytes(Syncsafe.encode(body.length));
                }
                if (compress) {
                    bits |= V24_COMPRESSION;
                }
                data.writeBytes(compress ? deflate(body) : body);
                byte[] payload = data.toByteArray();
                if (unsync) {
                    bits |= V24_UNSYNCHRONISATION;
                    payload = Unsynchronisation.encode(payload, Version.ID3V24);
                }
                return header(idBytes, Syncsafe.encode(payload.length), bits, payload);
            }
        }
    }

    private static FrameFlags decodeFlags(int bits, Version version) {
        switch (version) {
            case ID3V23:
                return new FrameFlags(
                        (bits & V23_TAG_ALTER) != 0,
                        (bits & V23_FILE_ALTER) != 0,
                        (bits & V23_READ_ONLY) != 0,
                        null,
                        (bits & V23_COMPRESSION) != 0,
                        (bits & V23_ENCRYPTION) != 0,
                        false,
                        false);
            case ID3V24:
                return new FrameFlags(
                        (bits & V24_TAG_ALTER) != 0,
                        (bits & V24_FILE_ALTER) != 0,
                        (bits & V24_READ_ONLY) != 0,
                        null,
                        (bits & V24_COMPRESSION) != 0,
                        (bits & V24_ENCRYPTION) != 0,
                        (bits & V24_UNSYNCHRONISATION) != 0,
                        (bits & V24_DATA_LENGTH_INDICATOR) != 0);
            default:
                return FrameFlags.NONE;
        }
    }

    private static int statusBits(FrameFlags flags, int tagAlter, int fileAlter, int readOnly) {
        int bits = 0;
        if (flags.tagAlterPreservation()) bits |= tagAlter;
        if (flags.fileAlterPreservation()) bits |= fileAlter;
        if (flags.readOnly()) bits |= readOnly;
        return bits;
    }

    private static byte[] header(byte[] id, byte[] size, int flagBits, byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(10 + payload.length);
        out.put(id).put(size).putShort((short) flagBits).put(payload);
        return out.array();
    }

    static byte[] inflate(String id, byte[] compressed, long expectedLength) throws Id3Exception {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(
                    expectedLength > 0 && expectedLength < Integer.MAX_VALUE ? (int) expectedLength : INFLATE_BUFFER);
            byte[] buffer = new byte[INFLATE_BUFFER];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + ": komprimierte Daten sind abgeschnitten");
                }
                out.write(buffer, 0, n);
            }
            if (expectedLength >= 0 && out.size() != expectedLength) {
                throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + ": entpackt " + out.size()
                        + " Bytes, erwartet " + expectedLength);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + ": Entpacken fehlgeschlagen", e);
        } finally {
            inflater.end();
        }
    }

    static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 16);
            byte[] buffer = new byte[INFLATE_BUFFER];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }
}
