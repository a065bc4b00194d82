package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Version;
import mp3tags.frame.Comment;
import mp3tags.frame.Content;
import mp3tags.frame.ContentType;
import mp3tags.frame.EncapsulatedObject;
import mp3tags.frame.ExtendedLink;
import mp3tags.frame.ExtendedText;
import mp3tags.frame.FrameIds;
import mp3tags.frame.Link;
import mp3tags.frame.Lyrics;
import mp3tags.frame.Picture;
import mp3tags.frame.Popularimeter;
import mp3tags.frame.Private;
import mp3tags.frame.Text;
import mp3tags.frame.Timestamp;
import mp3tags.frame.UniqueFileIdentifier;
import mp3tags.frame.Unknown;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Liest und schreibt den Rumpf eines Frames. Welche Form gilt, bestimmt allein die kanonische Kennung
 * ({@link FrameIds#contentType(String)}).
 */
public final class ContentCodec {
    private static final Logger LOGGER = Logger.getLogger(ContentCodec.class.getName());

    private ContentCodec() {}

    /** Gelesener Inhalt samt der Kodierung, mit der er im Frame stand ({@code null} bei Binärinhalten). */
    public record Decoded(Content content, Encoding encoding) {}

    public static Decoded decode(String id, Version version, byte[] body) throws Id3Exception {
        BodyReader in = new BodyReader(id, body);
        ContentType type = FrameIds.contentType(id);
        switch (type) {
            case TEXT: {
                Encoding encoding = in.readEncoding();
                return new Decoded(new Text(in.readValues(encoding)), encoding);
            }
            case TIMESTAMP: {
                Encoding encoding = in.readEncoding();
                return new Decoded(Timestamp.parse(in.readValues(encoding).get(0)), encoding);
            }
            case EXTENDED_TEXT: {
                Encoding encoding = in.readEncoding();
                String description = in.readTerminated(encoding);
                return new Decoded(new ExtendedText(description, in.readRest(encoding)), encoding);
            }
            case LINK:
                return new Decoded(new Link(in.readRestUntilNull()), null);
            case EXTENDED_LINK: {
                Encoding encoding = in.readEncoding();
                String description = in.readTerminated(encoding);
                return new Decoded(new ExtendedLink(description, in.readRestUntilNull()), encoding);
            }
            case COMMENT: {
                Encoding encoding = in.readEncoding();
                String lang = in.readLanguage();
                String description = in.readTerminated(encoding);
                return new Decoded(new Comment(lang, description, in.readRest(encoding)), encoding);
            }
            case LYRICS: {
                Encoding encoding = in.readEncoding();
                String lang = in.readLanguage();
                String description = in.readTerminated(encoding);
                return new Decoded(new Lyrics(lang, description, in.readRest(encoding)), encoding);
            }
            case PICTURE: {
                Encoding encoding = in.readEncoding();
                String mimeType = version == Version.ID3V22
                        ? mimeTypeForFormat(Encoding.LATIN1.decode(in.readBytes(3)))
                        : in.readTerminated(Encoding.LATIN1);
                int pictureType = in.readByte();
                String description = in.readTerminated(encoding);
                return new Decoded(new Picture(mimeType, pictureType, description, in.readRestBytes()), encoding);
            }
            case POPULARIMETER: {
                String user = in.readTerminated(Encoding.LATIN1);
                int rating = in.readByte();
                return new Decoded(new Popularimeter(user, rating, in.readCounter()), null);
            }
            case ENCAPSULATED_OBJECT: {
                Encoding encoding = in.readEncoding();
                String mimeType = in.readTerminated(Encoding.LATIN1);
                String filename = in.readTerminated(encoding);
                String description = in.readTerminated(encoding);
                return new Decoded(new EncapsulatedObject(mimeType, filename, description, in.readRestBytes()),
                        encoding);
            }
            case PRIVATE: {
                String owner = in.readTerminated(Encoding.LATIN1);
                return new Decoded(new Private(owner, in.readRestBytes()), null);
            }
            case UNIQUE_FILE_IDENTIFIER: {
                String owner = in.readTerminated(Encoding.LATIN1);
                return new Decoded(new UniqueFileIdentifier(owner, in.readRestBytes()), null);
            }
            default:
                return new Decoded(new Unknown(body.clone()), null);
        }
    }

    /**
     * Schreibt den Rumpf eines Frames.
     *
     * @param id kanonische Kennung
     * @param preferred gewünschte Kodierung oder {@code null}; nicht unterstützte Kodierungen werden auf UTF-16
     *                  herabgestuft
     */
    public static byte[] encode(String id, Content content, Encoding preferred, Version version)
            throws Id3Exception {
        ContentType expected = FrameIds.contentType(id);
        if (content.type() != ContentType.UNKNOWN && content.type() != expected) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT,
                    "Frame " + id + " erwartet " + expected + ", nicht " + content.type());
        }
        BodyWriter out = new BodyWriter();
        switch (content.type()) {
            case TEXT: {
                Text text = (Text) content;
                Encoding encoding = Encoding.forVersion(preferred, version, text.values().toArray(new String[0]));
                out.writeByte(encoding.code());
                byte[] last = null;
                for (int i = 0; i < text.values().size(); i++) {
                    if (i > 0) {
                        out.write(encoding.terminator());
                    }
                    last = encoding.encode(text.values().get(i));
                    out.write(last);
                }
                // Ein leerer letzter Wert endet mit einem eigenen Terminator.
                if (text.values().size() > 1 && last.length == 0) {
                    out.write(encoding.terminator());
                }
                break;
            }
            case TIMESTAMP: {
                String value = content.toString();
                Encoding encoding = Encoding.forVersion(preferred, version, value);
                out.writeByte(encoding.code());
                out.write(encoding.encode(value));
                break;
            }
            case EXTENDED_TEXT: {
                ExtendedText text = (ExtendedText) content;
                Encoding encoding = Encoding.forVersion(preferred, version, text.description(), text.value());
                out.writeByte(encoding.code());
                out.writeTerminated(encoding, text.description());
                out.write(encoding.encode(text.value()));
                break;
            }
            case LINK:
                out.write(Encoding.LATIN1.encode(((Link) content).url()));
                break;
            case EXTENDED_LINK: {
                ExtendedLink link = (ExtendedLink) content;
                Encoding encoding = Encoding.forVersion(preferred, version, link.description());
                out.writeByte(encoding.code());
                out.writeTerminated(encoding, link.description());
                out.write(Encoding.LATIN1.encode(link.link()));
                break;
            }
            case COMMENT: {
                Comment comment = (Comment) content;
                writeLanguageText(out, preferred, version, comment.lang(), comment.description(), comment.text());
                break;
            }
            case LYRICS: {
                Lyrics lyrics = (Lyrics) content;
                writeLanguageText(out, preferred, version, lyrics.lang(), lyrics.description(), lyrics.text());
                break;
            }
            case PICTURE: {
                Picture picture = (Picture) content;
                Encoding encoding = Encoding.forVersion(preferred, version, picture.description());
                out.writeByte(encoding.code());
                if (version == Version.ID3V22) {
                    out.write(Encoding.LATIN1.encode(formatForMimeType(picture.mimeType())));
                } else {
                    out.writeTerminated(Encoding.LATIN1, picture.mimeType());
                }
                out.writeByte(picture.pictureType());
                out.writeTerminated(encoding, picture.description());
                out.write(picture.data());
                break;
            }
            case POPULARIMETER: {
                Popularimeter popm = (Popularimeter) content;
                out.writeTerminated(Encoding.LATIN1, popm.user());
                out.writeByte(popm.rating());
                out.writeCounter(popm.counter());
                break;
            }
            case ENCAPSULATED_OBJECT: {
                EncapsulatedObject geob = (EncapsulatedObject) content;
                Encoding encoding = Encoding.forVersion(preferred, version, geob.filename(), geob.description());
                out.writeByte(encoding.code());
                out.writeTerminated(Encoding.LATIN1, geob.mimeType());
                out.writeTerminated(encoding, geob.filename());
                out.writeTerminated(encoding, geob.description());
                out.write(geob.data());
                break;
            }
            case PRIVATE: {
                Private priv = (Private) content;
                out.writeTerminated(Encoding.LATIN1, priv.ownerIdentifier());
                out.write(priv.data());
                break;
            }
            case UNIQUE_FILE_IDENTIFIER: {
                UniqueFileIdentifier ufid = (UniqueFileIdentifier) content;
                out.writeTerminated(Encoding.LATIN1, ufid.ownerIdentifier());
                out.write(ufid.identifier());
                break;
            }
            default:
                out.write(((Unknown) content).data());
                break;
        }
        return out.toByteArray();
    }

    private static void writeLanguageText(BodyWriter out, Encoding preferred, Version version, String lang,
                                          String description, String text) throws Id3Exception {
        if (lang.length() != 3 || !Encoding.LATIN1.canEncode(lang)) {
            throw new Id3Exception(ErrorKind.INVALID_INPUT, "Sprachcode muss 3 Zeichen haben: " + lang);
        }
        Encoding encoding = Encoding.forVersion(preferred, version, description, text);
        out.writeByte(encoding.code());
        out.write(Encoding.LATIN1.encode(lang));
        out.writeTerminated(encoding, description);
        out.write(encoding.encode(text));
    }

    /** v2.2 speichert statt des MIME-Typs ein Bildformat aus 3 Zeichen. */
    static String mimeTypeForFormat(String format) {
        switch (format.toUpperCase(Locale.ROOT)) {
            case "JPG":
                return "image/jpeg";
            case "PNG":
                return "image/png";
            default:
                return "image/" + format.toLowerCase(Locale.ROOT);
        }
    }

    static String formatForMimeType(String mimeType) throws Id3Exception {
        String lower = mimeType.toLowerCase(Locale.ROOT);
        if (lower.equals("image/jpeg") || lower.equals("image/jpg")) {
            return "JPG";
        }
        if (lower.equals("image/png")) {
            return "PNG";
        }
        if (lower.startsWith("image/") && lower.length() == 9) {
            return lower.substring(6).toUpperCase(Locale.ROOT);
        }
        throw new Id3Exception(ErrorKind.UNSUPPORTED_FEATURE,
                "MIME-Typ lässt sich in ID3v2.2 nicht darstellen: " + mimeType);
    }

    private static final class BodyReader {
        private final String id;
        private final byte[] data;
        private int pos;

        BodyReader(String id, byte[] data) {
            this.id = id;
            this.data = data;
        }

        int readByte() throws Id3Exception {
            require(1);
            return data[pos++] & 0xFF;
        }

        byte[] readBytes(int n) throws Id3Exception {
            require(n);
            byte[] out = Arrays.copyOfRange(data, pos, pos + n);
            pos += n;
            return out;
        }

        byte[] readRestBytes() {
            byte[] out = Arrays.copyOfRange(data, pos, data.length);
            pos = data.length;
            return out;
        }

        Encoding readEncoding() throws Id3Exception {
            return Encoding.fromCode(readByte());
        }

        String readLanguage() throws Id3Exception {
            String lang = Encoding.LATIN1.decode(readBytes(3));
            if (!lang.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                LOGGER.warning(() -> "Ungültiger Sprachcode in " + id + " wird unverändert übernommen: " + lang);
            }
            return lang;
        }

        /** Text bis zum Terminator; fehlt der Terminator, ist der Frame abgeschnitten. */
        String readTerminated(Encoding encoding) throws Id3Exception {
            int end = encoding.indexOfTerminator(data, pos, data.length);
            if (end < 0) {
                throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + ": Text ohne Terminator");
            }
            String value = encoding.decode(data, pos, end - pos);
            pos = end + encoding.terminator().length;
            return value;
        }

        /** Letzter Text eines Frames; ein einzelner abschließender Terminator wird toleriert. */
        String readRest(Encoding encoding) throws Id3Exception {
            int end = stripTerminator(encoding, pos, data.length);
            String value = encoding.decode(data, pos, end - pos);
            pos = data.length;
            return value;
        }

        String readRestUntilNull() throws Id3Exception {
            int end = Encoding.LATIN1.indexOfTerminator(data, pos, data.length);
            String value = Encoding.LATIN1.decode(data, pos, (end < 0 ? data.length : end) - pos);
            pos = data.length;
            return value;
        }

        List<String> readValues(Encoding encoding) throws Id3Exception {
            List<String> values = new ArrayList<>();
            int end = stripTerminator(encoding, pos, data.length);
            int termLength = encoding.terminator().length;
            int start = pos;
            while (true) {
                int next = encoding.indexOfTerminator(data, start, end);
                if (next < 0) {
                    values.add(encoding.decode(data, start, end - start));
                    break;
                }
                values.add(encoding.decode(data, start, next - start));
                start = next + termLength;
            }
            pos = data.length;
            return values;
        }

        long readCounter() throws Id3Exception {
            byte[] bytes = readRestBytes();
            long counter = 0;
            int significant = 0;
            for (byte b : bytes) {
                if (significant == 0 && b == 0) {
                    continue;
                }
                significant++;
                counter = (counter << 8) | (b & 0xFF);
            }
            if (significant > 8 || counter < 0) {
                throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + ": Zähler zu groß");
            }
            return counter;
        }

        private int stripTerminator(Encoding encoding, int from, int end) {
            int termLength = encoding.terminator().length;
            if (end - from < termLength || (end - from) % termLength != 0) {
                return end;
            }
            for (int i = end - termLength; i < end; i++) {
                if (data[i] != 0) {
                    return end;
                }
            }
            return end - termLength;
        }

        private void require(int n) throws Id3Exception {
            if (data.length - pos < n) {
                throw new Id3Exception(ErrorKind.PARSING, "Frame " + id + " ist abgeschnitten");
            }
        }
    }

    private static final class BodyWriter {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        void writeByte(int b) {
            out.write(b);
        }

        void write(byte[] bytes) {
            out.write(bytes, 0, bytes.length);
        }

        void writeTerminated(Encoding encoding, String s) throws Id3Exception {
            write(encoding.encode(s));
            write(encoding.terminator());
        }

        /** Big Endian, mindestens 4 Bytes. */
        void writeCounter(long counter) {
            int bits = 64 - Long.numberOfLeadingZeros(counter);
            int length = Math.max(4, (bits + 7) / 8);
            for (int i = length - 1; i >= 0; i--) {
                out.write((int) (counter >>> (8 * i)) & 0xFF);
            }
        }

        byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
