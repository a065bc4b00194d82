package mp3tags;

import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.id3.ID3v23Tag;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Prüft geschriebene Tags mit einem unabhängigen Leser. */
class JaudiotaggerInteropTest {

    private static Tag sample() {
        Tag tag = new Tag();
        tag.setTitle("Distant Wonders");
        tag.setArtist("Test Artist");
        tag.setAlbum("Test Album");
        return tag;
    }

    @Test
    void version24TagShouldBeReadableByJaudiotagger() throws Exception {
        byte[] bytes = new Encoder().encode(sample());
        ID3v24Tag parsed = new ID3v24Tag(ByteBuffer.wrap(bytes), "interop.mp3");
        assertEquals("Distant Wonders", parsed.getFirst(FieldKey.TITLE));
        assertEquals("Test Artist", parsed.getFirst(FieldKey.ARTIST));
        assertEquals("Test Album", parsed.getFirst(FieldKey.ALBUM));
    }

    @Test
    void version23TagShouldBeReadableByJaudiotagger() throws Exception {
        Tag tag = sample();
        tag.setTitle("Grüße ✓");
        byte[] bytes = new Encoder().version(Version.ID3V23).encode(tag);
        ID3v23Tag parsed = new ID3v23Tag(ByteBuffer.wrap(bytes), "interop.mp3");
        assertEquals("Grüße ✓", parsed.getFirst(FieldKey.TITLE));
        assertEquals("Test Artist", parsed.getFirst(FieldKey.ARTIST));
    }
}
