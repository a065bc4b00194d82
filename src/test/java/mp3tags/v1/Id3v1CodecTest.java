package mp3tags.v1;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static mp3tags.TestBytes.filled;
import static mp3tags.TestBytes.id3v1;
import static mp3tags.TestBytes.latin1;
import static mp3tags.TestBytes.write;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Id3v1CodecTest {

    @TempDir
    Path dir;

    private static FileChannel open(Path file) throws IOException {
        return FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    @Test
    void shouldReadVersion11Fields() throws IOException {
        byte[] block = id3v1("Distant Wonders", 7, 31);
        System.arraycopy(latin1("Artist"), 0, block, 33, 6);
        System.arraycopy(latin1("2024"), 0, block, 93, 4);
        System.arraycopy(latin1("Kommentar  "), 0, block, 97, 11);
        Path file = write(dir.resolve("a.mp3"), filled(500, 0xAA), block);

        try (FileChannel channel = open(file)) {
            assertTrue(Id3v1Codec.isCandidate(channel));
            Id3v1Tag tag = Id3v1Codec.read(channel);
            assertEquals("Distant Wonders", tag.title());
            assertEquals("Artist", tag.artist());
            assertEquals("", tag.album());
            assertEquals("2024", tag.year());
            assertEquals("Kommentar", tag.comment());
            assertEquals(Integer.valueOf(7), tag.track());
            assertEquals(Integer.valueOf(31), tag.genre());
            assertEquals("Trance", tag.genreName());
        }
    }

    @Test
    void version10CommentShouldUseAllThirtyBytes() throws IOException {
        byte[] block = id3v1("T", 0, 255);
        byte[] comment = latin1("abcdefghijklmnopqrstuvwxyz1234");
        System.arraycopy(comment, 0, block, 97, 30);
        Path file = write(dir.resolve("a.mp3"), block);

        try (FileChannel channel = open(file)) {
            Id3v1Tag tag = Id3v1Codec.read(channel);
            assertEquals("abcdefghijklmnopqrstuvwxyz1234", tag.comment());
            assertNull(tag.track());
            assertNull(tag.genre());
        }
    }

    @Test
    void missingTagShouldBeNoTag() throws IOException {
        Path file = write(dir.resolve("a.mp3"), filled(100, 0xAA));
        try (FileChannel channel = open(file)) {
            assertFalse(Id3v1Codec.isCandidate(channel));
            assertEquals(ErrorKind.NO_TAG, assertThrows(Id3Exception.class, () -> Id3v1Codec.read(channel)).kind());
            assertFalse(Id3v1Codec.removeFrom(channel));
        }
    }

    @Test
    void removeShouldTruncateTheLast128Bytes() throws IOException {
        byte[] audio = filled(1337, 0xAA);
        Path file = write(dir.resolve("a.mp3"), audio, id3v1("Song", 1, 31));
        try (FileChannel channel = open(file)) {
            assertTrue(Id3v1Codec.removeFrom(channel));
        }
        assertArrayEquals(audio, Files.readAllBytes(file));
    }

    @Test
    void shouldConvertToVersion2Tag() {
        Id3v1Tag v1 = new Id3v1Tag("Song", "Artist", "", "2001", "Hallo", 3, 31);
        Tag tag = v1.toTag();
        assertEquals("Song", tag.title());
        assertEquals("Artist", tag.artist());
        assertNull(tag.album());
        assertEquals(Integer.valueOf(2001), tag.year());
        assertEquals("Hallo", tag.comments().get(0).text());
        assertEquals(Integer.valueOf(3), tag.track());
        assertEquals("Trance", tag.genreParsed());
    }
}
