package mp3tags;

import mp3tags.frame.Comment;
import mp3tags.frame.Frame;
import mp3tags.frame.Picture;
import mp3tags.frame.PictureType;
import mp3tags.frame.Popularimeter;
import mp3tags.frame.Timestamp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static mp3tags.TestBytes.filled;
import static mp3tags.TestBytes.write;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagTest {

    @TempDir
    Path dir;

    private Tag tag;

    @BeforeEach
    void setUp() {
        tag = new Tag();
    }

    @Test
    void addFrameShouldReplaceFrameWithSameKey() {
        Frame first = Frame.text("TIT2", "Alt");
        assertNull(tag.addFrame(first));
        tag.setArtist("Artist");
        assertSame(first, tag.addFrame(Frame.text("TIT2", "Neu")));
        assertEquals(2, tag.frameCount());
        assertEquals("TIT2", tag.frames().get(0).id());
        assertEquals("Neu", tag.title());
    }

    @Test
    void commentsWithDifferentDescriptionsShouldCoexist() {
        tag.addComment(new Comment("eng", "", "eins"));
        tag.addComment(new Comment("eng", "zwei", "zwei"));
        tag.addComment(new Comment("eng", "", "drei"));
        assertEquals(2, tag.comments().size());
        assertEquals("drei", tag.comments().get(0).text());
        assertEquals(1, tag.removeComment("zwei", null));
        assertEquals(1, tag.comments().size());
    }

    @Test
    void picturesShouldBeKeyedByType() {
        tag.addPicture(new Picture("image/png", PictureType.COVER_FRONT, "", new byte[] {1}));
        tag.addPicture(new Picture("image/png", PictureType.COVER_BACK, "", new byte[] {2}));
        tag.addPicture(new Picture("image/jpeg", PictureType.COVER_FRONT, "", new byte[] {3}));
        assertEquals(2, tag.pictures().size());
        assertEquals(1, tag.removePicture(PictureType.COVER_BACK.code()));
        assertArrayEquals(new byte[] {3}, tag.pictures().get(0).data());
    }

    @Test
    void trackAndDiscShouldBeSplitAtSlash() {
        tag.setTrack(3);
        tag.setTotalTracks(12);
        assertEquals("3/12", tag.text("TRCK"));
        assertEquals(Integer.valueOf(3), tag.track());
        assertEquals(Integer.valueOf(12), tag.totalTracks());
        tag.setText("TPOS", "2");
        assertEquals(Integer.valueOf(2), tag.disc());
        assertNull(tag.totalDiscs());
        tag.setText("TRCK", "x/y");
        assertNull(tag.track());
    }

    @Test
    void genreShouldBeKeptRawAndParsed() {
        tag.setGenre("(31)");
        assertEquals("(31)", tag.genre());
        assertEquals("Trance", tag.genreParsed());
        assertEquals(List.of("Trance"), tag.genres());
    }

    @Test
    void recordingDateShouldFallBackToVersion23Frames() {
        tag.setText("TYER", "2019");
        tag.setText("TDAT", "1705");
        assertEquals(Timestamp.ofDate(2019, 5, 17), tag.dateRecorded());
        assertEquals(Integer.valueOf(2019), tag.year());
        tag.setYear(2020);
        assertEquals(Integer.valueOf(2020), tag.year());
        assertNull(tag.get("TDAT"));
        tag.removeDateRecorded();
        assertNull(tag.year());
        assertNull(tag.get("TYER"));
    }

    @Test
    void otherAccessorsShouldMapToTheirFrames() {
        tag.setDuration(215_000);
        tag.setAlbumArtist("Various");
        tag.addExtendedText("MOOD", "ruhig");
        tag.addExtendedLink("Shop", "https://example.com");
        tag.setPopularimeter(new Popularimeter("a@b", 128, 3));
        assertEquals(Long.valueOf(215_000), tag.duration());
        assertEquals("Various", tag.text("TPE2"));
        assertEquals("ruhig", tag.extendedTexts().get(0).value());
        assertEquals("https://example.com", tag.extendedLinks().get(0).link());
        assertEquals(128, tag.popularimeter().rating());
        assertEquals(1, tag.removeExtendedText("MOOD"));
        tag.removePopularimeter();
        assertNull(tag.popularimeter());
    }

    @Test
    void shouldReadFromStreamAndStopBehindTag() throws IOException {
        tag.setTitle("Song");
        byte[] bytes = TestBytes.concat(new Encoder().encode(tag), new byte[] {0x55, 0x66});
        InputStream in = new ByteArrayInputStream(bytes);
        assertEquals("Song", Tag.readFrom(in).title());
        assertEquals(0x55, in.read());
    }

    @Test
    void fileWithoutTagShouldBeNoTag() throws IOException {
        Path file = write(dir.resolve("a.mp3"), filled(300, 0xAA));
        assertFalse(Tag.isCandidate(file));
        assertEquals(ErrorKind.NO_TAG, assertThrows(Id3Exception.class, () -> Tag.readFrom(file)).kind());
        assertNull(Id3Exception.noTagOk(() -> Tag.readFrom(file)));
        assertFalse(Tag.removeFrom(file));
    }

    @Test
    void shouldWriteReadAndRemoveThroughFile() throws IOException {
        byte[] audio = filled(5000, 0xAA);
        Path file = write(dir.resolve("a.mp3"), audio);
        tag.setTitle("Song");
        tag.setArtist("Artist");
        for (Version version : Version.values()) {
            tag.writeTo(file, version);
            assertTrue(Tag.isCandidate(file));
            Tag read = Tag.readFrom(file);
            assertEquals(version, read.version());
            assertEquals("Song", read.title());
            assertEquals("Artist", read.artist());
        }
        assertTrue(Tag.removeFrom(file));
        assertArrayEquals(audio, Files.readAllBytes(file));
    }
}
