package mp3tags;

import mp3tags.ID3TagReader.FormatVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static mp3tags.TestBytes.bytes;
import static mp3tags.TestBytes.concat;
import static mp3tags.TestBytes.filled;
import static mp3tags.TestBytes.id3v1;
import static mp3tags.TestBytes.latin1;
import static mp3tags.TestBytes.write;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MP3TagWriterTest {

    @TempDir
    Path dir;

    private byte[] filler;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        filler = filled(1337, 0xAA);
        Tag tag = new Tag();
        tag.setTitle("Song");
        file = write(dir.resolve("song.mp3"), new Encoder().encode(tag), filler, id3v1("Song", 1, 31));
    }

    private void assertEndsWithFiller() throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        assertArrayEquals(filler, Arrays.copyOfRange(bytes, bytes.length - filler.length, bytes.length));
    }

    @Test
    void writingArtistShouldRemoveVersion1() throws IOException {
        assertEquals(0, MP3TagWriter.run(new String[] {file.toString(), "artist=High Contrast"}));

        Tag tag = Tag.readFrom(file);
        assertEquals("High Contrast", tag.artist());
        assertEquals("Song", tag.title());
        assertEquals(FormatVersion.ID3V2, ID3TagReader.detect(file));
        assertEndsWithFiller();
    }

    @Test
    void versionOptionShouldSelectTargetVersion() throws IOException {
        assertEquals(0, MP3TagWriter.run(new String[] {
                "--version=2.3", file.toString(), "year=2024", "track=3/12", "genre=(31)", "comment=Hallo"}));

        Tag tag = Tag.readFrom(file);
        assertEquals(Version.ID3V23, tag.version());
        assertEquals(Integer.valueOf(2024), tag.year());
        assertEquals(Integer.valueOf(12), tag.totalTracks());
        assertEquals("Trance", tag.genreParsed());
        assertEquals("Hallo", tag.comments().get(0).text());
        assertEndsWithFiller();
    }

    @Test
    void version22ShouldBeWritable() throws IOException {
        assertEquals(0, MP3TagWriter.run(new String[] {"--version=22", file.toString(), "album=Album"}));
        assertEquals(2, Files.readAllBytes(file)[3]);
        assertEquals("Album", Tag.readFrom(file).album());
    }

    @Test
    void version1OnlyFileShouldKeepItsFields() throws IOException {
        Path v1Only = write(dir.resolve("v1.mp3"), filler, id3v1("Alt", 4, 31));
        assertEquals(0, MP3TagWriter.run(new String[] {v1Only.toString(), "albumartist=Various"}));

        Tag tag = Tag.readFrom(v1Only);
        assertEquals("Alt", tag.title());
        assertEquals("Various", tag.albumArtist());
        assertEquals(FormatVersion.ID3V2, ID3TagReader.detect(v1Only));
    }

    @Test
    void usageErrorsShouldExitWithOne() {
        assertEquals(1, MP3TagWriter.run(new String[0]));
        assertEquals(1, MP3TagWriter.run(new String[] {file.toString()}));
        assertEquals(1, MP3TagWriter.run(new String[] {file.toString(), "mood=ruhig"}));
        assertEquals(1, MP3TagWriter.run(new String[] {file.toString(), "year=neulich"}));
        assertEquals(1, MP3TagWriter.run(new String[] {"--version=2.5", file.toString(), "title=x"}));
        assertEquals(1, MP3TagWriter.run(new String[] {file.toString(), "title"}));
    }

    @Test
    void missingFileShouldExitWithTwo() {
        assertEquals(2, MP3TagWriter.run(new String[] {dir.resolve("fehlt.mp3").toString(), "title=x"}));
    }

    @Test
    void unreadableFramesShouldLeaveFileUntouched() throws IOException {
        byte[] frames = concat(
                latin1("TIT2"), bytes(0, 0, 0, 5, 0, 0, 0), latin1("Song"),
                // verschlüsselt (0x0040), Methode 0x80
                latin1("TALB"), bytes(0, 0, 0, 5, 0, 0x40, 0x80), latin1("xxxx"));
        byte[] original = concat(latin1("ID3"), bytes(3, 0, 0, 0, 0, 0, frames.length),
                frames, filler);
        Path encrypted = write(dir.resolve("encrypted.mp3"), original);

        assertEquals(2, MP3TagWriter.run(new String[] {encrypted.toString(), "artist=High Contrast"}));

        assertArrayEquals(original, Files.readAllBytes(encrypted));
    }

    @Test
    void tagErrorsShouldExitWithTwo() throws IOException {
        Path broken = write(dir.resolve("broken.mp3"), latin1("ID3"), new byte[] {9, 0, 0, 0, 0, 0, 0}, filler);
        assertEquals(2, MP3TagWriter.run(new String[] {broken.toString(), "title=x"}));
    }
}
