package mp3tags.frame;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameTest {

    @Test
    void uniquenessKeyShouldDependOnShape() {
        assertEquals(Frame.text("TIT2", "a").uniquenessKey(), Frame.text("TIT2", "b").uniquenessKey());
        assertNotEquals(
                Frame.of("COMM", new Comment("eng", "a", "x")).uniquenessKey(),
                Frame.of("COMM", new Comment("eng", "b", "x")).uniquenessKey());
        assertNotEquals(
                Frame.of("COMM", new Comment("eng", "a", "x")).uniquenessKey(),
                Frame.of("COMM", new Comment("deu", "a", "x")).uniquenessKey());
        assertEquals(
                Frame.of("APIC", new Picture("image/png", PictureType.COVER_FRONT, "a", new byte[1])).uniquenessKey(),
                Frame.of("APIC", new Picture("image/jpeg", PictureType.COVER_FRONT, "b", new byte[2])).uniquenessKey());
        assertNull(Frame.of("PRIV", new Private("o", new byte[0])).uniquenessKey());
    }

    @Test
    void identifierShouldHaveThreeOrFourCharacters() {
        assertThrows(IllegalArgumentException.class, () -> Frame.text("TI", "x"));
        assertThrows(IllegalArgumentException.class, () -> Frame.text("TITLE", "x"));
    }

    @Test
    void binaryContentShouldCompareByValue() {
        assertEquals(new Private("o", new byte[] {1, 2}), new Private("o", new byte[] {1, 2}));
        assertEquals(new Unknown(new byte[] {3}).hashCode(), new Unknown(new byte[] {3}).hashCode());
        assertEquals(PictureType.COVER_FRONT, PictureType.fromCode(3));
        assertNull(PictureType.fromCode(0x42));
    }
}
