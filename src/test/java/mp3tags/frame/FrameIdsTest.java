package mp3tags.frame;

import mp3tags.Version;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameIdsTest {

    @Test
    void shouldMapLegacyIdentifiersBothWays() {
        assertEquals("TIT2", FrameIds.toCanonical("TT2"));
        assertEquals("TT2", FrameIds.toLegacy("TIT2"));
        assertEquals("APIC", FrameIds.toCanonical("PIC"));
        assertEquals("TCMP", FrameIds.toCanonical("TCP"));
        assertNull(FrameIds.toLegacy("PRIV"));
    }

    @Test
    void identifierForVersionShouldRejectUnmappableFrames() {
        assertEquals("TT2", FrameIds.idForVersion("TIT2", Version.ID3V22));
        assertEquals("TIT2", FrameIds.idForVersion("TIT2", Version.ID3V23));
        assertNull(FrameIds.idForVersion("TDRC", Version.ID3V22));
        assertNull(FrameIds.idForVersion("XYZ", Version.ID3V24));
        assertEquals("XYZ", FrameIds.idForVersion("XYZ", Version.ID3V22));
    }

    @Test
    void normaliseShouldOnlyTouchVersion22() {
        assertEquals("TIT2", FrameIds.normalize("TT2", Version.ID3V22));
        assertEquals("XYZ", FrameIds.normalize("XYZ", Version.ID3V22));
        assertEquals("TIT2", FrameIds.normalize("TIT2", Version.ID3V24));
    }

    @Test
    void shouldResolveContentShape() {
        assertEquals(ContentType.TEXT, FrameIds.contentType("TALB"));
        assertEquals(ContentType.EXTENDED_TEXT, FrameIds.contentType("TXXX"));
        assertEquals(ContentType.LINK, FrameIds.contentType("WOAR"));
        assertEquals(ContentType.EXTENDED_LINK, FrameIds.contentType("WXXX"));
        assertEquals(ContentType.PICTURE, FrameIds.contentType("APIC"));
        assertEquals(ContentType.TIMESTAMP, FrameIds.contentType("TDRC"));
        assertEquals(ContentType.UNKNOWN, FrameIds.contentType("MCDI"));
        assertEquals(ContentType.UNKNOWN, FrameIds.contentType("XYZW"));
    }

    @Test
    void shouldValidateIdentifierSyntax() {
        assertTrue(FrameIds.isValid("TIT2", Version.ID3V23));
        assertTrue(FrameIds.isValid("TT2", Version.ID3V22));
        assertFalse(FrameIds.isValid("tit2", Version.ID3V24));
        assertFalse(FrameIds.isValid("TT2", Version.ID3V24));
        assertFalse(FrameIds.isValid("TI 2", Version.ID3V23));
    }
}
