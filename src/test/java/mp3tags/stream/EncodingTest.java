package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import mp3tags.Version;
import org.junit.jupiter.api.Test;

import static mp3tags.TestBytes.bytes;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EncodingTest {

    @Test
    void shouldRoundTripEveryEncoding() throws Id3Exception {
        assertEquals("Grüße", Encoding.LATIN1.decode(Encoding.LATIN1.encode("Grüße")));
        String wide = "Grüße ✓ 𝄞";
        for (Encoding encoding : new Encoding[] {Encoding.UTF16, Encoding.UTF16BE, Encoding.UTF8}) {
            assertEquals(wide, encoding.decode(encoding.encode(wide)), encoding.name());
        }
    }

    @Test
    void latin1ShouldRejectCharactersOutsideItsRange() {
        Id3Exception e = assertThrows(Id3Exception.class, () -> Encoding.LATIN1.encode("✓"));
        assertEquals(ErrorKind.INVALID_INPUT, e.kind());
    }

    @Test
    void utf16ShouldBeWrittenLittleEndianWithBom() throws Id3Exception {
        assertArrayEquals(bytes(0xFF, 0xFE, 0x41, 0x00), Encoding.UTF16.encode("A"));
        assertArrayEquals(bytes(0x00, 0x41), Encoding.UTF16BE.encode("A"));
    }

    @Test
    void utf16ShouldHonourBigEndianBom() throws Id3Exception {
        assertEquals("A", Encoding.UTF16.decode(bytes(0xFE, 0xFF, 0x00, 0x41)));
    }

    @Test
    void utf16WithoutBomShouldFail() {
        Id3Exception e = assertThrows(Id3Exception.class, () -> Encoding.UTF16.decode(bytes(0x41, 0x00)));
        assertEquals(ErrorKind.STRING_DECODING, e.kind());
    }

    @Test
    void malformedUtf8ShouldFail() {
        Id3Exception e = assertThrows(Id3Exception.class, () -> Encoding.UTF8.decode(bytes(0xC3, 0x28)));
        assertEquals(ErrorKind.STRING_DECODING, e.kind());
    }

    @Test
    void unknownEncodingByteShouldFail() {
        Id3Exception e = assertThrows(Id3Exception.class, () -> Encoding.fromCode(4));
        assertEquals(ErrorKind.PARSING, e.kind());
    }

    @Test
    void shouldPickEncodingForVersion() {
        assertEquals(Encoding.UTF8, Encoding.forVersion(null, Version.ID3V24, "abc"));
        assertEquals(Encoding.LATIN1, Encoding.forVersion(null, Version.ID3V23, "Grüße"));
        assertEquals(Encoding.UTF16, Encoding.forVersion(null, Version.ID3V22, "✓"));
        assertEquals(Encoding.UTF16, Encoding.forVersion(Encoding.UTF8, Version.ID3V23, "abc"));
        assertEquals(Encoding.UTF16BE, Encoding.forVersion(Encoding.UTF16BE, Version.ID3V24, "abc"));
    }

    @Test
    void sixteenBitTerminatorShouldOnlyMatchOnEvenOffsets() {
        byte[] data = bytes(0x41, 0x00, 0x00, 0x42, 0x00, 0x00);
        assertEquals(4, Encoding.UTF16BE.indexOfTerminator(data, 0, data.length));
        assertEquals(1, Encoding.LATIN1.indexOfTerminator(data, 0, data.length));
        assertEquals(-1, Encoding.UTF16BE.indexOfTerminator(data, 0, 4));
    }
}
