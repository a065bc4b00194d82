package mp3tags.stream;

import mp3tags.ErrorKind;
import mp3tags.Id3Exception;
import org.junit.jupiter.api.Test;

import static mp3tags.TestBytes.bytes;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SyncsafeTest {

    @Test
    void shouldEncodeSevenBitsPerByte() throws Id3Exception {
        assertArrayEquals(bytes(0x00, 0x00, 0x02, 0x01), Syncsafe.encode(257));
        assertArrayEquals(bytes(0x7F, 0x7F, 0x7F, 0x7F), Syncsafe.encode(Syncsafe.MAX_VALUE));
    }

    @Test
    void shouldRoundTripAcrossTheDomain() throws Id3Exception {
        int[] values = {0, 1, 127, 128, 16383, 16384, 2097151, 2097152, 123456789, Syncsafe.MAX_VALUE};
        for (int value : values) {
            assertEquals(value, Syncsafe.decode(Syncsafe.encode(value), 0));
        }
        for (int value = 0; value <= Syncsafe.MAX_VALUE; value += 9973) {
            assertEquals(value, Syncsafe.decode(Syncsafe.encode(value), 0));
        }
    }

    @Test
    void decodeShouldRejectHighBit() {
        for (int i = 0; i < 4; i++) {
            byte[] data = new byte[4];
            data[i] = (byte) 0x80;
            Id3Exception e = assertThrows(Id3Exception.class, () -> Syncsafe.decode(data, 0));
            assertEquals(ErrorKind.PARSING, e.kind());
        }
    }

    @Test
    void encodeShouldRejectValuesOutside28Bits() {
        assertEquals(ErrorKind.INVALID_INPUT,
                assertThrows(Id3Exception.class, () -> Syncsafe.encode(Syncsafe.MAX_VALUE + 1)).kind());
        assertEquals(ErrorKind.INVALID_INPUT, assertThrows(Id3Exception.class, () -> Syncsafe.encode(-1)).kind());
    }
}
