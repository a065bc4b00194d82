package mp3tags.stream;

import mp3tags.Version;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static mp3tags.TestBytes.bytes;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnsynchronisationTest {

    @Test
    void shouldInsertZeroAfterFalseSync() {
        assertArrayEquals(bytes(0xFF, 0x00, 0xE0), Unsynchronisation.encode(bytes(0xFF, 0xE0), Version.ID3V23));
        assertArrayEquals(bytes(0xFF, 0x00, 0xFF, 0x00, 0x00),
                Unsynchronisation.encode(bytes(0xFF, 0xFF, 0x00), Version.ID3V24));
        assertArrayEquals(bytes(0xFF, 0x12), Unsynchronisation.encode(bytes(0xFF, 0x12), Version.ID3V23));
    }

    @Test
    void trailingFfShouldOnlyBeStuffedBeforeVersion4() {
        assertArrayEquals(bytes(0x01, 0xFF, 0x00), Unsynchronisation.encode(bytes(0x01, 0xFF), Version.ID3V23));
        assertArrayEquals(bytes(0x01, 0xFF), Unsynchronisation.encode(bytes(0x01, 0xFF), Version.ID3V24));
    }

    @Test
    void applyThenRemoveShouldBeIdentity() {
        Random random = new Random(42);
        for (Version version : Version.values()) {
            for (int length = 0; length < 200; length += 7) {
                byte[] data = new byte[length];
                random.nextBytes(data);
                // viele FF, damit die Regeln auch greifen
                for (int i = 0; i < length; i += 3) {
                    data[i] = (byte) 0xFF;
                }
                assertArrayEquals(data, Unsynchronisation.decode(Unsynchronisation.encode(data, version)));
            }
        }
    }

    @Test
    void removeShouldNotChangeDataWithoutFfZeroPairs() {
        byte[] data = bytes(0x01, 0xFF, 0xE0, 0x00, 0xFF);
        assertArrayEquals(data, Unsynchronisation.decode(data));
        assertArrayEquals(bytes(0xFF, 0xE0), Unsynchronisation.decode(bytes(0xFF, 0x00, 0xE0)));
    }

    @Test
    void shouldReportWhetherStuffingIsRequired() {
        assertTrue(Unsynchronisation.isRequired(bytes(0xFF, 0xF3), Version.ID3V23));
        assertTrue(Unsynchronisation.isRequired(bytes(0x00, 0xFF), Version.ID3V23));
        assertFalse(Unsynchronisation.isRequired(bytes(0x00, 0xFF), Version.ID3V24));
        assertFalse(Unsynchronisation.isRequired(bytes(0xFF, 0x7F), Version.ID3V23));
    }
}
