package io.github.mdzhigarov.jzipcodec.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtraFieldsTest {

    @Test
    @DisplayName("Should find a ZIP64 record after other records")
    void shouldFindZip64Record() {
        // Given - extended timestamp (0x5455, 5 bytes) then ZIP64 (0x0001, 8 bytes)
        byte[] extra = {
            0x55, 0x54, 5, 0, 1, 0, 0, 0, 0,
            1, 0, 8, 0, 0, 0, 0, 0, 0, 0, 0, 0
        };

        assertTrue(ExtraFields.containsZip64(extra));
    }

    @Test
    @DisplayName("Should ignore records without ZIP64 and stop at an overrunning record")
    void shouldIgnoreOtherRecords() {
        byte[] timestamp = {0x55, 0x54, 1, 0, 7};
        byte[] overrun = {0x55, 0x54, 40, 0, 1, 0, 8, 0};

        assertFalse(ExtraFields.containsZip64(timestamp));
        assertFalse(ExtraFields.containsZip64(overrun));
        assertFalse(ExtraFields.containsZip64(new byte[0]));
    }
}
