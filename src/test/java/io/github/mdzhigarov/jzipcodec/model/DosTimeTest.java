package io.github.mdzhigarov.jzipcodec.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DosTimeTest {

    @Test
    @DisplayName("Should pack and unpack a timestamp at two-second resolution")
    void shouldPackAndUnpack() {
        // Given
        LocalDateTime time = LocalDateTime.of(2024, 3, 15, 13, 45, 31);

        // When
        int packed = DosTime.pack(time);

        // Then
        assertEquals(LocalDateTime.of(2024, 3, 15, 13, 45, 30),
            DosTime.toLocalDateTime(DosTime.date(packed), DosTime.time(packed)));
    }

    @Test
    @DisplayName("Should encode 1980-01-01 00:00 as date 0x21 and time 0")
    void shouldEncodeEpoch() {
        int packed = DosTime.pack(LocalDateTime.of(1980, 1, 1, 0, 0));

        assertEquals(0x21, DosTime.date(packed));
        assertEquals(0, DosTime.time(packed));
    }

    @Test
    @DisplayName("Should clamp timestamps outside the DOS range")
    void shouldClamp() {
        int early = DosTime.pack(LocalDateTime.of(1970, 6, 1, 12, 0));
        int late = DosTime.pack(LocalDateTime.of(2200, 1, 1, 0, 0));

        assertEquals(LocalDateTime.of(1980, 1, 1, 0, 0), DosTime.toLocalDateTime(DosTime.date(early), DosTime.time(early)));
        assertEquals(LocalDateTime.of(2107, 12, 31, 23, 59, 58), DosTime.toLocalDateTime(DosTime.date(late), DosTime.time(late)));
    }

    @Test
    @DisplayName("Should roll over out-of-range fields instead of failing")
    void shouldRollOverInvalidFields() {
        // Given - 2023-02-30 and month 0
        int feb30 = (43 << 9) | (2 << 5) | 30;
        int monthZero = (43 << 9) | 1;

        // Then
        assertEquals(LocalDateTime.of(2023, 3, 2, 0, 0), DosTime.toLocalDateTime(feb30, 0));
        assertEquals(LocalDateTime.of(2022, 12, 1, 0, 0), DosTime.toLocalDateTime(monthZero, 0));
    }
}
