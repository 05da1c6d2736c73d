/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipcodec.model;

import java.time.LocalDateTime;

/**
 * Conversion between {@link LocalDateTime} and the packed MS-DOS date and time
 * fields of ZIP headers. DOS time has 2-second resolution and covers 1980 to 2107.
 */
public final class DosTime {

    private static final LocalDateTime MIN = LocalDateTime.of(1980, 1, 1, 0, 0, 0);
    private static final LocalDateTime MAX = LocalDateTime.of(2107, 12, 31, 23, 59, 58);

    private DosTime() {
    }

    /**
     * @return The date in the high 16 bits and the time in the low 16 bits
     */
    public static int pack(LocalDateTime dateTime) {
        LocalDateTime t = dateTime;
        if (t.isBefore(MIN)) {
            t = MIN;
        } else if (t.isAfter(MAX)) {
            t = MAX;
        }
        int date = ((t.getYear() - 1980) << 9) | (t.getMonthValue() << 5) | t.getDayOfMonth();
        int time = (t.getHour() << 11) | (t.getMinute() << 5) | (t.getSecond() >> 1);
        return (date << 16) | time;
    }

    public static int date(int packed) {
        return (packed >>> 16) & 0xFFFF;
    }

    public static int time(int packed) {
        return packed & 0xFFFF;
    }

    /**
     * Out-of-range fields (month 0, day 31 of a short month) roll over the way
     * {@link java.util.Date} handles them instead of failing.
     */
    public static LocalDateTime toLocalDateTime(int dosDate, int dosTime) {
        int year = ((dosDate >> 9) & 0x7F) + 1980;
        int month = (dosDate >> 5) & 0x0F;
        int day = dosDate & 0x1F;
        int hour = (dosTime >> 11) & 0x1F;
        int minute = (dosTime >> 5) & 0x3F;
        int second = (dosTime & 0x1F) * 2;
        return LocalDateTime.of(year, 1, 1, 0, 0, 0)
            .plusMonths(month - 1L)
            .plusDays(day - 1L)
            .plusHours(hour)
            .plusMinutes(minute)
            .plusSeconds(second);
    }
}
