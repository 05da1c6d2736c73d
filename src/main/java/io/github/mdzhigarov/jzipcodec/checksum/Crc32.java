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

package io.github.mdzhigarov.jzipcodec.checksum;

/**
 * Table-driven CRC-32 (reflected polynomial 0xEDB88320) as used by ZIP.
 * The class holds no state: callers carry the running value between calls,
 * starting from {@link #INITIAL}.
 */
public final class Crc32 {

    public static final int INITIAL = 0;

    private static final int POLYNOMIAL = 0xEDB88320;
    private static final int[] TABLE = new int[256];

    static {
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? POLYNOMIAL ^ (c >>> 1) : c >>> 1;
            }
            TABLE[n] = c;
        }
    }

    private Crc32() {
    }

    /**
     * Folds {@code len} bytes of {@code buf} into a running checksum.
     *
     * @param crc The checksum of all bytes seen so far ({@link #INITIAL} for none)
     * @param buf The data
     * @param off Offset of the first byte in {@code buf}
     * @param len Number of bytes
     * @return The checksum of the previous bytes followed by these
     */
    public static int update(int crc, byte[] buf, int off, int len) {
        int c = ~crc;
        int end = off + len;
        for (int i = off; i < end; i++) {
            c = TABLE[(c ^ buf[i]) & 0xFF] ^ (c >>> 8);
        }
        return ~c;
    }

    public static int update(int crc, int b) {
        int c = ~crc;
        c = TABLE[(c ^ b) & 0xFF] ^ (c >>> 8);
        return ~c;
    }

    public static int compute(byte[] buf) {
        return update(INITIAL, buf, 0, buf.length);
    }

    /**
     * @return The checksum as the unsigned value stored in ZIP records
     */
    public static long toUnsigned(int crc) {
        return crc & 0xFFFFFFFFL;
    }
}
