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

package io.github.mdzhigarov.jzipcodec.io;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;

/**
 * A random-access byte source. Every read names its own position, so independent
 * callers (one per open entry stream) never disturb each other's cursor.
 */
public interface SeekableSource extends Closeable {

    /**
     * @return The total number of bytes in the source
     */
    long size() throws IOException;

    /**
     * Reads up to {@code len} bytes starting at {@code position}.
     *
     * @return The number of bytes read, at least one when {@code len} is positive, or -1
     * if {@code position} is at or past the end
     */
    int read(long position, byte[] buf, int off, int len) throws IOException;

    /**
     * Reads exactly {@code len} bytes starting at {@code position}.
     *
     * @throws EOFException If the source ends first
     */
    default void readFully(long position, byte[] buf, int off, int len) throws IOException {
        int done = 0;
        while (done < len) {
            int n = read(position + done, buf, off + done, len - done);
            if (n < 0) {
                throw new EOFException("Source ended at " + (position + done) + ", needed "
                    + (len - done) + " more bytes");
            }
            if (n == 0) {
                throw new IOException("Source returned no data at " + (position + done));
            }
            done += n;
        }
    }

    default byte[] readFully(long position, int len) throws IOException {
        byte[] buf = new byte[len];
        readFully(position, buf, 0, len);
        return buf;
    }
}
