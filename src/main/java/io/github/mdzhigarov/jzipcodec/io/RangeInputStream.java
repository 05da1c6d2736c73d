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

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the window {@code [start, start + length)} of a {@link SeekableSource} as a
 * stream, through a fixed-size buffer. End of stream is the end of the window, so
 * callers never read past an entry's recorded boundary.
 */
public class RangeInputStream extends InputStream {

    private final SeekableSource source;
    private final byte[] buffer;
    private long position;
    private long remaining;
    private int bufferPos;
    private int bufferLimit;
    private boolean closed;

    public RangeInputStream(SeekableSource source, long start, long length, int bufferSize) {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: start=" + start + ", length=" + length);
        }
        this.source = source;
        this.buffer = new byte[(int) Math.max(1, Math.min(bufferSize, length))];
        this.position = start;
        this.remaining = length;
    }

    @Override
    public int read() throws IOException {
        if (bufferPos == bufferLimit && !refill()) {
            return -1;
        }
        return buffer[bufferPos++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (bufferPos == bufferLimit && !refill()) {
            return -1;
        }
        int n = Math.min(len, bufferLimit - bufferPos);
        System.arraycopy(buffer, bufferPos, b, off, n);
        bufferPos += n;
        return n;
    }

    @Override
    public int available() {
        return bufferLimit - bufferPos;
    }

    @Override
    public void close() {
        closed = true;
    }

    private boolean refill() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (remaining == 0) {
            return false;
        }
        int want = (int) Math.min(buffer.length, remaining);
        source.readFully(position, buffer, 0, want);
        position += want;
        remaining -= want;
        bufferPos = 0;
        bufferLimit = want;
        return true;
    }
}
