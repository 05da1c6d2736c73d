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

import java.util.Arrays;

/**
 * An in-memory {@link SeekableByteSink}.
 */
public class ByteArraySink implements SeekableByteSink {

    private byte[] data;
    private int count;

    public ByteArraySink() {
        this(1024);
    }

    public ByteArraySink(int initialCapacity) {
        this.data = new byte[Math.max(16, initialCapacity)];
    }

    @Override
    public void write(byte[] buf, int off, int len) {
        ensureCapacity((long) count + len);
        System.arraycopy(buf, off, data, count, len);
        count += len;
    }

    @Override
    public void writeAt(long position, byte[] buf, int off, int len) {
        if (position < 0 || position + len > count) {
            throw new IndexOutOfBoundsException("Patch [" + position + ", " + (position + len)
                + ") outside written range [0, " + count + ")");
        }
        System.arraycopy(buf, off, data, (int) position, len);
    }

    @Override
    public long position() {
        return count;
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public void close() {
        // nothing to release
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(data, count);
    }

    private void ensureCapacity(long needed) {
        if (needed > Integer.MAX_VALUE - 8) {
            throw new OutOfMemoryError("ByteArraySink cannot hold " + needed + " bytes");
        }
        if (needed > data.length) {
            long grown = Math.max(needed, (long) data.length * 2);
            data = Arrays.copyOf(data, (int) Math.min(grown, Integer.MAX_VALUE - 8));
        }
    }
}
