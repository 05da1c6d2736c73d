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

import io.github.mdzhigarov.jzipcodec.ZipFormatException;
import io.github.mdzhigarov.jzipcodec.io.SeekableSource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The record that follows an entry's data when general purpose bit 3 is set.
 * Written with its optional signature; read with or without it.
 */
public final class DataDescriptor {

    public static final int SIZE_WITH_SIGNATURE = 16;
    public static final int SIZE_WITHOUT_SIGNATURE = 12;

    private final long crc32;
    private final long compressedSize;
    private final long uncompressedSize;
    private final boolean signed;

    public DataDescriptor(long crc32, long compressedSize, long uncompressedSize) {
        this(crc32, compressedSize, uncompressedSize, true);
    }

    private DataDescriptor(long crc32, long compressedSize, long uncompressedSize, boolean signed) {
        this.crc32 = crc32;
        this.compressedSize = compressedSize;
        this.uncompressedSize = uncompressedSize;
        this.signed = signed;
    }

    /**
     * Reads the descriptor at {@code position}, which must end at or before {@code limit}.
     */
    public static DataDescriptor read(SeekableSource source, long position, long limit) throws IOException {
        long available = limit - position;
        if (available < SIZE_WITHOUT_SIGNATURE) {
            throw new ZipFormatException("Data descriptor at offset " + position + " is truncated");
        }
        int length = (int) Math.min(SIZE_WITH_SIGNATURE, available);
        ByteBuffer buffer = ByteBuffer.wrap(source.readFully(position, length)).order(ByteOrder.LITTLE_ENDIAN);
        boolean signed = length == SIZE_WITH_SIGNATURE && buffer.getInt(0) == ZipConstants.DATA_DESCRIPTOR_SIGNATURE;
        buffer.position(signed ? 4 : 0);
        long crc32 = buffer.getInt() & 0xFFFFFFFFL;
        long compressedSize = buffer.getInt() & 0xFFFFFFFFL;
        long uncompressedSize = buffer.getInt() & 0xFFFFFFFFL;
        return new DataDescriptor(crc32, compressedSize, uncompressedSize, signed);
    }

    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(SIZE_WITH_SIGNATURE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(ZipConstants.DATA_DESCRIPTOR_SIGNATURE);
        buffer.putInt((int) crc32);
        buffer.putInt((int) compressedSize);
        buffer.putInt((int) uncompressedSize);
        return buffer.array();
    }

    public boolean matches(ZipEntry entry) {
        return crc32 == entry.getCrc32()
            && compressedSize == entry.getCompressedSize()
            && uncompressedSize == entry.getUncompressedSize();
    }

    public long getCrc32() {
        return crc32;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public long getUncompressedSize() {
        return uncompressedSize;
    }

    public boolean isSigned() {
        return signed;
    }
}
