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
 * The header written immediately before each entry's data.
 */
public final class LocalFileHeader {

    /** Offset of the CRC-32 field; compressed and uncompressed size follow it. */
    public static final int CRC_OFFSET = 14;

    private final int versionNeeded;
    private final int flags;
    private final int methodCode;
    private final int dosTime;
    private final int dosDate;
    private final long crc32;
    private final long compressedSize;
    private final long uncompressedSize;
    private final byte[] rawName;
    private final byte[] extra;

    public LocalFileHeader(int versionNeeded, int flags, int methodCode, int dosTime, int dosDate,
                           long crc32, long compressedSize, long uncompressedSize, byte[] rawName, byte[] extra) {
        this.versionNeeded = versionNeeded;
        this.flags = flags;
        this.methodCode = methodCode;
        this.dosTime = dosTime;
        this.dosDate = dosDate;
        this.crc32 = crc32;
        this.compressedSize = compressedSize;
        this.uncompressedSize = uncompressedSize;
        this.rawName = rawName;
        this.extra = extra;
    }

    /**
     * Reads the header at {@code offset}. The fixed part, name and extra field must
     * all end at or before {@code limit}, the start of the central directory.
     */
    public static LocalFileHeader read(SeekableSource source, long offset, long limit) throws IOException {
        if (offset < 0 || offset + ZipConstants.LOCAL_FILE_HEADER_SIZE > limit) {
            throw new ZipFormatException("Local file header at offset " + offset + " lies outside the entry data region");
        }
        ByteBuffer buffer = ByteBuffer.wrap(source.readFully(offset, ZipConstants.LOCAL_FILE_HEADER_SIZE))
            .order(ByteOrder.LITTLE_ENDIAN);

        int signature = buffer.getInt();
        if (signature != ZipConstants.LOCAL_FILE_HEADER_SIGNATURE) {
            throw new ZipFormatException(String.format("Invalid local file header signature 0x%08x at offset %d", signature, offset));
        }
        int versionNeeded = buffer.getShort() & 0xFFFF;
        int flags = buffer.getShort() & 0xFFFF;
        int methodCode = buffer.getShort() & 0xFFFF;
        int dosTime = buffer.getShort() & 0xFFFF;
        int dosDate = buffer.getShort() & 0xFFFF;
        long crc32 = buffer.getInt() & 0xFFFFFFFFL;
        long compressedSize = buffer.getInt() & 0xFFFFFFFFL;
        long uncompressedSize = buffer.getInt() & 0xFFFFFFFFL;
        int nameLength = buffer.getShort() & 0xFFFF;
        int extraLength = buffer.getShort() & 0xFFFF;

        long variableStart = offset + ZipConstants.LOCAL_FILE_HEADER_SIZE;
        if (variableStart + nameLength + extraLength > limit) {
            throw new ZipFormatException("Local file header at offset " + offset + " is truncated");
        }
        byte[] variable = source.readFully(variableStart, nameLength + extraLength);
        byte[] rawName = new byte[nameLength];
        byte[] extra = new byte[extraLength];
        System.arraycopy(variable, 0, rawName, 0, nameLength);
        System.arraycopy(variable, nameLength, extra, 0, extraLength);

        return new LocalFileHeader(versionNeeded, flags, methodCode, dosTime, dosDate,
            crc32, compressedSize, uncompressedSize, rawName, extra);
    }

    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(getSize()).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(ZipConstants.LOCAL_FILE_HEADER_SIGNATURE);
        buffer.putShort((short) versionNeeded);
        buffer.putShort((short) flags);
        buffer.putShort((short) methodCode);
        buffer.putShort((short) dosTime);
        buffer.putShort((short) dosDate);
        buffer.putInt((int) crc32);
        buffer.putInt((int) compressedSize);
        buffer.putInt((int) uncompressedSize);
        buffer.putShort((short) rawName.length);
        buffer.putShort((short) extra.length);
        buffer.put(rawName);
        buffer.put(extra);
        return buffer.array();
    }

    /**
     * @return The 12 bytes stored at {@link #CRC_OFFSET}: CRC-32, compressed size, uncompressed size
     */
    public static byte[] encodeChecksumAndSizes(long crc32, long compressedSize, long uncompressedSize) {
        ByteBuffer buffer = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt((int) crc32);
        buffer.putInt((int) compressedSize);
        buffer.putInt((int) uncompressedSize);
        return buffer.array();
    }

    public int getSize() {
        return ZipConstants.LOCAL_FILE_HEADER_SIZE + rawName.length + extra.length;
    }

    public int getVersionNeeded() {
        return versionNeeded;
    }

    public int getFlags() {
        return flags;
    }

    public boolean hasDataDescriptor() {
        return (flags & ZipConstants.FLAG_DATA_DESCRIPTOR) != 0;
    }

    public int getMethodCode() {
        return methodCode;
    }

    public int getDosTime() {
        return dosTime;
    }

    public int getDosDate() {
        return dosDate;
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

    public byte[] getRawName() {
        return rawName.clone();
    }

    public int getExtraLength() {
        return extra.length;
    }

    /**
     * Compares the name, method and (unless sizes are deferred to a data descriptor)
     * the checksum and sizes against the central directory copy of the same entry.
     *
     * @return A description of the first disagreement, or {@code null} if the two agree
     */
    public String describeMismatch(ZipEntry entry) {
        if (!entry.rawNameEquals(rawName)) {
            return "name differs from central directory";
        }
        if (methodCode != entry.getCompressionMethod().getCode()) {
            return "compression method " + methodCode + " differs from central directory ("
                + entry.getCompressionMethod().getCode() + ")";
        }
        if (hasDataDescriptor()) {
            // Values written before the data was known are zero; anything else must still agree.
            if (!zeroOrEqual(crc32, entry.getCrc32())
                || !zeroOrEqual(compressedSize, entry.getCompressedSize())
                || !zeroOrEqual(uncompressedSize, entry.getUncompressedSize())) {
                return "checksum or sizes differ from central directory";
            }
            return null;
        }
        if (crc32 != entry.getCrc32()) {
            return String.format("CRC-32 %08x differs from central directory (%08x)", crc32, entry.getCrc32());
        }
        if (compressedSize != entry.getCompressedSize()) {
            return "compressed size " + compressedSize + " differs from central directory (" + entry.getCompressedSize() + ")";
        }
        if (uncompressedSize != entry.getUncompressedSize()) {
            return "uncompressed size " + uncompressedSize + " differs from central directory (" + entry.getUncompressedSize() + ")";
        }
        return null;
    }

    private static boolean zeroOrEqual(long local, long central) {
        return local == 0 || local == central;
    }
}
