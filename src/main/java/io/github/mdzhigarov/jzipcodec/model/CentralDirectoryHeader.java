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
import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Reads and writes the per-entry records of the central directory.
 */
public final class CentralDirectoryHeader {

    private CentralDirectoryHeader() {
    }

    /**
     * Parses one record at the buffer's position and advances past it.
     *
     * @param legacyCharset Charset for names and comments without the UTF-8 flag
     */
    public static ZipEntry read(ByteBuffer buffer, int index, Charset legacyCharset) throws ZipFormatException {
        int recordStart = buffer.position();
        if (buffer.remaining() < ZipConstants.CENTRAL_DIRECTORY_HEADER_SIZE) {
            throw new ZipFormatException("Corrupt central directory: record " + index + " is truncated");
        }
        int signature = buffer.getInt();
        if (signature != ZipConstants.CENTRAL_DIRECTORY_SIGNATURE) {
            throw new ZipFormatException(String.format(
                "Corrupt central directory: record %d has signature 0x%08x at directory offset %d", index, signature, recordStart));
        }

        int versionMadeBy = buffer.getShort() & 0xFFFF;
        int versionNeeded = buffer.getShort() & 0xFFFF;
        int flags = buffer.getShort() & 0xFFFF;
        int methodCode = buffer.getShort() & 0xFFFF;
        int dosTime = buffer.getShort() & 0xFFFF;
        int dosDate = buffer.getShort() & 0xFFFF;
        long crc32 = buffer.getInt() & 0xFFFFFFFFL;
        long compressedSize = buffer.getInt() & 0xFFFFFFFFL;
        long uncompressedSize = buffer.getInt() & 0xFFFFFFFFL;
        int fileNameLength = buffer.getShort() & 0xFFFF;
        int extraFieldLength = buffer.getShort() & 0xFFFF;
        int fileCommentLength = buffer.getShort() & 0xFFFF;
        int diskNumberStart = buffer.getShort() & 0xFFFF;
        int internalAttributes = buffer.getShort() & 0xFFFF;
        long externalAttributes = buffer.getInt() & 0xFFFFFFFFL;
        long localHeaderOffset = buffer.getInt() & 0xFFFFFFFFL;

        if (buffer.remaining() < fileNameLength + extraFieldLength + fileCommentLength) {
            throw new ZipFormatException("Corrupt central directory: record " + index + " is truncated");
        }
        byte[] rawName = new byte[fileNameLength];
        buffer.get(rawName);
        byte[] extra = new byte[extraFieldLength];
        buffer.get(extra);
        byte[] rawComment = new byte[fileCommentLength];
        buffer.get(rawComment);

        boolean utf8 = (flags & ZipConstants.FLAG_UTF8) != 0;
        Charset charset = utf8 ? StandardCharsets.UTF_8 : legacyCharset;

        return ZipEntry.builder()
            .index(index)
            .name(rawName, new String(rawName, charset))
            .versionMadeBy(versionMadeBy)
            .versionNeeded(versionNeeded)
            .flags(flags)
            .method(CompressionMethod.of(methodCode))
            .dosDateTime(dosDate, dosTime)
            .crc32(crc32)
            .compressedSize(compressedSize)
            .uncompressedSize(uncompressedSize)
            .diskNumberStart(diskNumberStart)
            .internalAttributes(internalAttributes)
            .externalAttributes(externalAttributes)
            .localHeaderOffset(localHeaderOffset)
            .extra(extra)
            .comment(rawComment, new String(rawComment, charset))
            .build();
    }

    public static int sizeOf(ZipEntry entry) {
        return ZipConstants.CENTRAL_DIRECTORY_HEADER_SIZE
            + entry.rawNameBytes().length + entry.getExtraLength() + entry.rawCommentBytes().length;
    }

    public static byte[] toBytes(ZipEntry entry) {
        ByteBuffer buffer = ByteBuffer.allocate(sizeOf(entry)).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(ZipConstants.CENTRAL_DIRECTORY_SIGNATURE);
        buffer.putShort((short) entry.getVersionMadeBy());
        buffer.putShort((short) entry.getVersionNeeded());
        buffer.putShort((short) entry.getFlags());
        buffer.putShort((short) entry.getCompressionMethod().getCode());
        buffer.putShort((short) entry.getDosTime());
        buffer.putShort((short) entry.getDosDate());
        buffer.putInt((int) entry.getCrc32());
        buffer.putInt((int) entry.getCompressedSize());
        buffer.putInt((int) entry.getUncompressedSize());
        buffer.putShort((short) entry.rawNameBytes().length);
        buffer.putShort((short) entry.getExtraLength());
        buffer.putShort((short) entry.rawCommentBytes().length);
        buffer.putShort((short) 0); // disk number start
        buffer.putShort((short) entry.getInternalAttributes());
        buffer.putInt((int) entry.getExternalAttributes());
        buffer.putInt((int) entry.getLocalHeaderOffset());
        buffer.put(entry.rawNameBytes());
        buffer.put(entry.extraBytes());
        buffer.put(entry.rawCommentBytes());
        return buffer.array();
    }
}
