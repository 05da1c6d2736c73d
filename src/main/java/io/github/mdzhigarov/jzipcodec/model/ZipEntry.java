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

import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a file entry within a ZIP archive, as recorded in the central directory.
 * Contains all the metadata needed to locate, extract and verify the entry.
 * Instances are immutable.
 */
public final class ZipEntry {
    private final int index;
    private final byte[] rawName;
    private final String name;
    private final int versionMadeBy;
    private final int versionNeeded;
    private final int flags;
    private final CompressionMethod method;
    private final int dosTime;
    private final int dosDate;
    private final long crc32;
    private final long compressedSize;
    private final long uncompressedSize;
    private final int diskNumberStart;
    private final int internalAttributes;
    private final long externalAttributes;
    private final long localHeaderOffset;
    private final byte[] extra;
    private final byte[] rawComment;
    private final String comment;

    private ZipEntry(Builder builder) {
        this.index = builder.index;
        this.rawName = builder.rawName;
        this.name = builder.name != null ? builder.name : new String(builder.rawName, StandardCharsets.UTF_8);
        this.versionMadeBy = builder.versionMadeBy;
        this.versionNeeded = builder.versionNeeded;
        this.flags = builder.flags;
        this.method = builder.method;
        this.dosTime = builder.dosTime;
        this.dosDate = builder.dosDate;
        this.crc32 = builder.crc32;
        this.compressedSize = builder.compressedSize;
        this.uncompressedSize = builder.uncompressedSize;
        this.diskNumberStart = builder.diskNumberStart;
        this.internalAttributes = builder.internalAttributes;
        this.externalAttributes = builder.externalAttributes;
        this.localHeaderOffset = builder.localHeaderOffset;
        this.extra = builder.extra;
        this.rawComment = builder.rawComment;
        this.comment = builder.comment != null ? builder.comment : new String(builder.rawComment, StandardCharsets.UTF_8);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The position of this entry in the central directory, starting at 0
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return The decoded name of the file in the ZIP archive
     */
    public String getName() {
        return name;
    }

    /**
     * @return A copy of the name exactly as stored in the archive
     */
    public byte[] getRawName() {
        return rawName.clone();
    }

    boolean rawNameEquals(byte[] other) {
        return Arrays.equals(rawName, other);
    }

    /**
     * @return Whether general purpose bit 11 marks the name and comment as UTF-8
     */
    public boolean isUtf8() {
        return (flags & ZipConstants.FLAG_UTF8) != 0;
    }

    public int getFlags() {
        return flags;
    }

    /**
     * @return Whether the entry's data is followed by a data descriptor
     */
    public boolean hasDataDescriptor() {
        return (flags & ZipConstants.FLAG_DATA_DESCRIPTOR) != 0;
    }

    public boolean isEncrypted() {
        return (flags & (ZipConstants.FLAG_ENCRYPTED | ZipConstants.FLAG_STRONG_ENCRYPTION)) != 0;
    }

    public CompressionMethod getCompressionMethod() {
        return method;
    }

    public int getVersionMadeBy() {
        return versionMadeBy;
    }

    public int getVersionNeeded() {
        return versionNeeded;
    }

    public int getDosTime() {
        return dosTime;
    }

    public int getDosDate() {
        return dosDate;
    }

    /**
     * @return The last modification time, at the 2-second resolution of the format
     */
    public LocalDateTime getLastModifiedTime() {
        return DosTime.toLocalDateTime(dosDate, dosTime);
    }

    /**
     * @return The CRC32 checksum of the uncompressed data
     */
    public long getCrc32() {
        return crc32;
    }

    /**
     * @return The size of the compressed data in bytes
     */
    public long getCompressedSize() {
        return compressedSize;
    }

    /**
     * @return The size of the uncompressed data in bytes
     */
    public long getUncompressedSize() {
        return uncompressedSize;
    }

    public int getDiskNumberStart() {
        return diskNumberStart;
    }

    public int getInternalAttributes() {
        return internalAttributes;
    }

    public long getExternalAttributes() {
        return externalAttributes;
    }

    /**
     * @return The offset to the local file header from the beginning of the ZIP file
     */
    public long getLocalHeaderOffset() {
        return localHeaderOffset;
    }

    /**
     * @return A copy of the central directory extra field
     */
    public byte[] getExtra() {
        return extra.clone();
    }

    int getExtraLength() {
        return extra.length;
    }

    byte[] extraBytes() {
        return extra;
    }

    byte[] rawNameBytes() {
        return rawName;
    }

    byte[] rawCommentBytes() {
        return rawComment;
    }

    public String getComment() {
        return comment;
    }

    public byte[] getRawComment() {
        return rawComment.clone();
    }

    /**
     * @return Whether this entry represents a directory
     */
    public boolean isDirectory() {
        return name.endsWith("/") || (externalAttributes & ZipConstants.DOS_DIRECTORY_ATTRIBUTE) != 0;
    }

    /**
     * @return Whether a size or offset field holds the ZIP64 sentinel, or the extra
     * field carries a ZIP64 record. The data of such an entry cannot be opened.
     */
    public boolean isZip64() {
        return compressedSize == ZipConstants.ZIP64_SENTINEL
            || uncompressedSize == ZipConstants.ZIP64_SENTINEL
            || localHeaderOffset == ZipConstants.ZIP64_SENTINEL
            || ExtraFields.containsZip64(extra);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZipEntry)) {
            return false;
        }
        ZipEntry other = (ZipEntry) o;
        return index == other.index
            && versionMadeBy == other.versionMadeBy
            && versionNeeded == other.versionNeeded
            && flags == other.flags
            && dosTime == other.dosTime
            && dosDate == other.dosDate
            && crc32 == other.crc32
            && compressedSize == other.compressedSize
            && uncompressedSize == other.uncompressedSize
            && diskNumberStart == other.diskNumberStart
            && internalAttributes == other.internalAttributes
            && externalAttributes == other.externalAttributes
            && localHeaderOffset == other.localHeaderOffset
            && method.equals(other.method)
            && name.equals(other.name)
            && Arrays.equals(rawName, other.rawName)
            && Arrays.equals(extra, other.extra)
            && Arrays.equals(rawComment, other.rawComment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name, method, crc32, compressedSize, uncompressedSize, localHeaderOffset);
    }

    @Override
    public String toString() {
        return String.format("ZipEntry{index=%d, name='%s', offset=%d, compressedSize=%d, uncompressedSize=%d, method=%s, crc32=%08x}",
                index, name, localHeaderOffset, compressedSize, uncompressedSize, method, crc32);
    }

    /**
     * Builder for entries parsed from a central directory or produced by a writer.
     */
    public static final class Builder {
        private int index;
        private byte[] rawName = new byte[0];
        private String name;
        private int versionMadeBy = ZipConstants.VERSION_MADE_BY;
        private int versionNeeded = ZipConstants.VERSION_STORED;
        private int flags;
        private CompressionMethod method = CompressionMethod.STORED;
        private int dosTime;
        private int dosDate = 0x21; // 1980-01-01
        private long crc32;
        private long compressedSize;
        private long uncompressedSize;
        private int diskNumberStart;
        private int internalAttributes;
        private long externalAttributes;
        private long localHeaderOffset;
        private byte[] extra = new byte[0];
        private byte[] rawComment = new byte[0];
        private String comment;

        private Builder() {
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        /**
         * @param rawName The name bytes as stored; not copied
         * @param name The decoded name
         */
        public Builder name(byte[] rawName, String name) {
            this.rawName = Objects.requireNonNull(rawName, "rawName");
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder versionMadeBy(int versionMadeBy) {
            this.versionMadeBy = versionMadeBy;
            return this;
        }

        public Builder versionNeeded(int versionNeeded) {
            this.versionNeeded = versionNeeded;
            return this;
        }

        public Builder flags(int flags) {
            this.flags = flags;
            return this;
        }

        public Builder method(CompressionMethod method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder dosDateTime(int dosDate, int dosTime) {
            this.dosDate = dosDate;
            this.dosTime = dosTime;
            return this;
        }

        public Builder crc32(long crc32) {
            this.crc32 = crc32;
            return this;
        }

        public Builder compressedSize(long compressedSize) {
            this.compressedSize = compressedSize;
            return this;
        }

        public Builder uncompressedSize(long uncompressedSize) {
            this.uncompressedSize = uncompressedSize;
            return this;
        }

        public Builder diskNumberStart(int diskNumberStart) {
            this.diskNumberStart = diskNumberStart;
            return this;
        }

        public Builder internalAttributes(int internalAttributes) {
            this.internalAttributes = internalAttributes;
            return this;
        }

        public Builder externalAttributes(long externalAttributes) {
            this.externalAttributes = externalAttributes;
            return this;
        }

        public Builder localHeaderOffset(long localHeaderOffset) {
            this.localHeaderOffset = localHeaderOffset;
            return this;
        }

        /**
         * @param extra Extra field bytes; not copied
         */
        public Builder extra(byte[] extra) {
            this.extra = Objects.requireNonNull(extra, "extra");
            return this;
        }

        /**
         * @param rawComment The comment bytes as stored; not copied
         * @param comment The decoded comment
         */
        public Builder comment(byte[] rawComment, String comment) {
            this.rawComment = Objects.requireNonNull(rawComment, "rawComment");
            this.comment = Objects.requireNonNull(comment, "comment");
            return this;
        }

        public ZipEntry build() {
            return new ZipEntry(this);
        }
    }
}
