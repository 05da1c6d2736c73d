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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The end of central directory record (the trailer): where the directory is,
 * how big it is, how many entries it holds, and the archive comment.
 */
public final class EndOfCentralDirectory {

    private static final Logger logger = LoggerFactory.getLogger(EndOfCentralDirectory.class);

    /** The trailer is the fixed record plus a comment of at most 65535 bytes. */
    static final int MAX_SIZE = ZipConstants.EOCD_SIZE + ZipConstants.MAX_USHORT;

    private final int diskNumber;
    private final int centralDirectoryDisk;
    private final int entriesOnDisk;
    private final int totalEntries;
    private final long centralDirectorySize;
    private final long centralDirectoryOffset;
    private final byte[] comment;
    private final long position;

    private EndOfCentralDirectory(int diskNumber, int centralDirectoryDisk, int entriesOnDisk, int totalEntries,
                                  long centralDirectorySize, long centralDirectoryOffset, byte[] comment, long position) {
        this.diskNumber = diskNumber;
        this.centralDirectoryDisk = centralDirectoryDisk;
        this.entriesOnDisk = entriesOnDisk;
        this.totalEntries = totalEntries;
        this.centralDirectorySize = centralDirectorySize;
        this.centralDirectoryOffset = centralDirectoryOffset;
        this.comment = comment;
        this.position = position;
    }

    /**
     * Describes a single-disk archive whose trailer is written at {@code position}.
     */
    public static EndOfCentralDirectory of(int totalEntries, long centralDirectorySize, long centralDirectoryOffset,
                                           byte[] comment, long position) {
        return new EndOfCentralDirectory(0, 0, totalEntries, totalEntries,
            centralDirectorySize, centralDirectoryOffset, comment, position);
    }

    /**
     * Finds the trailer by scanning backwards from the end of the source, over at most
     * the largest possible trailer. A signature only counts if its comment length
     * reaches exactly to the end of the source, so signature bytes inside a comment
     * are skipped. Among those, the last one whose directory lies before it wins.
     *
     * @throws ZipFormatException If no candidate exists ("trailer not found"), or
     * candidates exist but each points outside the archive ("truncated directory")
     */
    public static EndOfCentralDirectory find(SeekableSource source) throws IOException {
        long fileSize = source.size();
        if (fileSize < ZipConstants.EOCD_SIZE) {
            throw new ZipFormatException("End of central directory trailer not found: source is only " + fileSize + " bytes");
        }

        int sizeToRead = (int) Math.min(fileSize, MAX_SIZE);
        long windowStart = fileSize - sizeToRead;
        logger.debug("Searching for EOCD in last {} bytes (range: {}-{})", sizeToRead, windowStart, fileSize - 1);

        ByteBuffer buffer = ByteBuffer.wrap(source.readFully(windowStart, sizeToRead)).order(ByteOrder.LITTLE_ENDIAN);
        EndOfCentralDirectory outOfBounds = null;
        for (int i = sizeToRead - ZipConstants.EOCD_SIZE; i >= 0; i--) {
            if (buffer.getInt(i) != ZipConstants.EOCD_SIGNATURE) {
                continue;
            }
            int commentLength = buffer.getShort(i + 20) & 0xFFFF;
            if (i + ZipConstants.EOCD_SIZE + commentLength != sizeToRead) {
                logger.debug("Ignoring EOCD signature at {}: comment length {} does not reach end of source",
                    windowStart + i, commentLength);
                continue;
            }
            EndOfCentralDirectory candidate = parse(buffer, i, windowStart + i);
            if (candidate.hasZip64Sentinels()) {
                return candidate;
            }
            if (candidate.centralDirectoryOffset + candidate.centralDirectorySize <= candidate.position) {
                logger.debug("EOCD parsed at {} - Total entries: {}, Central dir size: {}, Central dir offset: {}",
                    candidate.position, candidate.totalEntries, candidate.centralDirectorySize, candidate.centralDirectoryOffset);
                return candidate;
            }
            logger.debug("Ignoring EOCD at {}: central directory [{}, {}) extends past it", candidate.position,
                candidate.centralDirectoryOffset, candidate.centralDirectoryOffset + candidate.centralDirectorySize);
            if (outOfBounds == null) {
                outOfBounds = candidate;
            }
        }

        if (outOfBounds != null) {
            throw new ZipFormatException(String.format(
                "Truncated central directory: trailer at %d declares directory at offset %d with size %d in a %d byte archive",
                outOfBounds.position, outOfBounds.centralDirectoryOffset, outOfBounds.centralDirectorySize, fileSize));
        }
        throw new ZipFormatException("End of central directory trailer not found");
    }

    private static EndOfCentralDirectory parse(ByteBuffer buffer, int at, long position) {
        ByteBuffer record = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        record.position(at + 4);
        int diskNumber = record.getShort() & 0xFFFF;
        int centralDirectoryDisk = record.getShort() & 0xFFFF;
        int entriesOnDisk = record.getShort() & 0xFFFF;
        int totalEntries = record.getShort() & 0xFFFF;
        long centralDirectorySize = record.getInt() & 0xFFFFFFFFL;
        long centralDirectoryOffset = record.getInt() & 0xFFFFFFFFL;
        int commentLength = record.getShort() & 0xFFFF;
        byte[] comment = new byte[commentLength];
        record.get(comment);
        return new EndOfCentralDirectory(diskNumber, centralDirectoryDisk, entriesOnDisk, totalEntries,
            centralDirectorySize, centralDirectoryOffset, comment, position);
    }

    public byte[] toBytes() {
        ByteBuffer eocd = ByteBuffer.allocate(getSize()).order(ByteOrder.LITTLE_ENDIAN);
        eocd.putInt(ZipConstants.EOCD_SIGNATURE);
        eocd.putShort((short) diskNumber);
        eocd.putShort((short) centralDirectoryDisk);
        eocd.putShort((short) entriesOnDisk);
        eocd.putShort((short) totalEntries);
        eocd.putInt((int) centralDirectorySize);
        eocd.putInt((int) centralDirectoryOffset);
        eocd.putShort((short) comment.length);
        eocd.put(comment);
        return eocd.array();
    }

    /**
     * @return Whether the directory size or offset holds the ZIP64 sentinel
     */
    public boolean hasZip64Sentinels() {
        return centralDirectorySize == ZipConstants.ZIP64_SENTINEL
            || centralDirectoryOffset == ZipConstants.ZIP64_SENTINEL;
    }

    public boolean isMultiDisk() {
        return diskNumber != 0 || centralDirectoryDisk != 0 || entriesOnDisk != totalEntries;
    }

    public int getSize() {
        return ZipConstants.EOCD_SIZE + comment.length;
    }

    public int getDiskNumber() {
        return diskNumber;
    }

    public int getCentralDirectoryDisk() {
        return centralDirectoryDisk;
    }

    public int getEntriesOnDisk() {
        return entriesOnDisk;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    public long getCentralDirectorySize() {
        return centralDirectorySize;
    }

    public long getCentralDirectoryOffset() {
        return centralDirectoryOffset;
    }

    public byte[] getComment() {
        return comment.clone();
    }

    /**
     * @return Offset of the trailer's signature within the archive
     */
    public long getPosition() {
        return position;
    }
}
