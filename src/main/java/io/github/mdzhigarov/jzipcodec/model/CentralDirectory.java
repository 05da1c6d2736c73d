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

import io.github.mdzhigarov.jzipcodec.UnsupportedZipFeatureException;
import io.github.mdzhigarov.jzipcodec.ZipFormatException;
import io.github.mdzhigarov.jzipcodec.io.ByteSink;
import io.github.mdzhigarov.jzipcodec.io.SeekableSource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entries of one archive in storage order, plus the trailer that located them.
 *
 * <p>Names are not unique in the ZIP format. Index lookup always identifies one
 * entry; name lookup resolves to the <em>first</em> entry with that name in
 * storage order.
 */
public final class CentralDirectory {

    private static final Logger logger = LoggerFactory.getLogger(CentralDirectory.class);

    private final List<ZipEntry> entries;
    private final EndOfCentralDirectory trailer;
    private final String comment;

    public CentralDirectory(List<ZipEntry> entries, EndOfCentralDirectory trailer, String comment) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.trailer = trailer;
        this.comment = comment;
    }

    /**
     * Code page 437, the charset of names without the UTF-8 flag, when the JDK
     * ships it; ISO-8859-1 otherwise.
     */
    public static Charset defaultLegacyCharset() {
        try {
            return Charset.forName("IBM437");
        } catch (UnsupportedCharsetException e) {
            logger.debug("IBM437 not available, decoding legacy names as ISO-8859-1");
            return StandardCharsets.ISO_8859_1;
        }
    }

    /**
     * Parses the whole directory. Either every one of the trailer's entry records
     * parses, or this throws: a partial directory is never returned.
     *
     * @param legacyCharset Charset for names, comments and the archive comment without the UTF-8 flag
     */
    public static CentralDirectory read(SeekableSource source, Charset legacyCharset) throws IOException {
        EndOfCentralDirectory eocd = EndOfCentralDirectory.find(source);
        if (eocd.hasZip64Sentinels() || hasZip64Locator(source, eocd)) {
            throw new UnsupportedZipFeatureException("ZIP64 archives are not supported");
        }
        if (eocd.isMultiDisk()) {
            throw new UnsupportedZipFeatureException(String.format(
                "Multi-disk archives are not supported (disk %d, directory disk %d, %d of %d entries on this disk)",
                eocd.getDiskNumber(), eocd.getCentralDirectoryDisk(), eocd.getEntriesOnDisk(), eocd.getTotalEntries()));
        }

        long centralDirOffset = eocd.getCentralDirectoryOffset();
        long centralDirSize = eocd.getCentralDirectorySize();
        if (centralDirSize > Integer.MAX_VALUE - 8) {
            throw new ZipFormatException("Central directory of " + centralDirSize + " bytes is too large");
        }
        logger.debug("Reading central directory: {} entries at offset {}, size {} bytes",
            eocd.getTotalEntries(), centralDirOffset, centralDirSize);

        ByteBuffer buffer = ByteBuffer.wrap(source.readFully(centralDirOffset, (int) centralDirSize))
            .order(ByteOrder.LITTLE_ENDIAN);
        List<ZipEntry> entries = new ArrayList<>(eocd.getTotalEntries());
        for (int i = 0; i < eocd.getTotalEntries(); i++) {
            ZipEntry entry = CentralDirectoryHeader.read(buffer, i, legacyCharset);
            long offset = entry.getLocalHeaderOffset();
            if (offset != ZipConstants.ZIP64_SENTINEL
                && offset + ZipConstants.LOCAL_FILE_HEADER_SIZE > centralDirOffset) {
                throw new ZipFormatException("Corrupt central directory: entry " + i + " (" + entry.getName()
                    + ") has local header offset " + offset + " beyond the entry data");
            }
            entries.add(entry);
        }
        if (buffer.hasRemaining()) {
            logger.debug("{} bytes after the last central directory record ignored", buffer.remaining());
        }

        warnOnDuplicateNames(entries);
        String comment = new String(eocd.getComment(), legacyCharset);
        return new CentralDirectory(entries, eocd, comment);
    }

    /**
     * Writes each entry's record in list order, then the trailer, at the sink's
     * current position.
     *
     * @param comment The archive comment, at most 65535 bytes
     */
    public static CentralDirectory write(ByteSink sink, List<ZipEntry> entries, byte[] comment, String decodedComment)
            throws IOException {
        if (entries.size() > ZipConstants.MAX_USHORT) {
            throw new UnsupportedZipFeatureException("Archives with more than " + ZipConstants.MAX_USHORT
                + " entries need ZIP64, which is not supported");
        }
        if (comment.length > ZipConstants.MAX_USHORT) {
            throw new IllegalArgumentException("Archive comment is " + comment.length + " bytes, maximum is "
                + ZipConstants.MAX_USHORT);
        }
        long centralDirOffset = sink.position();
        long centralDirSize = 0;
        for (ZipEntry entry : entries) {
            centralDirSize += CentralDirectoryHeader.sizeOf(entry);
        }
        if (centralDirOffset + centralDirSize >= ZipConstants.ZIP64_SENTINEL) {
            throw new UnsupportedZipFeatureException("Central directory would end beyond 4 GiB; ZIP64 is not supported");
        }

        for (ZipEntry entry : entries) {
            sink.write(CentralDirectoryHeader.toBytes(entry));
        }
        EndOfCentralDirectory eocd = EndOfCentralDirectory.of(entries.size(), centralDirSize, centralDirOffset,
            comment.clone(), sink.position());
        sink.write(eocd.toBytes());
        logger.debug("Wrote central directory: {} entries at offset {}, size {} bytes, trailer at {}",
            entries.size(), centralDirOffset, centralDirSize, eocd.getPosition());
        return new CentralDirectory(entries, eocd, decodedComment);
    }

    private static boolean hasZip64Locator(SeekableSource source, EndOfCentralDirectory eocd) throws IOException {
        long locatorPosition = eocd.getPosition() - ZipConstants.ZIP64_EOCD_LOCATOR_SIZE;
        if (locatorPosition < 0) {
            return false;
        }
        ByteBuffer signature = ByteBuffer.wrap(source.readFully(locatorPosition, 4)).order(ByteOrder.LITTLE_ENDIAN);
        return signature.getInt() == ZipConstants.ZIP64_EOCD_LOCATOR_SIGNATURE;
    }

    private static void warnOnDuplicateNames(List<ZipEntry> entries) {
        Set<String> seen = new HashSet<>();
        for (ZipEntry entry : entries) {
            if (!seen.add(entry.getName())) {
                logger.warn("Duplicate entry name '{}' at index {}; name lookup resolves to the first occurrence",
                    entry.getName(), entry.getIndex());
            }
        }
    }

    public List<ZipEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @throws IndexOutOfBoundsException If there is no entry at {@code index}
     */
    public ZipEntry getEntry(int index) {
        if (index < 0 || index >= entries.size()) {
            throw new IndexOutOfBoundsException("No entry at index " + index + " (archive has " + entries.size() + " entries)");
        }
        return entries.get(index);
    }

    /**
     * @return The first entry in storage order with this decoded name
     */
    public Optional<ZipEntry> findEntry(String name) {
        for (ZipEntry entry : entries) {
            if (entry.getName().equals(name)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The first entry in storage order whose stored name bytes equal {@code rawName}
     */
    public Optional<ZipEntry> findEntry(byte[] rawName) {
        for (ZipEntry entry : entries) {
            if (entry.rawNameEquals(rawName)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * @return Every entry with this name, in storage order
     */
    public List<ZipEntry> findAll(String name) {
        return entries.stream()
            .filter(entry -> entry.getName().equals(name))
            .collect(Collectors.toList());
    }

    public List<String> getNames() {
        return entries.stream().map(ZipEntry::getName).collect(Collectors.toList());
    }

    /**
     * @return Whether {@code entry} is this directory's own record at its index
     */
    public boolean contains(ZipEntry entry) {
        int index = entry.getIndex();
        return index >= 0 && index < entries.size() && entries.get(index) == entry;
    }

    public String getComment() {
        return comment;
    }

    public byte[] getRawComment() {
        return trailer.getComment();
    }

    public EndOfCentralDirectory getTrailer() {
        return trailer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CentralDirectory)) {
            return false;
        }
        CentralDirectory other = (CentralDirectory) o;
        return entries.equals(other.entries)
            && Arrays.equals(trailer.getComment(), other.trailer.getComment())
            && trailer.getCentralDirectoryOffset() == other.trailer.getCentralDirectoryOffset()
            && trailer.getCentralDirectorySize() == other.trailer.getCentralDirectorySize();
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return String.format("CentralDirectory{entries=%d, offset=%d, size=%d, commentLength=%d}",
            entries.size(), trailer.getCentralDirectoryOffset(), trailer.getCentralDirectorySize(), trailer.getSize() - ZipConstants.EOCD_SIZE);
    }
}
