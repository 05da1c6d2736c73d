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

package io.github.mdzhigarov.jzipcodec.impl;

import io.github.mdzhigarov.jzipcodec.UnsupportedZipFeatureException;
import io.github.mdzhigarov.jzipcodec.ZipFormatException;
import io.github.mdzhigarov.jzipcodec.ZipReader;
import io.github.mdzhigarov.jzipcodec.codec.Codec;
import io.github.mdzhigarov.jzipcodec.codec.CodecRegistry;
import io.github.mdzhigarov.jzipcodec.io.RangeInputStream;
import io.github.mdzhigarov.jzipcodec.io.SeekableSource;
import io.github.mdzhigarov.jzipcodec.model.CentralDirectory;
import io.github.mdzhigarov.jzipcodec.model.DataDescriptor;
import io.github.mdzhigarov.jzipcodec.model.LocalFileHeader;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of ZipReader over any {@link SeekableSource}.
 * The central directory is parsed once in {@link Builder#build()}; entry data is
 * only touched when an entry is opened, and then only within that entry's bounds.
 */
public class SeekableZipReader implements ZipReader {

    private static final Logger logger = LoggerFactory.getLogger(SeekableZipReader.class);

    static final int DEFAULT_BUFFER_SIZE = 8192;

    private final SeekableSource source;
    private final CodecRegistry registry;
    private final CentralDirectory directory;
    private final long fileSize;
    private final int bufferSize;
    private volatile boolean closed = false;

    private SeekableZipReader(SeekableSource source, CodecRegistry registry, CentralDirectory directory,
                              long fileSize, int bufferSize) {
        this.source = source;
        this.registry = registry;
        this.directory = directory;
        this.fileSize = fileSize;
        this.bufferSize = bufferSize;
    }

    @Override
    public CentralDirectory getDirectory() {
        return directory;
    }

    @Override
    public InputStream openEntry(ZipEntry entry) throws IOException {
        if (closed) {
            throw new IllegalStateException("ZipReader is closed");
        }
        Objects.requireNonNull(entry, "entry");
        if (!directory.contains(entry)) {
            throw new IllegalArgumentException("Entry " + entry + " does not belong to this archive");
        }

        Codec codec = codecFor(entry);
        long dataLimit = directory.getTrailer().getCentralDirectoryOffset();

        logger.debug("File entry details for {}: local header offset={}, compressed size={}, uncompressed size={}",
                    entry.getName(), entry.getLocalHeaderOffset(), entry.getCompressedSize(), entry.getUncompressedSize());

        LocalFileHeader header = LocalFileHeader.read(source, entry.getLocalHeaderOffset(), dataLimit);
        String mismatch = header.describeMismatch(entry);
        if (mismatch != null) {
            throw new ZipFormatException("Local header of entry '" + entry.getName() + "' at offset "
                + entry.getLocalHeaderOffset() + " does not match the central directory: " + mismatch);
        }
        if (header.getExtraLength() != entry.getExtra().length) {
            logger.debug("Local extra field of {} is {} bytes, central copy is {} bytes",
                entry.getName(), header.getExtraLength(), entry.getExtra().length);
        }

        long dataOffset = entry.getLocalHeaderOffset() + header.getSize();
        long dataEnd = dataOffset + entry.getCompressedSize();
        if (dataEnd > dataLimit) {
            throw new ZipFormatException("Data of entry '" + entry.getName() + "' [" + dataOffset + ", " + dataEnd
                + ") extends past the entry data region, which ends at " + dataLimit);
        }

        if (entry.hasDataDescriptor() || header.hasDataDescriptor()) {
            DataDescriptor descriptor = DataDescriptor.read(source, dataEnd, dataLimit);
            if (!descriptor.matches(entry)) {
                throw new ZipFormatException(String.format(
                    "Data descriptor of entry '%s' (crc=%08x, compressed=%d, uncompressed=%d) does not match the central directory",
                    entry.getName(), descriptor.getCrc32(), descriptor.getCompressedSize(), descriptor.getUncompressedSize()));
            }
            logger.debug("Data descriptor of {} verified ({} signature)", entry.getName(),
                descriptor.isSigned() ? "with" : "without");
        }

        if (entry.getCompressionMethod().isStored() && entry.getCompressedSize() != entry.getUncompressedSize()) {
            throw new ZipFormatException("Stored entry '" + entry.getName() + "' has compressed size "
                + entry.getCompressedSize() + " but uncompressed size " + entry.getUncompressedSize());
        }

        logger.debug("Calculated data offset: {}, data range: {}-{}", dataOffset, dataOffset, dataEnd - 1);
        InputStream compressed = new RangeInputStream(source, dataOffset, entry.getCompressedSize(), bufferSize);
        return new ZipEntryInputStream(entry, codec.newDecoder(compressed));
    }

    /**
     * Deferred per-entry checks: these make the entry's data unreadable without
     * invalidating the rest of the directory.
     */
    private Codec codecFor(ZipEntry entry) throws UnsupportedZipFeatureException {
        if (entry.isZip64()) {
            throw new UnsupportedZipFeatureException("Entry '" + entry.getName()
                + "' uses ZIP64 sizes or offsets, which are not supported");
        }
        if (entry.isEncrypted()) {
            throw new UnsupportedZipFeatureException("Entry '" + entry.getName() + "' is encrypted, which is not supported");
        }
        if (entry.getDiskNumberStart() != 0) {
            throw new UnsupportedZipFeatureException("Entry '" + entry.getName() + "' starts on disk "
                + entry.getDiskNumberStart() + "; multi-disk archives are not supported");
        }
        return registry.find(entry.getCompressionMethod())
            .orElseThrow(() -> new UnsupportedZipFeatureException("Entry '" + entry.getName()
                + "' uses unsupported compression method " + entry.getCompressionMethod().getCode()));
    }

    @Override
    public long getSize() {
        return fileSize;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        source.close();
    }

    /**
     * Builder class for creating SeekableZipReader instances.
     */
    public static class Builder implements ZipReader.Builder {
        private final SeekableSource source;
        private CodecRegistry registry;
        private Charset legacyCharset;
        private int bufferSize = DEFAULT_BUFFER_SIZE;

        public Builder(SeekableSource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        @Override
        public Builder withCodecRegistry(CodecRegistry registry) {
            this.registry = registry;
            return this;
        }

        @Override
        public Builder withLegacyCharset(Charset charset) {
            this.legacyCharset = charset;
            return this;
        }

        @Override
        public Builder withBufferSize(int bufferSize) {
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
            }
            this.bufferSize = bufferSize;
            return this;
        }

        @Override
        public ZipReader build() throws IOException {
            CodecRegistry codecs = registry != null ? registry : CodecRegistry.defaults();
            Charset charset = legacyCharset != null ? legacyCharset : CentralDirectory.defaultLegacyCharset();

            long fileSize = source.size();
            logger.debug("Finding End of Central Directory record in {} byte archive...", fileSize);
            CentralDirectory directory = CentralDirectory.read(source, charset);
            logger.debug("Parsed {} file entries", directory.size());
            return new SeekableZipReader(source, codecs, directory, fileSize, bufferSize);
        }
    }
}
