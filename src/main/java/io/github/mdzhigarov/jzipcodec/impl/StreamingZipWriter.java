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

import io.github.mdzhigarov.jzipcodec.EntryInProgressException;
import io.github.mdzhigarov.jzipcodec.EntryOptions;
import io.github.mdzhigarov.jzipcodec.UnsupportedZipFeatureException;
import io.github.mdzhigarov.jzipcodec.WriterClosedException;
import io.github.mdzhigarov.jzipcodec.ZipIntegrityException;
import io.github.mdzhigarov.jzipcodec.ZipWriter;
import io.github.mdzhigarov.jzipcodec.checksum.Crc32;
import io.github.mdzhigarov.jzipcodec.codec.Codec;
import io.github.mdzhigarov.jzipcodec.codec.CodecRegistry;
import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import io.github.mdzhigarov.jzipcodec.codec.EncoderOutputStream;
import io.github.mdzhigarov.jzipcodec.io.ByteSink;
import io.github.mdzhigarov.jzipcodec.io.SeekableByteSink;
import io.github.mdzhigarov.jzipcodec.io.SinkOutputStream;
import io.github.mdzhigarov.jzipcodec.model.CentralDirectory;
import io.github.mdzhigarov.jzipcodec.model.DataDescriptor;
import io.github.mdzhigarov.jzipcodec.model.DosTime;
import io.github.mdzhigarov.jzipcodec.model.ExtraFields;
import io.github.mdzhigarov.jzipcodec.model.LocalFileHeader;
import io.github.mdzhigarov.jzipcodec.model.ZipConstants;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of ZipWriter over a {@link ByteSink}. Not thread-safe.
 *
 * <p>Every check that can reject a call runs before anything is written, so a
 * rejected call leaves the output untouched. A failure of the sink itself, or a
 * size that outgrows the 32-bit fields, leaves the output unrecoverable; the
 * writer then refuses every further call with {@link WriterClosedException}.
 */
public class StreamingZipWriter implements ZipWriter {

    private static final Logger logger = LoggerFactory.getLogger(StreamingZipWriter.class);

    private final ByteSink sink;
    private final CodecRegistry registry;
    private final CompressionMethod defaultMethod;
    private final boolean closeSink;
    private final List<ZipEntry> entries = new ArrayList<>();

    private byte[] comment;
    private State state = State.IDLE;
    private OpenEntry current;
    private boolean failed;
    private boolean closed;

    private StreamingZipWriter(ByteSink sink, CodecRegistry registry, CompressionMethod defaultMethod,
                               byte[] comment, boolean closeSink) {
        this.sink = sink;
        this.registry = registry;
        this.defaultMethod = defaultMethod;
        this.closeSink = closeSink;
        this.comment = comment;
    }

    @Override
    public OutputStream startEntry(String name, EntryOptions options) throws IOException {
        Objects.requireNonNull(name, "name");
        byte[] rawName = name.getBytes(StandardCharsets.UTF_8);
        String entryComment = options.getComment().orElse("");
        byte[] rawComment = entryComment.getBytes(StandardCharsets.UTF_8);
        boolean ascii = rawName.length == name.length() && rawComment.length == entryComment.length();
        return begin(rawName, name, rawComment, entryComment, ascii ? 0 : ZipConstants.FLAG_UTF8, options);
    }

    @Override
    public OutputStream startEntry(byte[] rawName, EntryOptions options) throws IOException {
        Objects.requireNonNull(rawName, "rawName");
        Charset legacy = CentralDirectory.defaultLegacyCharset();
        String entryComment = options.getComment().orElse("");
        return begin(rawName.clone(), new String(rawName, legacy), entryComment.getBytes(legacy), entryComment, 0,
            options);
    }

    private OutputStream begin(byte[] rawName, String name, byte[] rawComment, String entryComment, int nameFlags,
                               EntryOptions options) throws IOException {
        ensureWritable();
        if (state == State.ENTRY_OPEN) {
            throw new EntryInProgressException("Entry '" + current.name + "' is still open; finish it before starting '"
                + name + "'");
        }
        byte[] extra = options.getExtra();
        checkFieldLength("Entry name", rawName.length);
        checkFieldLength("Extra field", extra.length);
        checkFieldLength("Entry comment", rawComment.length);
        if (ExtraFields.containsZip64(extra)) {
            throw new IllegalArgumentException("Extra field of '" + name + "' contains a ZIP64 record, which cannot be written");
        }

        CompressionMethod method = options.getMethod().orElse(defaultMethod);
        Codec codec = registry.find(method)
            .orElseThrow(() -> new UnsupportedZipFeatureException("No codec registered for compression method " + method));
        boolean precomputed = options.hasPrecomputed();
        if (precomputed && !method.isStored()) {
            throw new IllegalArgumentException("Precomputed checksum and size apply to stored entries only, not " + method);
        }
        if (precomputed && options.getPrecomputedSize() >= ZipConstants.ZIP64_SENTINEL) {
            throw new UnsupportedZipFeatureException("Entry '" + name + "' of " + options.getPrecomputedSize()
                + " bytes needs ZIP64, which is not supported");
        }
        long headerOffset = sink.position();
        if (headerOffset >= ZipConstants.ZIP64_SENTINEL) {
            failed = true;
            throw new UnsupportedZipFeatureException("Entry '" + name + "' would start at offset " + headerOffset
                + "; ZIP64 is not supported");
        }

        boolean descriptor = !precomputed && !(sink instanceof SeekableByteSink);
        int flags = nameFlags | (descriptor ? ZipConstants.FLAG_DATA_DESCRIPTOR : 0);
        int versionNeeded = method.isStored() && !descriptor ? ZipConstants.VERSION_STORED : ZipConstants.VERSION_DEFLATE;
        int packed = DosTime.pack(options.getLastModified().orElseGet(LocalDateTime::now));
        int dosDate = DosTime.date(packed);
        int dosTime = DosTime.time(packed);
        long crc = precomputed ? options.getPrecomputedCrc() : 0;
        long size = precomputed ? options.getPrecomputedSize() : 0;
        long attributes = options.getExternalAttributes()
            .orElse(name.endsWith("/") ? ZipConstants.UNIX_DIRECTORY_ATTRIBUTES : ZipConstants.UNIX_FILE_ATTRIBUTES);

        LocalFileHeader header = new LocalFileHeader(versionNeeded, flags, method.getCode(), dosTime, dosDate,
            crc, size, size, rawName, extra);
        emit(header.toBytes());

        ZipEntry.Builder entry = ZipEntry.builder()
            .name(rawName, name)
            .versionMadeBy(ZipConstants.VERSION_MADE_BY)
            .versionNeeded(versionNeeded)
            .flags(flags)
            .method(method)
            .dosDateTime(dosDate, dosTime)
            .externalAttributes(attributes)
            .localHeaderOffset(headerOffset)
            .extra(extra)
            .comment(rawComment, entryComment);
        EncoderOutputStream encoder;
        try {
            encoder = codec.newEncoder(new SinkOutputStream(sink));
        } catch (IOException e) {
            failed = true;
            throw e;
        }
        current = new OpenEntry(name, entry, encoder, headerOffset, sink.position(), descriptor,
            precomputed ? options.getPrecomputedCrc() : null, precomputed ? options.getPrecomputedSize() : null);
        state = State.ENTRY_OPEN;

        logger.debug("Started entry '{}' at offset {} ({}, {})", name, headerOffset, method,
            descriptor ? "data descriptor" : precomputed ? "precomputed header" : "header patched on finish");
        return new ZipEntryOutputStream(this, current);
    }

    @Override
    public void write(byte[] data, int off, int len) throws IOException {
        ensureWritable();
        if (state != State.ENTRY_OPEN) {
            throw new IllegalStateException("No entry is open");
        }
        writeEntryData(data, off, len);
    }

    void writeLeased(OpenEntry lease, byte[] data, int off, int len) throws IOException {
        ensureWritable();
        if (!isOpen(lease)) {
            throw new IllegalStateException("Entry '" + lease.name + "' is already finished");
        }
        writeEntryData(data, off, len);
    }

    boolean isOpen(OpenEntry lease) {
        return !failed && state == State.ENTRY_OPEN && current == lease;
    }

    private void writeEntryData(byte[] data, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, data.length);
        if (len == 0) {
            return;
        }
        if (current.size + len >= ZipConstants.ZIP64_SENTINEL) {
            failed = true;
            throw new UnsupportedZipFeatureException("Entry '" + current.name
                + "' would reach 4 GiB uncompressed; ZIP64 is not supported");
        }
        current.crc = Crc32.update(current.crc, data, off, len);
        current.size += len;
        try {
            current.encoder.write(data, off, len);
        } catch (IOException e) {
            failed = true;
            throw e;
        }
    }

    @Override
    public ZipEntry finishEntry() throws IOException {
        ensureWritable();
        if (state != State.ENTRY_OPEN) {
            throw new IllegalStateException("No entry is open");
        }
        OpenEntry open = current;
        try {
            open.encoder.finish();
        } catch (IOException e) {
            failed = true;
            throw e;
        }
        long compressedSize = sink.position() - open.dataOffset;
        long crc = Crc32.toUnsigned(open.crc);
        if (compressedSize >= ZipConstants.ZIP64_SENTINEL) {
            failed = true;
            throw new UnsupportedZipFeatureException("Entry '" + open.name + "' compressed to " + compressedSize
                + " bytes; ZIP64 is not supported");
        }
        if (open.precomputedCrc != null
                && (open.precomputedCrc != crc || open.precomputedSize != open.size)) {
            failed = true;
            throw new ZipIntegrityException(String.format(
                "Entry '%s' was declared as %d bytes with CRC-32 %08x but %d bytes with CRC-32 %08x were written",
                open.name, open.precomputedSize, open.precomputedCrc, open.size, crc));
        }

        try {
            if (open.descriptor) {
                sink.write(new DataDescriptor(crc, compressedSize, open.size).toBytes());
            } else if (open.precomputedCrc == null) {
                byte[] patch = LocalFileHeader.encodeChecksumAndSizes(crc, compressedSize, open.size);
                ((SeekableByteSink) sink).writeAt(open.headerOffset + LocalFileHeader.CRC_OFFSET, patch, 0, patch.length);
            }
        } catch (IOException e) {
            failed = true;
            throw e;
        }

        ZipEntry entry = open.entry
            .index(entries.size())
            .crc32(crc)
            .compressedSize(compressedSize)
            .uncompressedSize(open.size)
            .build();
        entries.add(entry);
        current = null;
        state = State.IDLE;
        logger.debug("Finished entry '{}': {} bytes, {} compressed, crc {}", open.name, open.size, compressedSize,
            String.format("%08x", crc));
        return entry;
    }

    @Override
    public void setComment(String comment) {
        ensureWritable();
        this.comment = encodeComment(comment);
    }

    @Override
    public void setComment(byte[] comment) {
        ensureWritable();
        this.comment = checkComment(comment);
    }

    /**
     * Encodes an archive comment the way readers decode it: the trailer has no UTF-8 flag.
     */
    static byte[] encodeComment(String comment) {
        Objects.requireNonNull(comment, "comment");
        Charset legacy = CentralDirectory.defaultLegacyCharset();
        if (!legacy.newEncoder().canEncode(comment)) {
            throw new IllegalArgumentException("Archive comment cannot be encoded in " + legacy.name()
                + "; pass the comment as bytes instead");
        }
        return checkComment(comment.getBytes(legacy));
    }

    static byte[] checkComment(byte[] comment) {
        Objects.requireNonNull(comment, "comment");
        checkFieldLength("Archive comment", comment.length);
        return comment.clone();
    }

    @Override
    public CentralDirectory finishArchive() throws IOException {
        ensureWritable();
        if (state == State.ENTRY_OPEN) {
            throw new EntryInProgressException("Entry '" + current.name + "' is still open; finish it before the archive");
        }
        CentralDirectory directory;
        try {
            directory = CentralDirectory.write(sink, entries, comment,
                new String(comment, CentralDirectory.defaultLegacyCharset()));
            sink.flush();
        } catch (IOException e) {
            failed = true;
            throw e;
        }
        state = State.FINISHED;
        logger.debug("Finished archive with {} entries, {} bytes", entries.size(), sink.position());
        return directory;
    }

    @Override
    public List<ZipEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            if (!failed && state != State.FINISHED) {
                if (state == State.ENTRY_OPEN) {
                    finishEntry();
                }
                finishArchive();
            }
        } finally {
            closed = true;
            if (closeSink) {
                sink.close();
            }
        }
    }

    private void ensureWritable() {
        if (failed) {
            throw new WriterClosedException("ZipWriter failed earlier and accepts no further calls");
        }
        if (state == State.FINISHED) {
            throw new WriterClosedException("Archive is already finished");
        }
        if (closed) {
            throw new WriterClosedException("ZipWriter is closed");
        }
    }

    private void emit(byte[] bytes) throws IOException {
        try {
            sink.write(bytes);
        } catch (IOException e) {
            failed = true;
            throw e;
        }
    }

    private static void checkFieldLength(String field, int length) {
        if (length > ZipConstants.MAX_USHORT) {
            throw new IllegalArgumentException(field + " is " + length + " bytes, maximum is " + ZipConstants.MAX_USHORT);
        }
    }

    /**
     * Bookkeeping for the entry between start and finish.
     */
    static final class OpenEntry {
        private final String name;
        private final ZipEntry.Builder entry;
        private final EncoderOutputStream encoder;
        private final long headerOffset;
        private final long dataOffset;
        private final boolean descriptor;
        private final Long precomputedCrc;
        private final Long precomputedSize;
        private int crc = Crc32.INITIAL;
        private long size;

        private OpenEntry(String name, ZipEntry.Builder entry, EncoderOutputStream encoder, long headerOffset,
                          long dataOffset, boolean descriptor, Long precomputedCrc, Long precomputedSize) {
            this.name = name;
            this.entry = entry;
            this.encoder = encoder;
            this.headerOffset = headerOffset;
            this.dataOffset = dataOffset;
            this.descriptor = descriptor;
            this.precomputedCrc = precomputedCrc;
            this.precomputedSize = precomputedSize;
        }
    }

    /**
     * Builder class for creating StreamingZipWriter instances.
     */
    public static class Builder implements ZipWriter.Builder {
        private final ByteSink sink;
        private CodecRegistry registry;
        private CompressionMethod defaultMethod = CompressionMethod.DEFLATE;
        private byte[] comment = new byte[0];
        private boolean closeSink = true;

        public Builder(ByteSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
        }

        @Override
        public Builder withCodecRegistry(CodecRegistry registry) {
            this.registry = registry;
            return this;
        }

        @Override
        public Builder withDefaultMethod(CompressionMethod method) {
            this.defaultMethod = Objects.requireNonNull(method, "method");
            return this;
        }

        @Override
        public Builder withComment(String comment) {
            this.comment = encodeComment(comment);
            return this;
        }

        @Override
        public Builder withComment(byte[] comment) {
            this.comment = checkComment(comment);
            return this;
        }

        @Override
        public Builder withCloseSink(boolean closeSink) {
            this.closeSink = closeSink;
            return this;
        }

        @Override
        public ZipWriter build() {
            CodecRegistry codecs = registry != null ? registry : CodecRegistry.defaults();
            return new StreamingZipWriter(sink, codecs, defaultMethod, comment, closeSink);
        }
    }
}
