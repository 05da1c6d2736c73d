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

package io.github.mdzhigarov.jzipcodec;

import io.github.mdzhigarov.jzipcodec.codec.CodecRegistry;
import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import io.github.mdzhigarov.jzipcodec.impl.StreamingZipWriter;
import io.github.mdzhigarov.jzipcodec.io.ByteSink;
import io.github.mdzhigarov.jzipcodec.io.FileChannelSink;
import io.github.mdzhigarov.jzipcodec.io.OutputStreamSink;
import io.github.mdzhigarov.jzipcodec.model.CentralDirectory;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a ZIP archive one entry at a time, strictly sequentially.
 *
 * <p>A writer is {@link State#IDLE} until {@link #startEntry} opens an entry
 * ({@link State#ENTRY_OPEN}); {@link #finishEntry()} returns it to idle, and
 * {@link #finishArchive()} writes the central directory and moves it to
 * {@link State#FINISHED}. Only one entry can be open at a time.
 *
 * <p>Each local header is written as the entry starts. On a
 * {@link io.github.mdzhigarov.jzipcodec.io.SeekableByteSink} the checksum and sizes
 * are patched into it when the entry finishes; on any other sink they follow the
 * data in a data descriptor.
 */
public interface ZipWriter extends Closeable {

    enum State {
        IDLE,
        ENTRY_OPEN,
        FINISHED
    }

    /**
     * Starts an entry with the writer's default options. The name is encoded as UTF-8.
     *
     * @return A stream for the entry's data; closing it finishes the entry
     */
    default OutputStream startEntry(String name) throws IOException {
        return startEntry(name, EntryOptions.defaults());
    }

    /**
     * Starts an entry and writes its local header.
     *
     * @param name Entry name, encoded as UTF-8 (the UTF-8 flag is set when it is not plain ASCII)
     * @return A stream for the entry's data; it stops accepting bytes once the entry is finished
     * @throws EntryInProgressException If another entry is open
     * @throws WriterClosedException If the archive is finished
     * @throws UnsupportedZipFeatureException If no codec is registered for the method, or the
     * entry would start beyond the 4 GiB a non-ZIP64 archive can address
     */
    OutputStream startEntry(String name, EntryOptions options) throws IOException;

    /**
     * Starts an entry whose name bytes are written verbatim without the UTF-8 flag,
     * for names in a legacy charset.
     */
    OutputStream startEntry(byte[] rawName, EntryOptions options) throws IOException;

    /**
     * Writes data to the open entry.
     *
     * @throws IllegalStateException If no entry is open
     * @throws WriterClosedException If the archive is finished
     */
    void write(byte[] data, int off, int len) throws IOException;

    default void write(byte[] data) throws IOException {
        write(data, 0, data.length);
    }

    /**
     * Completes the open entry: flushes the encoder, then patches the local header or
     * appends a data descriptor.
     *
     * @return The entry as it will appear in the central directory
     * @throws IllegalStateException If no entry is open
     * @throws ZipIntegrityException If precomputed values were declared and the data does not match them
     * @throws UnsupportedZipFeatureException If a size reached 4 GiB; the writer is unusable afterwards
     */
    ZipEntry finishEntry() throws IOException;

    /**
     * Sets the archive comment written by {@link #finishArchive()}. The trailer has no
     * encoding flag, so the text is stored in the legacy charset readers decode it with
     * ({@link CentralDirectory#defaultLegacyCharset()}).
     *
     * @throws IllegalArgumentException If the text cannot be encoded in that charset, or
     * encodes to more than 65535 bytes
     */
    void setComment(String comment);

    /**
     * Sets the archive comment bytes, written verbatim.
     *
     * @throws IllegalArgumentException If longer than 65535 bytes
     */
    void setComment(byte[] comment);

    /**
     * Writes the central directory and trailer. No entry can be added afterwards.
     *
     * @throws EntryInProgressException If an entry is still open
     */
    CentralDirectory finishArchive() throws IOException;

    /**
     * @return The entries finished so far, in write order
     */
    List<ZipEntry> getEntries();

    State getState();

    /**
     * Finishes the open entry and the archive if that has not happened yet, then
     * closes the sink if the writer owns it.
     */
    @Override
    void close() throws IOException;

    static Builder newBuilder(ByteSink sink) {
        return new StreamingZipWriter.Builder(sink);
    }

    /**
     * A writer over a stream that cannot seek; every entry gets a data descriptor.
     */
    static Builder newBuilder(OutputStream out) {
        return newBuilder(new OutputStreamSink(out));
    }

    /**
     * A writer creating (or truncating) a file; local headers are patched in place.
     */
    static ZipWriter create(Path path) throws IOException {
        return newBuilder(FileChannelSink.open(path)).build();
    }

    /**
     * A builder for configuring and creating a ZipWriter instance.
     */
    interface Builder {
        /**
         * (Optional) Sets the codecs used to encode entry data. Defaults to
         * {@link CodecRegistry#defaults()}.
         */
        Builder withCodecRegistry(CodecRegistry registry);

        /**
         * (Optional) Method for entries that do not choose one. Defaults to deflate.
         */
        Builder withDefaultMethod(CompressionMethod method);

        /**
         * (Optional) Archive comment, encoded in the legacy charset as by
         * {@link ZipWriter#setComment(String)}. At most 65535 bytes.
         */
        Builder withComment(String comment);

        /**
         * (Optional) Archive comment bytes, written verbatim. At most 65535 bytes.
         */
        Builder withComment(byte[] comment);

        /**
         * (Optional) Whether {@link ZipWriter#close()} closes the sink. Defaults to true.
         */
        Builder withCloseSink(boolean closeSink);

        ZipWriter build();
    }
}
