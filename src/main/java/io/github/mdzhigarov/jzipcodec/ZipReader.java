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
import io.github.mdzhigarov.jzipcodec.impl.SeekableZipReader;
import io.github.mdzhigarov.jzipcodec.io.FileChannelSource;
import io.github.mdzhigarov.jzipcodec.io.SeekableSource;
import io.github.mdzhigarov.jzipcodec.model.CentralDirectory;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Random access to the entries of an existing ZIP archive.
 *
 * <p>The central directory is parsed once, when the reader is built, and never
 * changes afterwards; it may be shared for lookups. Each stream returned by
 * {@link #openEntry(ZipEntry)} carries its own cursor and must be consumed by one
 * caller at a time, but several may be open at once.
 */
public interface ZipReader extends Closeable {

    /**
     * @return The parsed central directory
     */
    CentralDirectory getDirectory();

    /**
     * @return All entries, in the order they are stored in the central directory
     */
    default List<ZipEntry> getEntries() {
        return getDirectory().getEntries();
    }

    /**
     * @return The names of all entries, in storage order (duplicates included)
     */
    default List<String> listFiles() {
        return getDirectory().getNames();
    }

    /**
     * @throws IndexOutOfBoundsException If there is no entry at {@code index}
     */
    default ZipEntry getEntry(int index) {
        return getDirectory().getEntry(index);
    }

    /**
     * @param name The exact name of the entry inside the archive (e.g., "data/metadata.yml")
     * @return The first entry with this name in storage order, or empty if there is none
     */
    default Optional<ZipEntry> findEntry(String name) {
        return getDirectory().findEntry(name);
    }

    /**
     * Opens a stream of the entry's uncompressed data. The local header is read and
     * checked against the directory first. When the stream reaches its end, the
     * decoded length and CRC-32 are compared with the directory; a mismatch throws
     * {@link ZipIntegrityException} from that final read.
     *
     * @param entry An entry of this reader's directory
     * @throws UnsupportedZipFeatureException If the entry uses ZIP64, encryption, another
     * disk, or a compression method with no registered codec
     * @throws ZipFormatException If the local header or data descriptor disagrees with the
     * directory, or the data lies outside the archive
     * @throws IllegalArgumentException If the entry does not belong to this reader
     */
    InputStream openEntry(ZipEntry entry) throws IOException;

    default InputStream openEntry(int index) throws IOException {
        return openEntry(getEntry(index));
    }

    /**
     * Opens the first entry with this name.
     *
     * @return The entry's data, or empty if the archive has no such entry
     */
    default Optional<InputStream> getFile(String name) throws IOException {
        Optional<ZipEntry> entry = findEntry(name);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(openEntry(entry.get()));
    }

    /**
     * @return The total size of the archive in bytes
     */
    long getSize();

    /**
     * Factory method to obtain a builder for a reader over {@code source}.
     * The reader takes ownership of the source and closes it on {@link #close()}.
     */
    static Builder newBuilder(SeekableSource source) {
        return new SeekableZipReader.Builder(source);
    }

    /**
     * Opens a ZIP file with the default configuration.
     */
    static ZipReader open(Path path) throws IOException {
        FileChannelSource source = FileChannelSource.open(path);
        try {
            return newBuilder(source).build();
        } catch (IOException | RuntimeException e) {
            source.close();
            throw e;
        }
    }

    /**
     * A builder for configuring and creating a ZipReader instance.
     */
    interface Builder {
        /**
         * (Optional) Sets the codecs used to decode entry data. Defaults to
         * {@link CodecRegistry#defaults()}.
         */
        Builder withCodecRegistry(CodecRegistry registry);

        /**
         * (Optional) Sets the charset for names and comments stored without the UTF-8 flag.
         * Defaults to code page 437.
         */
        Builder withLegacyCharset(Charset charset);

        /**
         * (Optional) Sets how many compressed bytes an entry stream fetches per source read.
         */
        Builder withBufferSize(int bufferSize);

        /**
         * Reads and parses the central directory.
         *
         * @throws ZipFormatException If the trailer or directory is missing or corrupt
         * @throws UnsupportedZipFeatureException If the archive is ZIP64 or spans several disks
         */
        ZipReader build() throws IOException;
    }
}
