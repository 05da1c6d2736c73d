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

import io.github.mdzhigarov.jzipcodec.codec.CompressionMethod;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-entry settings for {@link ZipWriter#startEntry(String, EntryOptions)}.
 * Unset values fall back to the writer's defaults.
 */
public final class EntryOptions {

    private CompressionMethod method;
    private LocalDateTime lastModified;
    private Long externalAttributes;
    private String comment;
    private byte[] extra = new byte[0];
    private Long precomputedCrc;
    private Long precomputedSize;

    public static EntryOptions defaults() {
        return new EntryOptions();
    }

    public EntryOptions withMethod(CompressionMethod method) {
        this.method = Objects.requireNonNull(method, "method");
        return this;
    }

    public EntryOptions withLastModified(LocalDateTime lastModified) {
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
        return this;
    }

    /**
     * Platform file attributes; for Unix the mode goes in the high 16 bits.
     */
    public EntryOptions withExternalAttributes(long externalAttributes) {
        this.externalAttributes = externalAttributes;
        return this;
    }

    public EntryOptions withComment(String comment) {
        this.comment = Objects.requireNonNull(comment, "comment");
        return this;
    }

    /**
     * Opaque extra field bytes written to both the local and central header.
     */
    public EntryOptions withExtra(byte[] extra) {
        this.extra = Objects.requireNonNull(extra, "extra").clone();
        return this;
    }

    /**
     * Declares the CRC-32 and length of a stored entry before its data is written,
     * so the local header carries final values and needs neither patching nor a
     * data descriptor. The data written must match.
     */
    public EntryOptions withPrecomputed(long crc32, long size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size: " + size);
        }
        this.precomputedCrc = crc32 & 0xFFFFFFFFL;
        this.precomputedSize = size;
        return this;
    }

    public Optional<CompressionMethod> getMethod() {
        return Optional.ofNullable(method);
    }

    public Optional<LocalDateTime> getLastModified() {
        return Optional.ofNullable(lastModified);
    }

    public Optional<Long> getExternalAttributes() {
        return Optional.ofNullable(externalAttributes);
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    public byte[] getExtra() {
        return extra.clone();
    }

    public boolean hasPrecomputed() {
        return precomputedCrc != null;
    }

    public long getPrecomputedCrc() {
        return precomputedCrc;
    }

    public long getPrecomputedSize() {
        return precomputedSize;
    }
}
