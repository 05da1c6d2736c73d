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

import io.github.mdzhigarov.jzipcodec.ZipFormatException;
import io.github.mdzhigarov.jzipcodec.ZipIntegrityException;
import io.github.mdzhigarov.jzipcodec.checksum.Crc32;
import io.github.mdzhigarov.jzipcodec.model.ZipEntry;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.ZipException;

/**
 * Decoded data of one entry. Every byte handed out is folded into a running CRC-32;
 * when the decoder reports end of data, the length and checksum are compared with
 * the directory. Bytes already returned are never taken back: a mismatch surfaces
 * as an exception from the read that hit the end.
 */
final class ZipEntryInputStream extends InputStream {

    private final ZipEntry entry;
    private final InputStream decoder;
    private int crc = Crc32.INITIAL;
    private long count;
    private boolean verified;
    private boolean closed;

    ZipEntryInputStream(ZipEntry entry, InputStream decoder) {
        this.entry = entry;
        this.decoder = decoder;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (len == 0) {
            return 0;
        }
        if (verified) {
            return -1;
        }
        int n;
        try {
            n = decoder.read(b, off, len);
        } catch (ZipException | EOFException e) {
            throw new ZipFormatException("Corrupt compressed data in entry '" + entry.getName() + "': " + e.getMessage(), e);
        }
        if (n < 0) {
            verify();
            return -1;
        }
        count += n;
        if (count > entry.getUncompressedSize()) {
            throw new ZipIntegrityException("Entry '" + entry.getName() + "' decodes to more than its declared "
                + entry.getUncompressedSize() + " bytes");
        }
        crc = Crc32.update(crc, b, off, n);
        return n;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        decoder.close();
    }

    private void verify() throws ZipIntegrityException {
        if (count != entry.getUncompressedSize()) {
            throw new ZipIntegrityException("Entry '" + entry.getName() + "' decodes to " + count
                + " bytes, directory declares " + entry.getUncompressedSize());
        }
        long actual = Crc32.toUnsigned(crc);
        if (actual != entry.getCrc32()) {
            throw new ZipIntegrityException(String.format("CRC-32 mismatch in entry '%s': expected %08x, computed %08x",
                entry.getName(), entry.getCrc32(), actual));
        }
        verified = true;
    }
}
