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

import java.io.IOException;
import java.io.OutputStream;

/**
 * The stream handed out by {@link StreamingZipWriter#startEntry}. It writes only
 * while its entry is the writer's open entry; afterwards writes fail and
 * {@link #close()} does nothing.
 */
final class ZipEntryOutputStream extends OutputStream {

    private final StreamingZipWriter writer;
    private final StreamingZipWriter.OpenEntry lease;

    ZipEntryOutputStream(StreamingZipWriter writer, StreamingZipWriter.OpenEntry lease) {
        this.writer = writer;
        this.lease = lease;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        writer.writeLeased(lease, b, off, len);
    }

    /**
     * Finishes the entry if it is still open.
     */
    @Override
    public void close() throws IOException {
        if (writer.isOpen(lease)) {
            writer.finishEntry();
        }
    }
}
