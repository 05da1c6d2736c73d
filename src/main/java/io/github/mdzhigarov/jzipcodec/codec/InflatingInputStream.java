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

package io.github.mdzhigarov.jzipcodec.codec;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Raw-inflate stream that owns its {@link Inflater}. A "nowrap" inflater may
 * ask for one byte past the end of the deflate data, so a single zero byte is
 * supplied once the compressed input is spent; running dry a second time means
 * the deflate data was cut short.
 */
class InflatingInputStream extends InflaterInputStream {

    private boolean inputSpent = false;
    private boolean closed = false;

    InflatingInputStream(InputStream in, Inflater inflater, int size) {
        super(in, inflater, size);
    }

    @Override
    protected void fill() throws IOException {
        if (inputSpent) {
            throw new EOFException("Unexpected end of deflate data");
        }
        len = in.read(buf, 0, buf.length);
        if (len == -1) {
            buf[0] = 0;
            len = 1;
            inputSpent = true;
        }
        inf.setInput(buf, 0, len);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            super.close();
        } finally {
            inf.end();
        }
    }
}
