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

import java.io.IOException;
import java.io.OutputStream;

/**
 * Output side of a {@link Codec}. Unlike a plain filter stream it never closes
 * the stream it writes to: {@link #close()} only finishes the encoding.
 */
public abstract class EncoderOutputStream extends OutputStream {

    private boolean finished = false;

    @Override
    public void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public final void write(byte[] b, int off, int len) throws IOException {
        if (finished) {
            throw new IOException("Encoder already finished");
        }
        encode(b, off, len);
    }

    /**
     * Writes any buffered or trailing codec bytes to the sink and releases codec
     * resources. Calling it again has no effect.
     */
    public final void finish() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        finishEncoding();
    }

    @Override
    public void close() throws IOException {
        finish();
    }

    protected abstract void encode(byte[] b, int off, int len) throws IOException;

    protected abstract void finishEncoding() throws IOException;
}
