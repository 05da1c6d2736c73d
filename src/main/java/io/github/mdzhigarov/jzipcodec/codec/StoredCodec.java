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
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Method 0: bytes pass through unchanged in both directions.
 */
public final class StoredCodec implements Codec {

    @Override
    public CompressionMethod getMethod() {
        return CompressionMethod.STORED;
    }

    @Override
    public EncoderOutputStream newEncoder(OutputStream sink) {
        return new EncoderOutputStream() {
            @Override
            protected void encode(byte[] b, int off, int len) throws IOException {
                sink.write(b, off, len);
            }

            @Override
            protected void finishEncoding() {
                // nothing buffered
            }
        };
    }

    @Override
    public InputStream newDecoder(InputStream compressed) {
        return compressed;
    }
}
