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
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.Inflater;

/**
 * Method 8: raw deflate (no zlib header), backed by {@link Deflater} and {@link Inflater}.
 */
public final class DeflateCodec implements Codec {

    public static final int DEFAULT_LEVEL = 6;

    private static final int BUFFER_SIZE = 8192;

    private final int level;

    public DeflateCodec() {
        this(DEFAULT_LEVEL);
    }

    /**
     * @param level Deflate level, 0 (no compression) to 9 (best), or -1 for the zlib default
     */
    public DeflateCodec(int level) {
        if (level < Deflater.DEFAULT_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Invalid deflate level: " + level);
        }
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public CompressionMethod getMethod() {
        return CompressionMethod.DEFLATE;
    }

    @Override
    public EncoderOutputStream newEncoder(OutputStream sink) {
        Deflater deflater = new Deflater(level, true);
        DeflaterOutputStream out = new DeflaterOutputStream(sink, deflater, BUFFER_SIZE);
        return new EncoderOutputStream() {
            @Override
            protected void encode(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            protected void finishEncoding() throws IOException {
                try {
                    out.finish();
                } finally {
                    deflater.end();
                }
            }
        };
    }

    @Override
    public InputStream newDecoder(InputStream compressed) {
        return new InflatingInputStream(compressed, new Inflater(true), BUFFER_SIZE);
    }
}
