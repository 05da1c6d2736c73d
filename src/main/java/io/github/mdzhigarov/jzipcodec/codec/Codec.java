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
 * A compress/decompress strategy for one compression method code.
 * Both directions stream: memory use is bounded by the codec's own window,
 * never by the size of an entry.
 */
public interface Codec {

    /**
     * @return The method this codec handles
     */
    CompressionMethod getMethod();

    /**
     * Wraps a sink so that bytes written to the returned stream reach the sink compressed.
     * {@link EncoderOutputStream#finish()} flushes the codec's trailing bytes and
     * leaves the sink open.
     *
     * @param sink Where compressed bytes go
     * @return A new encoder, used for exactly one entry
     */
    EncoderOutputStream newEncoder(OutputStream sink) throws IOException;

    /**
     * Wraps the compressed bytes of one entry. Closing the returned stream
     * closes {@code compressed} and releases any native codec state.
     *
     * @param compressed The entry's compressed bytes, ending exactly at the entry boundary
     * @return A stream of decompressed bytes
     */
    InputStream newDecoder(InputStream compressed) throws IOException;
}
