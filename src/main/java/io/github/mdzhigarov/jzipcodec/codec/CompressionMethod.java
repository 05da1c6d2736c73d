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

/**
 * The compression method code of an entry. {@link #STORED} and {@link #DEFLATE}
 * are the methods this library knows by name; any other code is kept as-is so
 * the entry stays listable, and is only rejected when its data is opened
 * without a matching {@link Codec} in the {@link CodecRegistry}.
 */
public final class CompressionMethod {

    public static final CompressionMethod STORED = new CompressionMethod(0, "stored");
    public static final CompressionMethod DEFLATE = new CompressionMethod(8, "deflate");

    private final int code;
    private final String name;

    private CompressionMethod(int code, String name) {
        this.code = code;
        this.name = name;
    }

    /**
     * @param code The 16-bit method code from a local or central header
     * @return The named constant for known codes, otherwise an unsupported method carrying the raw code
     */
    public static CompressionMethod of(int code) {
        if (code < 0 || code > 0xFFFF) {
            throw new IllegalArgumentException("Compression method code out of range: " + code);
        }
        switch (code) {
            case 0:
                return STORED;
            case 8:
                return DEFLATE;
            default:
                return new CompressionMethod(code, "unsupported(" + code + ")");
        }
    }

    public int getCode() {
        return code;
    }

    public boolean isStored() {
        return code == STORED.code;
    }

    public boolean isDeflate() {
        return code == DEFLATE.code;
    }

    /**
     * @return Whether this is one of the named methods, stored or deflate
     */
    public boolean isKnown() {
        return isStored() || isDeflate();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompressionMethod)) {
            return false;
        }
        return code == ((CompressionMethod) o).code;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(code);
    }

    @Override
    public String toString() {
        return name;
    }
}
