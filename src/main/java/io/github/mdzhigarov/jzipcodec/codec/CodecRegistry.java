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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table from method code to {@link Codec}. Readers and writers only ever
 * ask the registry, so a new method is added by registering its codec.
 *
 * <p>A registry is mutable while it is being set up; share it between readers and
 * writers only once registration is done.
 */
public final class CodecRegistry {

    private final Map<Integer, Codec> codecs = new LinkedHashMap<>();

    /**
     * @return A registry with {@link StoredCodec} and a default-level {@link DeflateCodec}
     */
    public static CodecRegistry defaults() {
        return new CodecRegistry()
            .register(new StoredCodec())
            .register(new DeflateCodec());
    }

    /**
     * @return A registry with no codecs; every entry's data is unsupported until one is registered
     */
    public static CodecRegistry empty() {
        return new CodecRegistry();
    }

    /**
     * Adds a codec, replacing any codec already registered for the same method.
     */
    public CodecRegistry register(Codec codec) {
        codecs.put(codec.getMethod().getCode(), codec);
        return this;
    }

    public Optional<Codec> find(CompressionMethod method) {
        return Optional.ofNullable(codecs.get(method.getCode()));
    }

    public boolean supports(CompressionMethod method) {
        return codecs.containsKey(method.getCode());
    }

    public Set<Integer> supportedCodes() {
        return Collections.unmodifiableSet(codecs.keySet());
    }
}
