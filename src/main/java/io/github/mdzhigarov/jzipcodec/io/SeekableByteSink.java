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

package io.github.mdzhigarov.jzipcodec.io;

import java.io.IOException;

/**
 * A {@link ByteSink} that can overwrite bytes it has already written. Used to
 * patch a local header once an entry's sizes and checksum are known.
 */
public interface SeekableByteSink extends ByteSink {

    /**
     * Overwrites bytes at {@code position}, which must lie entirely before
     * {@link #position()}. The append position does not move.
     */
    void writeAt(long position, byte[] buf, int off, int len) throws IOException;
}
