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

package io.github.mdzhigarov.jzipcodec.model;

/**
 * Extra fields are kept as opaque bytes; the only thing looked for in them is
 * a ZIP64 extended-information record.
 */
public final class ExtraFields {

    private ExtraFields() {
    }

    /**
     * Walks the (id, length, data) records of an extra field. A record whose
     * length runs past the end stops the walk; such bytes are not a ZIP64 marker.
     */
    public static boolean containsZip64(byte[] extra) {
        int i = 0;
        while (i + 4 <= extra.length) {
            int id = (extra[i] & 0xFF) | ((extra[i + 1] & 0xFF) << 8);
            int size = (extra[i + 2] & 0xFF) | ((extra[i + 3] & 0xFF) << 8);
            if (i + 4 + size > extra.length) {
                return false;
            }
            if (id == ZipConstants.ZIP64_EXTRA_FIELD_ID) {
                return true;
            }
            i += 4 + size;
        }
        return false;
    }
}
