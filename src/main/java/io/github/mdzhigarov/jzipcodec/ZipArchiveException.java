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

package io.github.mdzhigarov.jzipcodec;

import java.io.IOException;

/**
 * Base class for failures caused by the content of an archive rather than by the
 * underlying byte source or sink.
 */
public abstract class ZipArchiveException extends IOException {

    protected ZipArchiveException(String message) {
        super(message);
    }

    protected ZipArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
