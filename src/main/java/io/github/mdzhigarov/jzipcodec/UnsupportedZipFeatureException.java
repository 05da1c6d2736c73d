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

/**
 * The archive uses a feature this library recognizes but does not implement:
 * ZIP64 sizes or records, encryption, multi-disk archives, or a compression
 * method with no registered codec.
 */
public class UnsupportedZipFeatureException extends ZipArchiveException {

    public UnsupportedZipFeatureException(String message) {
        super(message);
    }
}
