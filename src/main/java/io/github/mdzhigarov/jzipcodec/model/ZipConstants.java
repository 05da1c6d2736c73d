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
 * Signatures, record sizes and flag bits of the ZIP container format.
 * All multi-byte fields on disk are little-endian.
 */
public final class ZipConstants {

    public static final int LOCAL_FILE_HEADER_SIGNATURE = 0x04034b50; // "PK\003\004"
    public static final int CENTRAL_DIRECTORY_SIGNATURE = 0x02014b50; // "PK\001\002"
    public static final int DATA_DESCRIPTOR_SIGNATURE = 0x08074b50; // "PK\007\010"
    public static final int EOCD_SIGNATURE = 0x06054b50; // "PK\005\006"
    public static final int ZIP64_EOCD_LOCATOR_SIGNATURE = 0x07064b50; // "PK\006\007"

    public static final int LOCAL_FILE_HEADER_SIZE = 30;
    public static final int CENTRAL_DIRECTORY_HEADER_SIZE = 46;
    public static final int EOCD_SIZE = 22;
    public static final int ZIP64_EOCD_LOCATOR_SIZE = 20;

    /** Largest value of any 16-bit length field (names, extras, comments, entry counts). */
    public static final int MAX_USHORT = 0xFFFF;

    /** A 32-bit size or offset with this value defers to a ZIP64 record. */
    public static final long ZIP64_SENTINEL = 0xFFFFFFFFL;

    public static final int ZIP64_EXTRA_FIELD_ID = 0x0001;

    public static final int FLAG_ENCRYPTED = 1;
    public static final int FLAG_DATA_DESCRIPTOR = 1 << 3;
    public static final int FLAG_STRONG_ENCRYPTION = 1 << 6;
    public static final int FLAG_UTF8 = 1 << 11;

    public static final int VERSION_STORED = 10;
    public static final int VERSION_DEFLATE = 20;
    /** Made-by host 3 (Unix), specification version 2.0. */
    public static final int VERSION_MADE_BY = (3 << 8) | VERSION_DEFLATE;

    public static final long UNIX_FILE_ATTRIBUTES = 0100644L << 16;
    public static final long UNIX_DIRECTORY_ATTRIBUTES = (040755L << 16) | 0x10;
    /** MS-DOS directory attribute bit in the low byte of the external attributes. */
    public static final int DOS_DIRECTORY_ATTRIBUTE = 0x10;

    private ZipConstants() {
    }
}
