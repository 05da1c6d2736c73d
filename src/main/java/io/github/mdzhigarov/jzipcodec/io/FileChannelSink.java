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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A {@link SeekableByteSink} writing a file through a {@link FileChannel}.
 * Opening a path truncates any existing file.
 */
public class FileChannelSink implements SeekableByteSink {

    private final FileChannel channel;
    private long position;

    public FileChannelSink(FileChannel channel) throws IOException {
        this.channel = channel;
        this.position = channel.position();
    }

    public static FileChannelSink open(Path path) throws IOException {
        return new FileChannelSink(FileChannel.open(path,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING));
    }

    @Override
    public void write(byte[] buf, int off, int len) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(buf, off, len);
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    @Override
    public void writeAt(long at, byte[] buf, int off, int len) throws IOException {
        if (at < 0 || at + len > position) {
            throw new IndexOutOfBoundsException("Patch [" + at + ", " + (at + len)
                + ") outside written range [0, " + position + ")");
        }
        ByteBuffer buffer = ByteBuffer.wrap(buf, off, len);
        long target = at;
        while (buffer.hasRemaining()) {
            target += channel.write(buffer, target);
        }
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void flush() throws IOException {
        channel.force(false);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
