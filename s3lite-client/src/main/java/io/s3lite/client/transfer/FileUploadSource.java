/*
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
package io.s3lite.client.transfer;

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.file.StandardOpenOption.READ;
import static java.util.Objects.requireNonNull;

/**
 * Reads ranges with positional reads, so parts can be read concurrently.
 */
public class FileUploadSource
        implements UploadSource
{
    private final Path path;

    public FileUploadSource(Path path)
    {
        this.path = requireNonNull(path, "path is null");
    }

    @Override
    public long size()
    {
        try {
            return Files.size(path);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Cannot determine size of file source: " + path, e);
        }
    }

    @Override
    public byte[] read(long offset, int length)
    {
        checkArgument(offset >= 0, "offset is negative");
        checkArgument(length >= 0, "length is negative");

        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, READ)) {
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, offset + buffer.position());
                if (read < 0) {
                    throw new EOFException("File %s ended at %s while reading %s bytes at offset %s".formatted(path, offset + buffer.position(), length, offset));
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + path, e);
        }
        return buffer.array();
    }

    @Override
    public String toString()
    {
        return "file:" + path;
    }
}
