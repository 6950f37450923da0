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
import java.io.InputStream;
import java.io.UncheckedIOException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A stream of known length. Ranges must be read in order; the stream is not closed.
 */
public class InputStreamUploadSource
        implements UploadSource
{
    private final InputStream inputStream;
    private final long size;
    private long position;

    public InputStreamUploadSource(InputStream inputStream, long size)
    {
        this.inputStream = requireNonNull(inputStream, "inputStream is null");
        checkArgument(size >= 0, "size is negative");
        this.size = size;
    }

    @Override
    public long size()
    {
        return size;
    }

    @Override
    public synchronized byte[] read(long offset, int length)
    {
        checkState(offset == position, "stream source must be read sequentially: requested offset %s but stream is at %s", offset, position);
        checkArgument(offset + length <= size, "range [%s, %s) is beyond the declared size %s", offset, offset + length, size);
        try {
            byte[] bytes = inputStream.readNBytes(length);
            if (bytes.length < length) {
                throw new EOFException("Stream ended after %s bytes, expected %s".formatted(offset + bytes.length, size));
            }
            position += length;
            return bytes;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed reading upload stream", e);
        }
    }

    @Override
    public boolean isSequential()
    {
        return true;
    }
}
