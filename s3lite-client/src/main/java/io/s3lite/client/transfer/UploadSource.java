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

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Bytes to upload. {@link #size()} must be known before the transfer starts.
 * I/O failures are raised as {@link java.io.UncheckedIOException}.
 */
public interface UploadSource
{
    long size();

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}
     */
    byte[] read(long offset, int length);

    /**
     * Whether ranges must be read in ascending order without gaps
     */
    default boolean isSequential()
    {
        return false;
    }

    static UploadSource fromFile(Path path)
    {
        return new FileUploadSource(path);
    }

    static UploadSource fromBytes(byte[] bytes)
    {
        return new ByteArrayUploadSource(bytes);
    }

    static UploadSource fromInputStream(InputStream inputStream, long size)
    {
        return new InputStreamUploadSource(inputStream, size);
    }
}
