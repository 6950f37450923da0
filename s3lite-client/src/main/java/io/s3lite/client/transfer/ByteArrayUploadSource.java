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

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class ByteArrayUploadSource
        implements UploadSource
{
    private final byte[] bytes;

    public ByteArrayUploadSource(byte[] bytes)
    {
        this.bytes = requireNonNull(bytes, "bytes is null");
    }

    @Override
    public long size()
    {
        return bytes.length;
    }

    @Override
    public byte[] read(long offset, int length)
    {
        checkArgument(offset >= 0 && length >= 0 && offset + length <= bytes.length, "range [%s, %s) is outside of %s bytes", offset, offset + length, bytes.length);
        return Arrays.copyOfRange(bytes, (int) offset, (int) offset + length);
    }

    @Override
    public String toString()
    {
        return "bytes:" + bytes.length;
    }
}
