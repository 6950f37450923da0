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
package io.s3lite.spi.transfer;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record UploadResult(String bucket, String key, String eTag, long size, UploadType uploadType, Optional<Long> partSize, int partCount, Optional<String> location)
{
    public UploadResult
    {
        requireNonNull(bucket, "bucket is null");
        requireNonNull(key, "key is null");
        requireNonNull(eTag, "eTag is null");
        requireNonNull(uploadType, "uploadType is null");
        requireNonNull(partSize, "partSize is null");
        requireNonNull(location, "location is null");
        checkArgument(size >= 0, "size is negative");
        checkArgument(partCount >= 1, "partCount must be at least 1");
    }

    public static UploadResult singlePart(String bucket, String key, String eTag, long size)
    {
        return new UploadResult(bucket, key, eTag, size, UploadType.SINGLE_PART, Optional.empty(), 1, Optional.empty());
    }

    public static UploadResult multipart(String bucket, String key, String eTag, long size, long partSize, int partCount, Optional<String> location)
    {
        return new UploadResult(bucket, key, eTag, size, UploadType.MULTIPART, Optional.of(partSize), partCount, location);
    }
}
