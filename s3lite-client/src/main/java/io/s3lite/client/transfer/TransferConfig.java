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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;
import io.airlift.units.MinDataSize;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static java.util.Objects.requireNonNull;

/**
 * Requested transfer settings. The part size actually used is computed per transfer
 * by {@link PartSizing#adjustPartSize(long, long)} and never written back here.
 */
public class TransferConfig
{
    private DataSize multipartThreshold = DataSize.of(8, MEGABYTE);
    private DataSize partSize = DataSize.of(8, MEGABYTE);
    private int maxConcurrency = 10;

    @NotNull
    @MinDataSize("1B")
    public DataSize getMultipartThreshold()
    {
        return multipartThreshold;
    }

    @Config("s3.transfer.multipart-threshold")
    @ConfigDescription("Uploads larger than this are sent as multipart uploads")
    public TransferConfig setMultipartThreshold(DataSize multipartThreshold)
    {
        this.multipartThreshold = requireNonNull(multipartThreshold, "multipartThreshold is null");
        return this;
    }

    @NotNull
    @MinDataSize("1B")
    public DataSize getPartSize()
    {
        return partSize;
    }

    @Config("s3.transfer.part-size")
    @ConfigDescription("Requested size of each part of a multipart upload, adjusted to the S3 part limits")
    public TransferConfig setPartSize(DataSize partSize)
    {
        this.partSize = requireNonNull(partSize, "partSize is null");
        return this;
    }

    @Min(1)
    public int getMaxConcurrency()
    {
        return maxConcurrency;
    }

    @Config("s3.transfer.max-concurrency")
    @ConfigDescription("Maximum number of parts of one multipart upload in flight at a time")
    public TransferConfig setMaxConcurrency(int maxConcurrency)
    {
        this.maxConcurrency = maxConcurrency;
        return this;
    }
}
