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

import com.google.common.math.LongMath;
import io.airlift.units.DataSize;
import io.s3lite.spi.exceptions.ProtocolLimitException;
import io.s3lite.spi.transfer.Part;
import io.s3lite.spi.transfer.UploadType;

import java.math.RoundingMode;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.units.DataSize.Unit.GIGABYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;

/**
 * S3 multipart limits, see
 * <a href="https://docs.aws.amazon.com/AmazonS3/latest/userguide/qfacts.html">multipart upload limits</a>.
 */
public final class PartSizing
{
    public static final long MIN_PART_SIZE = DataSize.of(5, MEGABYTE).toBytes();
    public static final long MAX_PART_SIZE = DataSize.of(5, GIGABYTE).toBytes();
    public static final int MAX_PARTS = Part.MAX_PART_NUMBER;

    private PartSizing() {}

    public static UploadType decideStrategy(long size, long multipartThreshold)
    {
        checkArgument(size >= 0, "size is negative");
        return size > multipartThreshold ? UploadType.MULTIPART : UploadType.SINGLE_PART;
    }

    /**
     * Doubles {@code requestedPartSize} until {@code size} fits in {@link #MAX_PARTS} parts,
     * then clamps it into {@code [MIN_PART_SIZE, MAX_PART_SIZE]}.
     */
    public static long adjustPartSize(long requestedPartSize, long size)
    {
        checkArgument(requestedPartSize > 0, "requestedPartSize must be positive");
        checkArgument(size >= 0, "size is negative");

        long partSize = requestedPartSize;
        while (partCount(size, partSize) > MAX_PARTS) {
            partSize *= 2;
        }
        return Math.max(MIN_PART_SIZE, Math.min(MAX_PART_SIZE, partSize));
    }

    public static long partCount(long size, long partSize)
    {
        checkArgument(partSize > 0, "partSize must be positive");
        return LongMath.divide(size, partSize, RoundingMode.CEILING);
    }

    public static void checkPartNumber(int partNumber)
    {
        if (partNumber < Part.MIN_PART_NUMBER || partNumber > Part.MAX_PART_NUMBER) {
            throw new ProtocolLimitException("Part number must be between %s and %s: %s".formatted(Part.MIN_PART_NUMBER, Part.MAX_PART_NUMBER, partNumber));
        }
    }
}
