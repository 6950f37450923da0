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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A contiguous byte range of the source uploaded as one part.
 */
public record PartRange(int partNumber, long offset, int length)
{
    public PartRange
    {
        PartSizing.checkPartNumber(partNumber);
        checkArgument(offset >= 0, "offset is negative");
        checkArgument(length > 0, "length must be positive");
    }

    /**
     * Splits {@code size} bytes into ranges of {@code partSize}, numbered from 1. Only the last range may be shorter.
     */
    public static List<PartRange> split(long size, long partSize)
    {
        checkArgument(size > 0, "size must be positive");
        checkArgument(partSize > 0 && partSize <= Integer.MAX_VALUE, "partSize must be between 1 and %s bytes: %s", Integer.MAX_VALUE, partSize);

        long partCount = PartSizing.partCount(size, partSize);
        PartSizing.checkPartNumber((int) Math.min(partCount, Integer.MAX_VALUE));

        ImmutableList.Builder<PartRange> ranges = ImmutableList.builderWithExpectedSize((int) partCount);
        long offset = 0;
        for (int partNumber = 1; offset < size; partNumber++) {
            int length = (int) Math.min(partSize, size - offset);
            ranges.add(new PartRange(partNumber, offset, length));
            offset += length;
        }
        return ranges.build();
    }
}
