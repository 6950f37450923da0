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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A part acknowledged by the service. {@code eTag} is stored without surrounding quotes.
 */
public record Part(int partNumber, String eTag, long size)
{
    public static final int MIN_PART_NUMBER = 1;
    public static final int MAX_PART_NUMBER = 10_000;

    public Part
    {
        checkArgument(partNumber >= MIN_PART_NUMBER && partNumber <= MAX_PART_NUMBER, "partNumber out of range: %s", partNumber);
        requireNonNull(eTag, "eTag is null");
        checkArgument(size >= 0, "size is negative");
    }

    public String quotedETag()
    {
        return "\"" + eTag + "\"";
    }
}
