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
package io.s3lite.spi.model;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record ListObjectsResult(List<S3ObjectSummary> objects, boolean truncated, Optional<String> nextContinuationToken, Optional<String> prefix, int maxKeys)
{
    public ListObjectsResult
    {
        objects = ImmutableList.copyOf(objects);
        requireNonNull(nextContinuationToken, "nextContinuationToken is null");
        requireNonNull(prefix, "prefix is null");
    }

    public static ListObjectsResult empty(Optional<String> prefix, int maxKeys)
    {
        return new ListObjectsResult(ImmutableList.of(), false, Optional.empty(), prefix, maxKeys);
    }
}
