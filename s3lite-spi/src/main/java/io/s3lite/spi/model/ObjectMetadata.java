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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Object headers as returned by GET and HEAD.
 *
 * @param userMetadata {@code x-amz-meta-*} headers with the prefix removed
 */
public record ObjectMetadata(
        Optional<String> contentType,
        long contentLength,
        String eTag,
        Optional<String> lastModified,
        Optional<String> versionId,
        Optional<String> serverSideEncryption,
        Map<String, String> userMetadata)
{
    public ObjectMetadata
    {
        requireNonNull(contentType, "contentType is null");
        requireNonNull(eTag, "eTag is null");
        requireNonNull(lastModified, "lastModified is null");
        requireNonNull(versionId, "versionId is null");
        requireNonNull(serverSideEncryption, "serverSideEncryption is null");
        userMetadata = ImmutableMap.copyOf(userMetadata);
    }
}
