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

import static java.util.Objects.requireNonNull;

public record S3ObjectSummary(String key, String lastModified, String eTag, long size, String storageClass)
{
    public static final String DEFAULT_STORAGE_CLASS = "STANDARD";

    public S3ObjectSummary
    {
        requireNonNull(key, "key is null");
        requireNonNull(lastModified, "lastModified is null");
        requireNonNull(eTag, "eTag is null");
        requireNonNull(storageClass, "storageClass is null");
    }
}
