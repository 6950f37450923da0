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
package io.s3lite.spi.addressing;

import java.net.URI;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The resolved base URI of a bucket. Object URIs are formed by appending {@code /<encoded key>}
 * to the path of {@code baseUri}.
 */
public record BucketAddress(String bucket, URI baseUri, AddressStyle style)
{
    public BucketAddress
    {
        requireNonNull(bucket, "bucket is null");
        requireNonNull(baseUri, "baseUri is null");
        requireNonNull(style, "style is null");
        checkArgument(style != AddressStyle.AUTO, "a resolved address cannot use AUTO style");
        checkArgument(baseUri.getRawQuery() == null, "baseUri must not have a query: %s", baseUri);
    }

    public String basePath()
    {
        String path = baseUri.getRawPath();
        if (path == null) {
            return "";
        }
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
