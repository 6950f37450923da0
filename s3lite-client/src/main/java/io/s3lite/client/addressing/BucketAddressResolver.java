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
package io.s3lite.client.addressing;

import com.google.common.base.CharMatcher;
import io.airlift.log.Logger;
import io.s3lite.spi.addressing.AddressStyle;
import io.s3lite.spi.addressing.BucketAddress;
import io.s3lite.spi.exceptions.S3ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.base.Strings.nullToEmpty;
import static io.s3lite.spi.addressing.AddressStyle.PATH_STYLE;
import static io.s3lite.spi.addressing.AddressStyle.VIRTUAL_HOSTED;
import static java.util.Objects.requireNonNull;

/**
 * Computes the base URI of a bucket from a service endpoint.
 * <ul>
 *     <li>virtual hosted: {@code https://<bucket>.<endpoint host>/<endpoint path>}, or the endpoint itself when its host already starts with the bucket</li>
 *     <li>path style: {@code https://<endpoint host>/<bucket>}</li>
 * </ul>
 */
public final class BucketAddressResolver
{
    private static final Logger log = Logger.get(BucketAddressResolver.class);

    private BucketAddressResolver() {}

    /**
     * The AWS endpoint of a region, used when no endpoint is configured
     */
    public static URI defaultEndpoint(String region)
    {
        requireNonNull(region, "region is null");
        return URI.create("https://s3.%s.amazonaws.com".formatted(region));
    }

    public static BucketAddress resolve(URI endpoint, String bucket, AddressStyle styleHint)
    {
        requireNonNull(endpoint, "endpoint is null");
        requireNonNull(bucket, "bucket is null");
        requireNonNull(styleHint, "styleHint is null");

        String bucketName = CharMatcher.is('/').trimFrom(bucket);
        if (bucketName.isEmpty()) {
            throw new S3ConfigurationException("Bucket name is empty");
        }
        if (!"https".equalsIgnoreCase(endpoint.getScheme()) || isNullOrEmpty(endpoint.getHost())) {
            throw new S3ConfigurationException("Invalid endpoint URL. Must be a valid HTTPS URL: " + endpoint);
        }

        String host = endpoint.getHost();
        String path = nullToEmpty(endpoint.getPath());
        boolean bucketInHost = host.startsWith(bucketName + ".");
        if (bucketInHost && path.endsWith(bucketName)) {
            throw new S3ConfigurationException("Bucket '%s' is both in the host and path part of the URL '%s'".formatted(bucketName, endpoint));
        }

        boolean validSubdomain = BucketNames.isValidSubdomain(bucketName);
        BucketAddress address = switch (styleHint) {
            case AUTO -> validSubdomain ? virtualHosted(endpoint, bucketName, bucketInHost) : pathStyle(endpoint, bucketName);
            case VIRTUAL_HOSTED -> {
                if (!validSubdomain) {
                    throw new S3ConfigurationException("Invalid bucket name '%s' for virtual hosted addressing on endpoint URL '%s'".formatted(bucketName, endpoint));
                }
                yield virtualHosted(endpoint, bucketName, bucketInHost);
            }
            case PATH_STYLE -> pathStyle(endpoint, bucketName);
        };

        log.debug("Resolved bucket %s on %s to %s (%s)", bucketName, endpoint, address.baseUri(), address.style());
        return address;
    }

    private static BucketAddress virtualHosted(URI endpoint, String bucket, boolean bucketInHost)
    {
        String host = bucketInHost ? endpoint.getHost() : bucket + "." + endpoint.getHost();
        return new BucketAddress(bucket, buildUri(endpoint, host, endpoint.getPath()), VIRTUAL_HOSTED);
    }

    private static BucketAddress pathStyle(URI endpoint, String bucket)
    {
        return new BucketAddress(bucket, buildUri(endpoint, endpoint.getHost(), "/" + bucket), PATH_STYLE);
    }

    private static URI buildUri(URI endpoint, String host, String path)
    {
        try {
            return new URI(endpoint.getScheme(), endpoint.getUserInfo(), host, endpoint.getPort(), nullToEmpty(path), null, null);
        }
        catch (URISyntaxException e) {
            throw new S3ConfigurationException("Invalid bucket URL for host %s and path %s".formatted(host, path), e);
        }
    }
}
