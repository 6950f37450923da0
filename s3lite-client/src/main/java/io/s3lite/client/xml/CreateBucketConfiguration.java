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
package io.s3lite.client.xml;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import io.s3lite.spi.model.CreateBucketRequest;

import java.util.Optional;

@JacksonXmlRootElement(localName = "CreateBucketConfiguration")
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CreateBucketConfiguration
{
    private static final String DEFAULT_REGION = "us-east-1";

    @JacksonXmlProperty(localName = "LocationConstraint")
    final String locationConstraint;
    @JacksonXmlProperty(localName = "Location")
    final Location location;
    @JacksonXmlProperty(localName = "Bucket")
    final BucketInfo bucket;

    private CreateBucketConfiguration(String locationConstraint, Location location, BucketInfo bucket)
    {
        this.locationConstraint = locationConstraint;
        this.location = location;
        this.bucket = bucket;
    }

    /**
     * Returns empty when the request needs no configuration body, i.e. a {@code us-east-1}
     * or unspecified region and no directory bucket options.
     */
    public static Optional<CreateBucketConfiguration> from(CreateBucketRequest request)
    {
        String locationConstraint = request.region()
                .filter(region -> !region.equals(DEFAULT_REGION))
                .orElse(null);
        Location location = (request.locationName().isPresent() || request.locationType().isPresent())
                ? new Location(request.locationName().orElse(null), request.locationType().orElse(null))
                : null;
        BucketInfo bucket = (request.dataRedundancy().isPresent() || request.bucketType().isPresent())
                ? new BucketInfo(request.dataRedundancy().orElse(null), request.bucketType().orElse(null))
                : null;

        if (locationConstraint == null && location == null && bucket == null) {
            return Optional.empty();
        }
        return Optional.of(new CreateBucketConfiguration(locationConstraint, location, bucket));
    }

    public Optional<String> locationConstraint()
    {
        return Optional.ofNullable(locationConstraint);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class Location
    {
        @JacksonXmlProperty(localName = "Name")
        final String name;
        @JacksonXmlProperty(localName = "Type")
        final String type;

        Location(String name, String type)
        {
            this.name = name;
            this.type = type;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class BucketInfo
    {
        @JacksonXmlProperty(localName = "DataRedundancy")
        final String dataRedundancy;
        @JacksonXmlProperty(localName = "Type")
        final String type;

        BucketInfo(String dataRedundancy, String type)
        {
            this.dataRedundancy = dataRedundancy;
            this.type = type;
        }
    }
}
