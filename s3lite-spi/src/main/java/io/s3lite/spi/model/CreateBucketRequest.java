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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Options of a bucket creation. {@code region} becomes the {@code LocationConstraint}
 * unless it is {@code us-east-1}; the location and bucket type fields only apply to
 * directory buckets.
 */
public record CreateBucketRequest(
        Optional<String> region,
        Optional<String> acl,
        Optional<String> grantFullControl,
        Optional<String> grantRead,
        Optional<String> grantReadAcp,
        Optional<String> grantWrite,
        Optional<String> grantWriteAcp,
        Optional<Boolean> objectLockEnabled,
        Optional<String> objectOwnership,
        Optional<String> locationType,
        Optional<String> locationName,
        Optional<String> bucketType,
        Optional<String> dataRedundancy)
{
    public CreateBucketRequest
    {
        requireNonNull(region, "region is null");
        requireNonNull(acl, "acl is null");
        requireNonNull(grantFullControl, "grantFullControl is null");
        requireNonNull(grantRead, "grantRead is null");
        requireNonNull(grantReadAcp, "grantReadAcp is null");
        requireNonNull(grantWrite, "grantWrite is null");
        requireNonNull(grantWriteAcp, "grantWriteAcp is null");
        requireNonNull(objectLockEnabled, "objectLockEnabled is null");
        requireNonNull(objectOwnership, "objectOwnership is null");
        requireNonNull(locationType, "locationType is null");
        requireNonNull(locationName, "locationName is null");
        requireNonNull(bucketType, "bucketType is null");
        requireNonNull(dataRedundancy, "dataRedundancy is null");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private Optional<String> region = Optional.empty();
        private Optional<String> acl = Optional.empty();
        private Optional<String> grantFullControl = Optional.empty();
        private Optional<String> grantRead = Optional.empty();
        private Optional<String> grantReadAcp = Optional.empty();
        private Optional<String> grantWrite = Optional.empty();
        private Optional<String> grantWriteAcp = Optional.empty();
        private Optional<Boolean> objectLockEnabled = Optional.empty();
        private Optional<String> objectOwnership = Optional.empty();
        private Optional<String> locationType = Optional.empty();
        private Optional<String> locationName = Optional.empty();
        private Optional<String> bucketType = Optional.empty();
        private Optional<String> dataRedundancy = Optional.empty();

        private Builder() {}

        public Builder withRegion(String region)
        {
            this.region = Optional.of(region);
            return this;
        }

        public Builder withAcl(String acl)
        {
            this.acl = Optional.of(acl);
            return this;
        }

        public Builder withGrantFullControl(String grantFullControl)
        {
            this.grantFullControl = Optional.of(grantFullControl);
            return this;
        }

        public Builder withGrantRead(String grantRead)
        {
            this.grantRead = Optional.of(grantRead);
            return this;
        }

        public Builder withGrantReadAcp(String grantReadAcp)
        {
            this.grantReadAcp = Optional.of(grantReadAcp);
            return this;
        }

        public Builder withGrantWrite(String grantWrite)
        {
            this.grantWrite = Optional.of(grantWrite);
            return this;
        }

        public Builder withGrantWriteAcp(String grantWriteAcp)
        {
            this.grantWriteAcp = Optional.of(grantWriteAcp);
            return this;
        }

        public Builder withObjectLockEnabled(boolean objectLockEnabled)
        {
            this.objectLockEnabled = Optional.of(objectLockEnabled);
            return this;
        }

        public Builder withObjectOwnership(String objectOwnership)
        {
            this.objectOwnership = Optional.of(objectOwnership);
            return this;
        }

        public Builder withLocation(String locationType, String locationName)
        {
            this.locationType = Optional.of(locationType);
            this.locationName = Optional.of(locationName);
            return this;
        }

        public Builder withBucketType(String bucketType, String dataRedundancy)
        {
            this.bucketType = Optional.of(bucketType);
            this.dataRedundancy = Optional.of(dataRedundancy);
            return this;
        }

        public CreateBucketRequest build()
        {
            return new CreateBucketRequest(region, acl, grantFullControl, grantRead, grantReadAcp, grantWrite, grantWriteAcp,
                    objectLockEnabled, objectOwnership, locationType, locationName, bucketType, dataRedundancy);
        }
    }
}
