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
package io.s3lite.client;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;
import io.airlift.units.Duration;
import io.airlift.units.MaxDuration;
import io.airlift.units.MinDuration;
import io.s3lite.spi.addressing.AddressStyle;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;

import java.io.File;
import java.net.URI;
import java.util.Optional;

import static java.util.concurrent.TimeUnit.HOURS;

public class S3ClientConfig
{
    private Optional<URI> endpoint = Optional.empty();
    private String bucket;
    private Optional<String> region = Optional.empty();
    private AddressStyle addressStyle = AddressStyle.AUTO;
    private S3Provider provider = S3Provider.STANDARD;
    private Optional<String> accessKey = Optional.empty();
    private Optional<String> secretKey = Optional.empty();
    private Optional<String> sessionToken = Optional.empty();
    private String credentialsProfile = "default";
    private Optional<File> credentialsConfigFile = Optional.empty();
    private Optional<File> credentialsFile = Optional.empty();
    private Duration presignedUrlDuration = new Duration(1, HOURS);

    @Config("s3.endpoint")
    @ConfigDescription("S3 service endpoint, defaults to the AWS endpoint of the region")
    public S3ClientConfig setEndpoint(URI endpoint)
    {
        this.endpoint = Optional.ofNullable(endpoint);
        return this;
    }

    @Config("s3.bucket")
    public S3ClientConfig setBucket(String bucket)
    {
        this.bucket = bucket;
        return this;
    }

    @Config("s3.region")
    @ConfigDescription("Signing region, defaults to the profile region or us-east-1")
    public S3ClientConfig setRegion(String region)
    {
        this.region = Optional.ofNullable(region);
        return this;
    }

    @Config("s3.address-style")
    public S3ClientConfig setAddressStyle(AddressStyle addressStyle)
    {
        this.addressStyle = addressStyle;
        return this;
    }

    @Config("s3.provider")
    @ConfigDescription("Service provider whose protocol deviations are applied")
    public S3ClientConfig setProvider(S3Provider provider)
    {
        this.provider = provider;
        return this;
    }

    @Config("s3.access-key")
    public S3ClientConfig setAccessKey(String accessKey)
    {
        this.accessKey = Optional.ofNullable(accessKey);
        return this;
    }

    @Config("s3.secret-key")
    @ConfigSecuritySensitive
    public S3ClientConfig setSecretKey(String secretKey)
    {
        this.secretKey = Optional.ofNullable(secretKey);
        return this;
    }

    @Config("s3.session-token")
    @ConfigSecuritySensitive
    public S3ClientConfig setSessionToken(String sessionToken)
    {
        this.sessionToken = Optional.ofNullable(sessionToken);
        return this;
    }

    @Config("s3.credentials.profile")
    @ConfigDescription("AWS shared config profile used when no access key is configured")
    public S3ClientConfig setCredentialsProfile(String credentialsProfile)
    {
        this.credentialsProfile = credentialsProfile;
        return this;
    }

    @Config("s3.credentials.config-file")
    public S3ClientConfig setCredentialsConfigFile(File credentialsConfigFile)
    {
        this.credentialsConfigFile = Optional.ofNullable(credentialsConfigFile);
        return this;
    }

    @Config("s3.credentials.credentials-file")
    public S3ClientConfig setCredentialsFile(File credentialsFile)
    {
        this.credentialsFile = Optional.ofNullable(credentialsFile);
        return this;
    }

    @Config("s3.presigned-url.duration")
    @ConfigDescription("Default validity of generated presigned URLs")
    public S3ClientConfig setPresignedUrlDuration(Duration presignedUrlDuration)
    {
        this.presignedUrlDuration = presignedUrlDuration;
        return this;
    }

    @NotNull
    public Optional<URI> getEndpoint()
    {
        return endpoint;
    }

    @NotNull
    public String getBucket()
    {
        return bucket;
    }

    @NotNull
    public Optional<String> getRegion()
    {
        return region;
    }

    @NotNull
    public AddressStyle getAddressStyle()
    {
        return addressStyle;
    }

    @NotNull
    public S3Provider getProvider()
    {
        return provider;
    }

    @NotNull
    public Optional<String> getAccessKey()
    {
        return accessKey;
    }

    @NotNull
    public Optional<String> getSecretKey()
    {
        return secretKey;
    }

    @NotNull
    public Optional<String> getSessionToken()
    {
        return sessionToken;
    }

    @NotNull
    public String getCredentialsProfile()
    {
        return credentialsProfile;
    }

    @NotNull
    public Optional<File> getCredentialsConfigFile()
    {
        return credentialsConfigFile;
    }

    @NotNull
    public Optional<File> getCredentialsFile()
    {
        return credentialsFile;
    }

    @NotNull
    @MinDuration("1s")
    @MaxDuration("7d")
    public Duration getPresignedUrlDuration()
    {
        return presignedUrlDuration;
    }

    @AssertTrue(message = "s3.access-key and s3.secret-key must be set together")
    public boolean isStaticCredentialsComplete()
    {
        return accessKey.isPresent() == secretKey.isPresent();
    }
}
