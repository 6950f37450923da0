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
package io.s3lite.client.credentials;

import io.s3lite.spi.credentials.Credentials;
import io.s3lite.spi.exceptions.S3ConfigurationException;

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static io.s3lite.client.credentials.IniFile.value;
import static java.util.Objects.requireNonNull;

/**
 * A profile of the AWS shared {@code config} and {@code credentials} files. Values in
 * the credentials file take precedence. The region falls back to {@code AWS_DEFAULT_REGION}
 * and then {@code us-east-1}.
 */
public record AwsProfile(String name, Credentials credentials, Optional<URI> endpointUrl)
{
    public static final String DEFAULT_PROFILE = "default";
    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_REGION_ENVIRONMENT_VARIABLE = "AWS_DEFAULT_REGION";

    public AwsProfile
    {
        requireNonNull(name, "name is null");
        requireNonNull(credentials, "credentials is null");
        requireNonNull(endpointUrl, "endpointUrl is null");
    }

    public static Path defaultConfigFile()
    {
        return Path.of(System.getProperty("user.home"), ".aws", "config");
    }

    public static AwsProfile load(String profileName, Path configFile, Optional<Path> credentialsFile)
    {
        return load(profileName, configFile, credentialsFile, System.getenv());
    }

    /**
     * @throws S3ConfigurationException if the profile has no access key or secret key
     */
    public static AwsProfile load(String profileName, Path configFile, Optional<Path> credentialsFile, Map<String, String> environment)
    {
        requireNonNull(profileName, "profileName is null");
        // config uses "[profile name]" except for the default profile, credentials always uses "[name]"
        String configSection = profileName.equals(DEFAULT_PROFILE) ? DEFAULT_PROFILE : "profile " + profileName;
        Map<String, String> config = IniFile.load(configFile).section(configSection);
        Map<String, String> credentials = credentialsFile.map(IniFile::load).orElseGet(IniFile::empty).section(profileName);

        String accessKey = lookup(credentials, config, "aws_access_key_id")
                .orElseThrow(() -> new S3ConfigurationException("aws_access_key_id not found for profile '%s' in config or credentials files".formatted(profileName)));
        String secretKey = lookup(credentials, config, "aws_secret_access_key")
                .orElseThrow(() -> new S3ConfigurationException("aws_secret_access_key not found for profile '%s' in config or credentials files".formatted(profileName)));
        Optional<String> sessionToken = lookup(credentials, config, "aws_session_token");
        String region = lookup(credentials, config, "region")
                .or(() -> Optional.ofNullable(environment.get(DEFAULT_REGION_ENVIRONMENT_VARIABLE)).filter(value -> !value.isEmpty()))
                .orElse(DEFAULT_REGION);
        Optional<URI> endpointUrl = lookup(credentials, config, "endpoint_url")
                .or(() -> lookup(credentials, config, "s3.endpoint_url"))
                .map(AwsProfile::toUri);

        return new AwsProfile(
                profileName,
                new Credentials(accessKey, secretKey, sessionToken, region, Credentials.DEFAULT_SERVICE),
                endpointUrl);
    }

    private static Optional<String> lookup(Map<String, String> credentials, Map<String, String> config, String key)
    {
        return value(credentials, key).or(() -> value(config, key));
    }

    private static URI toUri(String value)
    {
        try {
            return URI.create(value);
        }
        catch (IllegalArgumentException e) {
            throw new S3ConfigurationException("Invalid endpoint_url: " + value, e);
        }
    }
}
