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
import io.s3lite.spi.credentials.CredentialsProvider;

import java.nio.file.Path;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Credentials of an AWS shared config profile, read once at construction.
 */
public class AwsProfileCredentialsProvider
        implements CredentialsProvider
{
    private final AwsProfile profile;

    public AwsProfileCredentialsProvider(String profileName, Path configFile, Optional<Path> credentialsFile)
    {
        this(AwsProfile.load(profileName, configFile, credentialsFile));
    }

    public AwsProfileCredentialsProvider(AwsProfile profile)
    {
        this.profile = requireNonNull(profile, "profile is null");
    }

    public AwsProfile profile()
    {
        return profile;
    }

    @Override
    public Credentials credentials()
    {
        return profile.credentials();
    }
}
