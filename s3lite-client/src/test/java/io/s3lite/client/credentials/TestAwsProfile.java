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

import com.google.common.collect.ImmutableMap;
import io.s3lite.spi.exceptions.S3ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestAwsProfile
{
    private static final Map<String, String> NO_ENVIRONMENT = ImmutableMap.of();

    @TempDir
    Path directory;

    @Test
    public void testDefaultProfileFromConfig()
            throws IOException
    {
        Path config = write("config", """
                [default]
                aws_access_key_id = AKIDDEFAULT
                aws_secret_access_key = secret-default
                region = eu-central-1
                """);

        AwsProfile profile = AwsProfile.load(AwsProfile.DEFAULT_PROFILE, config, Optional.empty(), NO_ENVIRONMENT);
        assertThat(profile.name()).isEqualTo("default");
        assertThat(profile.credentials().accessKey()).isEqualTo("AKIDDEFAULT");
        assertThat(profile.credentials().secretKey()).isEqualTo("secret-default");
        assertThat(profile.credentials().session()).isEmpty();
        assertThat(profile.credentials().region()).isEqualTo("eu-central-1");
        assertThat(profile.credentials().service()).isEqualTo("s3");
        assertThat(profile.endpointUrl()).isEmpty();
    }

    @Test
    public void testNamedProfileWithCredentialsFile()
            throws IOException
    {
        Path config = write("config", """
                [default]
                aws_access_key_id = AKIDDEFAULT
                aws_secret_access_key = secret-default

                [profile minio]
                aws_access_key_id = from-config
                aws_secret_access_key = from-config-secret
                region = us-west-2
                endpoint_url = https://minio.example.com:9000
                """);
        Path credentials = write("credentials", """
                [minio]
                aws_access_key_id = from-credentials
                aws_session_token = session-token
                """);

        AwsProfile profile = AwsProfile.load("minio", config, Optional.of(credentials), NO_ENVIRONMENT);
        assertThat(profile.credentials().accessKey()).isEqualTo("from-credentials");
        assertThat(profile.credentials().secretKey()).isEqualTo("from-config-secret");
        assertThat(profile.credentials().session()).contains("session-token");
        assertThat(profile.credentials().region()).isEqualTo("us-west-2");
        assertThat(profile.endpointUrl()).contains(URI.create("https://minio.example.com:9000"));
    }

    @Test
    public void testNestedS3EndpointUrl()
            throws IOException
    {
        Path config = write("config", """
                [profile ovh]
                aws_access_key_id = key
                aws_secret_access_key = secret
                s3 =
                    endpoint_url = https://s3.gra.io.cloud.ovh.net
                """);

        AwsProfile profile = AwsProfile.load("ovh", config, Optional.empty(), NO_ENVIRONMENT);
        assertThat(profile.endpointUrl()).contains(URI.create("https://s3.gra.io.cloud.ovh.net"));
    }

    @Test
    public void testRegionFallbacks()
            throws IOException
    {
        Path config = write("config", """
                [default]
                aws_access_key_id = key
                aws_secret_access_key = secret
                """);

        assertThat(AwsProfile.load("default", config, Optional.empty(), ImmutableMap.of("AWS_DEFAULT_REGION", "ap-southeast-2")).credentials().region())
                .isEqualTo("ap-southeast-2");
        assertThat(AwsProfile.load("default", config, Optional.empty(), ImmutableMap.of("AWS_DEFAULT_REGION", "")).credentials().region())
                .isEqualTo(AwsProfile.DEFAULT_REGION);
        assertThat(AwsProfile.load("default", config, Optional.empty(), NO_ENVIRONMENT).credentials().region())
                .isEqualTo("us-east-1");
    }

    @Test
    public void testMissingKeys()
            throws IOException
    {
        Path config = write("config", """
                [default]
                aws_access_key_id = key
                """);

        assertThatThrownBy(() -> AwsProfile.load("default", config, Optional.empty(), NO_ENVIRONMENT))
                .isInstanceOf(S3ConfigurationException.class)
                .hasMessage("aws_secret_access_key not found for profile 'default' in config or credentials files");
        assertThatThrownBy(() -> AwsProfile.load("other", config, Optional.empty(), NO_ENVIRONMENT))
                .isInstanceOf(S3ConfigurationException.class)
                .hasMessage("aws_access_key_id not found for profile 'other' in config or credentials files");
        assertThatThrownBy(() -> AwsProfile.load("default", directory.resolve("missing"), Optional.empty(), NO_ENVIRONMENT))
                .isInstanceOf(S3ConfigurationException.class);
    }

    @Test
    public void testCredentialsProvider()
            throws IOException
    {
        Path config = write("config", """
                [profile ci]
                aws_access_key_id = ci-key
                aws_secret_access_key = ci-secret
                region = eu-west-3
                """);

        AwsProfileCredentialsProvider provider = new AwsProfileCredentialsProvider("ci", config, Optional.empty());
        assertThat(provider.profile().name()).isEqualTo("ci");
        assertThat(provider.credentials().accessKey()).isEqualTo("ci-key");
        assertThat(provider.credentials().region()).isEqualTo("eu-west-3");
        assertThat(provider.credentials().toString()).doesNotContain("ci-secret");
    }

    private Path write(String name, String content)
            throws IOException
    {
        return Files.writeString(directory.resolve(name), content);
    }
}
