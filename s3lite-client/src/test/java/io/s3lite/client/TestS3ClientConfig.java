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

import com.google.common.collect.ImmutableMap;
import io.airlift.units.Duration;
import io.s3lite.spi.addressing.AddressStyle;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URI;
import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static org.assertj.core.api.Assertions.assertThat;

public class TestS3ClientConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(S3ClientConfig.class)
                .setEndpoint(null)
                .setBucket(null)
                .setRegion(null)
                .setAddressStyle(AddressStyle.AUTO)
                .setProvider(S3Provider.STANDARD)
                .setAccessKey(null)
                .setSecretKey(null)
                .setSessionToken(null)
                .setCredentialsProfile("default")
                .setCredentialsConfigFile(null)
                .setCredentialsFile(null)
                .setPresignedUrlDuration(new Duration(1, HOURS)));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = ImmutableMap.<String, String>builder()
                .put("s3.endpoint", "https://minio.example.com:9000")
                .put("s3.bucket", "data")
                .put("s3.region", "eu-west-1")
                .put("s3.address-style", "PATH_STYLE")
                .put("s3.provider", "OVH")
                .put("s3.access-key", "access")
                .put("s3.secret-key", "secret")
                .put("s3.session-token", "token")
                .put("s3.credentials.profile", "ci")
                .put("s3.credentials.config-file", "/etc/aws/config")
                .put("s3.credentials.credentials-file", "/etc/aws/credentials")
                .put("s3.presigned-url.duration", "15m")
                .buildOrThrow();

        S3ClientConfig expected = new S3ClientConfig()
                .setEndpoint(URI.create("https://minio.example.com:9000"))
                .setBucket("data")
                .setRegion("eu-west-1")
                .setAddressStyle(AddressStyle.PATH_STYLE)
                .setProvider(S3Provider.OVH)
                .setAccessKey("access")
                .setSecretKey("secret")
                .setSessionToken("token")
                .setCredentialsProfile("ci")
                .setCredentialsConfigFile(new File("/etc/aws/config"))
                .setCredentialsFile(new File("/etc/aws/credentials"))
                .setPresignedUrlDuration(new Duration(15, MINUTES));

        assertFullMapping(properties, expected);
    }

    @Test
    public void testStaticCredentialsMustBeComplete()
    {
        assertThat(new S3ClientConfig().isStaticCredentialsComplete()).isTrue();
        assertThat(new S3ClientConfig().setAccessKey("access").isStaticCredentialsComplete()).isFalse();
        assertThat(new S3ClientConfig().setSecretKey("secret").isStaticCredentialsComplete()).isFalse();
        assertThat(new S3ClientConfig().setAccessKey("access").setSecretKey("secret").isStaticCredentialsComplete()).isTrue();
    }
}
