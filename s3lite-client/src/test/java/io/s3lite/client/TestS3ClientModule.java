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
import com.google.inject.Injector;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.s3lite.client.quirks.OvhS3ProviderQuirks;
import io.s3lite.client.quirks.StandardS3ProviderQuirks;
import io.s3lite.spi.addressing.AddressStyle;
import io.s3lite.spi.addressing.BucketAddress;
import io.s3lite.spi.credentials.CredentialsProvider;
import io.s3lite.spi.quirks.S3ProviderQuirks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class TestS3ClientModule
{
    @Test
    public void testStaticCredentials()
            throws Exception
    {
        Injector injector = initialize(ImmutableMap.<String, String>builder()
                .put("s3.endpoint", "https://minio.example.com:9000")
                .put("s3.bucket", "data")
                .put("s3.address-style", "PATH_STYLE")
                .put("s3.region", "eu-west-1")
                .put("s3.access-key", "access")
                .put("s3.secret-key", "secret")
                .buildOrThrow());
        try {
            S3Client client = injector.getInstance(S3Client.class);
            assertThat(client.bucketAddress()).isEqualTo(new BucketAddress("data", URI.create("https://minio.example.com:9000/data"), AddressStyle.PATH_STYLE));
            assertThat(injector.getInstance(S3ProviderQuirks.class)).isInstanceOf(StandardS3ProviderQuirks.class);

            CredentialsProvider credentialsProvider = injector.getInstance(CredentialsProvider.class);
            assertThat(credentialsProvider.credentials().accessKey()).isEqualTo("access");
            assertThat(credentialsProvider.credentials().region()).isEqualTo("eu-west-1");
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    @Test
    public void testProfileCredentials(@TempDir Path directory)
            throws Exception
    {
        Path config = Files.writeString(directory.resolve("config"), """
                [profile ovh]
                aws_access_key_id = ovh-key
                aws_secret_access_key = ovh-secret
                region = gra
                endpoint_url = https://s3.gra.io.cloud.ovh.net
                """);

        Injector injector = initialize(ImmutableMap.<String, String>builder()
                .put("s3.bucket", "archive")
                .put("s3.provider", "OVH")
                .put("s3.credentials.profile", "ovh")
                .put("s3.credentials.config-file", config.toString())
                .buildOrThrow());
        try {
            BucketAddress bucketAddress = injector.getInstance(BucketAddress.class);
            assertThat(bucketAddress.style()).isEqualTo(AddressStyle.VIRTUAL_HOSTED);
            assertThat(bucketAddress.baseUri().getHost()).isEqualTo("archive.s3.gra.io.cloud.ovh.net");
            assertThat(injector.getInstance(S3ProviderQuirks.class)).isInstanceOf(OvhS3ProviderQuirks.class);
            assertThat(injector.getInstance(CredentialsProvider.class).credentials().region()).isEqualTo("gra");
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    private static Injector initialize(Map<String, String> properties)
            throws Exception
    {
        return new Bootstrap(new S3ClientModule())
                .doNotInitializeLogging()
                .setRequiredConfigurationProperties(properties)
                .initialize();
    }
}
