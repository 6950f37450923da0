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

import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.s3lite.client.S3Client.ForS3Client;
import io.s3lite.client.addressing.BucketAddressResolver;
import io.s3lite.client.credentials.AwsProfile;
import io.s3lite.client.credentials.AwsProfileCredentialsProvider;
import io.s3lite.client.credentials.StaticCredentialsProvider;
import io.s3lite.client.quirks.OvhS3ProviderQuirks;
import io.s3lite.client.quirks.StandardS3ProviderQuirks;
import io.s3lite.client.signing.InternalSigningController;
import io.s3lite.client.transfer.TransferConfig;
import io.s3lite.spi.addressing.BucketAddress;
import io.s3lite.spi.credentials.Credentials;
import io.s3lite.spi.credentials.CredentialsProvider;
import io.s3lite.spi.quirks.S3ProviderQuirks;
import io.s3lite.spi.signing.SigningController;

import java.io.File;
import java.net.URI;
import java.util.Optional;

import static io.airlift.configuration.ConditionalModule.conditionalModule;
import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.http.client.HttpClientBinder.httpClientBinder;

public class S3ClientModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(S3ClientModule.class);

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(S3ClientConfig.class);
        configBinder(binder).bindConfig(TransferConfig.class);

        httpClientBinder(binder).bindHttpClient("s3", ForS3Client.class);
        binder.bind(SigningController.class).to(InternalSigningController.class).in(Scopes.SINGLETON);
        binder.bind(S3Client.class).in(Scopes.SINGLETON);

        install(conditionalModule(
                S3ClientConfig.class,
                config -> config.getProvider() == S3Provider.OVH,
                innerBinder -> innerBinder.bind(S3ProviderQuirks.class).to(OvhS3ProviderQuirks.class).in(Scopes.SINGLETON),
                innerBinder -> innerBinder.bind(S3ProviderQuirks.class).to(StandardS3ProviderQuirks.class).in(Scopes.SINGLETON)));
    }

    @Provides
    @Singleton
    public CredentialsProvider credentialsProvider(S3ClientConfig config)
    {
        if (config.getAccessKey().isPresent()) {
            log.info("Using static credentials for access key %s", config.getAccessKey().get());
            return new StaticCredentialsProvider(new Credentials(
                    config.getAccessKey().get(),
                    config.getSecretKey().orElseThrow(),
                    config.getSessionToken(),
                    config.getRegion()
                            .or(() -> Optional.ofNullable(System.getenv(AwsProfile.DEFAULT_REGION_ENVIRONMENT_VARIABLE)).filter(region -> !region.isEmpty()))
                            .orElse(AwsProfile.DEFAULT_REGION),
                    Credentials.DEFAULT_SERVICE));
        }

        AwsProfile profile = AwsProfile.load(
                config.getCredentialsProfile(),
                config.getCredentialsConfigFile().map(File::toPath).orElseGet(AwsProfile::defaultConfigFile),
                config.getCredentialsFile().map(File::toPath));
        if (config.getRegion().isPresent()) {
            profile = new AwsProfile(profile.name(), profile.credentials().withRegion(config.getRegion().get()), profile.endpointUrl());
        }
        log.info("Using credentials of AWS profile %s", profile.name());
        return new AwsProfileCredentialsProvider(profile);
    }

    @Provides
    @Singleton
    public BucketAddress bucketAddress(S3ClientConfig config, CredentialsProvider credentialsProvider)
    {
        Optional<URI> profileEndpoint = (credentialsProvider instanceof AwsProfileCredentialsProvider profileProvider)
                ? profileProvider.profile().endpointUrl()
                : Optional.empty();
        URI endpoint = config.getEndpoint()
                .or(() -> profileEndpoint)
                .orElseGet(() -> BucketAddressResolver.defaultEndpoint(credentialsProvider.credentials().region()));
        return BucketAddressResolver.resolve(endpoint, config.getBucket(), config.getAddressStyle());
    }
}
