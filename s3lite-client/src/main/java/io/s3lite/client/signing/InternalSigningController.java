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
package io.s3lite.client.signing;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.s3lite.spi.credentials.CredentialsProvider;
import io.s3lite.spi.signing.SigningContext;
import io.s3lite.spi.signing.SigningController;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static java.util.Objects.requireNonNull;

public class InternalSigningController
        implements SigningController
{
    private final CredentialsProvider credentialsProvider;
    private final Clock clock;

    @Inject
    public InternalSigningController(CredentialsProvider credentialsProvider)
    {
        this(credentialsProvider, Clock.systemUTC());
    }

    @VisibleForTesting
    public InternalSigningController(CredentialsProvider credentialsProvider, Clock clock)
    {
        this.credentialsProvider = requireNonNull(credentialsProvider, "credentialsProvider is null");
        this.clock = requireNonNull(clock, "clock is null");
    }

    @Override
    public SigningContext signRequest(
            String httpMethod,
            URI requestUri,
            Map<String, String> requestHeaders,
            Map<String, String> queryParameters,
            byte[] payload)
    {
        return Signer.sign(
                credentialsProvider.credentials(),
                httpMethod,
                requestUri,
                SigningHeaders.build(requestHeaders),
                queryParameters,
                requireNonNull(payload, "payload is null"),
                clock.instant());
    }

    @Override
    public URI presignRequest(
            String httpMethod,
            URI requestUri,
            Map<String, String> queryParameters,
            Duration expiresIn)
    {
        return Signer.presign(
                credentialsProvider.credentials(),
                httpMethod,
                requestUri,
                queryParameters,
                requireNonNull(expiresIn, "expiresIn is null"),
                clock.instant());
    }
}
