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
package io.s3lite.client.rest;

import io.airlift.http.client.HttpClient;
import io.airlift.http.client.Request;
import io.airlift.log.Logger;
import io.s3lite.client.signing.CanonicalRequest;
import io.s3lite.spi.addressing.BucketAddress;
import io.s3lite.spi.signing.SigningContext;
import io.s3lite.spi.signing.SigningController;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static io.airlift.http.client.Request.Builder.prepareDelete;
import static io.airlift.http.client.Request.Builder.prepareGet;
import static io.airlift.http.client.Request.Builder.prepareHead;
import static io.airlift.http.client.Request.Builder.preparePost;
import static io.airlift.http.client.Request.Builder.preparePut;
import static io.airlift.http.client.StaticBodyGenerator.createStaticBodyGenerator;
import static java.util.Objects.requireNonNull;

/**
 * Signs and sends requests against one bucket. Responses with status 400 or above
 * are raised as {@link io.s3lite.spi.exceptions.S3ServiceException}.
 */
public class S3RequestDispatcher
{
    private static final Logger log = Logger.get(S3RequestDispatcher.class);

    private final HttpClient httpClient;
    private final SigningController signingController;
    private final BucketAddress bucketAddress;

    public S3RequestDispatcher(HttpClient httpClient, SigningController signingController, BucketAddress bucketAddress)
    {
        this.httpClient = requireNonNull(httpClient, "httpClient is null");
        this.signingController = requireNonNull(signingController, "signingController is null");
        this.bucketAddress = requireNonNull(bucketAddress, "bucketAddress is null");
    }

    public BucketAddress bucketAddress()
    {
        return bucketAddress;
    }

    public S3Response execute(S3Request request)
    {
        URI requestUri = requestUri(request.key());
        SigningContext signingContext = signingController.signRequest(
                request.httpMethod(),
                requestUri,
                request.headers(),
                request.queryParameters(),
                request.body());

        Request.Builder requestBuilder = prepare(request.httpMethod()).setUri(withQuery(requestUri, request.queryParameters()));
        signingContext.requestHeaders().forEach(requestBuilder::addHeader);
        if (request.body().length > 0) {
            requestBuilder.setBodyGenerator(createStaticBodyGenerator(request.body()));
        }

        S3Response response = httpClient.execute(requestBuilder.build(), S3ResponseHandler.INSTANCE);
        log.debug("%s %s returned %s", request.httpMethod(), requestUri, response.statusCode());
        if (response.statusCode() >= 400) {
            throw S3ErrorParser.toException(response);
        }
        return response;
    }

    public URI presign(String httpMethod, String key, Map<String, String> queryParameters, Duration expiresIn)
    {
        return signingController.presignRequest(httpMethod, requestUri(Optional.of(key)), queryParameters, expiresIn);
    }

    URI requestUri(Optional<String> key)
    {
        URI baseUri = bucketAddress.baseUri();
        String path = bucketAddress.basePath() + key.map(value -> "/" + CanonicalRequest.encodePath(value)).orElse("");
        return URI.create("%s://%s%s".formatted(baseUri.getScheme(), baseUri.getRawAuthority(), path));
    }

    private static URI withQuery(URI requestUri, Map<String, String> queryParameters)
    {
        if (queryParameters.isEmpty()) {
            return requestUri;
        }
        return URI.create(requestUri + "?" + CanonicalRequest.canonicalQueryString(queryParameters));
    }

    private static Request.Builder prepare(String httpMethod)
    {
        return switch (httpMethod.toUpperCase(Locale.ROOT)) {
            case "GET" -> prepareGet();
            case "HEAD" -> prepareHead();
            case "PUT" -> preparePut();
            case "POST" -> preparePost();
            case "DELETE" -> prepareDelete();
            default -> throw new IllegalArgumentException("Unsupported HTTP method: " + httpMethod);
        };
    }
}
