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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import io.airlift.log.Logger;
import io.s3lite.spi.credentials.Credentials;
import io.s3lite.spi.exceptions.SigningInputException;
import io.s3lite.spi.signing.RequestAuthorization;
import io.s3lite.spi.signing.SigningContext;
import io.s3lite.spi.timestamps.AwsTimestamp;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.net.URI;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Strings.isNullOrEmpty;
import static io.s3lite.client.signing.CanonicalRequest.UNSIGNED_PAYLOAD;
import static io.s3lite.spi.signing.RequestAuthorization.SIGNATURE_ALGORITHM;
import static java.nio.charset.StandardCharsets.UTF_8;

final class Signer
{
    private static final Logger log = Logger.get(Signer.class);

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String TERMINATOR = "aws4_request";

    static final String AMZ_DATE_HEADER = "x-amz-date";
    static final String CONTENT_SHA256_HEADER = "x-amz-content-sha256";
    static final String SECURITY_TOKEN_HEADER = "x-amz-security-token";
    static final String AUTHORIZATION_HEADER = "Authorization";

    static final String ALGORITHM_PARAMETER = "X-Amz-Algorithm";
    static final String CREDENTIAL_PARAMETER = "X-Amz-Credential";
    static final String DATE_PARAMETER = "X-Amz-Date";
    static final String EXPIRES_PARAMETER = "X-Amz-Expires";
    static final String SIGNED_HEADERS_PARAMETER = "X-Amz-SignedHeaders";
    static final String SECURITY_TOKEN_PARAMETER = "X-Amz-Security-Token";
    static final String SIGNATURE_PARAMETER = "X-Amz-Signature";

    private static final Set<String> RESERVED_PRESIGN_PARAMETERS = ImmutableSet.of(
            ALGORITHM_PARAMETER, CREDENTIAL_PARAMETER, DATE_PARAMETER, EXPIRES_PARAMETER, SIGNED_HEADERS_PARAMETER, SECURITY_TOKEN_PARAMETER, SIGNATURE_PARAMETER)
            .stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(ImmutableSet.toImmutableSet());

    // https://docs.aws.amazon.com/AmazonS3/latest/API/sigv4-query-string-auth.html
    // Presigned SigV4 requests have a maximum length of 7 days
    @VisibleForTesting
    static final Duration MAX_PRESIGNED_REQUEST_AGE = Duration.ofDays(7);

    private Signer() {}

    static byte[] signingKey(String secretKey, String dateStamp, String region, String service)
    {
        byte[] dateKey = hmacSha256(("AWS4" + secretKey).getBytes(UTF_8), dateStamp);
        byte[] regionKey = hmacSha256(dateKey, region);
        byte[] serviceKey = hmacSha256(regionKey, service);
        return hmacSha256(serviceKey, TERMINATOR);
    }

    static SigningContext sign(
            Credentials credentials,
            String httpMethod,
            URI requestURI,
            SigningHeaders signingHeaders,
            Map<String, String> queryParameters,
            byte[] payload,
            Instant now)
    {
        Instant requestDate = signingHeaders.getFirst(AMZ_DATE_HEADER)
                .map(Signer::parseRequestDate)
                .orElse(now);
        String contentHash = signingHeaders.getFirst(CONTENT_SHA256_HEADER)
                .orElseGet(() -> Hashing.sha256().hashBytes(payload).toString());

        SigningHeaders headers = signingHeaders.withHeader("host", hostHeader(requestURI));
        if (!headers.hasHeader(AMZ_DATE_HEADER)) {
            headers = headers.withHeader(AMZ_DATE_HEADER, AwsTimestamp.toRequestFormat(requestDate));
        }
        if (!headers.hasHeader(CONTENT_SHA256_HEADER)) {
            headers = headers.withHeader(CONTENT_SHA256_HEADER, contentHash);
        }
        if (credentials.session().isPresent() && !headers.hasHeader(SECURITY_TOKEN_HEADER)) {
            headers = headers.withHeader(SECURITY_TOKEN_HEADER, credentials.session().get());
        }

        Set<String> lowercaseSignedHeaders = headers.lowercaseHeadersToSign().keySet();
        String canonicalRequest = CanonicalRequest.build(
                httpMethod,
                requestURI.getPath(),
                queryParameters,
                headers.lowercaseHeadersToSign(),
                lowercaseSignedHeaders,
                contentHash);

        String keyPath = keyPath(requestDate, credentials);
        String signature = signature(credentials, requestDate, keyPath, canonicalRequest);
        RequestAuthorization authorization = new RequestAuthorization(
                credentials.accessKey(),
                credentials.region(),
                keyPath,
                lowercaseSignedHeaders,
                signature,
                credentials.session());

        Map<String, String> signedHeaders = new LinkedHashMap<>(headers.requestHeaders());
        signedHeaders.put(AUTHORIZATION_HEADER, authorization.authorization());

        log.debug("Signed %s %s with scope %s and headers %s", httpMethod, requestURI.getRawPath(), keyPath, authorization.signedHeaders());
        return new SigningContext(authorization, signedHeaders, contentHash, requestDate);
    }

    static URI presign(
            Credentials credentials,
            String httpMethod,
            URI requestURI,
            Map<String, String> queryParameters,
            Duration expiresIn,
            Instant now)
    {
        if (expiresIn.compareTo(Duration.ofSeconds(1)) < 0 || expiresIn.compareTo(MAX_PRESIGNED_REQUEST_AGE) > 0) {
            throw new SigningInputException("Presigned URL expiry must be between 1 second and %s: %s".formatted(MAX_PRESIGNED_REQUEST_AGE, expiresIn));
        }
        queryParameters.keySet().forEach(name -> {
            if (RESERVED_PRESIGN_PARAMETERS.contains(name.toLowerCase(Locale.ROOT))) {
                throw new SigningInputException("Query parameter %s is reserved for presigning".formatted(name));
            }
        });

        String host = hostHeader(requestURI);
        String keyPath = keyPath(now, credentials);
        Set<String> lowercaseSignedHeaders = ImmutableSet.of("host");

        Map<String, String> presignParameters = new LinkedHashMap<>(queryParameters);
        presignParameters.put(ALGORITHM_PARAMETER, SIGNATURE_ALGORITHM);
        presignParameters.put(CREDENTIAL_PARAMETER, credentials.accessKey() + "/" + keyPath);
        presignParameters.put(DATE_PARAMETER, AwsTimestamp.toRequestFormat(now));
        presignParameters.put(EXPIRES_PARAMETER, String.valueOf(expiresIn.toSeconds()));
        presignParameters.put(SIGNED_HEADERS_PARAMETER, CanonicalRequest.signedHeaders(lowercaseSignedHeaders));
        credentials.session().ifPresent(session -> presignParameters.put(SECURITY_TOKEN_PARAMETER, session));

        String canonicalQuery = CanonicalRequest.canonicalQueryString(presignParameters);
        String canonicalRequest = CanonicalRequest.build(
                httpMethod,
                requestURI.getPath(),
                presignParameters,
                ImmutableMap.of("host", host),
                lowercaseSignedHeaders,
                UNSIGNED_PAYLOAD);
        String signature = signature(credentials, now, keyPath, canonicalRequest);

        log.debug("Presigned %s %s with scope %s expiring in %s", httpMethod, requestURI.getRawPath(), keyPath, expiresIn);
        // signature goes last and is not part of the canonical query
        return URI.create("%s://%s%s?%s&%s=%s".formatted(
                requestURI.getScheme(),
                requestURI.getRawAuthority(),
                CanonicalRequest.encodePath(requestURI.getPath()),
                canonicalQuery,
                SIGNATURE_PARAMETER,
                signature));
    }

    @VisibleForTesting
    static String stringToSign(Instant requestDate, String keyPath, String canonicalRequest)
    {
        return String.join("\n",
                SIGNATURE_ALGORITHM,
                AwsTimestamp.toRequestFormat(requestDate),
                keyPath,
                Hashing.sha256().hashString(canonicalRequest, UTF_8).toString());
    }

    static String hostHeader(URI requestURI)
    {
        String host = requestURI.getHost();
        if (isNullOrEmpty(host)) {
            throw new SigningInputException("Request URI has no host: " + requestURI);
        }
        int port = requestURI.getPort();
        if (port == -1 || isDefaultPort(requestURI.getScheme(), port)) {
            return host;
        }
        return host + ":" + port;
    }

    private static boolean isDefaultPort(String scheme, int port)
    {
        return ("https".equalsIgnoreCase(scheme) && port == 443) || ("http".equalsIgnoreCase(scheme) && port == 80);
    }

    private static String keyPath(Instant requestDate, Credentials credentials)
    {
        return String.join("/", AwsTimestamp.toDateStamp(requestDate), credentials.region(), credentials.service(), TERMINATOR);
    }

    private static String signature(Credentials credentials, Instant requestDate, String keyPath, String canonicalRequest)
    {
        byte[] signingKey = signingKey(credentials.secretKey(), AwsTimestamp.toDateStamp(requestDate), credentials.region(), credentials.service());
        return HashCode.fromBytes(hmacSha256(signingKey, stringToSign(requestDate, keyPath, canonicalRequest))).toString();
    }

    private static Instant parseRequestDate(String amzDate)
    {
        try {
            return AwsTimestamp.fromRequestTimestamp(amzDate);
        }
        catch (DateTimeParseException e) {
            throw new SigningInputException("Invalid %s header: %s".formatted(AMZ_DATE_HEADER, amzDate), e);
        }
    }

    private static byte[] hmacSha256(byte[] key, String data)
    {
        try {
            Mac hmacSha256 = Mac.getInstance(HMAC_SHA256);
            hmacSha256.init(new SecretKeySpec(key, HMAC_SHA256));
            return hmacSha256.doFinal(data.getBytes(UTF_8));
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
