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
package io.s3lite.spi.signing;

import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The parts of a SigV4 {@code Authorization} header.
 * {@code keyPath} is the credential scope, i.e. {@code date/region/service/aws4_request}.
 */
public record RequestAuthorization(String accessKey, String region, String keyPath, Set<String> lowercaseSignedHeaders, String signature, Optional<String> securityToken)
{
    public static final String SIGNATURE_ALGORITHM = "AWS4-HMAC-SHA256";

    public RequestAuthorization
    {
        requireNonNull(accessKey, "accessKey is null");
        requireNonNull(region, "region is null");
        requireNonNull(keyPath, "keyPath is null");
        lowercaseSignedHeaders = ImmutableSet.copyOf(lowercaseSignedHeaders);
        requireNonNull(signature, "signature is null");
        requireNonNull(securityToken, "securityToken is null");
    }

    public String credential()
    {
        return accessKey + "/" + keyPath;
    }

    public String signedHeaders()
    {
        return String.join(";", lowercaseSignedHeaders);
    }

    public String authorization()
    {
        return "%s Credential=%s, SignedHeaders=%s, Signature=%s".formatted(SIGNATURE_ALGORITHM, credential(), signedHeaders(), signature);
    }
}
