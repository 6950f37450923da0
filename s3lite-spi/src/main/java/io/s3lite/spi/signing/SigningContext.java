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

import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Result of signing a request.
 *
 * @param requestHeaders the caller's headers plus {@code host}, {@code x-amz-date},
 * {@code x-amz-content-sha256}, the optional session token and {@code Authorization}
 */
public record SigningContext(RequestAuthorization signingAuthorization, Map<String, String> requestHeaders, String contentHash, Instant requestDate)
{
    public SigningContext
    {
        requireNonNull(signingAuthorization, "signingAuthorization is null");
        requestHeaders = ImmutableMap.copyOf(requestHeaders);
        requireNonNull(contentHash, "contentHash is null");
        requireNonNull(requestDate, "requestDate is null");
    }
}
