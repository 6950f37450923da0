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

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Signs outgoing requests with AWS Signature Version 4. Only the scheme, authority
 * and path of {@code requestUri} are used; query parameters are always passed
 * separately and unencoded.
 */
public interface SigningController
{
    SigningContext signRequest(
            String httpMethod,
            URI requestUri,
            Map<String, String> requestHeaders,
            Map<String, String> queryParameters,
            byte[] payload);

    URI presignRequest(
            String httpMethod,
            URI requestUri,
            Map<String, String> queryParameters,
            Duration expiresIn);
}
