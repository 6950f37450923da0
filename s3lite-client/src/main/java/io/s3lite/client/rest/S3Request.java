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

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An unsigned request against the client's bucket. {@code key} absent means a bucket level request.
 * Query parameters and headers are unencoded.
 */
public record S3Request(String httpMethod, Optional<String> key, Map<String, String> queryParameters, Map<String, String> headers, byte[] body)
{
    private static final byte[] EMPTY_BODY = new byte[0];

    public S3Request
    {
        requireNonNull(httpMethod, "httpMethod is null");
        requireNonNull(key, "key is null");
        checkArgument(key.map(value -> !value.isEmpty()).orElse(true), "key is empty");
        queryParameters = ImmutableMap.copyOf(queryParameters);
        headers = ImmutableMap.copyOf(headers);
        requireNonNull(body, "body is null");
    }

    public static Builder builder(String httpMethod)
    {
        return new Builder(httpMethod);
    }

    public static final class Builder
    {
        private final String httpMethod;
        private Optional<String> key = Optional.empty();
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body = EMPTY_BODY;

        private Builder(String httpMethod)
        {
            this.httpMethod = requireNonNull(httpMethod, "httpMethod is null");
        }

        public Builder withKey(String key)
        {
            this.key = Optional.of(key);
            return this;
        }

        public Builder addQueryParameter(String name, String value)
        {
            queryParameters.put(name, value);
            return this;
        }

        public Builder addQueryParameters(Map<String, String> queryParameters)
        {
            this.queryParameters.putAll(queryParameters);
            return this;
        }

        public Builder addHeader(String name, String value)
        {
            headers.put(name, value);
            return this;
        }

        public Builder addOptionalHeader(String name, Optional<String> value)
        {
            value.ifPresent(headerValue -> headers.put(name, headerValue));
            return this;
        }

        public Builder addUserMetadata(Map<String, String> metadata)
        {
            metadata.forEach((name, value) -> headers.put("x-amz-meta-" + name, value));
            return this;
        }

        /**
         * Sets the body and its {@code Content-Length}
         */
        public Builder withBody(byte[] body)
        {
            this.body = requireNonNull(body, "body is null");
            headers.put("Content-Length", String.valueOf(body.length));
            return this;
        }

        public S3Request build()
        {
            return new S3Request(httpMethod, key, queryParameters, headers, body);
        }
    }
}
