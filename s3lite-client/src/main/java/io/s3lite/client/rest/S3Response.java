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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A fully read response. Header names are lowercase.
 */
public record S3Response(int statusCode, ListMultimap<String, String> headers, byte[] body)
{
    private static final String USER_METADATA_PREFIX = "x-amz-meta-";

    public S3Response
    {
        headers = ImmutableListMultimap.copyOf(headers);
        requireNonNull(body, "body is null");
    }

    public Optional<String> header(String name)
    {
        return headers.get(name.toLowerCase(Locale.ROOT)).stream().findFirst();
    }

    /**
     * Value of the {@code ETag} header without surrounding quotes, empty string when missing
     */
    public String eTag()
    {
        return header("ETag").map(S3Response::unquote).orElse("");
    }

    public Map<String, String> userMetadata()
    {
        ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
        headers.asMap().forEach((name, values) -> {
            if (name.startsWith(USER_METADATA_PREFIX) && !values.isEmpty()) {
                metadata.put(name.substring(USER_METADATA_PREFIX.length()), values.iterator().next());
            }
        });
        return metadata.buildOrThrow();
    }

    public String bodyAsString()
    {
        return new String(body, UTF_8);
    }

    public static String unquote(String eTag)
    {
        String value = eTag.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
