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

import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.collect.ImmutableSortedSet.toImmutableSortedSet;
import static java.util.Comparator.naturalOrder;
import static java.util.stream.Collectors.joining;

/**
 * Builds the SigV4 canonical request, see
 * <a href="https://docs.aws.amazon.com/IAM/latest/UserGuide/create-signed-request.html">create-signed-request</a>.
 * The encoding helpers are also used to write request URIs so that what is sent is exactly what was signed.
 */
public final class CanonicalRequest
{
    public static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";

    // RFC 3986 unreserved characters, plus '/' for paths. S3 paths are encoded once.
    private static final Escaper PATH_ESCAPER = new PercentEscaper("-_.~/", false);
    private static final Escaper QUERY_ESCAPER = new PercentEscaper("-_.~", false);

    private CanonicalRequest() {}

    /**
     * @param path the decoded URI path
     * @param lowercaseHeaders request headers keyed by lowercase name
     * @param lowercaseSignedHeaders names of the headers to include
     */
    static String build(String httpMethod, String path, Map<String, String> queryParameters, Map<String, String> lowercaseHeaders, Collection<String> lowercaseSignedHeaders, String payloadHash)
    {
        return String.join("\n",
                httpMethod,
                encodePath(path),
                canonicalQueryString(queryParameters),
                canonicalHeaders(lowercaseHeaders, lowercaseSignedHeaders),
                signedHeaders(lowercaseSignedHeaders),
                payloadHash);
    }

    public static String encodePath(String path)
    {
        if (isNullOrEmpty(path)) {
            return "/";
        }
        return PATH_ESCAPER.escape(path);
    }

    public static String encodeQueryComponent(String value)
    {
        return QUERY_ESCAPER.escape(value);
    }

    /**
     * Encoded {@code key=value} pairs sorted by encoded key, then encoded value, joined by {@code &}
     */
    public static String canonicalQueryString(Map<String, String> queryParameters)
    {
        return queryParameters.entrySet().stream()
                .map(entry -> Map.entry(encodeQueryComponent(entry.getKey()), encodeQueryComponent(entry.getValue())))
                .sorted(Map.Entry.<String, String>comparingByKey().thenComparing(Map.Entry.comparingByValue()))
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(joining("&"));
    }

    static String canonicalHeaders(Map<String, String> lowercaseHeaders, Collection<String> lowercaseSignedHeaders)
    {
        StringBuilder block = new StringBuilder();
        for (String name : sorted(lowercaseSignedHeaders)) {
            String value = lowercaseHeaders.getOrDefault(name, "");
            block.append(name).append(':').append(value.trim()).append('\n');
        }
        return block.toString();
    }

    static String signedHeaders(Collection<String> lowercaseSignedHeaders)
    {
        return String.join(";", sorted(lowercaseSignedHeaders));
    }

    private static Set<String> sorted(Collection<String> names)
    {
        return names.stream().collect(toImmutableSortedSet(naturalOrder()));
    }
}
