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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import io.s3lite.spi.exceptions.SigningInputException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

import static java.util.Objects.requireNonNull;

/**
 * Headers of a request being signed. Names keep the caller's case for sending
 * and are signed in lowercase; every header present is signed.
 */
final class SigningHeaders
{
    static final SigningHeaders EMPTY = new SigningHeaders(ImmutableMap.of());

    private final Map<String, String> headers;
    private final SortedMap<String, String> lowercaseHeaders;

    private SigningHeaders(Map<String, String> headers)
    {
        this.headers = ImmutableMap.copyOf(headers);

        ImmutableSortedMap.Builder<String, String> lowercaseHeaders = ImmutableSortedMap.naturalOrder();
        this.headers.forEach((name, value) -> lowercaseHeaders.put(name.toLowerCase(Locale.ROOT), value));
        this.lowercaseHeaders = lowercaseHeaders.buildOrThrow();
    }

    /**
     * @throws SigningInputException if two names differ only by case
     */
    static SigningHeaders build(Map<String, String> requestHeaders)
    {
        Map<String, String> seen = new LinkedHashMap<>();
        requestHeaders.forEach((name, value) -> {
            requireNonNull(name, "header name is null");
            requireNonNull(value, () -> "value of header %s is null".formatted(name));
            String previous = seen.put(name.toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                throw new SigningInputException("Header %s is specified more than once: %s and %s".formatted(name.toLowerCase(Locale.ROOT), previous, name));
            }
        });
        return new SigningHeaders(requestHeaders);
    }

    boolean hasHeader(String lowercaseName)
    {
        return lowercaseHeaders.containsKey(lowercaseName);
    }

    Optional<String> getFirst(String lowercaseName)
    {
        return Optional.ofNullable(lowercaseHeaders.get(lowercaseName));
    }

    /**
     * Returns a copy with {@code lowercaseName} set to {@code value}, replacing any header of the same name in any case
     */
    SigningHeaders withHeader(String lowercaseName, String value)
    {
        Map<String, String> updated = new LinkedHashMap<>();
        headers.forEach((name, existing) -> {
            if (!name.toLowerCase(Locale.ROOT).equals(lowercaseName)) {
                updated.put(name, existing);
            }
        });
        updated.put(lowercaseName, value);
        return new SigningHeaders(updated);
    }

    Map<String, String> requestHeaders()
    {
        return headers;
    }

    SortedMap<String, String> lowercaseHeadersToSign()
    {
        return lowercaseHeaders;
    }
}
