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
package io.s3lite.client.credentials;

import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The subset of INI used by the AWS shared config files: {@code [section]} headers,
 * {@code key = value} lines, full line {@code #} and {@code ;} comments, and indented
 * sub-properties that are stored as {@code parent.key}.
 */
final class IniFile
{
    private final Map<String, Map<String, String>> sections;

    private IniFile(Map<String, Map<String, String>> sections)
    {
        this.sections = sections;
    }

    static IniFile empty()
    {
        return new IniFile(ImmutableMap.of());
    }

    /**
     * Returns an empty file when {@code path} does not exist
     */
    static IniFile load(Path path)
    {
        if (!Files.exists(path)) {
            return empty();
        }
        try {
            return parse(Files.readAllLines(path, UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    static IniFile parse(List<String> lines)
    {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> current = null;
        String parentKey = null;
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                String name = trimmed.substring(1, trimmed.length() - 1).strip();
                current = sections.computeIfAbsent(name, ignore -> new HashMap<>());
                parentKey = null;
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (current == null || separator < 0) {
                continue;
            }
            String key = trimmed.substring(0, separator).strip().toLowerCase(Locale.ROOT);
            String value = trimmed.substring(separator + 1).strip();
            boolean indented = Character.isWhitespace(line.charAt(0));
            if (indented && parentKey != null) {
                current.put(parentKey + "." + key, value);
                continue;
            }
            current.put(key, value);
            parentKey = value.isEmpty() ? key : null;
        }
        return new IniFile(sections.entrySet().stream()
                .collect(toImmutableMap(Map.Entry::getKey, entry -> ImmutableMap.copyOf(entry.getValue()))));
    }

    Map<String, String> section(String name)
    {
        return sections.getOrDefault(name, ImmutableMap.of());
    }

    static Optional<String> value(Map<String, String> section, String key)
    {
        return Optional.ofNullable(section.get(key)).filter(value -> !value.isEmpty());
    }
}
