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
package io.s3lite.client.addressing;

import com.google.common.base.CharMatcher;

import java.util.regex.Pattern;

/**
 * Bucket name checks for virtual hosted addressing, which are stricter than general DNS rules.
 */
public final class BucketNames
{
    private static final CharMatcher ALLOWED = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf(".-"))
            .precomputed();
    private static final CharMatcher EDGE = CharMatcher.anyOf(".-");
    private static final Pattern DOTTED_QUAD = Pattern.compile("\\d+\\.\\d+\\.\\d+\\.\\d+");

    private BucketNames() {}

    public static boolean isValidSubdomain(String bucket)
    {
        if (bucket == null || bucket.length() < 3 || bucket.length() > 63) {
            return false;
        }
        if (!ALLOWED.matchesAllOf(bucket)) {
            return false;
        }
        if (EDGE.matches(bucket.charAt(0)) || EDGE.matches(bucket.charAt(bucket.length() - 1))) {
            return false;
        }
        if (bucket.contains("..") || bucket.contains(".-") || bucket.contains("-.")) {
            return false;
        }
        return !DOTTED_QUAD.matcher(bucket).matches();
    }
}
