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
package io.s3lite.client.quirks;

import io.s3lite.spi.quirks.S3ProviderQuirks;

public class StandardS3ProviderQuirks
        implements S3ProviderQuirks
{
    @Override
    public String listPrefix(String prefix)
    {
        return prefix;
    }

    /**
     * Strips one leading {@code /}, which some providers return for keys uploaded through them
     */
    @Override
    public String normalizeListedKey(String key)
    {
        return key.startsWith("/") ? key.substring(1) : key;
    }
}
