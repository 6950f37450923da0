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

/**
 * OVH object storage only matches listing prefixes written with a leading {@code /}.
 */
public class OvhS3ProviderQuirks
        extends StandardS3ProviderQuirks
{
    @Override
    public String listPrefix(String prefix)
    {
        if (prefix.isEmpty() || prefix.startsWith("/")) {
            return prefix;
        }
        return "/" + prefix;
    }
}
