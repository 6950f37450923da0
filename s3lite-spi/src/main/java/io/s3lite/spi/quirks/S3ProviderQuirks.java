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
package io.s3lite.spi.quirks;

/**
 * Per-provider deviations from the S3 wire behavior. Selected by configuration,
 * never by matching the endpoint host name.
 */
public interface S3ProviderQuirks
{
    /**
     * Transforms the {@code prefix} parameter of a listing before it is sent
     */
    String listPrefix(String prefix);

    /**
     * Transforms a key returned in a listing into the key callers use
     */
    String normalizeListedKey(String key);
}
