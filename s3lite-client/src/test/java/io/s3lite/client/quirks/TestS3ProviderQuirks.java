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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestS3ProviderQuirks
{
    @Test
    public void testStandard()
    {
        S3ProviderQuirks quirks = new StandardS3ProviderQuirks();
        assertThat(quirks.listPrefix("photos/")).isEqualTo("photos/");
        assertThat(quirks.listPrefix("")).isEmpty();
        assertThat(quirks.normalizeListedKey("photos/cat.jpg")).isEqualTo("photos/cat.jpg");
        assertThat(quirks.normalizeListedKey("/photos/cat.jpg")).isEqualTo("photos/cat.jpg");
        assertThat(quirks.normalizeListedKey("//double")).isEqualTo("/double");
    }

    @Test
    public void testOvh()
    {
        S3ProviderQuirks quirks = new OvhS3ProviderQuirks();
        assertThat(quirks.listPrefix("photos/")).isEqualTo("/photos/");
        assertThat(quirks.listPrefix("/photos/")).isEqualTo("/photos/");
        assertThat(quirks.listPrefix("")).isEmpty();
        assertThat(quirks.normalizeListedKey("/photos/cat.jpg")).isEqualTo("photos/cat.jpg");
    }
}
