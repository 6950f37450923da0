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
package io.s3lite.client.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.Optional;

public final class CompleteMultipartUploadResult
{
    @JacksonXmlProperty(localName = "Location")
    String location;
    @JacksonXmlProperty(localName = "Bucket")
    String bucket;
    @JacksonXmlProperty(localName = "Key")
    String key;
    @JacksonXmlProperty(localName = "ETag")
    String eTag;

    public Optional<String> location()
    {
        return Optional.ofNullable(location);
    }

    public Optional<String> eTag()
    {
        return Optional.ofNullable(eTag);
    }
}
