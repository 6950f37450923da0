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

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.google.common.collect.ImmutableList;
import io.s3lite.spi.transfer.Part;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Completion manifest. Parts are written in ascending part number order with quoted ETags.
 */
@JacksonXmlRootElement(localName = "CompleteMultipartUpload")
public final class CompleteMultipartUpload
{
    @JacksonXmlProperty(localName = "Part")
    @JacksonXmlElementWrapper(useWrapping = false)
    final List<ManifestPart> parts;

    public CompleteMultipartUpload(Collection<Part> parts)
    {
        this.parts = parts.stream()
                .sorted(Comparator.comparingInt(Part::partNumber))
                .map(part -> new ManifestPart(part.partNumber(), part.quotedETag()))
                .collect(toImmutableList());
    }

    public List<ManifestPart> parts()
    {
        return ImmutableList.copyOf(parts);
    }

    public static final class ManifestPart
    {
        @JacksonXmlProperty(localName = "PartNumber")
        final int partNumber;
        @JacksonXmlProperty(localName = "ETag")
        final String eTag;

        ManifestPart(int partNumber, String eTag)
        {
            this.partNumber = partNumber;
            this.eTag = eTag;
        }

        public int partNumber()
        {
            return partNumber;
        }

        public String eTag()
        {
            return eTag;
        }
    }
}
