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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Reads and writes the S3 XML documents. Unknown elements are ignored and element
 * namespaces are not checked, so documents with or without the S3 namespace parse the same.
 */
public final class XmlCodec<T>
{
    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .defaultUseWrapper(false)
            .build();

    private final Class<T> type;

    private XmlCodec(Class<T> type)
    {
        this.type = requireNonNull(type, "type is null");
    }

    public static <T> XmlCodec<T> xmlCodec(Class<T> type)
    {
        return new XmlCodec<>(type);
    }

    /**
     * @throws UncheckedIOException if the document is not valid XML for this type
     */
    public T fromXml(byte[] xml)
    {
        try {
            return XML_MAPPER.readValue(xml, type);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Invalid %s document: %s".formatted(type.getSimpleName(), preview(xml)), e);
        }
    }

    public byte[] toXmlBytes(T instance)
    {
        try {
            return XML_MAPPER.writeValueAsBytes(instance);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("%s could not be converted to XML".formatted(instance.getClass().getName()), e);
        }
    }

    private static String preview(byte[] xml)
    {
        String text = new String(xml, UTF_8);
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
