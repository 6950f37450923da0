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
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.Optional;

@JacksonXmlRootElement(localName = "Error")
public final class ErrorDocument
{
    @JacksonXmlProperty(localName = "Code")
    String code;
    @JacksonXmlProperty(localName = "Message")
    String message;
    @JacksonXmlProperty(localName = "RequestId")
    String requestId;
    @JacksonXmlProperty(localName = "Resource")
    String resource;

    public Optional<String> code()
    {
        return Optional.ofNullable(code).filter(value -> !value.isBlank());
    }

    public Optional<String> message()
    {
        return Optional.ofNullable(message);
    }

    public Optional<String> requestId()
    {
        return Optional.ofNullable(requestId);
    }

    public Optional<String> resource()
    {
        return Optional.ofNullable(resource);
    }
}
