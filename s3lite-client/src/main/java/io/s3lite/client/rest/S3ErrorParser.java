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
package io.s3lite.client.rest;

import io.s3lite.client.xml.ErrorDocument;
import io.s3lite.client.xml.XmlCodec;
import io.s3lite.spi.exceptions.S3ServiceException;

import java.io.UncheckedIOException;
import java.util.Optional;

import static io.s3lite.client.xml.XmlCodec.xmlCodec;

/**
 * Maps an error response to {@link S3ServiceException}. Bodies that are not an S3 error
 * document, or carry neither code nor message, produce code {@code Unknown} with the raw body as message.
 */
final class S3ErrorParser
{
    static final String UNKNOWN_CODE = "Unknown";
    static final String UNKNOWN_MESSAGE = "Unknown error";

    private static final XmlCodec<ErrorDocument> ERROR_CODEC = xmlCodec(ErrorDocument.class);

    private S3ErrorParser() {}

    static S3ServiceException toException(S3Response response)
    {
        String body = response.bodyAsString();
        Optional<String> headerRequestId = response.header("x-amz-request-id");

        Optional<ErrorDocument> document = parse(response.body())
                .filter(error -> error.code().isPresent() || error.message().isPresent());
        if (document.isEmpty()) {
            return new S3ServiceException(response.statusCode(), UNKNOWN_CODE, body.isBlank() ? UNKNOWN_MESSAGE : body, headerRequestId);
        }

        ErrorDocument error = document.get();
        return new S3ServiceException(
                response.statusCode(),
                error.code().orElse(UNKNOWN_CODE),
                error.message().orElse(UNKNOWN_MESSAGE),
                error.requestId().or(() -> headerRequestId));
    }

    private static Optional<ErrorDocument> parse(byte[] body)
    {
        if (body.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(ERROR_CODEC.fromXml(body));
        }
        catch (UncheckedIOException e) {
            // not XML, the raw body is reported instead
            return Optional.empty();
        }
    }
}
