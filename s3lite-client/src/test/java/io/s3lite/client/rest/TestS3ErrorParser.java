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

import com.google.common.collect.ImmutableListMultimap;
import io.s3lite.spi.exceptions.S3ErrorCategory;
import io.s3lite.spi.exceptions.S3ServiceException;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class TestS3ErrorParser
{
    @Test
    public void testErrorDocument()
    {
        S3ServiceException exception = S3ErrorParser.toException(response(404, ImmutableListMultimap.of("x-amz-request-id", "header-id"), """
                <?xml version="1.0" encoding="UTF-8"?>
                <Error><Code>NoSuchKey</Code><Message>The specified key does not exist.</Message><RequestId>body-id</RequestId></Error>
                """));

        assertThat(exception.getStatusCode()).isEqualTo(404);
        assertThat(exception.getErrorCode()).isEqualTo("NoSuchKey");
        assertThat(exception.getErrorMessage()).isEqualTo("The specified key does not exist.");
        assertThat(exception.getRequestId()).contains("body-id");
        assertThat(exception.getCategory()).isEqualTo(S3ErrorCategory.NOT_FOUND);
        assertThat(exception).hasMessage("S3 request failed with status 404: NoSuchKey: The specified key does not exist.");
    }

    @Test
    public void testRequestIdFromHeader()
    {
        S3ServiceException exception = S3ErrorParser.toException(response(403, ImmutableListMultimap.of("x-amz-request-id", "header-id"),
                "<Error><Code>SignatureDoesNotMatch</Code><Message>bad signature</Message></Error>"));

        assertThat(exception.getRequestId()).contains("header-id");
        assertThat(exception.getCategory()).isEqualTo(S3ErrorCategory.ACCESS_DENIED);
    }

    @Test
    public void testMissingCode()
    {
        S3ServiceException exception = S3ErrorParser.toException(response(400, ImmutableListMultimap.of(), "<Error><Message>no code here</Message></Error>"));

        assertThat(exception.getErrorCode()).isEqualTo(S3ErrorParser.UNKNOWN_CODE);
        assertThat(exception.getErrorMessage()).isEqualTo("no code here");
        assertThat(exception.getCategory()).isEqualTo(S3ErrorCategory.CLIENT);
    }

    @Test
    public void testUnparseableBody()
    {
        S3ServiceException exception = S3ErrorParser.toException(response(503, ImmutableListMultimap.of(), "Service Unavailable"));

        assertThat(exception.getErrorCode()).isEqualTo(S3ErrorParser.UNKNOWN_CODE);
        assertThat(exception.getErrorMessage()).isEqualTo("Service Unavailable");
        assertThat(exception.getRequestId()).isEmpty();
        assertThat(exception.getCategory()).isEqualTo(S3ErrorCategory.SERVER);
    }

    @Test
    public void testEmptyBody()
    {
        S3ServiceException exception = S3ErrorParser.toException(response(404, ImmutableListMultimap.of(), ""));

        assertThat(exception.getErrorCode()).isEqualTo(S3ErrorParser.UNKNOWN_CODE);
        assertThat(exception.getErrorMessage()).isEqualTo(S3ErrorParser.UNKNOWN_MESSAGE);
        assertThat(exception.getCategory()).isEqualTo(S3ErrorCategory.NOT_FOUND);
    }

    private static S3Response response(int statusCode, ImmutableListMultimap<String, String> headers, String body)
    {
        return new S3Response(statusCode, headers, body.getBytes(UTF_8));
    }
}
