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
package io.s3lite.spi.exceptions;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The service answered with an error status. {@code errorCode} is the S3 error code
 * from the response body, or {@code Unknown} when the body could not be parsed.
 */
public class S3ServiceException
        extends S3ClientException
{
    private final int statusCode;
    private final String errorCode;
    private final String errorMessage;
    private final Optional<String> requestId;
    private final S3ErrorCategory category;

    public S3ServiceException(int statusCode, String errorCode, String errorMessage, Optional<String> requestId)
    {
        super("S3 request failed with status %s: %s: %s".formatted(statusCode, errorCode, errorMessage));
        this.statusCode = statusCode;
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
        this.errorMessage = requireNonNull(errorMessage, "errorMessage is null");
        this.requestId = requireNonNull(requestId, "requestId is null");
        this.category = S3ErrorCategory.classify(statusCode, errorCode);
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public String getErrorCode()
    {
        return errorCode;
    }

    public String getErrorMessage()
    {
        return errorMessage;
    }

    public Optional<String> getRequestId()
    {
        return requestId;
    }

    public S3ErrorCategory getCategory()
    {
        return category;
    }
}
