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
 * A multipart transfer did not complete. The cause is the first failure observed.
 * When an upload had been initiated it has already been aborted by the time this is thrown.
 */
public class TransferFailedException
        extends S3ClientException
{
    private final String key;
    private final Optional<String> uploadId;

    public TransferFailedException(String key, Optional<String> uploadId, String message, Throwable cause)
    {
        super(message, requireNonNull(cause, "cause is null"));
        this.key = requireNonNull(key, "key is null");
        this.uploadId = requireNonNull(uploadId, "uploadId is null");
    }

    public String getKey()
    {
        return key;
    }

    public Optional<String> getUploadId()
    {
        return uploadId;
    }
}
