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

/**
 * A request would break one of the S3 protocol limits, e.g. a part number outside {@code 1..10000}.
 */
public class ProtocolLimitException
        extends S3ClientException
{
    public ProtocolLimitException(String message)
    {
        super(message);
    }
}
