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

public enum S3ErrorCategory
{
    NOT_FOUND,
    ACCESS_DENIED,
    INVALID_REQUEST,
    CLIENT,
    SERVER;

    public static S3ErrorCategory classify(int statusCode, String errorCode)
    {
        if (statusCode == 404 || "NoSuchKey".equals(errorCode) || "NoSuchBucket".equals(errorCode)) {
            return NOT_FOUND;
        }
        if (statusCode == 403 || "AccessDenied".equals(errorCode)) {
            return ACCESS_DENIED;
        }
        if ("InvalidRequest".equals(errorCode)) {
            return INVALID_REQUEST;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return CLIENT;
        }
        return SERVER;
    }
}
