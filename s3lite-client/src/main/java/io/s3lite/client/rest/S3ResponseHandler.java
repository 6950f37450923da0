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
import com.google.common.io.ByteStreams;
import io.airlift.http.client.HeaderName;
import io.airlift.http.client.Request;
import io.airlift.http.client.Response;
import io.airlift.http.client.ResponseHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;

import static io.airlift.http.client.ResponseHandlerUtils.propagate;

class S3ResponseHandler
        implements ResponseHandler<S3Response, RuntimeException>
{
    static final S3ResponseHandler INSTANCE = new S3ResponseHandler();

    private S3ResponseHandler() {}

    @Override
    public S3Response handleException(Request request, Exception exception)
    {
        throw propagate(request, exception);
    }

    @Override
    public S3Response handle(Request request, Response response)
    {
        ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
        response.getHeaders().forEach((HeaderName name, String value) -> headers.put(name.toString().toLowerCase(Locale.ROOT), value));

        byte[] body;
        try (InputStream inputStream = response.getInputStream()) {
            body = ByteStreams.toByteArray(inputStream);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed reading response from " + request.getUri(), e);
        }
        return new S3Response(response.getStatusCode(), headers.build(), body);
    }
}
