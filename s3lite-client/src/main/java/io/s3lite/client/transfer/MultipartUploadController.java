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
package io.s3lite.client.transfer;

import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import io.s3lite.client.rest.S3Request;
import io.s3lite.client.rest.S3RequestDispatcher;
import io.s3lite.client.rest.S3Response;
import io.s3lite.client.xml.CompleteMultipartUpload;
import io.s3lite.client.xml.CompleteMultipartUploadResult;
import io.s3lite.client.xml.InitiateMultipartUploadResult;
import io.s3lite.client.xml.XmlCodec;
import io.s3lite.spi.exceptions.S3ClientException;
import io.s3lite.spi.transfer.CompletedMultipartUpload;
import io.s3lite.spi.transfer.Part;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static io.s3lite.client.xml.XmlCodec.xmlCodec;
import static java.util.Objects.requireNonNull;

/**
 * The four wire calls of a multipart upload. Each call is a single request; nothing is retried.
 */
public class MultipartUploadController
{
    private static final Logger log = Logger.get(MultipartUploadController.class);

    private static final XmlCodec<InitiateMultipartUploadResult> INITIATE_CODEC = xmlCodec(InitiateMultipartUploadResult.class);
    private static final XmlCodec<CompleteMultipartUpload> MANIFEST_CODEC = xmlCodec(CompleteMultipartUpload.class);
    private static final XmlCodec<CompleteMultipartUploadResult> COMPLETE_CODEC = xmlCodec(CompleteMultipartUploadResult.class);

    private final S3RequestDispatcher dispatcher;

    public MultipartUploadController(S3RequestDispatcher dispatcher)
    {
        this.dispatcher = requireNonNull(dispatcher, "dispatcher is null");
    }

    public MultipartUploadSession createMultipartUpload(String key, Optional<String> contentType, Map<String, String> metadata)
    {
        S3Response response = dispatcher.execute(S3Request.builder("POST")
                .withKey(key)
                .addQueryParameter("uploads", "")
                .addOptionalHeader("Content-Type", contentType)
                .addUserMetadata(metadata)
                .build());

        String uploadId = INITIATE_CODEC.fromXml(response.body()).uploadId()
                .orElseThrow(() -> new S3ClientException("No UploadId in response to initiating multipart upload of " + key));
        log.debug("Initiated multipart upload %s of %s", uploadId, key);
        return new MultipartUploadSession(dispatcher.bucketAddress().bucket(), key, uploadId);
    }

    public Part uploadPart(String key, String uploadId, int partNumber, byte[] data)
    {
        PartSizing.checkPartNumber(partNumber);
        requireNonNull(uploadId, "uploadId is null");

        S3Response response = dispatcher.execute(S3Request.builder("PUT")
                .withKey(key)
                .addQueryParameters(ImmutableMap.of(
                        "partNumber", String.valueOf(partNumber),
                        "uploadId", uploadId))
                .withBody(data)
                .build());
        log.debug("Uploaded part %s of upload %s (%s bytes)", partNumber, uploadId, data.length);
        return new Part(partNumber, response.eTag(), data.length);
    }

    /**
     * @throws IllegalArgumentException if {@code parts} is empty or repeats a part number
     */
    public CompletedMultipartUpload completeMultipartUpload(String key, String uploadId, List<Part> parts)
    {
        requireNonNull(uploadId, "uploadId is null");
        checkArgument(!parts.isEmpty(), "Cannot complete multipart upload %s without parts", uploadId);
        Set<Integer> partNumbers = new HashSet<>();
        for (Part part : parts) {
            checkArgument(partNumbers.add(part.partNumber()), "Part %s is listed more than once", part.partNumber());
        }

        S3Response response = dispatcher.execute(S3Request.builder("POST")
                .withKey(key)
                .addQueryParameter("uploadId", uploadId)
                .addHeader("Content-Type", "application/xml")
                .withBody(MANIFEST_CODEC.toXmlBytes(new CompleteMultipartUpload(parts)))
                .build());

        CompleteMultipartUploadResult result = COMPLETE_CODEC.fromXml(response.body());
        String eTag = result.eTag().map(S3Response::unquote).orElseGet(response::eTag);
        log.debug("Completed multipart upload %s of %s with %s parts", uploadId, key, parts.size());
        return new CompletedMultipartUpload(dispatcher.bucketAddress().bucket(), key, eTag, result.location(), parts.size());
    }

    public void abortMultipartUpload(String key, String uploadId)
    {
        requireNonNull(uploadId, "uploadId is null");
        dispatcher.execute(S3Request.builder("DELETE")
                .withKey(key)
                .addQueryParameter("uploadId", uploadId)
                .build());
        log.debug("Aborted multipart upload %s of %s", uploadId, key);
    }

    CompletedMultipartUpload complete(MultipartUploadSession session)
    {
        session.startCompletion();
        CompletedMultipartUpload completed = completeMultipartUpload(session.key(), session.uploadId(), session.parts());
        session.completed();
        return completed;
    }

    void abort(MultipartUploadSession session)
    {
        session.startAbort();
        abortMultipartUpload(session.key(), session.uploadId());
    }
}
