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
package io.s3lite.client.objects;

import com.google.common.primitives.Longs;
import io.airlift.log.Logger;
import io.s3lite.client.rest.S3Request;
import io.s3lite.client.rest.S3RequestDispatcher;
import io.s3lite.client.rest.S3Response;
import io.s3lite.client.xml.CreateBucketConfiguration;
import io.s3lite.client.xml.ListBucketResult;
import io.s3lite.client.xml.XmlCodec;
import io.s3lite.spi.model.CreateBucketRequest;
import io.s3lite.spi.model.CreateBucketResult;
import io.s3lite.spi.model.DeleteObjectResult;
import io.s3lite.spi.model.ListObjectsResult;
import io.s3lite.spi.model.ObjectMetadata;
import io.s3lite.spi.model.PutObjectResult;
import io.s3lite.spi.model.S3Object;
import io.s3lite.spi.model.S3ObjectSummary;
import io.s3lite.spi.quirks.S3ProviderQuirks;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.s3lite.client.xml.XmlCodec.xmlCodec;
import static java.util.Objects.requireNonNull;

/**
 * Object and bucket operations on the dispatcher's bucket.
 */
public class ObjectController
{
    private static final Logger log = Logger.get(ObjectController.class);

    public static final int MAX_LIST_KEYS = 1000;

    private static final XmlCodec<ListBucketResult> LIST_CODEC = xmlCodec(ListBucketResult.class);
    private static final XmlCodec<CreateBucketConfiguration> CREATE_BUCKET_CODEC = xmlCodec(CreateBucketConfiguration.class);

    private final S3RequestDispatcher dispatcher;
    private final S3ProviderQuirks quirks;

    public ObjectController(S3RequestDispatcher dispatcher, S3ProviderQuirks quirks)
    {
        this.dispatcher = requireNonNull(dispatcher, "dispatcher is null");
        this.quirks = requireNonNull(quirks, "quirks is null");
    }

    public PutObjectResult putObject(String key, byte[] data, Optional<String> contentType, Map<String, String> metadata)
    {
        S3Response response = dispatcher.execute(S3Request.builder("PUT")
                .withKey(key)
                .addOptionalHeader("Content-Type", contentType)
                .addUserMetadata(metadata)
                .withBody(data)
                .build());
        return new PutObjectResult(response.eTag(), response.header("x-amz-version-id"), response.header("x-amz-server-side-encryption"));
    }

    public S3Object getObject(String key)
    {
        S3Response response = dispatcher.execute(S3Request.builder("GET").withKey(key).build());
        return new S3Object(key, objectMetadata(response, response.body().length), response.body());
    }

    public ObjectMetadata headObject(String key)
    {
        S3Response response = dispatcher.execute(S3Request.builder("HEAD").withKey(key).build());
        return objectMetadata(response, 0);
    }

    public DeleteObjectResult deleteObject(String key)
    {
        S3Response response = dispatcher.execute(S3Request.builder("DELETE").withKey(key).build());
        boolean deleteMarker = response.header("x-amz-delete-marker").map(Boolean::parseBoolean).orElse(false);
        return new DeleteObjectResult(deleteMarker, response.header("x-amz-version-id"));
    }

    /**
     * One page of a ListObjectsV2 listing. Returned keys are normalized by the provider quirks.
     */
    public ListObjectsResult listObjects(Optional<String> prefix, int maxKeys, Optional<String> continuationToken)
    {
        checkArgument(maxKeys >= 1 && maxKeys <= MAX_LIST_KEYS, "maxKeys must be between 1 and %s: %s", MAX_LIST_KEYS, maxKeys);

        S3Request.Builder request = S3Request.builder("GET")
                .addQueryParameter("list-type", "2")
                .addQueryParameter("max-keys", String.valueOf(maxKeys));
        prefix.map(quirks::listPrefix).ifPresent(value -> request.addQueryParameter("prefix", value));
        continuationToken.ifPresent(token -> request.addQueryParameter("continuation-token", token));
        S3Response response = dispatcher.execute(request.build());

        if (response.body().length == 0) {
            return ListObjectsResult.empty(prefix, maxKeys);
        }
        ListBucketResult result = LIST_CODEC.fromXml(response.body());
        List<S3ObjectSummary> objects = result.contents().stream()
                .filter(contents -> contents.key().isPresent())
                .map(contents -> new S3ObjectSummary(
                        quirks.normalizeListedKey(contents.key().orElseThrow()),
                        contents.lastModified().orElse(""),
                        contents.eTag().map(S3Response::unquote).orElse(""),
                        contents.size(),
                        contents.storageClass().orElse(S3ObjectSummary.DEFAULT_STORAGE_CLASS)))
                .collect(toImmutableList());
        log.debug("Listed %s objects with prefix %s, truncated: %s", objects.size(), prefix.orElse(""), result.truncated());
        return new ListObjectsResult(objects, result.truncated(), result.nextContinuationToken(), prefix, maxKeys);
    }

    public CreateBucketResult createBucket(CreateBucketRequest createBucketRequest)
    {
        S3Request.Builder request = S3Request.builder("PUT")
                .addOptionalHeader("x-amz-acl", createBucketRequest.acl())
                .addOptionalHeader("x-amz-grant-full-control", createBucketRequest.grantFullControl())
                .addOptionalHeader("x-amz-grant-read", createBucketRequest.grantRead())
                .addOptionalHeader("x-amz-grant-read-acp", createBucketRequest.grantReadAcp())
                .addOptionalHeader("x-amz-grant-write", createBucketRequest.grantWrite())
                .addOptionalHeader("x-amz-grant-write-acp", createBucketRequest.grantWriteAcp())
                .addOptionalHeader("x-amz-bucket-object-lock-enabled", createBucketRequest.objectLockEnabled().map(String::valueOf))
                .addOptionalHeader("x-amz-object-ownership", createBucketRequest.objectOwnership());
        CreateBucketConfiguration.from(createBucketRequest).ifPresent(configuration -> request
                .addHeader("Content-Type", "application/xml")
                .withBody(CREATE_BUCKET_CODEC.toXmlBytes(configuration)));

        S3Response response = dispatcher.execute(request.build());
        log.debug("Created bucket %s", dispatcher.bucketAddress().bucket());
        return new CreateBucketResult(response.header("Location"));
    }

    public void deleteBucket()
    {
        dispatcher.execute(S3Request.builder("DELETE").build());
        log.debug("Deleted bucket %s", dispatcher.bucketAddress().bucket());
    }

    private static ObjectMetadata objectMetadata(S3Response response, long defaultContentLength)
    {
        long contentLength = response.header("Content-Length")
                .map(Longs::tryParse)
                .orElse(defaultContentLength);
        return new ObjectMetadata(
                response.header("Content-Type"),
                contentLength,
                response.eTag(),
                response.header("Last-Modified"),
                response.header("x-amz-version-id"),
                response.header("x-amz-server-side-encryption"),
                response.userMetadata());
    }
}
