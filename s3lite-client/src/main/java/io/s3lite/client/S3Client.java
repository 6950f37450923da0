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
package io.s3lite.client;

import com.google.common.collect.ImmutableMap;
import com.google.inject.BindingAnnotation;
import com.google.inject.Inject;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpClientConfig;
import io.airlift.http.client.jetty.JettyHttpClient;
import io.airlift.log.Logger;
import io.s3lite.client.addressing.BucketAddressResolver;
import io.s3lite.client.credentials.AwsProfile;
import io.s3lite.client.credentials.AwsProfileCredentialsProvider;
import io.s3lite.client.credentials.StaticCredentialsProvider;
import io.s3lite.client.objects.ObjectController;
import io.s3lite.client.quirks.StandardS3ProviderQuirks;
import io.s3lite.client.rest.S3RequestDispatcher;
import io.s3lite.client.signing.InternalSigningController;
import io.s3lite.client.transfer.MultipartUploadController;
import io.s3lite.client.transfer.MultipartUploadSession;
import io.s3lite.client.transfer.TransferConfig;
import io.s3lite.client.transfer.TransferController;
import io.s3lite.client.transfer.UploadSource;
import io.s3lite.spi.addressing.AddressStyle;
import io.s3lite.spi.addressing.BucketAddress;
import io.s3lite.spi.credentials.Credentials;
import io.s3lite.spi.credentials.CredentialsProvider;
import io.s3lite.spi.model.CreateBucketRequest;
import io.s3lite.spi.model.CreateBucketResult;
import io.s3lite.spi.model.DeleteObjectResult;
import io.s3lite.spi.model.ListObjectsResult;
import io.s3lite.spi.model.ObjectMetadata;
import io.s3lite.spi.model.PutObjectResult;
import io.s3lite.spi.model.S3Object;
import io.s3lite.spi.quirks.S3ProviderQuirks;
import io.s3lite.spi.signing.SigningController;
import io.s3lite.spi.transfer.CompletedMultipartUpload;
import io.s3lite.spi.transfer.Part;
import io.s3lite.spi.transfer.TransferProgressListener;
import io.s3lite.spi.transfer.UploadResult;
import jakarta.annotation.PreDestroy;

import java.io.Closeable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Client of a single bucket. The bucket address is resolved at construction, so a bad
 * endpoint or bucket name fails here rather than on the first request.
 */
public class S3Client
        implements Closeable
{
    private static final Logger log = Logger.get(S3Client.class);

    public static final Duration DEFAULT_PRESIGNED_URL_DURATION = Duration.ofHours(1);

    private final BucketAddress bucketAddress;
    private final S3RequestDispatcher dispatcher;
    private final ObjectController objectController;
    private final MultipartUploadController multipartUploadController;
    private final TransferController transferController;
    private final Duration defaultPresignedUrlDuration;
    private final Optional<JettyHttpClient> ownedHttpClient;

    @Retention(RUNTIME)
    @Target({FIELD, PARAMETER, METHOD})
    @BindingAnnotation
    public @interface ForS3Client {}

    @Inject
    public S3Client(@ForS3Client HttpClient httpClient, SigningController signingController, BucketAddress bucketAddress, S3ProviderQuirks quirks, TransferConfig transferConfig, S3ClientConfig config)
    {
        this(httpClient, signingController, bucketAddress, quirks, transferConfig, Duration.ofMillis(config.getPresignedUrlDuration().toMillis()), Optional.empty());
    }

    public S3Client(HttpClient httpClient, SigningController signingController, BucketAddress bucketAddress, S3ProviderQuirks quirks, TransferConfig transferConfig, Duration defaultPresignedUrlDuration)
    {
        this(httpClient, signingController, bucketAddress, quirks, transferConfig, defaultPresignedUrlDuration, Optional.empty());
    }

    private S3Client(HttpClient httpClient, SigningController signingController, BucketAddress bucketAddress, S3ProviderQuirks quirks, TransferConfig transferConfig, Duration defaultPresignedUrlDuration, Optional<JettyHttpClient> ownedHttpClient)
    {
        this.bucketAddress = requireNonNull(bucketAddress, "bucketAddress is null");
        this.dispatcher = new S3RequestDispatcher(httpClient, signingController, bucketAddress);
        this.objectController = new ObjectController(dispatcher, quirks);
        this.multipartUploadController = new MultipartUploadController(dispatcher);
        this.transferController = new TransferController(objectController, multipartUploadController, transferConfig);
        this.defaultPresignedUrlDuration = requireNonNull(defaultPresignedUrlDuration, "defaultPresignedUrlDuration is null");
        this.ownedHttpClient = requireNonNull(ownedHttpClient, "ownedHttpClient is null");
        log.debug("Created client for %s", bucketAddress);
    }

    public static S3Client create(URI endpoint, String bucket, Credentials credentials)
    {
        return create(endpoint, bucket, AddressStyle.AUTO, new StaticCredentialsProvider(credentials), new StandardS3ProviderQuirks(), new TransferConfig());
    }

    /**
     * Creates a client that owns its HTTP client and closes it in {@link #close()}
     *
     * @throws io.s3lite.spi.exceptions.S3ConfigurationException if the endpoint or bucket cannot be addressed or the transfer settings are not positive
     */
    public static S3Client create(URI endpoint, String bucket, AddressStyle addressStyle, CredentialsProvider credentialsProvider, S3ProviderQuirks quirks, TransferConfig transferConfig)
    {
        BucketAddress bucketAddress = BucketAddressResolver.resolve(endpoint, bucket, addressStyle);
        JettyHttpClient httpClient = new JettyHttpClient(new HttpClientConfig());
        try {
            return new S3Client(
                    httpClient,
                    new InternalSigningController(credentialsProvider),
                    bucketAddress,
                    quirks,
                    transferConfig,
                    DEFAULT_PRESIGNED_URL_DURATION,
                    Optional.of(httpClient));
        }
        catch (RuntimeException e) {
            httpClient.close();
            throw e;
        }
    }

    /**
     * Creates a client from a profile of {@code ~/.aws/config}. The endpoint is the
     * profile's {@code endpoint_url} or the AWS endpoint of the profile's region.
     */
    public static S3Client fromAwsProfile(String profileName, String bucket)
    {
        return fromAwsProfile(AwsProfile.load(profileName, AwsProfile.defaultConfigFile(), Optional.empty()), bucket);
    }

    public static S3Client fromAwsProfile(AwsProfile profile, String bucket)
    {
        URI endpoint = profile.endpointUrl().orElseGet(() -> BucketAddressResolver.defaultEndpoint(profile.credentials().region()));
        return create(endpoint, bucket, AddressStyle.AUTO, new AwsProfileCredentialsProvider(profile), new StandardS3ProviderQuirks(), new TransferConfig());
    }

    public String bucket()
    {
        return bucketAddress.bucket();
    }

    public BucketAddress bucketAddress()
    {
        return bucketAddress;
    }

    public PutObjectResult putObject(String key, byte[] data)
    {
        return putObject(key, data, Optional.empty(), ImmutableMap.of());
    }

    public PutObjectResult putObject(String key, byte[] data, Optional<String> contentType, Map<String, String> metadata)
    {
        return objectController.putObject(key, data, contentType, metadata);
    }

    public S3Object getObject(String key)
    {
        return objectController.getObject(key);
    }

    public ObjectMetadata headObject(String key)
    {
        return objectController.headObject(key);
    }

    public DeleteObjectResult deleteObject(String key)
    {
        return objectController.deleteObject(key);
    }

    public ListObjectsResult listObjects(Optional<String> prefix)
    {
        return listObjects(prefix, ObjectController.MAX_LIST_KEYS, Optional.empty());
    }

    public ListObjectsResult listObjects(Optional<String> prefix, int maxKeys, Optional<String> continuationToken)
    {
        return objectController.listObjects(prefix, maxKeys, continuationToken);
    }

    public CreateBucketResult createBucket()
    {
        return createBucket(CreateBucketRequest.builder().build());
    }

    public CreateBucketResult createBucket(CreateBucketRequest request)
    {
        return objectController.createBucket(request);
    }

    public void deleteBucket()
    {
        objectController.deleteBucket();
    }

    public URI generatePresignedUrl(String httpMethod, String key)
    {
        return generatePresignedUrl(httpMethod, key, defaultPresignedUrlDuration, ImmutableMap.of());
    }

    /**
     * @param queryParameters additional unencoded parameters covered by the signature
     */
    public URI generatePresignedUrl(String httpMethod, String key, Duration expiresIn, Map<String, String> queryParameters)
    {
        return dispatcher.presign(httpMethod, key, queryParameters, expiresIn);
    }

    public UploadResult uploadFile(String key, Path file)
    {
        return uploadFile(key, UploadSource.fromFile(file), Optional.empty(), ImmutableMap.of(), TransferProgressListener.NOOP);
    }

    /**
     * Uploads with a single PUT up to the multipart threshold, otherwise as a multipart upload.
     *
     * @throws io.s3lite.spi.exceptions.TransferFailedException if a multipart upload fails; the upload has been aborted
     */
    public UploadResult uploadFile(String key, UploadSource source, Optional<String> contentType, Map<String, String> metadata, TransferProgressListener progressListener)
    {
        return transferController.upload(bucketAddress.bucket(), key, source, contentType, metadata, progressListener);
    }

    public MultipartUploadSession createMultipartUpload(String key, Optional<String> contentType, Map<String, String> metadata)
    {
        return multipartUploadController.createMultipartUpload(key, contentType, metadata);
    }

    public Part uploadPart(String key, String uploadId, int partNumber, byte[] data)
    {
        return multipartUploadController.uploadPart(key, uploadId, partNumber, data);
    }

    public CompletedMultipartUpload completeMultipartUpload(String key, String uploadId, List<Part> parts)
    {
        return multipartUploadController.completeMultipartUpload(key, uploadId, parts);
    }

    public void abortMultipartUpload(String key, String uploadId)
    {
        multipartUploadController.abortMultipartUpload(key, uploadId);
    }

    @PreDestroy
    @Override
    public void close()
    {
        transferController.shutDown();
        ownedHttpClient.ifPresent(JettyHttpClient::close);
    }
}
