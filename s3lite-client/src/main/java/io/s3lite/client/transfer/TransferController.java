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

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.s3lite.client.objects.ObjectController;
import io.s3lite.spi.exceptions.ProtocolLimitException;
import io.s3lite.spi.exceptions.S3ConfigurationException;
import io.s3lite.spi.exceptions.TransferFailedException;
import io.s3lite.spi.model.PutObjectResult;
import io.s3lite.spi.transfer.CompletedMultipartUpload;
import io.s3lite.spi.transfer.Part;
import io.s3lite.spi.transfer.TransferProgressListener;
import io.s3lite.spi.transfer.UploadResult;
import io.s3lite.spi.transfer.UploadType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.util.concurrent.MoreExecutors.shutdownAndAwaitTermination;
import static io.airlift.concurrent.Threads.daemonThreadsNamed;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newCachedThreadPool;

/**
 * Uploads a source either with a single PUT or as a multipart upload whose parts
 * are sent by at most {@code maxConcurrency} workers. Once a multipart upload has
 * been initiated it is either completed or aborted, never left open by this class.
 */
public class TransferController
{
    private static final Logger log = Logger.get(TransferController.class);

    private final ObjectController objectController;
    private final MultipartUploadController multipartUploadController;
    private final long multipartThreshold;
    private final long requestedPartSize;
    private final int maxConcurrency;
    private final ExecutorService executor;

    public TransferController(ObjectController objectController, MultipartUploadController multipartUploadController, TransferConfig config)
    {
        this.objectController = requireNonNull(objectController, "objectController is null");
        this.multipartUploadController = requireNonNull(multipartUploadController, "multipartUploadController is null");
        requireNonNull(config, "config is null");
        this.multipartThreshold = config.getMultipartThreshold().toBytes();
        this.requestedPartSize = config.getPartSize().toBytes();
        this.maxConcurrency = config.getMaxConcurrency();
        if (multipartThreshold < 1) {
            throw new S3ConfigurationException("Multipart threshold must be positive: " + config.getMultipartThreshold());
        }
        if (requestedPartSize < 1) {
            throw new S3ConfigurationException("Part size must be positive: " + config.getPartSize());
        }
        if (maxConcurrency < 1) {
            throw new S3ConfigurationException("Max concurrency must be at least 1: " + maxConcurrency);
        }
        this.executor = newCachedThreadPool(daemonThreadsNamed("s3-transfer-%s"));
    }

    public void shutDown()
    {
        if (!shutdownAndAwaitTermination(executor, Duration.ofSeconds(10))) {
            log.warn("Transfer executor did not shut down properly");
        }
    }

    public UploadResult upload(String bucket, String key, UploadSource source, Optional<String> contentType, Map<String, String> metadata, TransferProgressListener progressListener)
    {
        requireNonNull(key, "key is null");
        requireNonNull(source, "source is null");
        requireNonNull(contentType, "contentType is null");
        requireNonNull(metadata, "metadata is null");
        requireNonNull(progressListener, "progressListener is null");

        long size = source.size();
        UploadType uploadType = PartSizing.decideStrategy(size, multipartThreshold);
        log.info("Uploading %s bytes to %s/%s as %s", size, bucket, key, uploadType);
        return switch (uploadType) {
            case SINGLE_PART -> uploadSinglePart(bucket, key, source, size, contentType, metadata, progressListener);
            case MULTIPART -> uploadMultipart(key, source, size, contentType, metadata, progressListener);
        };
    }

    private UploadResult uploadSinglePart(String bucket, String key, UploadSource source, long size, Optional<String> contentType, Map<String, String> metadata, TransferProgressListener progressListener)
    {
        if (size > Integer.MAX_VALUE) {
            throw new S3ConfigurationException("Multipart threshold of %s bytes is larger than a single request body can hold".formatted(multipartThreshold));
        }
        PutObjectResult result = objectController.putObject(key, source.read(0, (int) size), contentType, metadata);
        progressListener.bytesTransferred(size);
        log.info("Uploaded %s/%s in a single request", bucket, key);
        return UploadResult.singlePart(bucket, key, result.eTag(), size);
    }

    private UploadResult uploadMultipart(String key, UploadSource source, long size, Optional<String> contentType, Map<String, String> metadata, TransferProgressListener progressListener)
    {
        long partSize = PartSizing.adjustPartSize(requestedPartSize, size);
        if (partSize > Integer.MAX_VALUE) {
            throw new ProtocolLimitException("Part size of %s bytes required for %s bytes exceeds the largest part this client can buffer".formatted(partSize, size));
        }
        List<PartRange> ranges = PartRange.split(size, partSize);

        MultipartUploadSession session;
        try {
            session = multipartUploadController.createMultipartUpload(key, contentType, metadata);
        }
        catch (RuntimeException e) {
            throw new TransferFailedException(key, Optional.empty(), "Failed to initiate multipart upload of " + key, e);
        }
        log.info("Started multipart upload %s of %s: %s parts of %s bytes", session.uploadId(), key, ranges.size(), partSize);

        Optional<Throwable> failure;
        try {
            failure = uploadParts(session, source, ranges, progressListener);
        }
        catch (InterruptedException e) {
            abortQuietly(session, e);
            Thread.currentThread().interrupt();
            throw new TransferFailedException(key, Optional.of(session.uploadId()), "Multipart upload of %s was interrupted".formatted(key), e);
        }

        if (failure.isEmpty() && session.parts().size() != ranges.size()) {
            failure = Optional.of(new IllegalStateException("Expected %s parts but %s were uploaded".formatted(ranges.size(), session.parts().size())));
        }
        if (failure.isPresent()) {
            abortQuietly(session, failure.get());
            throw new TransferFailedException(key, Optional.of(session.uploadId()), "Multipart upload of %s failed".formatted(key), failure.get());
        }

        CompletedMultipartUpload completed;
        try {
            completed = multipartUploadController.complete(session);
        }
        catch (RuntimeException e) {
            abortQuietly(session, e);
            throw new TransferFailedException(key, Optional.of(session.uploadId()), "Failed to complete multipart upload of " + key, e);
        }
        log.info("Completed multipart upload %s of %s", session.uploadId(), key);
        return UploadResult.multipart(session.bucket(), key, completed.eTag(), size, partSize, completed.partCount(), completed.location());
    }

    /**
     * Returns the first failure of any worker. Workers stop taking parts once a failure is recorded.
     */
    private Optional<Throwable> uploadParts(MultipartUploadSession session, UploadSource source, List<PartRange> ranges, TransferProgressListener progressListener)
            throws InterruptedException
    {
        PartQueue queue = new PartQueue(source, ranges);
        AtomicBoolean cancelled = new AtomicBoolean();
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();

        int workerCount = Math.min(maxConcurrency, ranges.size());
        List<Future<?>> workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            try {
                workers.add(executor.submit(() -> uploadWorker(session, queue, cancelled, firstFailure, progressListener)));
            }
            catch (RejectedExecutionException e) {
                cancelled.set(true);
                firstFailure.compareAndSet(null, e);
                break;
            }
        }

        try {
            for (Future<?> worker : workers) {
                try {
                    worker.get();
                }
                catch (ExecutionException e) {
                    cancelled.set(true);
                    firstFailure.compareAndSet(null, e.getCause());
                }
            }
        }
        catch (InterruptedException e) {
            cancelled.set(true);
            throw e;
        }
        return Optional.ofNullable(firstFailure.get());
    }

    private void uploadWorker(MultipartUploadSession session, PartQueue queue, AtomicBoolean cancelled, AtomicReference<Throwable> firstFailure, TransferProgressListener progressListener)
    {
        while (!cancelled.get()) {
            try {
                Optional<PartPayload> payload = queue.next();
                if (payload.isEmpty() || cancelled.get()) {
                    return;
                }
                int partNumber = payload.get().range().partNumber();
                Part part = multipartUploadController.uploadPart(session.key(), session.uploadId(), partNumber, payload.get().data());
                if (cancelled.get()) {
                    // upload is being aborted, the part is discarded
                    return;
                }
                session.recordPart(part);
                progressListener.bytesTransferred(part.size());
            }
            catch (RuntimeException e) {
                if (firstFailure.compareAndSet(null, e)) {
                    log.debug(e, "Part upload of %s failed, cancelling remaining parts of %s", session.key(), session.uploadId());
                }
                cancelled.set(true);
                return;
            }
        }
    }

    private void abortQuietly(MultipartUploadSession session, Throwable cause)
    {
        try {
            multipartUploadController.abort(session);
        }
        catch (RuntimeException e) {
            log.warn(e, "Failed to abort multipart upload %s of %s", session.uploadId(), session.key());
            if (cause != e) {
                cause.addSuppressed(e);
            }
        }
    }

    private record PartPayload(PartRange range, byte[] data) {}

    private static class PartQueue
    {
        private final UploadSource source;
        private final Iterator<PartRange> ranges;

        PartQueue(UploadSource source, List<PartRange> ranges)
        {
            this.source = source;
            this.ranges = ImmutableList.copyOf(ranges).iterator();
        }

        Optional<PartPayload> next()
        {
            PartRange range;
            synchronized (this) {
                if (!ranges.hasNext()) {
                    return Optional.empty();
                }
                range = ranges.next();
                // sequential sources must be read in the order ranges are handed out
                if (source.isSequential()) {
                    return Optional.of(new PartPayload(range, source.read(range.offset(), range.length())));
                }
            }
            return Optional.of(new PartPayload(range, source.read(range.offset(), range.length())));
        }
    }
}
