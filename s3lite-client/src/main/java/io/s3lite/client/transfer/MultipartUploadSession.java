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
import io.s3lite.spi.transfer.Part;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * An initiated multipart upload and the parts acknowledged so far. Parts are kept
 * ordered by number; recording a number again replaces the earlier part.
 */
public final class MultipartUploadSession
{
    public enum State
    {
        ACTIVE,
        COMPLETING,
        COMPLETED,
        ABORTED,
    }

    private final String bucket;
    private final String key;
    private final String uploadId;
    private final SortedMap<Integer, Part> parts = new TreeMap<>();
    private State state = State.ACTIVE;

    public MultipartUploadSession(String bucket, String key, String uploadId)
    {
        this.bucket = requireNonNull(bucket, "bucket is null");
        this.key = requireNonNull(key, "key is null");
        this.uploadId = requireNonNull(uploadId, "uploadId is null");
    }

    public String bucket()
    {
        return bucket;
    }

    public String key()
    {
        return key;
    }

    public String uploadId()
    {
        return uploadId;
    }

    public synchronized void recordPart(Part part)
    {
        checkState(state == State.ACTIVE, "Cannot record part %s of upload %s in state %s", part.partNumber(), uploadId, state);
        parts.put(part.partNumber(), part);
    }

    public synchronized List<Part> parts()
    {
        return ImmutableList.copyOf(parts.values());
    }

    public synchronized State state()
    {
        return state;
    }

    synchronized void startCompletion()
    {
        checkState(state == State.ACTIVE, "Upload %s cannot be completed in state %s", uploadId, state);
        state = State.COMPLETING;
    }

    synchronized void completed()
    {
        checkState(state == State.COMPLETING, "Upload %s was not being completed: %s", uploadId, state);
        state = State.COMPLETED;
    }

    /**
     * Allowed once, before completion or after a failed completion
     */
    synchronized void startAbort()
    {
        checkState(state == State.ACTIVE || state == State.COMPLETING, "Upload %s cannot be aborted in state %s", uploadId, state);
        state = State.ABORTED;
    }

    @Override
    public String toString()
    {
        return "MultipartUploadSession[bucket=%s, key=%s, uploadId=%s]".formatted(bucket, key, uploadId);
    }
}
