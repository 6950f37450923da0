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

import io.s3lite.spi.transfer.Part;
import org.junit.jupiter.api.Test;

import static io.s3lite.client.transfer.MultipartUploadSession.State.ABORTED;
import static io.s3lite.client.transfer.MultipartUploadSession.State.ACTIVE;
import static io.s3lite.client.transfer.MultipartUploadSession.State.COMPLETED;
import static io.s3lite.client.transfer.MultipartUploadSession.State.COMPLETING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestMultipartUploadSession
{
    @Test
    public void testPartsAreOrderedAndReplaced()
    {
        MultipartUploadSession session = new MultipartUploadSession("bucket", "key", "upload-1");
        session.recordPart(new Part(3, "c", 1));
        session.recordPart(new Part(1, "a", 5));
        session.recordPart(new Part(2, "b", 5));
        session.recordPart(new Part(1, "a2", 5));

        assertThat(session.parts()).containsExactly(
                new Part(1, "a2", 5),
                new Part(2, "b", 5),
                new Part(3, "c", 1));
        assertThat(session.state()).isEqualTo(ACTIVE);
    }

    @Test
    public void testCompletion()
    {
        MultipartUploadSession session = new MultipartUploadSession("bucket", "key", "upload-1");
        session.startCompletion();
        assertThat(session.state()).isEqualTo(COMPLETING);
        assertThatThrownBy(() -> session.recordPart(new Part(1, "a", 5))).isInstanceOf(IllegalStateException.class);

        session.completed();
        assertThat(session.state()).isEqualTo(COMPLETED);
        assertThatThrownBy(session::startAbort).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::startCompletion).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testAbortHappensOnce()
    {
        MultipartUploadSession session = new MultipartUploadSession("bucket", "key", "upload-1");
        session.startAbort();
        assertThat(session.state()).isEqualTo(ABORTED);
        assertThatThrownBy(session::startAbort)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("upload-1");
        assertThatThrownBy(session::startCompletion).isInstanceOf(IllegalStateException.class);

        MultipartUploadSession failedCompletion = new MultipartUploadSession("bucket", "key", "upload-2");
        failedCompletion.startCompletion();
        failedCompletion.startAbort();
        assertThat(failedCompletion.state()).isEqualTo(ABORTED);
    }
}
