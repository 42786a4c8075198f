/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.streamledger.ledger.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.UndispatchedEventsFoundException;
import org.streamledger.ledger.api.WriteResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@Timeout(10)
class DefaultBucketTest {

    private CommitStore commitStore;
    private ExecutorService executor;
    private DispatchCoordinator dispatchCoordinator;
    private DefaultBucket bucket;

    @BeforeEach
    void create_bucket() {
        commitStore = mock(CommitStore.class);
        when(commitStore.bucketState("bucket")).thenReturn(new BucketState("bucket", 0, false));
        when(commitStore.append(any(Commit.class))).thenReturn(AppendResult.APPENDED);
        executor = Executors.newSingleThreadExecutor();
        dispatchCoordinator = new DispatchCoordinator(commitStore, List::of, executor);
        bucket = new DefaultBucket("bucket", commitStore, new RevisionArbitrator(commitStore, true), dispatchCoordinator,
                new CommitTruncator(commitStore), new CommitQueries(commitStore), Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
    }

    @AfterEach
    void executor_is_shutdown_after_each_test() {
        executor.shutdownNow();
    }

    @Test
    void dispatches_the_commit_even_when_the_bucket_revision_cannot_be_advanced() {
        // Given
        doThrow(new IllegalStateException("store unavailable")).when(commitStore).advanceBucketRevision("bucket", 1);

        // When
        WriteResult writeResult = bucket.write("stream", 0, List.of("event"));
        writeResult.getDispatchTask().join();

        // Then
        assertThat(writeResult.getCommit().getBucketRevision()).isEqualTo(1);
        verify(commitStore).markDispatched("bucket", 1);
    }

    @Test
    void rejects_the_write_when_a_previous_dispatch_failed() {
        // Given
        when(commitStore.bucketState("bucket")).thenReturn(new BucketState("bucket", 1, true));

        // When
        Throwable throwable = catchThrowable(() -> bucket.write("stream", 1, List.of("event")));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UndispatchedEventsFoundException.class);
        verify(commitStore, never()).append(any(Commit.class));
    }

    @Test
    void rejects_writes_after_the_dispatch_coordinator_has_been_shutdown() {
        // Given
        dispatchCoordinator.shutdown(1, TimeUnit.SECONDS);

        // When
        Throwable throwable = catchThrowable(() -> bucket.write("stream", 0, List.of("event")));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessageContaining("shutdown");
        verify(commitStore, never()).append(any(Commit.class));
    }
}
