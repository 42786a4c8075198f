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

package org.streamledger.ledger.inmemory;

import org.junit.jupiter.api.Test;
import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.CommitFilter;
import org.streamledger.ledger.core.BucketState;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCommitStoreTest {

    private final InMemoryCommitStore commitStore = new InMemoryCommitStore();

    @Test
    void querying_an_unknown_bucket_does_not_create_it() {
        // When
        BucketState bucketState = commitStore.bucketState("unknown");
        long streamRevision = commitStore.streamRevision("unknown", "stream");
        List<Commit> commits = commitStore.commits("unknown", CommitFilter.all()).toList();
        boolean hasUndispatchedCommits = commitStore.hasUndispatchedCommits("unknown");
        commitStore.markDispatched("unknown", 1);
        commitStore.deleteCommitsAbove("unknown", 0);

        // Then
        assertThat(bucketState).isEqualTo(new BucketState("unknown", 0, false));
        assertThat(streamRevision).isZero();
        assertThat(commits).isEmpty();
        assertThat(hasUndispatchedCommits).isFalse();
        assertThat(commitStore.streamIds("unknown")).isEmpty();
        assertThat(commitStore.lastCommittedBucketRevision("unknown")).isZero();
        assertThat(commitStore.exists("unknown")).isFalse();
    }

    @Test
    void appending_a_commit_creates_the_bucket() {
        // When
        commitStore.append(new Commit("bucket", 1, "stream", 1, 1, List.of("event"), false, Instant.EPOCH));

        // Then
        assertThat(commitStore.exists("bucket")).isTrue();
        assertThat(commitStore.lastCommittedBucketRevision("bucket")).isEqualTo(1);
    }

    @Test
    void flagging_a_failed_dispatch_of_an_unknown_bucket_is_kept() {
        // When
        commitStore.markDispatchFailed("bucket", true);

        // Then
        assertThat(commitStore.bucketState("bucket")).isEqualTo(new BucketState("bucket", 0, true));
    }

    @Test
    void deleting_a_bucket_removes_it() {
        // Given
        commitStore.append(new Commit("bucket", 1, "stream", 1, 1, List.of("event"), false, Instant.EPOCH));

        // When
        commitStore.deleteBucket("bucket");

        // Then
        assertThat(commitStore.exists("bucket")).isFalse();
    }
}
