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

package org.streamledger.ledger.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class CommitFilterTest {

    @Test
    void all_matches_every_commit() {
        assertThat(CommitFilter.all().matches(commit(1, "stream1"))).isTrue();
        assertThat(CommitFilter.all().matches(commit(42, "stream2"))).isTrue();
    }

    @Test
    void bucket_revision_bounds_are_inclusive() {
        CommitFilter filter = CommitFilter.bucketRevisionBetween(2, 4);

        assertThat(filter.matches(commit(1, "stream"))).isFalse();
        assertThat(filter.matches(commit(2, "stream"))).isTrue();
        assertThat(filter.matches(commit(4, "stream"))).isTrue();
        assertThat(filter.matches(commit(5, "stream"))).isFalse();
    }

    @Test
    void criteria_are_combined() {
        CommitFilter filter = CommitFilter.streamId("stream1").fromBucketRevision(3);

        assertThat(filter.matches(commit(3, "stream1"))).isTrue();
        assertThat(filter.matches(commit(3, "stream2"))).isFalse();
        assertThat(filter.matches(commit(2, "stream1"))).isFalse();
    }

    @Test
    void filters_with_the_same_criteria_are_equal() {
        assertThat(CommitFilter.streamId("stream").toBucketRevision(3)).isEqualTo(CommitFilter.all().toBucketRevision(3).andStreamId("stream"));
    }

    @Test
    void commit_rejects_stream_revision_range_that_does_not_match_the_number_of_events() {
        Throwable throwable = catchThrowable(() -> new Commit("bucket", 1, "stream", 1, 3, List.of("event"), false, Instant.EPOCH));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static Commit commit(long bucketRevision, String streamId) {
        return new Commit("bucket", bucketRevision, streamId, 1, 1, List.of("event"), false, Instant.EPOCH);
    }
}
