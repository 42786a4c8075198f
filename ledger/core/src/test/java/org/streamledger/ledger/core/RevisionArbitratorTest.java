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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.streamledger.ledger.api.ConcurrencyWriteException;
import org.streamledger.ledger.api.InvalidStreamRevisionException;
import org.streamledger.ledger.api.NonSequentialStreamRevisionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RevisionArbitratorTest {

    @Nested
    @DisplayName("arbitrate")
    class Arbitrate {

        @Test
        void accepts_expected_revision_that_equals_current_revision() {
            assertThat(RevisionArbitrator.arbitrate(3, 3).isAccepted()).isTrue();
        }

        @Test
        void accepts_zero_for_a_new_stream() {
            assertThat(RevisionArbitrator.arbitrate(0, 0)).isEqualTo(RevisionDecision.accepted());
        }

        @Test
        void rejects_negative_expected_revision() {
            assertThat(RevisionArbitrator.arbitrate(-1, 0)).isEqualTo(new RevisionDecision.NegativeRevision(-1));
        }

        @Test
        void rejects_expected_revision_ahead_of_current_revision_as_non_sequential() {
            assertThat(RevisionArbitrator.arbitrate(5, 2)).isEqualTo(new RevisionDecision.NonSequential(5, 2));
        }

        @Test
        void rejects_expected_revision_behind_current_revision_as_concurrency_conflict() {
            assertThat(RevisionArbitrator.arbitrate(1, 2)).isEqualTo(new RevisionDecision.ConcurrencyConflict(1, 2));
        }
    }

    @Nested
    @DisplayName("decision to exception")
    class DecisionToException {

        @Test
        void negative_revision_is_translated_to_invalid_stream_revision_exception() {
            RuntimeException exception = new RevisionDecision.NegativeRevision(-2).toException("bucket", "stream");

            assertThat(exception).isExactlyInstanceOf(InvalidStreamRevisionException.class).isInstanceOf(IllegalArgumentException.class);
            assertThat(((InvalidStreamRevisionException) exception).expectedStreamRevision).isEqualTo(-2);
        }

        @Test
        void non_sequential_is_translated_to_non_sequential_stream_revision_exception() {
            RuntimeException exception = new RevisionDecision.NonSequential(4, 1).toException("bucket", "stream");

            assertThat(exception).isInstanceOf(NonSequentialStreamRevisionException.class).isInstanceOf(IllegalArgumentException.class);
            assertThat(((NonSequentialStreamRevisionException) exception).actualStreamRevision).isEqualTo(1);
        }

        @Test
        void concurrency_conflict_is_translated_to_concurrency_write_exception() {
            RuntimeException exception = new RevisionDecision.ConcurrencyConflict(1, 2).toException("bucket", "stream");

            assertThat(exception).isEqualTo(new ConcurrencyWriteException("bucket", "stream", 1, 2));
        }

        @Test
        void accepted_cannot_be_translated_to_an_exception() {
            assertThatThrownBy(() -> RevisionDecision.accepted().toException("bucket", "stream"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("before write")
    class BeforeWrite {

        @Test
        void reads_the_current_stream_revision_when_check_before_writing_is_enabled() {
            // Given
            CommitStore commitStore = mock(CommitStore.class);
            when(commitStore.streamRevision("bucket", "stream")).thenReturn(2L);
            RevisionArbitrator arbitrator = new RevisionArbitrator(commitStore, true);

            // When
            RevisionDecision decision = arbitrator.beforeWrite("bucket", "stream", 1);

            // Then
            assertThat(decision).isEqualTo(new RevisionDecision.ConcurrencyConflict(1, 2));
        }

        @Test
        void does_not_read_the_stream_revision_when_check_before_writing_is_disabled() {
            // Given
            CommitStore commitStore = mock(CommitStore.class);
            RevisionArbitrator arbitrator = new RevisionArbitrator(commitStore, false);

            // When
            RevisionDecision decision = arbitrator.beforeWrite("bucket", "stream", 7);

            // Then
            assertThat(decision.isAccepted()).isTrue();
            verify(commitStore, never()).streamRevision(anyString(), anyString());
        }

        @Test
        void rejects_negative_revision_when_check_before_writing_is_disabled() {
            RevisionArbitrator arbitrator = new RevisionArbitrator(mock(CommitStore.class), false);

            assertThat(arbitrator.beforeWrite("bucket", "stream", -1)).isEqualTo(new RevisionDecision.NegativeRevision(-1));
        }
    }

    @Nested
    @DisplayName("stream revision taken")
    class StreamRevisionTaken {

        @Test
        void reports_the_current_stream_revision_of_the_concurrent_writer() {
            CommitStore commitStore = mock(CommitStore.class);
            when(commitStore.streamRevision("bucket", "stream")).thenReturn(3L);

            RevisionDecision decision = new RevisionArbitrator(commitStore, false).streamRevisionTaken("bucket", "stream", 1);

            assertThat(decision).isEqualTo(new RevisionDecision.ConcurrencyConflict(1, 3));
        }

        @Test
        void reports_a_stream_revision_ahead_of_the_expected_one_when_the_colliding_commit_is_gone() {
            CommitStore commitStore = mock(CommitStore.class);
            when(commitStore.streamRevision("bucket", "stream")).thenReturn(0L);

            RevisionDecision decision = new RevisionArbitrator(commitStore, true).streamRevisionTaken("bucket", "stream", 0);

            assertThat(decision).isEqualTo(new RevisionDecision.ConcurrencyConflict(0, 1));
        }
    }
}
