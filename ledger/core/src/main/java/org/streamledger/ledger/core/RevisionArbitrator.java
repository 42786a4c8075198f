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

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a write with a given expected stream revision may proceed.
 * <p>
 * Reading the stream revision before writing is only a fast path, two writers may both read the same revision. The commit store's
 * uniqueness constraint on {@code (streamId, streamRevisionStart)} catches those races, and {@link #streamRevisionTaken(String, String, long)}
 * maps such a rejection to the same {@link RevisionDecision.ConcurrencyConflict} as the read-based check.
 */
public class RevisionArbitrator {

    private final CommitStore commitStore;
    private final boolean checkStreamRevisionBeforeWriting;

    public RevisionArbitrator(CommitStore commitStore, boolean checkStreamRevisionBeforeWriting) {
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        this.commitStore = commitStore;
        this.checkStreamRevisionBeforeWriting = checkStreamRevisionBeforeWriting;
    }

    /**
     * Arbitrate the expected stream revision of a writer against the current revision of the stream.
     *
     * @param expectedStreamRevision The stream revision the writer expects the stream to be at
     * @param currentStreamRevision  The actual stream revision
     * @return The {@link RevisionDecision}
     */
    public static RevisionDecision arbitrate(long expectedStreamRevision, long currentStreamRevision) {
        if (expectedStreamRevision < 0) {
            return new RevisionDecision.NegativeRevision(expectedStreamRevision);
        } else if (expectedStreamRevision > currentStreamRevision) {
            return new RevisionDecision.NonSequential(expectedStreamRevision, currentStreamRevision);
        } else if (expectedStreamRevision < currentStreamRevision) {
            return new RevisionDecision.ConcurrencyConflict(expectedStreamRevision, currentStreamRevision);
        }
        return RevisionDecision.accepted();
    }

    /**
     * Validate the expected stream revision without accessing the commit store.
     */
    public static RevisionDecision validate(long expectedStreamRevision) {
        return expectedStreamRevision < 0 ? new RevisionDecision.NegativeRevision(expectedStreamRevision) : RevisionDecision.accepted();
    }

    /**
     * Decide whether a write may be attempted. Reads the current stream revision unless the check before writing is disabled, in which
     * case only negative revisions are rejected.
     */
    public RevisionDecision beforeWrite(String bucketName, String streamId, long expectedStreamRevision) {
        RevisionDecision validation = validate(expectedStreamRevision);
        if (!validation.isAccepted() || !checkStreamRevisionBeforeWriting) {
            return validation;
        }
        return arbitrate(expectedStreamRevision, commitStore.streamRevision(bucketName, streamId));
    }

    /**
     * The commit store rejected a commit because its stream revision range collides with an existing commit.
     */
    public RevisionDecision streamRevisionTaken(String bucketName, String streamId, long expectedStreamRevision) {
        long actualStreamRevision = commitStore.streamRevision(bucketName, streamId);
        // The colliding commit might have been rolled back in the meantime, the stream has still moved past what the writer expected.
        return new RevisionDecision.ConcurrencyConflict(expectedStreamRevision, Math.max(actualStreamRevision, expectedStreamRevision + 1));
    }

    public boolean isCheckStreamRevisionBeforeWriting() {
        return checkStreamRevisionBeforeWriting;
    }
}
