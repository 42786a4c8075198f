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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Truncates the tail of a bucket. This is a hard delete, the truncated commits are gone and their bucket revisions are reused by
 * subsequent writes.
 */
public class CommitTruncator {
    private static final Logger log = LoggerFactory.getLogger(CommitTruncator.class);

    private final CommitStore commitStore;

    public CommitTruncator(CommitStore commitStore) {
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        this.commitStore = commitStore;
    }

    /**
     * Remove all commits above {@code toBucketRevision} and rewind the bucket revision. Rolling back to a revision greater than
     * the current bucket revision has no effect.
     *
     * @param bucketName       The name of the bucket
     * @param toBucketRevision The last bucket revision to keep
     */
    public void rollback(String bucketName, long toBucketRevision) {
        if (toBucketRevision < 0) {
            throw new IllegalArgumentException("Bucket revision to rollback to cannot be negative, was " + toBucketRevision);
        }
        commitStore.deleteCommitsAbove(bucketName, toBucketRevision);
        long lastCommittedBucketRevision = commitStore.lastCommittedBucketRevision(bucketName);
        commitStore.resetBucketRevision(bucketName, lastCommittedBucketRevision);
        if (!commitStore.hasUndispatchedCommits(bucketName)) {
            commitStore.markDispatchFailed(bucketName, false);
        }
        log.info("Rolled back bucket {} to bucket revision {}", bucketName, lastCommittedBucketRevision);
    }
}
