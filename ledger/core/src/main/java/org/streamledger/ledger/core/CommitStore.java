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

import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.CommitFilter;

import java.util.Set;
import java.util.stream.Stream;

/**
 * The durable storage of commits and of the per-bucket state (bucket revision and dispatch failure flag). Implementations must
 * use the atomic primitives of the underlying datastore for every update, the bucket engine never does read-modify-write of
 * shared state in memory.
 * <p>
 * Implementations must guarantee that at most one commit exists per {@code (bucketName, bucketRevision)} and per
 * {@code (bucketName, streamId, streamRevisionStart)}, and report a violation through {@link #append(Commit)}.
 */
public interface CommitStore {

    /**
     * Get the state of a bucket, creating it if it doesn't exist.
     *
     * @param bucketName The name of the bucket
     * @return The current {@link BucketState}
     */
    BucketState bucketState(String bucketName);

    /**
     * Persist a new commit.
     *
     * @param commit The commit
     * @return {@link AppendResult#APPENDED} if the commit was persisted, otherwise the uniqueness constraint that rejected it.
     */
    AppendResult append(Commit commit);

    /**
     * Move the bucket revision of the bucket state forward to {@code bucketRevision}. Never moves it backwards.
     */
    void advanceBucketRevision(String bucketName, long bucketRevision);

    /**
     * Set the bucket revision of the bucket state to exactly {@code bucketRevision}.
     */
    void resetBucketRevision(String bucketName, long bucketRevision);

    /**
     * @return The highest bucket revision among the commits of the bucket, {@code 0} if there are no commits.
     */
    long lastCommittedBucketRevision(String bucketName);

    /**
     * @return The highest stream revision of the stream, {@code 0} if the stream has no commits.
     */
    long streamRevision(String bucketName, String streamId);

    Set<String> streamIds(String bucketName);

    /**
     * @return The commits matching the filter ordered by ascending bucket revision
     */
    Stream<Commit> commits(String bucketName, CommitFilter filter);

    /**
     * @return The commits that are not dispatched ordered by ascending bucket revision
     */
    Stream<Commit> undispatchedCommits(String bucketName);

    boolean hasUndispatchedCommits(String bucketName);

    /**
     * Flag a commit as dispatched. Idempotent.
     */
    void markDispatched(String bucketName, long bucketRevision);

    /**
     * Set or clear the flag that prevents new writes to the bucket after a failed dispatch.
     */
    void markDispatchFailed(String bucketName, boolean dispatchFailed);

    /**
     * Delete all commits with a bucket revision greater than {@code bucketRevision}.
     */
    void deleteCommitsAbove(String bucketName, long bucketRevision);

    /**
     * Delete all commits and the state of the bucket.
     */
    void deleteBucket(String bucketName);
}
