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

import java.util.List;
import java.util.Set;

/**
 * A bucket is an isolated namespace of streams. Every commit written to a bucket is assigned the next bucket revision, a sequence
 * number shared by all streams in the bucket. Each stream has its own stream revision, incremented by one per event.
 * <p>
 * Writes are optimistically concurrency controlled per stream, and the events of each commit are dispatched asynchronously to the
 * {@link EventDispatcher}s registered in the {@link Ledger} that the bucket belongs to.
 */
public interface Bucket {

    /**
     * @return The name of the bucket
     */
    String getName();

    /**
     * Write a batch of events to a stream as one commit.
     *
     * @param streamId               The id of the stream
     * @param expectedStreamRevision The current revision of the stream as known by the caller, {@code 0} for a new stream
     * @param events                 The events to write, at least one
     * @return A {@link WriteResult} holding the new commit and the handle of its dispatch
     * @throws InvalidStreamRevisionException    If {@code expectedStreamRevision} is negative
     * @throws NonSequentialStreamRevisionException If {@code expectedStreamRevision} is greater than the current stream revision
     * @throws ConcurrencyWriteException         If {@code expectedStreamRevision} is less than the current stream revision
     * @throws UndispatchedEventsFoundException  If a previous dispatch in this bucket has failed, or couldn't be scheduled, and not yet been resolved
     * @throws IllegalStateException             If the ledger has been shutdown
     */
    WriteResult write(String streamId, long expectedStreamRevision, List<?> events);

    /**
     * @return The bucket revision of the latest commit, {@code 0} if the bucket is empty
     */
    long getBucketRevision();

    /**
     * @return The stream revision of the latest event in the stream, {@code 0} if the stream doesn't exist
     */
    long getStreamRevision(String streamId);

    /**
     * @return The ids of all streams that have at least one commit
     */
    Set<String> getStreamIds();

    /**
     * @return All events of the stream in stream revision order
     */
    List<Object> getEvents(String streamId);

    /**
     * @param filter The filter to apply
     * @return The matching commits ordered by ascending bucket revision
     */
    List<Commit> getCommits(CommitFilter filter);

    /**
     * @return All commits of a stream ordered by ascending bucket revision
     */
    default List<Commit> getCommits(String streamId) {
        return getCommits(CommitFilter.streamId(streamId));
    }

    /**
     * @return The commits with {@code fromBucketRevision <= bucketRevision <= toBucketRevision} ordered by ascending bucket revision
     */
    default List<Commit> getCommits(long fromBucketRevision, long toBucketRevision) {
        return getCommits(CommitFilter.bucketRevisionBetween(fromBucketRevision, toBucketRevision));
    }

    /**
     * @return {@code true} if the bucket contains commits whose events haven't (yet) been dispatched
     */
    boolean hasUndispatchedCommits();

    /**
     * Dispatch all undispatched commits of the bucket in bucket revision order. Commits that are dispatched successfully are marked as
     * dispatched even if other commits fail. When all commits are dispatched the bucket accepts writes again.
     *
     * @throws DispatchException If at least one commit couldn't be dispatched
     */
    void dispatchUndispatched();

    /**
     * Remove all commits with a bucket revision greater than {@code toBucketRevision}. The next commit will get bucket revision
     * {@code toBucketRevision + 1}.
     *
     * @param toBucketRevision The bucket revision to keep, {@code 0} removes all commits
     */
    void rollback(long toBucketRevision);
}
