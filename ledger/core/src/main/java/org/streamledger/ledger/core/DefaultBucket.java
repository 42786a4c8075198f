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
import org.streamledger.ledger.api.*;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Bucket} backed by a {@link CommitStore}.
 * <p>
 * A commit is appended at the bucket revision following the one recorded in the bucket state. The commit store rejects the commit if
 * a concurrent writer already took that bucket revision, in which case the bucket state is brought up to date and the write is
 * arbitrated and attempted again. This keeps bucket revisions gap-free without a lock around the bucket.
 */
public class DefaultBucket implements Bucket {
    private static final Logger log = LoggerFactory.getLogger(DefaultBucket.class);

    private final String name;
    private final CommitStore commitStore;
    private final RevisionArbitrator revisionArbitrator;
    private final DispatchCoordinator dispatchCoordinator;
    private final CommitTruncator commitTruncator;
    private final CommitQueries commitQueries;
    private final Clock clock;

    public DefaultBucket(String name, CommitStore commitStore, RevisionArbitrator revisionArbitrator, DispatchCoordinator dispatchCoordinator,
                         CommitTruncator commitTruncator, CommitQueries commitQueries, Clock clock) {
        requireNonBlank(name, "Bucket name");
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        requireNonNull(revisionArbitrator, RevisionArbitrator.class.getSimpleName() + " cannot be null");
        requireNonNull(dispatchCoordinator, DispatchCoordinator.class.getSimpleName() + " cannot be null");
        requireNonNull(commitTruncator, CommitTruncator.class.getSimpleName() + " cannot be null");
        requireNonNull(commitQueries, CommitQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.name = name;
        this.commitStore = commitStore;
        this.revisionArbitrator = revisionArbitrator;
        this.dispatchCoordinator = dispatchCoordinator;
        this.commitTruncator = commitTruncator;
        this.commitQueries = commitQueries;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public WriteResult write(String streamId, long expectedStreamRevision, List<?> events) {
        requireNonBlank(streamId, "Stream id");
        requireNonNull(events, "Events cannot be null");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("A commit must contain at least one event");
        }

        RevisionDecision validation = RevisionArbitrator.validate(expectedStreamRevision);
        if (!validation.isAccepted()) {
            throw validation.toException(name, streamId);
        }

        if (dispatchCoordinator.isShutdown()) {
            throw new IllegalStateException("Cannot write to bucket " + name + " since the ledger has been shutdown");
        }

        Commit commit = append(streamId, expectedStreamRevision, events);
        try {
            commitStore.advanceBucketRevision(name, commit.getBucketRevision());
        } catch (RuntimeException e) {
            // The commit is durable, the next writer catches up with the bucket revision when it collides with this commit
            log.warn("Failed to advance bucket revision of bucket {} to {}", name, commit.getBucketRevision(), e);
        }

        if (log.isDebugEnabled()) {
            log.debug("Committed {} event(s) to stream {} in bucket {} (bucketRevision={}, streamRevision={})",
                    events.size(), streamId, name, commit.getBucketRevision(), commit.getStreamRevisionEnd());
        }

        CompletableFuture<Void> dispatchTask = dispatchCoordinator.dispatchInBackground(commit);
        return new WriteResult(commit, dispatchTask);
    }

    private Commit append(String streamId, long expectedStreamRevision, List<?> events) {
        while (true) {
            BucketState bucketState = commitStore.bucketState(name);
            if (bucketState.dispatchFailed()) {
                throw new UndispatchedEventsFoundException(name);
            }

            RevisionDecision decision = revisionArbitrator.beforeWrite(name, streamId, expectedStreamRevision);
            if (!decision.isAccepted()) {
                throw decision.toException(name, streamId);
            }

            Commit commit = new Commit(name, bucketState.nextBucketRevision(), streamId, expectedStreamRevision + 1,
                    expectedStreamRevision + events.size(), events, false, clock.instant().truncatedTo(ChronoUnit.MILLIS));

            AppendResult appendResult = commitStore.append(commit);
            if (appendResult == AppendResult.APPENDED) {
                return commit;
            } else if (appendResult == AppendResult.STREAM_REVISION_TAKEN) {
                throw revisionArbitrator.streamRevisionTaken(name, streamId, expectedStreamRevision).toException(name, streamId);
            }

            // Another writer took the bucket revision, catch up with the commits and try again.
            long lastCommittedBucketRevision = commitStore.lastCommittedBucketRevision(name);
            commitStore.advanceBucketRevision(name, lastCommittedBucketRevision);
            log.debug("Bucket revision {} in bucket {} was taken by a concurrent writer, retrying with bucket revision {}",
                    commit.getBucketRevision(), name, lastCommittedBucketRevision + 1);
        }
    }

    @Override
    public long getBucketRevision() {
        return commitQueries.bucketRevision(name);
    }

    @Override
    public long getStreamRevision(String streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        return commitQueries.streamRevision(name, streamId);
    }

    @Override
    public Set<String> getStreamIds() {
        return commitQueries.streamIds(name);
    }

    @Override
    public List<Object> getEvents(String streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        return commitQueries.events(name, streamId);
    }

    @Override
    public List<Commit> getCommits(CommitFilter filter) {
        return commitQueries.commits(name, filter);
    }

    @Override
    public boolean hasUndispatchedCommits() {
        return dispatchCoordinator.hasUndispatched(name);
    }

    @Override
    public void dispatchUndispatched() {
        dispatchCoordinator.redispatchAll(name);
    }

    @Override
    public void rollback(long toBucketRevision) {
        commitTruncator.rollback(name, toBucketRevision);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DefaultBucket.class.getSimpleName() + "[", "]")
                .add("name='" + name + "'")
                .toString();
    }

    static void requireNonBlank(String value, String description) {
        requireNonNull(value, description + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(description + " cannot be blank");
        }
    }
}
