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

import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.CommitFilter;
import org.streamledger.ledger.core.AppendResult;
import org.streamledger.ledger.core.BucketState;
import org.streamledger.ledger.core.CommitStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CommitStore} that keeps commits in memory. Each bucket is guarded by its own monitor which makes every operation atomic.
 * This is mainly useful for testing and/or demo purposes.
 */
public class InMemoryCommitStore implements CommitStore {

    private static final InMemoryBucket EMPTY_BUCKET = new InMemoryBucket();

    private final Map<String, InMemoryBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public BucketState bucketState(String bucketName) {
        return readBucket(bucketName, bucket -> new BucketState(bucketName, bucket.bucketRevision, bucket.dispatchFailed));
    }

    @Override
    public AppendResult append(Commit commit) {
        requireNonNull(commit, Commit.class.getSimpleName() + " cannot be null");
        return withBucket(commit.getBucketName(), bucket -> {
            if (bucket.commits.containsKey(commit.getBucketRevision())) {
                return AppendResult.BUCKET_REVISION_TAKEN;
            }
            boolean streamRevisionTaken = bucket.commits.values().stream()
                    .anyMatch(c -> c.getStreamId().equals(commit.getStreamId()) && c.getStreamRevisionStart() == commit.getStreamRevisionStart());
            if (streamRevisionTaken) {
                return AppendResult.STREAM_REVISION_TAKEN;
            }
            bucket.commits.put(commit.getBucketRevision(), commit);
            return AppendResult.APPENDED;
        });
    }

    @Override
    public void advanceBucketRevision(String bucketName, long bucketRevision) {
        withBucket(bucketName, bucket -> bucket.bucketRevision = Math.max(bucket.bucketRevision, bucketRevision));
    }

    @Override
    public void resetBucketRevision(String bucketName, long bucketRevision) {
        withBucket(bucketName, bucket -> bucket.bucketRevision = bucketRevision);
    }

    @Override
    public long lastCommittedBucketRevision(String bucketName) {
        return readBucket(bucketName, bucket -> bucket.commits.isEmpty() ? 0L : bucket.commits.lastKey());
    }

    @Override
    public long streamRevision(String bucketName, String streamId) {
        return readBucket(bucketName, bucket -> bucket.commits.values().stream()
                .filter(commit -> commit.getStreamId().equals(streamId))
                .mapToLong(Commit::getStreamRevisionEnd)
                .max()
                .orElse(0L));
    }

    @Override
    public Set<String> streamIds(String bucketName) {
        return readBucket(bucketName, bucket -> bucket.commits.values().stream()
                .map(Commit::getStreamId)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Override
    public Stream<Commit> commits(String bucketName, CommitFilter filter) {
        requireNonNull(filter, CommitFilter.class.getSimpleName() + " cannot be null");
        List<Commit> commits = readBucket(bucketName, bucket -> new ArrayList<>(bucket.commits.values()));
        return commits.stream().filter(filter::matches);
    }

    @Override
    public Stream<Commit> undispatchedCommits(String bucketName) {
        return commits(bucketName, CommitFilter.all()).filter(commit -> !commit.isDispatched());
    }

    @Override
    public boolean hasUndispatchedCommits(String bucketName) {
        return readBucket(bucketName, bucket -> bucket.commits.values().stream().anyMatch(commit -> !commit.isDispatched()));
    }

    @Override
    public void markDispatched(String bucketName, long bucketRevision) {
        readBucket(bucketName, bucket -> bucket.commits.computeIfPresent(bucketRevision, (__, commit) -> commit.markAsDispatched()));
    }

    @Override
    public void markDispatchFailed(String bucketName, boolean dispatchFailed) {
        withBucket(bucketName, bucket -> bucket.dispatchFailed = dispatchFailed);
    }

    @Override
    public void deleteCommitsAbove(String bucketName, long bucketRevision) {
        readBucket(bucketName, bucket -> {
            bucket.commits.tailMap(bucketRevision, false).clear();
            return null;
        });
    }

    @Override
    public void deleteBucket(String bucketName) {
        buckets.remove(bucketName);
    }

    boolean exists(String bucketName) {
        return buckets.containsKey(bucketName);
    }

    private <T> T withBucket(String bucketName, Function<InMemoryBucket, T> fn) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        InMemoryBucket bucket = buckets.computeIfAbsent(bucketName, __ -> new InMemoryBucket());
        synchronized (bucket) {
            return fn.apply(bucket);
        }
    }

    // Queries and updates of existing commits don't create the bucket
    private <T> T readBucket(String bucketName, Function<InMemoryBucket, T> fn) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        InMemoryBucket bucket = buckets.getOrDefault(bucketName, EMPTY_BUCKET);
        synchronized (bucket) {
            return fn.apply(bucket);
        }
    }

    private static class InMemoryBucket {
        private final NavigableMap<Long, Commit> commits = new TreeMap<>();
        private long bucketRevision;
        private boolean dispatchFailed;
    }
}
