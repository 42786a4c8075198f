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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Selects commits in a {@link Bucket}. All criteria are optional and are combined with "and". Bucket revision bounds are inclusive.
 * <p>
 * Example:
 * <pre>
 * CommitFilter filter = CommitFilter.streamId("account-1").fromBucketRevision(10);
 * </pre>
 */
@NullMarked
public final class CommitFilter {
    private static final CommitFilter ALL = new CommitFilter(null, null, null);

    private final @Nullable Long fromBucketRevision;
    private final @Nullable Long toBucketRevision;
    private final @Nullable String streamId;

    private CommitFilter(@Nullable Long fromBucketRevision, @Nullable Long toBucketRevision, @Nullable String streamId) {
        this.fromBucketRevision = fromBucketRevision;
        this.toBucketRevision = toBucketRevision;
        this.streamId = streamId;
    }

    /**
     * @return A filter that matches all commits in the bucket
     */
    public static CommitFilter all() {
        return ALL;
    }

    /**
     * @return A filter that matches the commits of the given stream
     */
    public static CommitFilter streamId(String streamId) {
        return ALL.andStreamId(streamId);
    }

    /**
     * @return A filter that matches commits with {@code from <= bucketRevision <= to}
     */
    public static CommitFilter bucketRevisionBetween(long from, long to) {
        return ALL.fromBucketRevision(from).toBucketRevision(to);
    }

    public CommitFilter fromBucketRevision(long fromBucketRevision) {
        return new CommitFilter(fromBucketRevision, toBucketRevision, streamId);
    }

    public CommitFilter toBucketRevision(long toBucketRevision) {
        return new CommitFilter(fromBucketRevision, toBucketRevision, streamId);
    }

    public CommitFilter andStreamId(String streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        return new CommitFilter(fromBucketRevision, toBucketRevision, streamId);
    }

    public @Nullable Long getFromBucketRevision() {
        return fromBucketRevision;
    }

    public @Nullable Long getToBucketRevision() {
        return toBucketRevision;
    }

    public @Nullable String getStreamId() {
        return streamId;
    }

    /**
     * @return {@code true} if the supplied commit is matched by this filter
     */
    public boolean matches(Commit commit) {
        return (fromBucketRevision == null || commit.getBucketRevision() >= fromBucketRevision)
                && (toBucketRevision == null || commit.getBucketRevision() <= toBucketRevision)
                && (streamId == null || streamId.equals(commit.getStreamId()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommitFilter)) return false;
        CommitFilter that = (CommitFilter) o;
        return Objects.equals(fromBucketRevision, that.fromBucketRevision) && Objects.equals(toBucketRevision, that.toBucketRevision) && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromBucketRevision, toBucketRevision, streamId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CommitFilter.class.getSimpleName() + "[", "]")
                .add("fromBucketRevision=" + fromBucketRevision)
                .add("toBucketRevision=" + toBucketRevision)
                .add("streamId='" + streamId + "'")
                .toString();
    }
}
