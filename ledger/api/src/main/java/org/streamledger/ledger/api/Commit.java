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

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A commit is the unit of durability in a {@link Bucket}. It's one batch of events written to a single stream by a single
 * call to {@link Bucket#write(String, long, List)}. A commit occupies exactly one bucket revision, regardless of how many events
 * it contains, and the stream revision range {@code [streamRevisionStart, streamRevisionEnd]}.
 * <p>
 * Commits are immutable once persisted except for the {@link #isDispatched() dispatched} flag.
 */
@NullMarked
public class Commit {
    private final String bucketName;
    private final long bucketRevision;
    private final String streamId;
    private final long streamRevisionStart;
    private final long streamRevisionEnd;
    private final List<Object> events;
    private final boolean dispatched;
    private final Instant timestamp;

    public Commit(String bucketName, long bucketRevision, String streamId, long streamRevisionStart, long streamRevisionEnd,
                  List<?> events, boolean dispatched, Instant timestamp) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(events, "Events cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
        if (bucketRevision < 1) {
            throw new IllegalArgumentException("Bucket revision must be greater than zero, was " + bucketRevision);
        }
        if (streamRevisionStart < 1 || streamRevisionEnd - streamRevisionStart + 1 != events.size()) {
            throw new IllegalArgumentException(String.format("Stream revision range [%d, %d] doesn't match the number of events (%d)", streamRevisionStart, streamRevisionEnd, events.size()));
        }
        this.bucketName = bucketName;
        this.bucketRevision = bucketRevision;
        this.streamId = streamId;
        this.streamRevisionStart = streamRevisionStart;
        this.streamRevisionEnd = streamRevisionEnd;
        this.events = List.copyOf(events);
        this.dispatched = dispatched;
        this.timestamp = timestamp;
    }

    public String getBucketName() {
        return bucketName;
    }

    public long getBucketRevision() {
        return bucketRevision;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getStreamRevisionStart() {
        return streamRevisionStart;
    }

    public long getStreamRevisionEnd() {
        return streamRevisionEnd;
    }

    /**
     * @return The events of this commit in the order they were written.
     */
    public List<Object> getEvents() {
        return events;
    }

    /**
     * @return {@code true} if every event in this commit has been handed to every registered {@link EventDispatcher} without error.
     */
    public boolean isDispatched() {
        return dispatched;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return A copy of this commit with the {@code dispatched} flag set to {@code true}.
     */
    public Commit markAsDispatched() {
        return new Commit(bucketName, bucketRevision, streamId, streamRevisionStart, streamRevisionEnd, events, true, timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commit)) return false;
        Commit commit = (Commit) o;
        return bucketRevision == commit.bucketRevision && streamRevisionStart == commit.streamRevisionStart && streamRevisionEnd == commit.streamRevisionEnd
                && dispatched == commit.dispatched && Objects.equals(bucketName, commit.bucketName) && Objects.equals(streamId, commit.streamId)
                && Objects.equals(events, commit.events) && Objects.equals(timestamp, commit.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketName, bucketRevision, streamId, streamRevisionStart, streamRevisionEnd, events, dispatched, timestamp);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Commit.class.getSimpleName() + "[", "]")
                .add("bucketName='" + bucketName + "'")
                .add("bucketRevision=" + bucketRevision)
                .add("streamId='" + streamId + "'")
                .add("streamRevisionStart=" + streamRevisionStart)
                .add("streamRevisionEnd=" + streamRevisionEnd)
                .add("events=" + events)
                .add("dispatched=" + dispatched)
                .add("timestamp=" + timestamp)
                .toString();
    }
}
