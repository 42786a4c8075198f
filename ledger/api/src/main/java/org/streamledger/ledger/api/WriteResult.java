/*
 *
 *  Copyright 2021 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.streamledger.ledger.api;

import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * The result of a write to a {@link Bucket}. Holds the commit that was persisted and a handle to the dispatch of its events.
 * <p>
 * The dispatch handle completes normally once every event has reached every registered {@link EventDispatcher}. If a dispatcher
 * throws, the handle completes exceptionally with the exception thrown by the dispatcher. The commit is durable regardless of the
 * outcome of the dispatch, ignoring the handle is fine since failures are also recorded in the bucket
 * (see {@link Bucket#hasUndispatchedCommits()}).
 */
public class WriteResult {

    private final Commit commit;
    private final CompletableFuture<Void> dispatchTask;

    public WriteResult(Commit commit, CompletableFuture<Void> dispatchTask) {
        requireNonNull(commit, Commit.class.getSimpleName() + " cannot be null");
        requireNonNull(dispatchTask, "Dispatch task cannot be null");
        this.commit = commit;
        this.dispatchTask = dispatchTask;
    }

    public Commit getCommit() {
        return commit;
    }

    public CompletableFuture<Void> getDispatchTask() {
        return dispatchTask;
    }

    public long getBucketRevision() {
        return commit.getBucketRevision();
    }

    public long getStreamRevision() {
        return commit.getStreamRevisionEnd();
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("commit=" + commit)
                .add("dispatchTask=" + dispatchTask)
                .toString();
    }
}
