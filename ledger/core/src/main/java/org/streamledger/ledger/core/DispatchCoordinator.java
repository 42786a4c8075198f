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
import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.DispatchException;
import org.streamledger.ledger.api.EventDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Delivers the events of committed commits to the registered {@link EventDispatcher}s and keeps the dispatch state of the commits
 * in the {@link CommitStore} up to date.
 * <p>
 * A commit is dispatched when each of its events, in order, has been handed to every dispatcher without error. When a dispatcher
 * throws, delivery of that commit stops, the commit stays undispatched and the bucket is flagged so that it rejects new writes until
 * {@link #redispatchAll(String)} succeeds. Failed dispatches are never retried automatically.
 */
public class DispatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DispatchCoordinator.class);

    private final CommitStore commitStore;
    private final Supplier<List<EventDispatcher>> dispatchers;
    private final ExecutorService dispatchExecutor;

    /**
     * @param commitStore      The commit store in which dispatch state is recorded
     * @param dispatchers      Supplies the dispatchers that are registered at the time of the dispatch
     * @param dispatchExecutor The executor that runs background dispatches
     */
    public DispatchCoordinator(CommitStore commitStore, Supplier<List<EventDispatcher>> dispatchers, ExecutorService dispatchExecutor) {
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        requireNonNull(dispatchers, "Dispatchers cannot be null");
        requireNonNull(dispatchExecutor, "Dispatch executor cannot be null");
        this.commitStore = commitStore;
        this.dispatchers = dispatchers;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Dispatch the events of a commit on the dispatch executor. If the dispatch cannot be scheduled, the bucket is flagged in the
     * same way as when a dispatcher fails.
     *
     * @param commit The commit to dispatch
     * @return A future that completes when the commit is dispatched, or exceptionally with the exception thrown by the dispatcher.
     */
    public CompletableFuture<Void> dispatchInBackground(Commit commit) {
        requireNonNull(commit, Commit.class.getSimpleName() + " cannot be null");
        DispatchTask dispatchTask = new DispatchTask(commit);
        try {
            dispatchExecutor.execute(dispatchTask);
        } catch (RejectedExecutionException e) {
            log.warn("Couldn't schedule dispatch of commit {} in bucket {}, the bucket will not accept writes until it's been redispatched.",
                    commit.getBucketRevision(), commit.getBucketName(), e);
            dispatchTask.abandon(e);
        }
        return dispatchTask.result;
    }

    /**
     * @return {@code true} if {@link #shutdown(long, TimeUnit)} has been called and no more commits will be dispatched in the background.
     */
    public boolean isShutdown() {
        return dispatchExecutor.isShutdown();
    }

    /**
     * Stop accepting background dispatches and wait for the running ones to complete. Dispatches that are still running when the
     * timeout expires, or when the current thread is interrupted, are cancelled. Dispatches that never started are abandoned,
     * their commits stay undispatched and their buckets are flagged.
     *
     * @param timeout The maximum time to wait for running dispatches
     * @param unit    The time unit of the timeout
     */
    public void shutdown(long timeout, TimeUnit unit) {
        if (dispatchExecutor.isShutdown()) {
            return;
        }
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(timeout, unit)) {
                abandonPending(dispatchExecutor.shutdownNow());
            }
        } catch (InterruptedException e) {
            abandonPending(dispatchExecutor.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private void abandonPending(List<Runnable> pending) {
        if (!pending.isEmpty()) {
            log.warn("{} dispatch(es) didn't start before shutdown", pending.size());
        }
        for (Runnable runnable : pending) {
            if (runnable instanceof DispatchTask dispatchTask) {
                dispatchTask.abandon(new CancellationException("Ledger was shutdown before commit " + dispatchTask.commit.getBucketRevision()
                        + " in bucket " + dispatchTask.commit.getBucketName() + " was dispatched"));
            }
        }
    }

    public boolean hasUndispatched(String bucketName) {
        return commitStore.hasUndispatchedCommits(bucketName);
    }

    /**
     * Dispatch all undispatched commits of a bucket in ascending bucket revision order, in the calling thread. A failure doesn't stop
     * the sweep, the remaining commits are still dispatched. The bucket accepts writes again only if every commit was dispatched.
     *
     * @param bucketName The name of the bucket
     * @throws DispatchException If one or more commits couldn't be dispatched
     */
    public void redispatchAll(String bucketName) {
        List<Commit> undispatchedCommits;
        try (Stream<Commit> commits = commitStore.undispatchedCommits(bucketName)) {
            undispatchedCommits = commits.collect(Collectors.toList());
        }
        log.debug("Redispatching {} commit(s) in bucket {}", undispatchedCommits.size(), bucketName);

        List<Long> failedBucketRevisions = new ArrayList<>();
        List<Exception> failures = new ArrayList<>();
        for (Commit commit : undispatchedCommits) {
            try {
                deliver(commit);
            } catch (Exception e) {
                log.warn("Failed to redispatch commit {} of stream {} in bucket {}", commit.getBucketRevision(), commit.getStreamId(), bucketName, e);
                failedBucketRevisions.add(commit.getBucketRevision());
                failures.add(e);
                continue;
            }
            commitStore.markDispatched(bucketName, commit.getBucketRevision());
        }

        if (failures.isEmpty()) {
            commitStore.markDispatchFailed(bucketName, false);
        } else {
            commitStore.markDispatchFailed(bucketName, true);
            DispatchException dispatchException = new DispatchException(bucketName, failedBucketRevisions, failures.get(0));
            failures.stream().skip(1).forEach(dispatchException::addSuppressed);
            throw dispatchException;
        }
    }

    private void dispatch(Commit commit) throws Exception {
        try {
            deliver(commit);
        } catch (Exception e) {
            log.warn("Failed to dispatch commit {} of stream {} in bucket {}, the bucket will not accept writes until it's been redispatched.",
                    commit.getBucketRevision(), commit.getStreamId(), commit.getBucketName(), e);
            flagDispatchFailed(commit.getBucketName(), e);
            throw e;
        }
        commitStore.markDispatched(commit.getBucketName(), commit.getBucketRevision());
        if (log.isDebugEnabled()) {
            log.debug("Dispatched commit {} of stream {} in bucket {}", commit.getBucketRevision(), commit.getStreamId(), commit.getBucketName());
        }
    }

    private void flagDispatchFailed(String bucketName, Throwable failure) {
        try {
            commitStore.markDispatchFailed(bucketName, true);
        } catch (RuntimeException storeException) {
            failure.addSuppressed(storeException);
        }
    }

    private void deliver(Commit commit) throws Exception {
        List<EventDispatcher> currentDispatchers = dispatchers.get();
        for (Object event : commit.getEvents()) {
            for (EventDispatcher dispatcher : currentDispatchers) {
                dispatcher.dispatch(event);
            }
        }
    }

    private class DispatchTask implements Runnable {
        private final Commit commit;
        private final CompletableFuture<Void> result = new CompletableFuture<>();

        private DispatchTask(Commit commit) {
            this.commit = commit;
        }

        @Override
        public void run() {
            try {
                dispatch(commit);
                result.complete(null);
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        }

        private void abandon(Throwable reason) {
            flagDispatchFailed(commit.getBucketName(), reason);
            result.completeExceptionally(reason);
        }
    }
}
