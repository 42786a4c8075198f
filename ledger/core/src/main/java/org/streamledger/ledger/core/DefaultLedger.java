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
import org.streamledger.ledger.api.Bucket;
import org.streamledger.ledger.api.EventDispatcher;
import org.streamledger.ledger.api.Ledger;

import javax.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Ledger} that creates {@link DefaultBucket}s on top of a {@link CommitStore}. Dispatchers registered in the ledger are
 * used by all of its buckets, including buckets that were obtained before the dispatcher was registered.
 */
public class DefaultLedger implements Ledger {
    private static final Logger log = LoggerFactory.getLogger(DefaultLedger.class);

    private final CommitStore commitStore;
    private final ConcurrentMap<String, Bucket> buckets;
    private final List<EventDispatcher> dispatchers;
    private final RevisionArbitrator revisionArbitrator;
    private final DispatchCoordinator dispatchCoordinator;
    private final CommitTruncator commitTruncator;
    private final CommitQueries commitQueries;
    private final LedgerConfig config;

    public DefaultLedger(CommitStore commitStore, LedgerConfig config) {
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        requireNonNull(config, LedgerConfig.class.getSimpleName() + " cannot be null");
        this.commitStore = commitStore;
        this.config = config;
        this.buckets = new ConcurrentHashMap<>();
        this.dispatchers = new CopyOnWriteArrayList<>();
        ExecutorService dispatchExecutor = Objects.requireNonNullElseGet(config.dispatchExecutor, Executors::newCachedThreadPool);
        this.revisionArbitrator = new RevisionArbitrator(commitStore, config.checkStreamRevisionBeforeWriting);
        this.dispatchCoordinator = new DispatchCoordinator(commitStore, () -> List.copyOf(dispatchers), dispatchExecutor);
        this.commitTruncator = new CommitTruncator(commitStore);
        this.commitQueries = new CommitQueries(commitStore);
    }

    @Override
    public Bucket bucket(String bucketName) {
        return buckets.computeIfAbsent(bucketName, name -> new DefaultBucket(name, commitStore, revisionArbitrator, dispatchCoordinator, commitTruncator, commitQueries, config.clock));
    }

    @Override
    public void registerDispatchers(EventDispatcher... dispatchers) {
        requireNonNull(dispatchers, "Dispatchers cannot be null");
        for (EventDispatcher dispatcher : dispatchers) {
            this.dispatchers.add(requireNonNull(dispatcher, EventDispatcher.class.getSimpleName() + " cannot be null"));
        }
    }

    @Override
    public void deleteBucket(String bucketName) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        commitStore.deleteBucket(bucketName);
        buckets.remove(bucketName);
        log.info("Deleted bucket {}", bucketName);
    }

    /**
     * Stop dispatching events. Buckets obtained from this ledger reject writes after shutdown.
     */
    @PreDestroy
    @Override
    public void shutdown() {
        dispatchCoordinator.shutdown(5, TimeUnit.SECONDS);
        log.info("Ledger was shutdown");
    }
}
