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

/**
 * A ledger owns a set of {@link Bucket}s stored in the same datastore and the {@link EventDispatcher}s that receive the events
 * written to any of them.
 */
public interface Ledger {

    /**
     * Get a bucket by name, the bucket is created on first use.
     *
     * @param bucketName The name of the bucket
     * @return The {@link Bucket}
     */
    Bucket bucket(String bucketName);

    /**
     * Register dispatchers that will receive the events of every commit in every bucket of this ledger.
     *
     * @param dispatchers The dispatchers to register
     */
    void registerDispatchers(EventDispatcher... dispatchers);

    /**
     * Delete a bucket, i.e. all of its commits and its bucket revision.
     *
     * @param bucketName The name of the bucket
     */
    void deleteBucket(String bucketName);

    /**
     * Stop dispatching events. Dispatches that are in progress are given a chance to complete. Writes are rejected after shutdown.
     */
    void shutdown();
}
