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
 * Receives the events of every commit written to a bucket. Delivery is at-least-once, the same event may be dispatched more than
 * once (for example after {@link Bucket#dispatchUndispatched()}) so implementations must be idempotent or deduplicate events.
 */
@FunctionalInterface
public interface EventDispatcher {

    /**
     * Deliver one event.
     *
     * @param event The event
     * @throws Exception If the event couldn't be delivered. The commit will then remain undispatched.
     */
    void dispatch(Object event) throws Exception;
}
