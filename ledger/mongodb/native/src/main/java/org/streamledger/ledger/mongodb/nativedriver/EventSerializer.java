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

package org.streamledger.ledger.mongodb.nativedriver;

import org.bson.Document;

/**
 * Converts the events of a commit to and from MongoDB documents. Events are opaque to the ledger, so the serializer is the only
 * component that knows their structure.
 */
public interface EventSerializer {

    /**
     * @param event The event to serialize
     * @return A document representing the event
     */
    Document serialize(Object event);

    /**
     * @param document A document created by {@link #serialize(Object)}
     * @return The event
     */
    Object deserialize(Document document);
}
