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
 * The expected stream revision supplied to {@link Bucket#write(String, long, java.util.List)} is not valid, for example because it's negative.
 * This is a programming error and the write should not be retried.
 */
public class InvalidStreamRevisionException extends IllegalArgumentException {
    public final String streamId;
    public final long expectedStreamRevision;

    public InvalidStreamRevisionException(String streamId, long expectedStreamRevision, String message) {
        super(message);
        this.streamId = streamId;
        this.expectedStreamRevision = expectedStreamRevision;
    }
}
