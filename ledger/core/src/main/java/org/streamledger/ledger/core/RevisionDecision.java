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

import org.streamledger.ledger.api.ConcurrencyWriteException;
import org.streamledger.ledger.api.InvalidStreamRevisionException;
import org.streamledger.ledger.api.NonSequentialStreamRevisionException;

/**
 * The decision of the {@link RevisionArbitrator} for an expected stream revision.
 */
public sealed interface RevisionDecision {

    static RevisionDecision accepted() {
        return Accepted.INSTANCE;
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /**
     * Translate a rejection into the exception thrown to the caller of the write.
     *
     * @throws IllegalStateException If the decision is {@link Accepted}
     */
    default RuntimeException toException(String bucketName, String streamId) {
        if (this instanceof NegativeRevision negativeRevision) {
            return new InvalidStreamRevisionException(streamId, negativeRevision.expectedStreamRevision(),
                    "Expected stream revision cannot be negative, was " + negativeRevision.expectedStreamRevision());
        } else if (this instanceof NonSequential nonSequential) {
            return new NonSequentialStreamRevisionException(streamId, nonSequential.expectedStreamRevision(), nonSequential.actualStreamRevision());
        } else if (this instanceof ConcurrencyConflict conflict) {
            return new ConcurrencyWriteException(bucketName, streamId, conflict.expectedStreamRevision(), conflict.actualStreamRevision());
        }
        throw new IllegalStateException(this + " is not a rejection");
    }

    final class Accepted implements RevisionDecision {
        private static final Accepted INSTANCE = new Accepted();

        private Accepted() {
        }

        @Override
        public String toString() {
            return Accepted.class.getSimpleName();
        }
    }

    record NegativeRevision(long expectedStreamRevision) implements RevisionDecision {
    }

    record NonSequential(long expectedStreamRevision, long actualStreamRevision) implements RevisionDecision {
    }

    record ConcurrencyConflict(long expectedStreamRevision, long actualStreamRevision) implements RevisionDecision {
    }
}
