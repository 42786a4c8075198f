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
 * The expected stream revision is ahead of the current revision of the stream. Writes must continue exactly where the stream ends,
 * gaps are never filled in.
 */
public class NonSequentialStreamRevisionException extends InvalidStreamRevisionException {
    public final long actualStreamRevision;

    public NonSequentialStreamRevisionException(String streamId, long expectedStreamRevision, long actualStreamRevision) {
        super(streamId, expectedStreamRevision, String.format("Stream revision of %s is not sequential. Expected stream revision %d but stream is at %d.", streamId, expectedStreamRevision, actualStreamRevision));
        this.actualStreamRevision = actualStreamRevision;
    }
}
