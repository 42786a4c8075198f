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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected stream revision of a write was behind the actual revision of the stream, i.e. another writer has already
 * committed events to the stream. Nothing was written. Re-read the stream and retry with the current revision.
 * <p>
 * This exception is thrown both when the conflict is detected by reading the stream revision before writing and when it's detected
 * by the datastore rejecting a commit whose stream revision range collides with an existing commit.
 */
public class ConcurrencyWriteException extends RuntimeException {
    public final String bucketName;
    public final String streamId;
    public final long expectedStreamRevision;
    public final long actualStreamRevision;

    public ConcurrencyWriteException(String bucketName, String streamId, long expectedStreamRevision, long actualStreamRevision) {
        this(bucketName, streamId, expectedStreamRevision, actualStreamRevision, null);
    }

    public ConcurrencyWriteException(String bucketName, String streamId, long expectedStreamRevision, long actualStreamRevision, Throwable cause) {
        super(String.format("Stream %s in bucket %s has already been modified. Expected stream revision %d but was %d.", streamId, bucketName, expectedStreamRevision, actualStreamRevision), cause);
        this.bucketName = bucketName;
        this.streamId = streamId;
        this.expectedStreamRevision = expectedStreamRevision;
        this.actualStreamRevision = actualStreamRevision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyWriteException)) return false;
        ConcurrencyWriteException that = (ConcurrencyWriteException) o;
        return expectedStreamRevision == that.expectedStreamRevision && actualStreamRevision == that.actualStreamRevision
                && Objects.equals(bucketName, that.bucketName) && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketName, streamId, expectedStreamRevision, actualStreamRevision);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyWriteException.class.getSimpleName() + "[", "]")
                .add("bucketName='" + bucketName + "'")
                .add("streamId='" + streamId + "'")
                .add("expectedStreamRevision=" + expectedStreamRevision)
                .add("actualStreamRevision=" + actualStreamRevision)
                .add("message=" + super.getMessage())
                .toString();
    }
}
