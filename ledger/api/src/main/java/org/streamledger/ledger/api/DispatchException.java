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

import java.util.List;

/**
 * Thrown by {@link Bucket#dispatchUndispatched()} when one or more commits couldn't be dispatched. The first failure is the cause,
 * failures of later commits in the same sweep are added as suppressed exceptions.
 */
public class DispatchException extends RuntimeException {
    public final String bucketName;
    public final List<Long> failedBucketRevisions;

    public DispatchException(String bucketName, List<Long> failedBucketRevisions, Throwable cause) {
        super(String.format("Failed to dispatch %d commit(s) in bucket %s (bucket revisions %s)", failedBucketRevisions.size(), bucketName, failedBucketRevisions), cause);
        this.bucketName = bucketName;
        this.failedBucketRevisions = List.copyOf(failedBucketRevisions);
    }
}
