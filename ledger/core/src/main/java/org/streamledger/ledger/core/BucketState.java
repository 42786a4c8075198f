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

/**
 * The persisted state of a bucket.
 *
 * @param bucketName     The name of the bucket
 * @param bucketRevision The bucket revision of the latest commit known to the bucket state. May lag behind the commits for a short
 *                       while when a writer has appended a commit but not yet advanced the bucket state.
 * @param dispatchFailed {@code true} if a dispatch has failed and the bucket doesn't accept writes
 */
public record BucketState(String bucketName, long bucketRevision, boolean dispatchFailed) {

    public long nextBucketRevision() {
        return bucketRevision + 1;
    }
}
