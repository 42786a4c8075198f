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

import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.CommitFilter;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Read-only queries over a {@link CommitStore}. Results don't depend on whether commits have been dispatched.
 */
public class CommitQueries {

    private final CommitStore commitStore;

    public CommitQueries(CommitStore commitStore) {
        requireNonNull(commitStore, CommitStore.class.getSimpleName() + " cannot be null");
        this.commitStore = commitStore;
    }

    public long bucketRevision(String bucketName) {
        return commitStore.lastCommittedBucketRevision(bucketName);
    }

    public long streamRevision(String bucketName, String streamId) {
        return commitStore.streamRevision(bucketName, streamId);
    }

    public Set<String> streamIds(String bucketName) {
        return commitStore.streamIds(bucketName);
    }

    /**
     * @return The events of all commits of the stream, concatenated in stream revision order
     */
    public List<Object> events(String bucketName, String streamId) {
        try (Stream<Commit> commits = commitStore.commits(bucketName, CommitFilter.streamId(streamId))) {
            return commits.sorted(Comparator.comparingLong(Commit::getStreamRevisionStart))
                    .flatMap(commit -> commit.getEvents().stream())
                    .collect(Collectors.toList());
        }
    }

    public List<Commit> commits(String bucketName, CommitFilter filter) {
        requireNonNull(filter, CommitFilter.class.getSimpleName() + " cannot be null");
        try (Stream<Commit> commits = commitStore.commits(bucketName, filter)) {
            return commits.collect(Collectors.toList());
        }
    }
}
