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
 * The outcome of {@link CommitStore#append(org.streamledger.ledger.api.Commit)}.
 */
public enum AppendResult {
    APPENDED,
    /**
     * Another commit in the same stream already starts at the same stream revision.
     */
    STREAM_REVISION_TAKEN,
    /**
     * Another commit in the same bucket already has the same bucket revision.
     */
    BUCKET_REVISION_TAKEN
}
