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

package org.streamledger.ledger.mongodb.nativedriver.internal;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoWriteException;
import org.streamledger.ledger.core.AppendResult;

/**
 * Translates unique index violations on insert of a commit to an {@link AppendResult}. Don't depend on this class since it's
 * supposed to be internal!
 */
public class MongoExceptionTranslator {
    public static final String UNIQUE_BUCKET_REVISION_INDEX = "unique_bucket_revision";
    public static final String UNIQUE_STREAM_REVISION_INDEX = "unique_stream_revision_start";

    /**
     * Translate the exception thrown by the insert of a commit.
     *
     * @param e The exception thrown by MongoDB
     * @return The {@link AppendResult} corresponding to the violated index
     * @throws MongoException {@code e} itself if it's not caused by one of the unique commit indexes
     */
    public static AppendResult translateAppendException(MongoException e) {
        if (!isDuplicateKey(e)) {
            throw e;
        }
        String message = e instanceof MongoWriteException ? ((MongoWriteException) e).getError().getMessage() : e.getMessage();
        if (message != null && message.contains("index: " + UNIQUE_STREAM_REVISION_INDEX)) {
            return AppendResult.STREAM_REVISION_TAKEN;
        } else if (message != null && message.contains("index: " + UNIQUE_BUCKET_REVISION_INDEX)) {
            return AppendResult.BUCKET_REVISION_TAKEN;
        }
        throw e;
    }

    public static boolean isDuplicateKey(MongoException e) {
        if (e instanceof MongoWriteException) {
            return ((MongoWriteException) e).getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
        }
        return e instanceof MongoServerException && ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }
}
