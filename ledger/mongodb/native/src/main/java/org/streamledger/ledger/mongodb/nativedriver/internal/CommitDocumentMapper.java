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

import org.bson.Document;
import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.mongodb.nativedriver.EventSerializer;

import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Maps a {@link Commit} to a MongoDB document and back. Don't depend on this class since it's supposed to be internal!
 */
public class CommitDocumentMapper {
    public static final String BUCKET_NAME = "bucketName";
    public static final String BUCKET_REVISION = "bucketRevision";
    public static final String STREAM_ID = "streamId";
    public static final String STREAM_REVISION_START = "streamRevisionStart";
    public static final String STREAM_REVISION_END = "streamRevisionEnd";
    public static final String EVENTS = "events";
    public static final String DISPATCHED = "dispatched";
    public static final String TIMESTAMP = "timestamp";

    private final EventSerializer eventSerializer;

    public CommitDocumentMapper(EventSerializer eventSerializer) {
        requireNonNull(eventSerializer, EventSerializer.class.getSimpleName() + " cannot be null");
        this.eventSerializer = eventSerializer;
    }

    public Document convertToDocument(Commit commit) {
        List<Document> events = commit.getEvents().stream().map(eventSerializer::serialize).collect(Collectors.toList());
        return new Document(BUCKET_NAME, commit.getBucketName())
                .append(BUCKET_REVISION, commit.getBucketRevision())
                .append(STREAM_ID, commit.getStreamId())
                .append(STREAM_REVISION_START, commit.getStreamRevisionStart())
                .append(STREAM_REVISION_END, commit.getStreamRevisionEnd())
                .append(EVENTS, events)
                .append(DISPATCHED, commit.isDispatched())
                .append(TIMESTAMP, Date.from(commit.getTimestamp()));
    }

    public Commit convertToCommit(Document document) {
        List<Object> events = document.getList(EVENTS, Document.class).stream().map(eventSerializer::deserialize).collect(Collectors.toList());
        return new Commit(document.getString(BUCKET_NAME),
                document.getLong(BUCKET_REVISION),
                document.getString(STREAM_ID),
                document.getLong(STREAM_REVISION_START),
                document.getLong(STREAM_REVISION_END),
                events,
                document.getBoolean(DISPATCHED, false),
                document.getDate(TIMESTAMP).toInstant());
    }
}
