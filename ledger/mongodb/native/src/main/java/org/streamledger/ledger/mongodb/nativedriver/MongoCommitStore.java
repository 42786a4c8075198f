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

package org.streamledger.ledger.mongodb.nativedriver;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamledger.ledger.api.Commit;
import org.streamledger.ledger.api.CommitFilter;
import org.streamledger.ledger.core.AppendResult;
import org.streamledger.ledger.core.BucketState;
import org.streamledger.ledger.core.CommitStore;
import org.streamledger.ledger.mongodb.nativedriver.internal.CommitDocumentMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static com.mongodb.client.model.Filters.*;
import static com.mongodb.client.model.Projections.include;
import static com.mongodb.client.model.Sorts.ascending;
import static com.mongodb.client.model.Sorts.descending;
import static com.mongodb.client.model.Updates.*;
import static java.util.Objects.requireNonNull;
import static org.streamledger.ledger.mongodb.nativedriver.internal.CommitDocumentMapper.*;
import static org.streamledger.ledger.mongodb.nativedriver.internal.MongoExceptionTranslator.*;

/**
 * A {@link CommitStore} that stores commits in MongoDB using the "native" synchronous java driver.
 * <p>
 * Commits of all buckets are stored in one collection, one document per commit. Unique indexes on {@code (bucketName, bucketRevision)}
 * and {@code (bucketName, streamId, streamRevisionStart)} reject colliding commits. The state of each bucket is stored in a separate
 * collection, one document per bucket, that is only ever modified with single-document atomic updates.
 */
public class MongoCommitStore implements CommitStore {
    private static final Logger log = LoggerFactory.getLogger(MongoCommitStore.class);

    private static final String ID = "_id";
    private static final String DISPATCH_FAILED = "dispatchFailed";

    private final MongoCollection<Document> commitCollection;
    private final MongoCollection<Document> bucketCollection;
    private final CommitDocumentMapper documentMapper;

    /**
     * Create a new instance of {@code MongoCommitStore}. Creates the collections and indexes if they don't exist.
     *
     * @param database The database in which commits and buckets will be persisted
     * @param config   The {@link MongoLedgerConfig} that will be used
     */
    public MongoCommitStore(MongoDatabase database, MongoLedgerConfig config) {
        requireNonNull(database, "Database must be defined");
        requireNonNull(config, MongoLedgerConfig.class.getSimpleName() + " cannot be null");
        this.commitCollection = database.getCollection(config.commitsCollectionName);
        this.bucketCollection = database.getCollection(config.bucketsCollectionName);
        this.documentMapper = new CommitDocumentMapper(config.eventSerializer);
        initializeCommitStore(database, commitCollection, bucketCollection);
    }

    @Override
    public BucketState bucketState(String bucketName) {
        Document document = upsertBucket(bucketName, combine(setOnInsert(BUCKET_REVISION, 0L), setOnInsert(DISPATCH_FAILED, false)));
        return new BucketState(bucketName, document.get(BUCKET_REVISION, 0L), document.get(DISPATCH_FAILED, false));
    }

    @Override
    public AppendResult append(Commit commit) {
        requireNonNull(commit, Commit.class.getSimpleName() + " cannot be null");
        try {
            commitCollection.insertOne(documentMapper.convertToDocument(commit));
            return AppendResult.APPENDED;
        } catch (MongoException e) {
            AppendResult appendResult = translateAppendException(e);
            if (log.isDebugEnabled()) {
                log.debug("Commit {} of stream {} in bucket {} was rejected: {}", commit.getBucketRevision(), commit.getStreamId(), commit.getBucketName(), appendResult);
            }
            return appendResult;
        }
    }

    @Override
    public void advanceBucketRevision(String bucketName, long bucketRevision) {
        upsertBucket(bucketName, combine(max(BUCKET_REVISION, bucketRevision), setOnInsert(DISPATCH_FAILED, false)));
    }

    @Override
    public void resetBucketRevision(String bucketName, long bucketRevision) {
        upsertBucket(bucketName, combine(set(BUCKET_REVISION, bucketRevision), setOnInsert(DISPATCH_FAILED, false)));
    }

    @Override
    public long lastCommittedBucketRevision(String bucketName) {
        Document latestCommit = commitCollection.find(bucketNameEqualTo(bucketName))
                .sort(descending(BUCKET_REVISION))
                .limit(1)
                .projection(include(BUCKET_REVISION))
                .first();
        return latestCommit == null ? 0 : latestCommit.getLong(BUCKET_REVISION);
    }

    @Override
    public long streamRevision(String bucketName, String streamId) {
        // Stream revision ranges never overlap so the commit with the highest start also has the highest end
        Document latestCommit = commitCollection.find(and(bucketNameEqualTo(bucketName), eq(STREAM_ID, streamId)))
                .sort(descending(STREAM_REVISION_START))
                .limit(1)
                .projection(include(STREAM_REVISION_END))
                .first();
        return latestCommit == null ? 0 : latestCommit.getLong(STREAM_REVISION_END);
    }

    @Override
    public Set<String> streamIds(String bucketName) {
        return commitCollection.distinct(STREAM_ID, bucketNameEqualTo(bucketName), String.class).into(new LinkedHashSet<>());
    }

    @Override
    public Stream<Commit> commits(String bucketName, CommitFilter filter) {
        requireNonNull(filter, CommitFilter.class.getSimpleName() + " cannot be null");
        return findCommits(convertToBson(bucketName, filter));
    }

    @Override
    public Stream<Commit> undispatchedCommits(String bucketName) {
        return findCommits(and(bucketNameEqualTo(bucketName), eq(DISPATCHED, false)));
    }

    @Override
    public boolean hasUndispatchedCommits(String bucketName) {
        return commitCollection.countDocuments(and(bucketNameEqualTo(bucketName), eq(DISPATCHED, false)), new CountOptions().limit(1)) > 0;
    }

    @Override
    public void markDispatched(String bucketName, long bucketRevision) {
        commitCollection.updateOne(and(bucketNameEqualTo(bucketName), eq(BUCKET_REVISION, bucketRevision)), set(DISPATCHED, true));
    }

    @Override
    public void markDispatchFailed(String bucketName, boolean dispatchFailed) {
        // A bucket document created here must be complete, the next write reads its bucket revision
        upsertBucket(bucketName, combine(set(DISPATCH_FAILED, dispatchFailed), setOnInsert(BUCKET_REVISION, 0L)));
    }

    @Override
    public void deleteCommitsAbove(String bucketName, long bucketRevision) {
        commitCollection.deleteMany(and(bucketNameEqualTo(bucketName), gt(BUCKET_REVISION, bucketRevision)));
    }

    @Override
    public void deleteBucket(String bucketName) {
        commitCollection.deleteMany(bucketNameEqualTo(bucketName));
        bucketCollection.deleteOne(eq(ID, bucketName));
    }

    private Stream<Commit> findCommits(Bson query) {
        MongoCursor<Document> cursor = commitCollection.find(query).sort(ascending(BUCKET_REVISION)).iterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
                .onClose(cursor::close)
                .map(documentMapper::convertToCommit);
    }

    private Document upsertBucket(String bucketName, Bson update) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER);
        try {
            return bucketCollection.findOneAndUpdate(eq(ID, bucketName), update, options);
        } catch (MongoException e) {
            if (!isDuplicateKey(e)) {
                throw e;
            }
            // Two upserts of a new bucket raced, the document exists now so the update will match it.
            return bucketCollection.findOneAndUpdate(eq(ID, bucketName), update, options);
        }
    }

    private static Bson convertToBson(String bucketName, CommitFilter filter) {
        List<Bson> criteria = new ArrayList<>();
        criteria.add(bucketNameEqualTo(bucketName));
        if (filter.getFromBucketRevision() != null) {
            criteria.add(gte(BUCKET_REVISION, filter.getFromBucketRevision()));
        }
        if (filter.getToBucketRevision() != null) {
            criteria.add(lte(BUCKET_REVISION, filter.getToBucketRevision()));
        }
        if (filter.getStreamId() != null) {
            criteria.add(eq(STREAM_ID, filter.getStreamId()));
        }
        return and(criteria);
    }

    private static Bson bucketNameEqualTo(String bucketName) {
        requireNonNull(bucketName, "Bucket name cannot be null");
        return eq(BUCKET_NAME, bucketName);
    }

    private static void initializeCommitStore(MongoDatabase database, MongoCollection<Document> commitCollection, MongoCollection<Document> bucketCollection) {
        createCollectionIfMissing(database, commitCollection.getNamespace().getCollectionName());
        createCollectionIfMissing(database, bucketCollection.getNamespace().getCollectionName());
        // One commit per bucket revision, this index also serves sorting by bucket revision within a bucket
        commitCollection.createIndex(Indexes.compoundIndex(Indexes.ascending(BUCKET_NAME), Indexes.ascending(BUCKET_REVISION)),
                new IndexOptions().unique(true).name(UNIQUE_BUCKET_REVISION_INDEX));
        // Concurrent writers to the same stream collide on this index
        commitCollection.createIndex(Indexes.compoundIndex(Indexes.ascending(BUCKET_NAME), Indexes.ascending(STREAM_ID), Indexes.ascending(STREAM_REVISION_START)),
                new IndexOptions().unique(true).name(UNIQUE_STREAM_REVISION_INDEX));
        commitCollection.createIndex(Indexes.compoundIndex(Indexes.ascending(BUCKET_NAME), Indexes.ascending(DISPATCHED)));
    }

    private static void createCollectionIfMissing(MongoDatabase database, String collectionName) {
        for (String listCollectionName : database.listCollectionNames()) {
            if (listCollectionName.equals(collectionName)) {
                return;
            }
        }
        database.createCollection(collectionName);
    }
}
