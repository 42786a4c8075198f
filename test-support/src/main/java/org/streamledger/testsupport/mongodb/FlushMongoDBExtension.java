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

package org.streamledger.testsupport.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Removes all commits and bucket documents from the ledger collections before each test. The collections and their indexes are kept,
 * so a ledger created in a {@code @BeforeEach} method doesn't have to recreate them.
 * <p>
 * Example:
 * <pre>
 * &#64;RegisterExtension
 * FlushMongoDBExtension flushMongoDBExtension = new FlushMongoDBExtension(connectionString, "commits", "buckets");
 * </pre>
 */
public class FlushMongoDBExtension implements BeforeEachCallback {
    private static final List<String> DEFAULT_LEDGER_COLLECTIONS = List.of("commits", "buckets");

    private final ConnectionString connectionString;
    private final List<String> collectionNames;

    /**
     * Flush the default ledger collections, {@code commits} and {@code buckets}.
     */
    public FlushMongoDBExtension(ConnectionString connectionString) {
        this(connectionString, DEFAULT_LEDGER_COLLECTIONS);
    }

    public FlushMongoDBExtension(ConnectionString connectionString, String... collectionNames) {
        this(connectionString, List.of(collectionNames));
    }

    private FlushMongoDBExtension(ConnectionString connectionString, List<String> collectionNames) {
        requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null");
        this.connectionString = connectionString;
        this.collectionNames = collectionNames;
    }

    @Override
    public void beforeEach(ExtensionContext extensionContext) {
        String databaseName = requireNonNull(connectionString.getDatabase(), "Database cannot be null in MongoDB connection string");
        try (MongoClient mongoClient = MongoClients.create(connectionString)) {
            MongoDatabase database = mongoClient.getDatabase(databaseName);
            for (String collectionName : collectionNames) {
                database.getCollection(collectionName).deleteMany(new Document());
            }
        }
    }
}
