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

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import org.streamledger.ledger.core.DefaultLedger;

import static java.util.Objects.requireNonNull;

/**
 * A ledger that stores its buckets in MongoDB using the "native" synchronous java driver.
 * <p>
 * Example:
 * <pre>
 * MongoLedger ledger = new MongoLedger(mongoClient, "ledger");
 * ledger.registerDispatchers(event -&gt; publisher.publish(event));
 * Bucket bucket = ledger.bucket("accounts");
 * WriteResult result = bucket.write("account-1", 0, List.of(new AccountOpened("account-1", "John Doe")));
 * </pre>
 */
public class MongoLedger extends DefaultLedger {

    /**
     * Create a new instance of {@code MongoLedger} with the default {@link MongoLedgerConfig}.
     *
     * @param mongoClient  The mongo client that the {@code MongoLedger} will use
     * @param databaseName The name of the database in which commits will be persisted
     */
    public MongoLedger(MongoClient mongoClient, String databaseName) {
        this(requireNonNull(mongoClient, "Mongo client cannot be null").getDatabase(requireNonNull(databaseName, "Database name cannot be null")), MongoLedgerConfig.defaults());
    }

    /**
     * Create a new instance of {@code MongoLedger} with the default {@link MongoLedgerConfig}.
     *
     * @param database The database in which commits will be persisted
     */
    public MongoLedger(MongoDatabase database) {
        this(database, MongoLedgerConfig.defaults());
    }

    /**
     * Create a new instance of {@code MongoLedger}
     *
     * @param database The database in which commits will be persisted
     * @param config   The {@link MongoLedgerConfig} that will be used
     */
    public MongoLedger(MongoDatabase database, MongoLedgerConfig config) {
        super(new MongoCommitStore(database, requireNonNull(config, MongoLedgerConfig.class.getSimpleName() + " cannot be null")), config.ledgerConfig);
    }
}
