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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;
import org.streamledger.ledger.core.LedgerConfig;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the synchronous java driver MongoDB ledger
 */
@NullMarked
public class MongoLedgerConfig {
    public static final String DEFAULT_COMMITS_COLLECTION_NAME = "commits";
    public static final String DEFAULT_BUCKETS_COLLECTION_NAME = "buckets";

    public final String commitsCollectionName;
    public final String bucketsCollectionName;
    public final EventSerializer eventSerializer;
    public final LedgerConfig ledgerConfig;

    /**
     * @return A configuration that stores commits in {@value #DEFAULT_COMMITS_COLLECTION_NAME}, buckets in {@value #DEFAULT_BUCKETS_COLLECTION_NAME},
     * serializes events with {@link JacksonEventSerializer} and uses {@link LedgerConfig#defaults()}.
     */
    public static MongoLedgerConfig defaults() {
        return new Builder().build();
    }

    private MongoLedgerConfig(@Nullable String commitsCollectionName, @Nullable String bucketsCollectionName, @Nullable EventSerializer eventSerializer, @Nullable LedgerConfig ledgerConfig) {
        this.commitsCollectionName = Objects.requireNonNullElse(commitsCollectionName, DEFAULT_COMMITS_COLLECTION_NAME);
        this.bucketsCollectionName = Objects.requireNonNullElse(bucketsCollectionName, DEFAULT_BUCKETS_COLLECTION_NAME);
        this.eventSerializer = Objects.requireNonNullElseGet(eventSerializer, JacksonEventSerializer::new);
        this.ledgerConfig = Objects.requireNonNullElseGet(ledgerConfig, LedgerConfig::defaults);
        if (this.commitsCollectionName.equals(this.bucketsCollectionName)) {
            throw new IllegalArgumentException("Commits and buckets must be stored in different collections");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoLedgerConfig)) return false;
        MongoLedgerConfig that = (MongoLedgerConfig) o;
        return Objects.equals(commitsCollectionName, that.commitsCollectionName) && Objects.equals(bucketsCollectionName, that.bucketsCollectionName)
                && Objects.equals(eventSerializer, that.eventSerializer) && Objects.equals(ledgerConfig, that.ledgerConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commitsCollectionName, bucketsCollectionName, eventSerializer, ledgerConfig);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoLedgerConfig.class.getSimpleName() + "[", "]")
                .add("commitsCollectionName='" + commitsCollectionName + "'")
                .add("bucketsCollectionName='" + bucketsCollectionName + "'")
                .add("eventSerializer=" + eventSerializer)
                .add("ledgerConfig=" + ledgerConfig)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String commitsCollectionName;
        private String bucketsCollectionName;
        private EventSerializer eventSerializer;
        private LedgerConfig ledgerConfig;

        /**
         * @param commitsCollectionName The name of the collection in which commits are stored
         * @return The builder instance
         */
        public Builder commitsCollectionName(String commitsCollectionName) {
            this.commitsCollectionName = commitsCollectionName;
            return this;
        }

        /**
         * @param bucketsCollectionName The name of the collection in which the bucket revision and dispatch state of each bucket is stored
         * @return The builder instance
         */
        public Builder bucketsCollectionName(String bucketsCollectionName) {
            this.bucketsCollectionName = bucketsCollectionName;
            return this;
        }

        /**
         * @param eventSerializer How events are converted to MongoDB documents
         * @return The builder instance
         */
        public Builder eventSerializer(EventSerializer eventSerializer) {
            this.eventSerializer = eventSerializer;
            return this;
        }

        /**
         * @param ledgerConfig Configuration that isn't specific to MongoDB
         * @return The builder instance
         */
        public Builder ledgerConfig(LedgerConfig ledgerConfig) {
            this.ledgerConfig = ledgerConfig;
            return this;
        }

        @NullMarked
        public MongoLedgerConfig build() {
            return new MongoLedgerConfig(commitsCollectionName, bucketsCollectionName, eventSerializer, ledgerConfig);
        }
    }
}
