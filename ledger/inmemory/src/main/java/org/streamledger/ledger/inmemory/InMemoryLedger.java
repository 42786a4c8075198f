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

package org.streamledger.ledger.inmemory;

import org.streamledger.ledger.core.DefaultLedger;
import org.streamledger.ledger.core.LedgerConfig;

/**
 * A ledger that keeps all buckets in memory. This is mainly useful for testing and/or demo purposes.
 */
public class InMemoryLedger extends DefaultLedger {

    /**
     * Create an {@link InMemoryLedger} with default configuration.
     */
    public InMemoryLedger() {
        this(LedgerConfig.defaults());
    }

    /**
     * Create an {@link InMemoryLedger}.
     *
     * @param config The {@link LedgerConfig} to use
     */
    public InMemoryLedger(LedgerConfig config) {
        super(new InMemoryCommitStore(), config);
    }
}
