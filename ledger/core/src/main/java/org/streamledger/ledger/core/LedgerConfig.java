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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

/**
 * Configuration of the bucket engine that is independent of the datastore. Use {@link #defaults()} or the {@link Builder}.
 */
@NullMarked
public class LedgerConfig {
    public final boolean checkStreamRevisionBeforeWriting;
    public final @Nullable ExecutorService dispatchExecutor;
    public final Clock clock;

    /**
     * @return A configuration that checks the stream revision before writing, dispatches events on a cached thread pool and uses the UTC clock.
     */
    public static LedgerConfig defaults() {
        return new Builder().build();
    }

    private LedgerConfig(boolean checkStreamRevisionBeforeWriting, @Nullable ExecutorService dispatchExecutor, @Nullable Clock clock) {
        this.checkStreamRevisionBeforeWriting = checkStreamRevisionBeforeWriting;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerConfig)) return false;
        LedgerConfig that = (LedgerConfig) o;
        return checkStreamRevisionBeforeWriting == that.checkStreamRevisionBeforeWriting && Objects.equals(dispatchExecutor, that.dispatchExecutor) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkStreamRevisionBeforeWriting, dispatchExecutor, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", LedgerConfig.class.getSimpleName() + "[", "]")
                .add("checkStreamRevisionBeforeWriting=" + checkStreamRevisionBeforeWriting)
                .add("dispatchExecutor=" + dispatchExecutor)
                .add("clock=" + clock)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private boolean checkStreamRevisionBeforeWriting = true;
        private ExecutorService dispatchExecutor;
        private Clock clock;

        /**
         * Whether the current stream revision should be read and compared with the expected stream revision before a commit is
         * inserted. Default is {@code true}. When disabled, concurrent modifications are only detected by the unique index of the
         * datastore and an expected stream revision that is ahead of the stream is not detected.
         *
         * @param checkStreamRevisionBeforeWriting {@code true} to check the stream revision before writing
         * @return The builder instance
         */
        @NullMarked
        public Builder checkStreamRevisionBeforeWriting(boolean checkStreamRevisionBeforeWriting) {
            this.checkStreamRevisionBeforeWriting = checkStreamRevisionBeforeWriting;
            return this;
        }

        /**
         * @param dispatchExecutor The executor that dispatches events in the background. It's shutdown together with the ledger.
         *                         Default is {@link java.util.concurrent.Executors#newCachedThreadPool()}.
         * @return The builder instance
         */
        public Builder dispatchExecutor(ExecutorService dispatchExecutor) {
            this.dispatchExecutor = dispatchExecutor;
            return this;
        }

        /**
         * @param clock The clock used to timestamp commits. Default is UTC.
         * @return The builder instance
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        @NullMarked
        public LedgerConfig build() {
            return new LedgerConfig(checkStreamRevisionBeforeWriting, dispatchExecutor, clock);
        }
    }
}
