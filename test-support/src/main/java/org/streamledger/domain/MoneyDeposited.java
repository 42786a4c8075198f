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

package org.streamledger.domain;

import java.util.Objects;

public class MoneyDeposited implements AccountEvent {

    private String accountId;
    private long amount;

    @SuppressWarnings("unused")
    MoneyDeposited() {
    }

    public MoneyDeposited(String accountId, long amount) {
        this.accountId = accountId;
        this.amount = amount;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    public long getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoneyDeposited)) return false;
        MoneyDeposited that = (MoneyDeposited) o;
        return amount == that.amount && Objects.equals(accountId, that.accountId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, amount);
    }

    @Override
    public String toString() {
        return "MoneyDeposited{" +
                "accountId='" + accountId + '\'' +
                ", amount=" + amount +
                '}';
    }
}
