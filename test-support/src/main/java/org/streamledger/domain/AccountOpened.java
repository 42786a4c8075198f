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

public class AccountOpened implements AccountEvent {

    private String accountId;
    private String owner;

    @SuppressWarnings("unused")
    AccountOpened() {
    }

    public AccountOpened(String accountId, String owner) {
        this.accountId = accountId;
        this.owner = owner;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    public String getOwner() {
        return owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccountOpened)) return false;
        AccountOpened that = (AccountOpened) o;
        return Objects.equals(accountId, that.accountId) && Objects.equals(owner, that.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, owner);
    }

    @Override
    public String toString() {
        return "AccountOpened{" +
                "accountId='" + accountId + '\'' +
                ", owner='" + owner + '\'' +
                '}';
    }
}
