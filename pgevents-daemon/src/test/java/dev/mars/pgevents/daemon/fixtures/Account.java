package dev.mars.pgevents.daemon.fixtures;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgevents.store.aggregation.Aggregator;

/**
 * Aggregate kept by the snapshot projection in the daemon tests.
 */
public record Account(String owner, long balance) {

    public static final Aggregator<Account> AGGREGATOR = Aggregator.forType(Account.class)
        .createdBy(AccountOpened.class, opened -> new Account(opened.owner(), 0))
        .apply(Deposited.class, (account, deposited) -> new Account(account.owner(), account.balance() + deposited.amount()))
        .apply(Withdrawn.class, (account, withdrawn) -> new Account(account.owner(), account.balance() - withdrawn.amount()))
        .build();
}
