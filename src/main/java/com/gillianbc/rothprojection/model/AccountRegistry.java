package com.gillianbc.rothprojection.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single namespace for the ids of every account and income stream in a scenario.
 * Rejects duplicates and mints ids for synthetic tax-free destination accounts.
 */
public class AccountRegistry {

    private static final String TAX_FREE_KIND = "tax-free";

    private final Map<AccountId, Account> accounts = new LinkedHashMap<>();
    private final Map<AccountId, IncomeStream> incomeStreams = new LinkedHashMap<>();
    private int syntheticSequence = 0;

    public AccountRegistry register(Account account) {
        Objects.requireNonNull(account, "account must not be null");
        claim(account.getId());
        accounts.put(account.getId(), account);
        return this;
    }

    public AccountRegistry register(IncomeStream incomeStream) {
        Objects.requireNonNull(incomeStream, "incomeStream must not be null");
        claim(incomeStream.getId());
        incomeStreams.put(incomeStream.getId(), incomeStream);
        return this;
    }

    /**
     * Creates and registers an empty tax-free account to receive conversions.
     */
    public Account newTaxFreeAccount(String name, Owner owner, BigDecimal growthRate) {
        AccountId id;
        do {
            id = AccountId.synthetic(TAX_FREE_KIND, ++syntheticSequence);
        } while (isTaken(id));
        Account account = Account.builder()
                .id(id)
                .name(name)
                .type(AccountType.TAX_FREE)
                .owner(owner)
                .startingBalance(BigDecimal.ZERO)
                .growthRate(growthRate)
                .build();
        accounts.put(id, account);
        return account;
    }

    public List<Account> accounts() {
        return Collections.unmodifiableList(new ArrayList<>(accounts.values()));
    }

    public List<IncomeStream> incomeStreams() {
        return Collections.unmodifiableList(new ArrayList<>(incomeStreams.values()));
    }

    private void claim(AccountId id) {
        if (isTaken(id)) {
            throw new IllegalArgumentException("duplicate account id " + id);
        }
    }

    private boolean isTaken(AccountId id) {
        return accounts.containsKey(id) || incomeStreams.containsKey(id);
    }
}
