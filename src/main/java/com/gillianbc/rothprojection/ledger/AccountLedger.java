package com.gillianbc.rothprojection.ledger;

import com.gillianbc.rothprojection.exception.StateNotReadyException;
import com.gillianbc.rothprojection.model.AccountId;
import com.gillianbc.rothprojection.model.Money;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-account, per-year ending balances for a single plan run.
 * <p>
 * Each account is opened with its starting balance as the ending balance of the year before the
 * projection, then receives exactly one balance per year in increasing year order. A lookup for a
 * year that has not been written fails with {@link StateNotReadyException}; there is no fallback
 * to the opening balance.
 */
public class AccountLedger {

    private final Map<AccountId, NavigableMap<Integer, BigDecimal>> balances = new LinkedHashMap<>();

    public void open(AccountId accountId, int year, BigDecimal openingBalance) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(openingBalance, "openingBalance must not be null");
        if (balances.containsKey(accountId)) {
            throw new IllegalArgumentException("account " + accountId + " is already open in the ledger");
        }
        if (openingBalance.signum() < 0) {
            throw new IllegalArgumentException("openingBalance must be >= 0 for account " + accountId);
        }
        NavigableMap<Integer, BigDecimal> byYear = new TreeMap<>();
        byYear.put(year, Money.round(openingBalance));
        balances.put(accountId, byYear);
    }

    public BigDecimal getBalance(AccountId accountId, int year) {
        BigDecimal balance = history(accountId).get(year);
        if (balance == null) {
            throw new StateNotReadyException("balance of account " + accountId + " for " + year
                    + " has not been computed; last computed year is " + lastYear(accountId));
        }
        return balance;
    }

    public void setBalance(AccountId accountId, int year, BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        NavigableMap<Integer, BigDecimal> byYear = history(accountId);
        int expected = byYear.lastKey() + 1;
        if (year != expected) {
            throw new StateNotReadyException("balance of account " + accountId + " written for " + year
                    + " but the next year to compute is " + expected);
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0 for account " + accountId + " in " + year);
        }
        byYear.put(year, Money.round(amount));
    }

    public int lastYear(AccountId accountId) {
        return history(accountId).lastKey();
    }

    /**
     * Balances of every account for one year, in the order accounts were opened.
     */
    public Map<AccountId, BigDecimal> balancesFor(int year) {
        Map<AccountId, BigDecimal> snapshot = new LinkedHashMap<>();
        for (AccountId accountId : balances.keySet()) {
            snapshot.put(accountId, getBalance(accountId, year));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    private NavigableMap<Integer, BigDecimal> history(AccountId accountId) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        NavigableMap<Integer, BigDecimal> byYear = balances.get(accountId);
        if (byYear == null) {
            throw new IllegalArgumentException("unknown account " + accountId);
        }
        return byYear;
    }
}
