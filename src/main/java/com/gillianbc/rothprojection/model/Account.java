package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable account definition taken from scenario input. Balances over time live in the
 * {@link com.gillianbc.rothprojection.ledger.AccountLedger}, never here.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Account {

    private final AccountId id;
    /** Display label only; never used as a key. */
    private final String name;
    private final AccountType type;
    private final Owner owner;
    private final BigDecimal startingBalance;
    /** Annual growth as a fraction, e.g. 0.06 for 6%. */
    private final BigDecimal growthRate;

    @Builder
    public Account(AccountId id,
                   String name,
                   AccountType type,
                   Owner owner,
                   BigDecimal startingBalance,
                   BigDecimal growthRate) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.owner = owner == null ? Owner.PRIMARY : owner;
        this.name = name == null ? id.getValue() : name;
        Objects.requireNonNull(startingBalance, "startingBalance must not be null");
        this.growthRate = Objects.requireNonNull(growthRate, "growthRate must not be null");
        if (startingBalance.signum() < 0) {
            throw new IllegalArgumentException("startingBalance must be >= 0 for account " + id);
        }
        if (growthRate.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new IllegalArgumentException("growthRate must be > -1 for account " + id);
        }
        this.startingBalance = Money.round(startingBalance);
    }

    public boolean isRmdEligible() {
        return type.isRmdEligible();
    }
}
