package com.gillianbc.rothprojection.ledger;

import lombok.Getter;

import java.util.Objects;

/**
 * All state a plan run carries from one year to the next. Each run owns its own instance;
 * nothing here is shared between plans or held between calls.
 */
@Getter
public class ProjectionState {

    private final AccountLedger ledger;
    private final MagiHistory magiHistory;

    public ProjectionState(AccountLedger ledger, MagiHistory magiHistory) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.magiHistory = Objects.requireNonNull(magiHistory, "magiHistory must not be null");
    }
}
