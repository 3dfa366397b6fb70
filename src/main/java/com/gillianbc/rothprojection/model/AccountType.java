package com.gillianbc.rothprojection.model;

/**
 * Tax treatment category of an account.
 */
public enum AccountType {

    /** Traditional IRA, 401(k), 403(b) and the like: withdrawals are taxable and subject to RMDs. */
    PRE_TAX,
    /** Roth accounts: qualified withdrawals are tax-free and carry no RMD for the owner. */
    TAX_FREE,
    /** Brokerage accounts. */
    TAXABLE;

    public boolean isRmdEligible() {
        return this == PRE_TAX;
    }
}
