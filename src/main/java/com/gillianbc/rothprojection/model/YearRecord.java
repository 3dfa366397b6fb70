package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One plan's complete, immutable result for one year. Every per-account quantity is keyed by
 * {@link AccountId} and nothing else.
 */
@Value
@Builder
public class YearRecord {

    int year;
    int primaryAge;
    /** Null when the scenario has no spouse. */
    Integer spouseAge;

    Map<AccountId, BigDecimal> balances;
    Map<AccountId, BigDecimal> rmds;
    Map<AccountId, BigDecimal> conversions;
    Map<AccountId, BigDecimal> taxFreeWithdrawals;
    /** Taxable income each account or income stream contributed this year. */
    Map<AccountId, BigDecimal> incomeContributions;

    BigDecimal totalConversion;
    BigDecimal wages;
    BigDecimal socialSecurityIncome;
    /**
     * Taxable share of the benefits, worked out from income without the conversion. Conversion
     * tax therefore does not include any extra Social Security a conversion would make taxable.
     */
    BigDecimal taxableSocialSecurity;
    /** Wages plus per-account income contributions; excludes Social Security and the conversion. */
    BigDecimal grossIncome;
    BigDecimal agi;
    BigDecimal magi;

    TaxResult tax;
    MedicareResult medicare;

    BigDecimal incomeAfterFederalTax;
    BigDecimal incomeAfterStateTax;
    /** Spendable income after taxes and Medicare, including tax-free withdrawals. */
    BigDecimal netIncome;

    public BigDecimal balanceOf(AccountId accountId) {
        BigDecimal balance = balances.get(accountId);
        if (balance == null) {
            throw new IllegalArgumentException("no account " + accountId + " in year " + year);
        }
        return balance;
    }

    public BigDecimal totalRmd() {
        return sum(rmds);
    }

    public BigDecimal totalBalance() {
        return sum(balances);
    }

    public BigDecimal totalTaxFreeWithdrawal() {
        return sum(taxFreeWithdrawals);
    }

    private static BigDecimal sum(Map<AccountId, BigDecimal> amounts) {
        return amounts.values().stream().reduce(Money.ZERO, BigDecimal::add);
    }
}
