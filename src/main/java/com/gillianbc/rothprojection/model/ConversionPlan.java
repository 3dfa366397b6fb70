package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Moves totalAmount out of a pre-tax source account into a tax-free destination account,
 * spread evenly over durationYears starting at startYear. Optionally withdraws a fixed amount
 * each year from the destination once the conversions are finished.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConversionPlan {

    private final AccountId sourceAccountId;
    private final AccountId destinationAccountId;
    private final BigDecimal totalAmount;
    private final int startYear;
    private final int durationYears;
    private final BigDecimal annualWithdrawal;
    private final Integer withdrawalStartYear;

    @Builder
    public ConversionPlan(AccountId sourceAccountId,
                          AccountId destinationAccountId,
                          BigDecimal totalAmount,
                          int startYear,
                          int durationYears,
                          BigDecimal annualWithdrawal,
                          Integer withdrawalStartYear) {
        this.sourceAccountId = Objects.requireNonNull(sourceAccountId, "sourceAccountId must not be null");
        this.destinationAccountId = Objects.requireNonNull(destinationAccountId, "destinationAccountId must not be null");
        Objects.requireNonNull(totalAmount, "totalAmount must not be null");
        if (sourceAccountId.equals(destinationAccountId)) {
            throw new IllegalArgumentException("source and destination must differ: " + sourceAccountId);
        }
        if (totalAmount.signum() < 0) {
            throw new IllegalArgumentException("totalAmount must be >= 0");
        }
        if (durationYears <= 0) {
            throw new IllegalArgumentException("durationYears must be positive");
        }
        BigDecimal withdrawal = annualWithdrawal == null ? BigDecimal.ZERO : annualWithdrawal;
        if (withdrawal.signum() < 0) {
            throw new IllegalArgumentException("annualWithdrawal must be >= 0");
        }
        this.totalAmount = Money.round(totalAmount);
        this.startYear = startYear;
        this.durationYears = durationYears;
        this.annualWithdrawal = Money.round(withdrawal);
        this.withdrawalStartYear = withdrawalStartYear;
    }

    public int endYear() {
        return startYear + durationYears - 1;
    }

    /**
     * Counts from the first conversion year; negative before it.
     */
    public int yearIndex(int year) {
        return year - startYear;
    }

    /**
     * First year of destination withdrawals, never inside the conversion window.
     * Null when no withdrawal is planned.
     */
    public Integer effectiveWithdrawalStartYear() {
        if (annualWithdrawal.signum() == 0 || withdrawalStartYear == null) {
            return null;
        }
        return Math.max(withdrawalStartYear, endYear() + 1);
    }

    public BigDecimal withdrawalFor(int year) {
        Integer first = effectiveWithdrawalStartYear();
        return first != null && year >= first ? annualWithdrawal : Money.ZERO;
    }
}
