package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.FilingStatus;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import com.gillianbc.rothprojection.reference.SocialSecurityThresholds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Taxable portion of Social Security benefits by the provisional-income rule.
 */
@Service
@RequiredArgsConstructor
public class SocialSecurityTaxCalculator {

    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal EIGHTY_FIVE_PERCENT = new BigDecimal("0.85");

    private final ReferenceTables referenceTables;

    /**
     * @param benefits    Social Security received in the year
     * @param otherIncome other taxable income counted toward provisional income
     */
    public BigDecimal taxableAmount(BigDecimal benefits, BigDecimal otherIncome, FilingStatus filingStatus, int year) {
        Objects.requireNonNull(benefits, "benefits must not be null");
        Objects.requireNonNull(otherIncome, "otherIncome must not be null");
        Objects.requireNonNull(filingStatus, "filingStatus must not be null");
        if (benefits.signum() <= 0) {
            return Money.ZERO;
        }
        SocialSecurityThresholds thresholds = referenceTables.forYear(year).socialSecurityThresholdsFor(filingStatus);
        BigDecimal base = thresholds.getBase();
        BigDecimal additional = thresholds.getAdditional();
        BigDecimal halfBenefits = benefits.multiply(HALF);
        BigDecimal provisional = otherIncome.add(halfBenefits);

        if (provisional.compareTo(base) <= 0) {
            return Money.ZERO;
        }
        if (provisional.compareTo(additional) <= 0) {
            return Money.round(halfBenefits.min(provisional.subtract(base).multiply(HALF)));
        }
        BigDecimal firstTier = halfBenefits.min(additional.subtract(base).multiply(HALF));
        BigDecimal secondTier = provisional.subtract(additional).multiply(EIGHTY_FIVE_PERCENT);
        return Money.round(benefits.multiply(EIGHTY_FIVE_PERCENT).min(secondTier.add(firstTier)));
    }
}
