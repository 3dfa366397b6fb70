package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Federal and state tax for one year. {@code conversionTax} is the federal tax attributable to the
 * conversion alone: total tax minus the tax on the same income without it.
 */
@Value
@Builder
public class TaxResult {

    BigDecimal standardDeduction;
    BigDecimal regularTaxableIncome;
    BigDecimal taxableIncome;
    BigDecimal regularTax;
    BigDecimal totalTax;
    BigDecimal conversionTax;
    BigDecimal stateTax;
    /** Rate of the bracket holding the top dollar of taxable income, zero when nothing is taxable. */
    BigDecimal marginalRate;
    /** Total federal tax over gross income, zero when gross income is zero. */
    BigDecimal effectiveRate;
}
