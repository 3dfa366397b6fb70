package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.FilingStatus;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.model.TaxResult;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import com.gillianbc.rothprojection.reference.StateTaxRule;
import com.gillianbc.rothprojection.reference.TaxBracket;
import com.gillianbc.rothprojection.reference.TaxYearTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Federal tax with and without the year's conversion, plus flat-rate state tax.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxCalculator {

    private final ReferenceTables referenceTables;

    public TaxResult compute(BigDecimal grossIncome,
                             BigDecimal taxableSocialSecurity,
                             BigDecimal conversionAmount,
                             FilingStatus filingStatus,
                             String stateCode,
                             int year) {
        Objects.requireNonNull(grossIncome, "grossIncome must not be null");
        Objects.requireNonNull(taxableSocialSecurity, "taxableSocialSecurity must not be null");
        Objects.requireNonNull(conversionAmount, "conversionAmount must not be null");
        Objects.requireNonNull(filingStatus, "filingStatus must not be null");
        Objects.requireNonNull(stateCode, "stateCode must not be null");
        if (grossIncome.signum() < 0 || taxableSocialSecurity.signum() < 0 || conversionAmount.signum() < 0) {
            throw new IllegalArgumentException("income amounts must be >= 0");
        }

        TaxYearTables tables = referenceTables.forYear(year);
        List<TaxBracket> brackets = tables.bracketsFor(filingStatus);
        BigDecimal deduction = Money.round(tables.standardDeductionFor(filingStatus));

        BigDecimal regularIncome = grossIncome.add(taxableSocialSecurity);
        BigDecimal regularTaxable = Money.round(Money.floorToZero(regularIncome.subtract(deduction)));
        BigDecimal taxable = Money.round(Money.floorToZero(regularIncome.add(conversionAmount).subtract(deduction)));

        BigDecimal regularTax = progressiveTax(brackets, regularTaxable);
        BigDecimal totalTax = progressiveTax(brackets, taxable);
        BigDecimal agi = regularIncome.add(conversionAmount);
        BigDecimal stateTax = stateTax(tables.stateRuleFor(stateCode), agi, taxableSocialSecurity);

        TaxResult result = TaxResult.builder()
                .standardDeduction(deduction)
                .regularTaxableIncome(regularTaxable)
                .taxableIncome(taxable)
                .regularTax(regularTax)
                .totalTax(totalTax)
                .conversionTax(totalTax.subtract(regularTax))
                .stateTax(stateTax)
                .marginalRate(marginalRate(brackets, taxable))
                .effectiveRate(Money.ratio(totalTax, grossIncome))
                .build();
        log.debug("Tax {} {}: taxable {} regular {} total {} conversion {} state {}", year, filingStatus,
                taxable, regularTax, totalTax, result.getConversionTax(), stateTax);
        return result;
    }

    BigDecimal progressiveTax(List<TaxBracket> brackets, BigDecimal taxableIncome) {
        BigDecimal tax = BigDecimal.ZERO;
        for (TaxBracket bracket : brackets) {
            tax = tax.add(bracket.slice(taxableIncome).multiply(bracket.getRate()));
        }
        return Money.round(tax);
    }

    /**
     * Rate of the bracket holding the top dollar; zero when nothing is taxable.
     */
    BigDecimal marginalRate(List<TaxBracket> brackets, BigDecimal taxableIncome) {
        if (taxableIncome.signum() <= 0) {
            return Money.rate(BigDecimal.ZERO);
        }
        for (TaxBracket bracket : brackets) {
            if (bracket.contains(taxableIncome)) {
                return Money.rate(bracket.getRate());
            }
        }
        return Money.rate(brackets.get(brackets.size() - 1).getRate());
    }

    BigDecimal stateTax(StateTaxRule rule, BigDecimal agi, BigDecimal taxableSocialSecurity) {
        if (rule.isRetirementIncomeExempt()) {
            return Money.ZERO;
        }
        BigDecimal base = rule.isSocialSecurityTaxed() ? agi : agi.subtract(taxableSocialSecurity);
        return Money.round(Money.floorToZero(base).multiply(rule.getIncomeTaxRate()));
    }
}
