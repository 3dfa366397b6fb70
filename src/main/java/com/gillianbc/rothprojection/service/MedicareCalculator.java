package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.config.ProjectionProperties;
import com.gillianbc.rothprojection.model.FilingStatus;
import com.gillianbc.rothprojection.model.MagiLookback;
import com.gillianbc.rothprojection.model.MedicareResult;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.reference.IrmaaBracket;
import com.gillianbc.rothprojection.reference.MedicareBaseRates;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import com.gillianbc.rothprojection.reference.TaxYearTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Part B and Part D premiums plus IRMAA for a household. The bracket is chosen from MAGI two years
 * back; without that MAGI only base premiums are charged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MedicareCalculator {

    private final ReferenceTables referenceTables;
    private final ProjectionProperties properties;

    public MedicareResult compute(MagiLookback lookback, int year, FilingStatus filingStatus, int enrollees) {
        Objects.requireNonNull(lookback, "lookback must not be null");
        Objects.requireNonNull(filingStatus, "filingStatus must not be null");
        if (enrollees < 0) {
            throw new IllegalArgumentException("enrollees must be >= 0");
        }
        if (enrollees == 0) {
            return MedicareResult.notEnrolled(lookback);
        }

        TaxYearTables tables = referenceTables.forYear(year);
        int yearsOut = Math.max(0, year - tables.getTaxYear());
        BigDecimal premiumFactor = Money.compoundFactor(properties.getMedicalInflationRate(), yearsOut);
        BigDecimal thresholdFactor = Money.compoundFactor(properties.getIrmaaThresholdInflationRate(), yearsOut);
        BigDecimal perEnrollee = BigDecimal.valueOf(enrollees);

        MedicareBaseRates baseRates = tables.medicareBaseRates();
        BigDecimal partB = annual(baseRates.getPartBMonthly(), premiumFactor, perEnrollee);
        BigDecimal partD = annual(baseRates.getPartDMonthly(), premiumFactor, perEnrollee);

        int bracketNumber = 0;
        IrmaaBracket matched = null;
        if (lookback.isAvailable()) {
            List<IrmaaBracket> brackets = tables.irmaaBracketsFor(filingStatus);
            for (int i = 0; i < brackets.size(); i++) {
                BigDecimal threshold = brackets.get(i).getMagiThreshold().multiply(thresholdFactor, Money.MATH_CONTEXT);
                if (lookback.getMagi().compareTo(threshold) > 0) {
                    bracketNumber = i + 1;
                    matched = brackets.get(i);
                }
            }
        }

        BigDecimal partBSurcharge = matched == null
                ? Money.ZERO : annual(matched.getPartBMonthlySurcharge(), premiumFactor, perEnrollee);
        BigDecimal partDSurcharge = matched == null
                ? Money.ZERO : annual(matched.getPartDMonthlySurcharge(), premiumFactor, perEnrollee);
        BigDecimal base = partB.add(partD);
        BigDecimal irmaa = partBSurcharge.add(partDSurcharge);

        log.debug("Medicare {}: {} enrollee(s), lookback {} MAGI {} -> bracket {}, base {} irmaa {}", year, enrollees,
                lookback.getLookbackYear(), lookback.isAvailable() ? lookback.getMagi() : "unavailable",
                bracketNumber, base, irmaa);

        return MedicareResult.builder()
                .enrollees(enrollees)
                .lookbackYear(lookback.getLookbackYear())
                .lookbackMagi(lookback.getMagi())
                .lookbackAvailable(lookback.isAvailable())
                .partB(partB)
                .partD(partD)
                .medicareBase(base)
                .partBSurcharge(partBSurcharge)
                .partDSurcharge(partDSurcharge)
                .irmaaSurcharge(irmaa)
                .irmaaBracket(bracketNumber)
                .totalMedicare(base.add(irmaa))
                .build();
    }

    private static BigDecimal annual(BigDecimal monthly, BigDecimal inflationFactor, BigDecimal enrollees) {
        return Money.round(Money.annualise(monthly.multiply(inflationFactor, Money.MATH_CONTEXT)).multiply(enrollees));
    }
}
