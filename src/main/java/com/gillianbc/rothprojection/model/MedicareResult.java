package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Annual Medicare cost for all enrollees in the household. Bracket 0 means no IRMAA surcharge.
 */
@Value
@Builder
public class MedicareResult {

    int enrollees;
    int lookbackYear;
    /** Null when no MAGI exists for the lookback year. */
    BigDecimal lookbackMagi;
    boolean lookbackAvailable;
    BigDecimal partB;
    BigDecimal partD;
    /** partB + partD, before any surcharge. */
    BigDecimal medicareBase;
    BigDecimal partBSurcharge;
    BigDecimal partDSurcharge;
    BigDecimal irmaaSurcharge;
    int irmaaBracket;
    BigDecimal totalMedicare;

    public static MedicareResult notEnrolled(MagiLookback lookback) {
        return MedicareResult.builder()
                .enrollees(0)
                .lookbackYear(lookback.getLookbackYear())
                .lookbackMagi(lookback.getMagi())
                .lookbackAvailable(lookback.isAvailable())
                .partB(Money.ZERO)
                .partD(Money.ZERO)
                .medicareBase(Money.ZERO)
                .partBSurcharge(Money.ZERO)
                .partDSurcharge(Money.ZERO)
                .irmaaSurcharge(Money.ZERO)
                .irmaaBracket(0)
                .totalMedicare(Money.ZERO)
                .build();
    }
}
