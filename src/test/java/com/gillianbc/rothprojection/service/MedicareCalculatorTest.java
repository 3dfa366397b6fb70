package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.FilingStatus;
import com.gillianbc.rothprojection.model.MagiLookback;
import com.gillianbc.rothprojection.model.MedicareResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class MedicareCalculatorTest {

    private final MedicareCalculator calculator = ProjectionFixtures.medicareCalculator();

    private static MagiLookback magi(String amount) {
        return MagiLookback.of(2023, new BigDecimal(amount));
    }

    @Test
    @DisplayName("Without a lookback MAGI only base premiums are charged")
    void unavailableLookback_basePremiumsOnly() {
        MedicareResult result = calculator.compute(MagiLookback.unavailable(2023), 2025, FilingStatus.SINGLE, 1);
        assertFalse(result.isLookbackAvailable());
        assertNull(result.getLookbackMagi());
        assertEquals(new BigDecimal("2220.00"), result.getPartB());
        assertEquals(new BigDecimal("852.00"), result.getPartD());
        assertEquals(new BigDecimal("3072.00"), result.getMedicareBase());
        assertEquals(0, result.getIrmaaBracket());
        assertEquals(new BigDecimal("0.00"), result.getIrmaaSurcharge());
        assertEquals(new BigDecimal("3072.00"), result.getTotalMedicare());
    }

    @Test
    @DisplayName("A surcharge applies only above the threshold")
    void threshold_isStrict() {
        assertEquals(0, calculator.compute(magi("106000.00"), 2025, FilingStatus.SINGLE, 1).getIrmaaBracket());

        MedicareResult first = calculator.compute(magi("106000.01"), 2025, FilingStatus.SINGLE, 1);
        assertEquals(1, first.getIrmaaBracket());
        assertEquals(new BigDecimal("888.00"), first.getPartBSurcharge());
        assertEquals(new BigDecimal("164.40"), first.getPartDSurcharge());
        assertEquals(new BigDecimal("1052.40"), first.getIrmaaSurcharge());
        assertEquals(new BigDecimal("4124.40"), first.getTotalMedicare());
    }

    @Test
    @DisplayName("Highest bracket for very large MAGI")
    void topBracket() {
        MedicareResult result = calculator.compute(magi("2000000.00"), 2025, FilingStatus.SINGLE, 1);
        assertEquals(5, result.getIrmaaBracket());
        assertEquals(new BigDecimal("6356.40"), result.getIrmaaSurcharge());
    }

    @Test
    @DisplayName("Joint filers use the joint table and pay per enrollee")
    void marriedFilingJointly_perEnrollee() {
        MedicareResult result = calculator.compute(magi("300000.00"), 2025, FilingStatus.MARRIED_FILING_JOINTLY, 2);
        assertEquals(2, result.getIrmaaBracket());
        assertEquals(new BigDecimal("4440.00"), result.getPartB());
        assertEquals(new BigDecimal("1704.00"), result.getPartD());
        assertEquals(new BigDecimal("4440.00"), result.getPartBSurcharge());
        assertEquals(new BigDecimal("847.20"), result.getPartDSurcharge());
    }

    @Test
    @DisplayName("Separate filers and heads of household pick their tables")
    void otherFilingStatuses() {
        MedicareResult separate = calculator.compute(magi("200000.00"), 2025, FilingStatus.MARRIED_FILING_SEPARATELY, 1);
        assertEquals(1, separate.getIrmaaBracket());
        assertEquals(new BigDecimal("4882.80"), separate.getPartBSurcharge());
        assertEquals(new BigDecimal("943.20"), separate.getPartDSurcharge());

        assertEquals(2, calculator.compute(magi("140000.00"), 2025, FilingStatus.HEAD_OF_HOUSEHOLD, 1).getIrmaaBracket());
    }

    @Test
    @DisplayName("Premiums inflate 5% a year and thresholds 1% a year after the table year")
    void laterYears_inflated() {
        MedicareResult result = calculator.compute(MagiLookback.of(2025, new BigDecimal("107000.00")), 2027,
                FilingStatus.SINGLE, 1);
        assertEquals(new BigDecimal("2447.55"), result.getPartB());
        assertEquals(new BigDecimal("939.33"), result.getPartD());
        // 106,000 x 1.01^2 = 108,130.60
        assertEquals(0, result.getIrmaaBracket());
        assertEquals(1, calculator.compute(magi("107000.00"), 2025, FilingStatus.SINGLE, 1).getIrmaaBracket());
    }

    @Test
    @DisplayName("No enrollees, no Medicare cost")
    void noEnrollees_zeroCost() {
        MedicareResult result = calculator.compute(magi("900000.00"), 2025, FilingStatus.SINGLE, 0);
        assertEquals(0, result.getEnrollees());
        assertEquals(new BigDecimal("0.00"), result.getTotalMedicare());
        assertEquals(0, result.getIrmaaBracket());
    }
}
