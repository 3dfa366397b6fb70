package com.gillianbc.rothprojection.reference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One progressive federal bracket: income above lowerBound and up to upperBound is taxed at rate.
 * The top bracket has no upper bound.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class TaxBracket {

    private BigDecimal lowerBound;
    private BigDecimal upperBound;
    private BigDecimal rate;

    public boolean contains(BigDecimal taxableIncome) {
        return taxableIncome.compareTo(lowerBound) > 0
                && (upperBound == null || taxableIncome.compareTo(upperBound) <= 0);
    }

    /**
     * Portion of taxableIncome that falls inside this bracket.
     */
    public BigDecimal slice(BigDecimal taxableIncome) {
        if (taxableIncome.compareTo(lowerBound) <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal top = upperBound == null ? taxableIncome : taxableIncome.min(upperBound);
        return top.subtract(lowerBound);
    }
}
