package com.gillianbc.rothprojection.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Currency and rate arithmetic shared by the engine. Money is held at 2 decimal places,
 * rounded HALF_UP; rates are held at 4.
 */
public final class Money {

    public static final MathContext MATH_CONTEXT = new MathContext(20, RoundingMode.HALF_UP);
    public static final int SCALE = 2;
    public static final int RATE_SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private Money() {
    }

    public static BigDecimal of(String amount) {
        return round(new BigDecimal(amount));
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal rate(BigDecimal rate) {
        return rate.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal floorToZero(BigDecimal amount) {
        return amount.signum() < 0 ? ZERO : amount;
    }

    public static BigDecimal annualise(BigDecimal monthly) {
        return monthly.multiply(MONTHS_PER_YEAR, MATH_CONTEXT);
    }

    /**
     * (1 + rate) ^ years, for years >= 0.
     */
    public static BigDecimal compoundFactor(BigDecimal rate, int years) {
        if (years < 0) {
            throw new IllegalArgumentException("years must be >= 0");
        }
        return BigDecimal.ONE.add(rate, MATH_CONTEXT).pow(years, MATH_CONTEXT);
    }

    /**
     * numerator / denominator as a rate, or zero when the denominator is not positive.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() <= 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE, RoundingMode.HALF_UP);
        }
        return numerator.divide(denominator, RATE_SCALE, RoundingMode.HALF_UP);
    }
}
