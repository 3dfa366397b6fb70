package com.gillianbc.rothprojection.model;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Baseline against conversion for one metric. Percent change is relative to the baseline and
 * zero when the baseline is zero.
 */
@Value
public class MetricComparison {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    SummaryMetric metric;
    BigDecimal baseline;
    BigDecimal conversion;
    BigDecimal difference;
    BigDecimal percentChange;

    public static MetricComparison of(SummaryMetric metric, BigDecimal baseline, BigDecimal conversion) {
        BigDecimal difference = conversion.subtract(baseline);
        BigDecimal percentChange = baseline.signum() == 0
                ? Money.ZERO
                : difference.multiply(HUNDRED).divide(baseline, Money.SCALE, RoundingMode.HALF_UP);
        return new MetricComparison(metric, baseline, conversion, difference, percentChange);
    }
}
