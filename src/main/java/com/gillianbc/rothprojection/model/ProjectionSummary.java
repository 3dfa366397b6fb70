package com.gillianbc.rothprojection.model;

import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Summary metrics of one plan. Every {@link SummaryMetric} has a value.
 */
@ToString
public class ProjectionSummary {

    private final PlanKind planKind;
    private final Map<SummaryMetric, BigDecimal> values;

    public ProjectionSummary(PlanKind planKind, Map<SummaryMetric, BigDecimal> values) {
        this.planKind = Objects.requireNonNull(planKind, "planKind must not be null");
        Objects.requireNonNull(values, "values must not be null");
        EnumMap<SummaryMetric, BigDecimal> copy = new EnumMap<>(SummaryMetric.class);
        for (SummaryMetric metric : SummaryMetric.values()) {
            copy.put(metric, Objects.requireNonNull(values.get(metric), metric + " must not be null"));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public PlanKind getPlanKind() {
        return planKind;
    }

    public BigDecimal get(SummaryMetric metric) {
        return values.get(metric);
    }

    public Map<SummaryMetric, BigDecimal> asMap() {
        return values;
    }
}
