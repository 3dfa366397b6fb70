package com.gillianbc.rothprojection.model;

import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@ToString
public class PlanComparison {

    private final Map<SummaryMetric, MetricComparison> comparisons;

    public PlanComparison(ProjectionSummary baseline, ProjectionSummary conversion) {
        EnumMap<SummaryMetric, MetricComparison> byMetric = new EnumMap<>(SummaryMetric.class);
        for (SummaryMetric metric : SummaryMetric.values()) {
            byMetric.put(metric, MetricComparison.of(metric, baseline.get(metric), conversion.get(metric)));
        }
        this.comparisons = Collections.unmodifiableMap(byMetric);
    }

    public MetricComparison get(SummaryMetric metric) {
        return comparisons.get(metric);
    }

    public List<MetricComparison> all() {
        return Collections.unmodifiableList(new ArrayList<>(comparisons.values()));
    }
}
