package com.gillianbc.rothprojection.model;

import lombok.Value;

/**
 * Baseline and conversion runs of one scenario, their summaries and the comparison between them.
 */
@Value
public class ConversionAnalysis {

    ProjectionResult baseline;
    ProjectionResult conversion;
    ProjectionSummary baselineSummary;
    ProjectionSummary conversionSummary;
    PlanComparison comparison;
}
