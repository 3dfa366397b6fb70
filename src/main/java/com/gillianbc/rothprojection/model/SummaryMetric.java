package com.gillianbc.rothprojection.model;

/**
 * Whole-horizon figures reported for a plan and compared between plans.
 */
public enum SummaryMetric {
    LIFETIME_FEDERAL_TAX("Lifetime federal tax"),
    LIFETIME_STATE_TAX("Lifetime state tax"),
    LIFETIME_MEDICARE("Lifetime Medicare base premiums"),
    TOTAL_IRMAA("Total IRMAA surcharges"),
    TOTAL_RMDS("Total RMDs"),
    TOTAL_CONVERTED("Total converted"),
    TOTAL_CONVERSION_TAX("Total conversion tax"),
    EFFECTIVE_CONVERSION_TAX_RATE("Effective conversion tax rate"),
    CUMULATIVE_NET_INCOME("Cumulative net income"),
    FINAL_TOTAL_BALANCE("Final total balance"),
    FINAL_TAX_FREE_BALANCE("Final tax-free balance"),
    TOTAL_EXPENSES("Total expenses");

    private final String label;

    SummaryMetric(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
