package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.Account;
import com.gillianbc.rothprojection.model.AccountType;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.model.PlanComparison;
import com.gillianbc.rothprojection.model.ProjectionResult;
import com.gillianbc.rothprojection.model.ProjectionSummary;
import com.gillianbc.rothprojection.model.SummaryMetric;
import com.gillianbc.rothprojection.model.YearRecord;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

@Service
public class ProjectionSummarizer {

    /**
     * @param result   a completed plan run
     * @param accounts the scenario's accounts, used to find the tax-free ones
     */
    public ProjectionSummary summarize(ProjectionResult result, List<Account> accounts) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(accounts, "accounts must not be null");
        List<YearRecord> years = result.getYears();

        BigDecimal federal = sum(years, record -> record.getTax().getTotalTax());
        BigDecimal state = sum(years, record -> record.getTax().getStateTax());
        BigDecimal medicare = sum(years, record -> record.getMedicare().getMedicareBase());
        BigDecimal irmaa = sum(years, record -> record.getMedicare().getIrmaaSurcharge());
        BigDecimal converted = sum(years, YearRecord::getTotalConversion);
        BigDecimal conversionTax = sum(years, record -> record.getTax().getConversionTax());

        BigDecimal finalTotal = Money.ZERO;
        BigDecimal finalTaxFree = Money.ZERO;
        if (!years.isEmpty()) {
            YearRecord last = result.finalYear();
            finalTotal = last.totalBalance();
            for (Account account : accounts) {
                if (account.getType() == AccountType.TAX_FREE && last.getBalances().containsKey(account.getId())) {
                    finalTaxFree = finalTaxFree.add(last.balanceOf(account.getId()));
                }
            }
        }

        Map<SummaryMetric, BigDecimal> values = new EnumMap<>(SummaryMetric.class);
        values.put(SummaryMetric.LIFETIME_FEDERAL_TAX, federal);
        values.put(SummaryMetric.LIFETIME_STATE_TAX, state);
        values.put(SummaryMetric.LIFETIME_MEDICARE, medicare);
        values.put(SummaryMetric.TOTAL_IRMAA, irmaa);
        values.put(SummaryMetric.TOTAL_RMDS, sum(years, YearRecord::totalRmd));
        values.put(SummaryMetric.TOTAL_CONVERTED, converted);
        values.put(SummaryMetric.TOTAL_CONVERSION_TAX, conversionTax);
        values.put(SummaryMetric.EFFECTIVE_CONVERSION_TAX_RATE, Money.ratio(conversionTax, converted));
        values.put(SummaryMetric.CUMULATIVE_NET_INCOME, sum(years, YearRecord::getNetIncome));
        values.put(SummaryMetric.FINAL_TOTAL_BALANCE, finalTotal);
        values.put(SummaryMetric.FINAL_TAX_FREE_BALANCE, finalTaxFree);
        values.put(SummaryMetric.TOTAL_EXPENSES, federal.add(state).add(medicare).add(irmaa));
        return new ProjectionSummary(result.getPlanKind(), values);
    }

    public PlanComparison compare(ProjectionSummary baseline, ProjectionSummary conversion) {
        return new PlanComparison(baseline, conversion);
    }

    private static BigDecimal sum(List<YearRecord> years, Function<YearRecord, BigDecimal> field) {
        return years.stream().map(field).reduce(Money.ZERO, BigDecimal::add);
    }
}
