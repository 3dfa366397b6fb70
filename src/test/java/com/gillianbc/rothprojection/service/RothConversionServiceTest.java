package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.Account;
import com.gillianbc.rothprojection.model.AccountId;
import com.gillianbc.rothprojection.model.AccountRegistry;
import com.gillianbc.rothprojection.model.AccountType;
import com.gillianbc.rothprojection.model.ConversionAnalysis;
import com.gillianbc.rothprojection.model.ConversionPlan;
import com.gillianbc.rothprojection.model.FilingStatus;
import com.gillianbc.rothprojection.model.MetricComparison;
import com.gillianbc.rothprojection.model.Owner;
import com.gillianbc.rothprojection.model.Person;
import com.gillianbc.rothprojection.model.PlanKind;
import com.gillianbc.rothprojection.model.Scenario;
import com.gillianbc.rothprojection.model.ScenarioConstants;
import com.gillianbc.rothprojection.model.SummaryMetric;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class RothConversionServiceTest {

    private static final BigDecimal ZERO = new BigDecimal("0.00");
    private static final BigDecimal GROWTH = new BigDecimal("0.06");
    private static final AccountId IRA = AccountId.of("ira");

    private ExecutorService executor;
    private RothConversionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new RothConversionService(ProjectionFixtures.projectionDriver(), new ProjectionSummarizer(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ScenarioConstants constants() {
        return ScenarioConstants.builder()
                .filingStatus(FilingStatus.MARRIED_FILING_JOINTLY)
                .stateCode("NY")
                .primary(Person.builder().birthYear(1958).socialSecurityBenefit(new BigDecimal("32000")).build())
                .spouse(Person.builder().birthYear(1960).socialSecurityBenefit(new BigDecimal("18000")).build())
                .startYear(2025)
                .endYear(2055)
                .retirementYear(2026)
                .preRetirementIncome(new BigDecimal("90000"))
                .socialSecurityCola(new BigDecimal("0.02"))
                .build();
    }

    private static Scenario scenario(AccountId source) {
        AccountRegistry registry = new AccountRegistry().register(Account.builder()
                .id(IRA)
                .type(AccountType.PRE_TAX)
                .startingBalance(new BigDecimal("2000000"))
                .growthRate(GROWTH)
                .build());
        Account roth = registry.newTaxFreeAccount("Roth", Owner.PRIMARY, GROWTH);
        ConversionPlan plan = ConversionPlan.builder()
                .sourceAccountId(source == null ? IRA : source)
                .destinationAccountId(roth.getId())
                .totalAmount(new BigDecimal("2000000"))
                .startYear(2025)
                .durationYears(10)
                .build();
        return Scenario.of(registry, List.of(plan), constants());
    }

    @Test
    @DisplayName("Both plans run on their own state and are summarised and compared")
    void analyze_runsBothPlans() {
        Scenario scenario = scenario(null);
        ConversionAnalysis analysis = service.analyze(scenario);
        analysis.getComparison().all().forEach(comparison -> log.info("{}: baseline {} conversion {} difference {} ({}%)",
                comparison.getMetric().label(), comparison.getBaseline(), comparison.getConversion(),
                comparison.getDifference(), comparison.getPercentChange()));

        assertEquals(PlanKind.BASELINE, analysis.getBaseline().getPlanKind());
        assertEquals(PlanKind.CONVERSION, analysis.getConversion().getPlanKind());
        assertNotSame(analysis.getBaseline().getState(), analysis.getConversion().getState());
        assertNotSame(analysis.getBaseline().getState().getLedger(), analysis.getConversion().getState().getLedger());

        MetricComparison converted = analysis.getComparison().get(SummaryMetric.TOTAL_CONVERTED);
        assertEquals(ZERO, converted.getBaseline());
        assertEquals(new BigDecimal("2000000.00"), converted.getConversion());
        assertEquals(new BigDecimal("2000000.00"), converted.getDifference());
        assertEquals(ZERO, converted.getPercentChange());

        assertEquals(ZERO, analysis.getBaselineSummary().get(SummaryMetric.FINAL_TAX_FREE_BALANCE));
        assertTrue(analysis.getConversionSummary().get(SummaryMetric.FINAL_TAX_FREE_BALANCE).signum() > 0);
        assertTrue(analysis.getConversionSummary().get(SummaryMetric.TOTAL_CONVERSION_TAX).signum() > 0);
        assertTrue(analysis.getBaselineSummary().get(SummaryMetric.TOTAL_RMDS)
                .compareTo(analysis.getConversionSummary().get(SummaryMetric.TOTAL_RMDS)) > 0);
    }

    @Test
    @DisplayName("Concurrent runs match sequential runs exactly")
    void analyze_matchesSequentialRuns() {
        Scenario scenario = scenario(null);
        ConversionAnalysis analysis = service.analyze(scenario);
        assertEquals(service.project(scenario, PlanKind.BASELINE).getYears(), analysis.getBaseline().getYears());
        assertEquals(service.project(scenario, PlanKind.CONVERSION).getYears(), analysis.getConversion().getYears());
    }

    @Test
    @DisplayName("Summary totals add up and percent change is relative to the baseline")
    void summary_totalsAndPercentChange() {
        ConversionAnalysis analysis = service.analyze(scenario(null));
        var summary = analysis.getConversionSummary();
        assertEquals(summary.get(SummaryMetric.LIFETIME_FEDERAL_TAX)
                        .add(summary.get(SummaryMetric.LIFETIME_STATE_TAX))
                        .add(summary.get(SummaryMetric.LIFETIME_MEDICARE))
                        .add(summary.get(SummaryMetric.TOTAL_IRMAA)),
                summary.get(SummaryMetric.TOTAL_EXPENSES));

        MetricComparison federal = analysis.getComparison().get(SummaryMetric.LIFETIME_FEDERAL_TAX);
        assertEquals(federal.getConversion().subtract(federal.getBaseline()), federal.getDifference());
        assertEquals(MetricComparison.of(SummaryMetric.LIFETIME_FEDERAL_TAX, federal.getBaseline(), federal.getConversion())
                .getPercentChange(), federal.getPercentChange());
        assertEquals(new BigDecimal("-25.00"),
                MetricComparison.of(SummaryMetric.TOTAL_RMDS, new BigDecimal("400.00"), new BigDecimal("300.00")).getPercentChange());
    }

    @Test
    @DisplayName("A failure inside a plan run surfaces as the original exception")
    void analyze_unwrapsWorkerFailure() {
        Scenario invalid = scenario(AccountId.of("no-such-account"));
        assertThrows(IllegalArgumentException.class, () -> service.analyze(invalid));
    }
}
