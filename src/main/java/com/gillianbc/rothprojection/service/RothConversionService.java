package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.ConversionAnalysis;
import com.gillianbc.rothprojection.model.PlanKind;
import com.gillianbc.rothprojection.model.ProjectionResult;
import com.gillianbc.rothprojection.model.ProjectionSummary;
import com.gillianbc.rothprojection.model.Scenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for analysing a scenario: baseline and conversion plans run side by side, each on
 * its own ledger and MAGI history, then get summarised and compared.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RothConversionService {

    private final ProjectionDriver projectionDriver;
    private final ProjectionSummarizer projectionSummarizer;
    private final Executor projectionExecutor;

    public ConversionAnalysis analyze(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario must not be null");
        log.info("Analysing scenario {}-{} with {} conversion plan(s)", scenario.getConstants().getStartYear(),
                scenario.getConstants().getEndYear(), scenario.getConversionPlans().size());

        CompletableFuture<ProjectionResult> baselineRun = CompletableFuture.supplyAsync(
                () -> projectionDriver.run(scenario, PlanKind.BASELINE), projectionExecutor);
        CompletableFuture<ProjectionResult> conversionRun = CompletableFuture.supplyAsync(
                () -> projectionDriver.run(scenario, PlanKind.CONVERSION), projectionExecutor);

        ProjectionResult baseline = await(baselineRun);
        ProjectionResult conversion = await(conversionRun);

        ProjectionSummary baselineSummary = projectionSummarizer.summarize(baseline, scenario.getAccounts());
        ProjectionSummary conversionSummary = projectionSummarizer.summarize(conversion, scenario.getAccounts());
        ConversionAnalysis analysis = new ConversionAnalysis(baseline, conversion, baselineSummary, conversionSummary,
                projectionSummarizer.compare(baselineSummary, conversionSummary));
        log.info("Analysis complete: {} clamped conversion(s)", conversion.getWarnings().size());
        return analysis;
    }

    /**
     * Runs a single plan on the calling thread.
     */
    public ProjectionResult project(Scenario scenario, PlanKind planKind) {
        return projectionDriver.run(scenario, planKind);
    }

    private static ProjectionResult await(CompletableFuture<ProjectionResult> run) {
        try {
            return run.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
