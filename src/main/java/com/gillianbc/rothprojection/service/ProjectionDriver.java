package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.ledger.AccountLedger;
import com.gillianbc.rothprojection.ledger.MagiHistory;
import com.gillianbc.rothprojection.ledger.ProjectionState;
import com.gillianbc.rothprojection.model.Account;
import com.gillianbc.rothprojection.model.AccountId;
import com.gillianbc.rothprojection.model.AccountType;
import com.gillianbc.rothprojection.model.AccountYear;
import com.gillianbc.rothprojection.model.ClampedInputWarning;
import com.gillianbc.rothprojection.model.ConversionPlan;
import com.gillianbc.rothprojection.model.IncomeStream;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.model.PlanKind;
import com.gillianbc.rothprojection.model.ProjectionResult;
import com.gillianbc.rothprojection.model.Scenario;
import com.gillianbc.rothprojection.model.ScenarioConstants;
import com.gillianbc.rothprojection.model.YearRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one plan of a scenario year by year. The only place where a year depends on the year
 * before it: balances come from the ledger entry for the prior year and IRMAA from the MAGI
 * history, both owned by this run alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionDriver {

    private final ConversionScheduler conversionScheduler;
    private final BalanceStepper balanceStepper;
    private final YearRecordAssembler yearRecordAssembler;

    public ProjectionResult run(Scenario scenario, PlanKind planKind) {
        Objects.requireNonNull(scenario, "scenario must not be null");
        Objects.requireNonNull(planKind, "planKind must not be null");
        ScenarioConstants constants = scenario.getConstants();
        int startYear = constants.getStartYear();
        int endYear = constants.getEndYear();

        Map<AccountId, Account> accounts = new LinkedHashMap<>();
        for (Account account : scenario.getAccounts()) {
            constants.person(account.getOwner());
            accounts.put(account.getId(), account);
        }
        for (IncomeStream stream : scenario.getIncomeStreams()) {
            constants.person(stream.getOwner());
        }
        List<ConversionPlan> plans = planKind == PlanKind.CONVERSION ? scenario.getConversionPlans() : List.of();
        validatePlans(plans, accounts, startYear, endYear);

        log.info("Projecting {} plan {}-{}: {} account(s), {} income stream(s), {} conversion plan(s)",
                planKind, startYear, endYear, accounts.size(), scenario.getIncomeStreams().size(), plans.size());

        AccountLedger ledger = new AccountLedger();
        accounts.values().forEach(account -> ledger.open(account.getId(), startYear - 1, account.getStartingBalance()));
        ProjectionState state = new ProjectionState(ledger, new MagiHistory(startYear, scenario.getPriorMagiByYear()));

        Map<AccountId, BigDecimal> convertedSoFar = new HashMap<>();
        List<ClampedInputWarning> warnings = new ArrayList<>();
        List<YearRecord> records = new ArrayList<>();

        for (int year = startYear; year <= endYear; year++) {
            Map<AccountId, BigDecimal> conversionOut = new HashMap<>();
            Map<AccountId, BigDecimal> transferIn = new HashMap<>();
            Map<AccountId, BigDecimal> withdrawals = new HashMap<>();

            for (ConversionPlan plan : plans) {
                AccountId source = plan.getSourceAccountId();
                BigDecimal prior = ledger.getBalance(source, year - 1);
                // Cumulative conversions may not exceed the starting balance, whatever the growth.
                BigDecimal allowance = accounts.get(source).getStartingBalance()
                        .subtract(convertedSoFar.getOrDefault(source, Money.ZERO));
                int yearIndex = plan.yearIndex(year);
                BigDecimal requested = conversionScheduler.requestedAmount(plan, yearIndex);
                BigDecimal applied = conversionScheduler.amountForYear(plan, prior.min(allowance), yearIndex);
                if (requested.compareTo(applied) > 0) {
                    log.warn("{} plan {}: conversion from {} clamped from {} to {}", planKind, year, source, requested, applied);
                    warnings.add(new ClampedInputWarning(source, year, requested, applied));
                }
                conversionOut.put(source, applied);
                convertedSoFar.merge(source, applied, BigDecimal::add);
                transferIn.merge(plan.getDestinationAccountId(), applied, BigDecimal::add);
                withdrawals.merge(plan.getDestinationAccountId(), plan.withdrawalFor(year), BigDecimal::add);
            }

            List<AccountYear> steps = new ArrayList<>();
            for (Account account : accounts.values()) {
                AccountId id = account.getId();
                AccountYear step = balanceStepper.step(account,
                        constants.person(account.getOwner()),
                        year,
                        ledger.getBalance(id, year - 1),
                        conversionOut.getOrDefault(id, Money.ZERO),
                        withdrawals.getOrDefault(id, Money.ZERO),
                        transferIn.getOrDefault(id, Money.ZERO));
                ledger.setBalance(id, year, step.getEndingBalance());
                steps.add(step);
            }

            YearRecord record = yearRecordAssembler.assemble(year, steps, scenario.getIncomeStreams(), state, constants);
            state.getMagiHistory().record(year, record.getMagi());
            records.add(record);
        }

        log.info("Finished {} plan: {} year(s), final total balance {}, {} clamped conversion(s)",
                planKind, records.size(), records.isEmpty() ? Money.ZERO : records.get(records.size() - 1).totalBalance(),
                warnings.size());
        return new ProjectionResult(planKind, records, state, warnings);
    }

    private static void validatePlans(List<ConversionPlan> plans, Map<AccountId, Account> accounts,
                                      int startYear, int endYear) {
        Set<AccountId> sources = new HashSet<>();
        for (ConversionPlan plan : plans) {
            Account source = accounts.get(plan.getSourceAccountId());
            Account destination = accounts.get(plan.getDestinationAccountId());
            if (source == null) {
                throw new IllegalArgumentException("unknown conversion source " + plan.getSourceAccountId());
            }
            if (destination == null) {
                throw new IllegalArgumentException("unknown conversion destination " + plan.getDestinationAccountId());
            }
            if (source.getType() != AccountType.PRE_TAX) {
                throw new IllegalArgumentException("conversion source " + source.getId() + " must be PRE_TAX, not " + source.getType());
            }
            if (destination.getType() != AccountType.TAX_FREE) {
                throw new IllegalArgumentException("conversion destination " + destination.getId()
                        + " must be TAX_FREE, not " + destination.getType());
            }
            // Installments outside the projected years would never be applied.
            if (plan.getStartYear() < startYear || plan.endYear() > endYear) {
                throw new IllegalArgumentException("conversion plan for " + source.getId() + " covers "
                        + plan.getStartYear() + "-" + plan.endYear() + ", outside the projection " + startYear + "-" + endYear);
            }
            if (!sources.add(source.getId())) {
                throw new IllegalArgumentException("more than one conversion plan for source " + source.getId());
            }
        }
    }
}
