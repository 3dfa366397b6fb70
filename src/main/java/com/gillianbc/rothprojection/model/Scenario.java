package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything one analysis needs: accounts, income streams, conversion plans, plan-invariant
 * constants and any MAGI already known for years before the projection starts.
 */
@Getter
@ToString
public class Scenario {

    private final List<Account> accounts;
    private final List<IncomeStream> incomeStreams;
    private final List<ConversionPlan> conversionPlans;
    private final ScenarioConstants constants;
    private final Map<Integer, BigDecimal> priorMagiByYear;

    @Builder
    public Scenario(@Singular List<Account> accounts,
                    @Singular List<IncomeStream> incomeStreams,
                    @Singular List<ConversionPlan> conversionPlans,
                    ScenarioConstants constants,
                    @Singular("priorMagi") Map<Integer, BigDecimal> priorMagiByYear) {
        this.accounts = List.copyOf(accounts);
        this.incomeStreams = List.copyOf(incomeStreams);
        this.conversionPlans = List.copyOf(conversionPlans);
        this.constants = Objects.requireNonNull(constants, "constants must not be null");
        this.priorMagiByYear = Map.copyOf(priorMagiByYear);
        validateIds();
    }

    public static Scenario of(AccountRegistry registry, List<ConversionPlan> plans, ScenarioConstants constants) {
        return Scenario.builder()
                .accounts(registry.accounts())
                .incomeStreams(registry.incomeStreams())
                .conversionPlans(plans)
                .constants(constants)
                .build();
    }

    private void validateIds() {
        Set<AccountId> seen = new HashSet<>();
        for (Account account : accounts) {
            if (!seen.add(account.getId())) {
                throw new IllegalArgumentException("duplicate account id " + account.getId());
            }
        }
        for (IncomeStream stream : incomeStreams) {
            if (!seen.add(stream.getId())) {
                throw new IllegalArgumentException("duplicate account id " + stream.getId());
            }
        }
        for (Map.Entry<Integer, BigDecimal> entry : priorMagiByYear.entrySet()) {
            if (entry.getKey() >= constants.getStartYear()) {
                throw new IllegalArgumentException("prior MAGI for " + entry.getKey()
                        + " overlaps the projection starting " + constants.getStartYear());
            }
        }
    }
}
