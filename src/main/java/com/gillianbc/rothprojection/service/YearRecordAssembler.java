package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.config.ProjectionProperties;
import com.gillianbc.rothprojection.ledger.AccountLedger;
import com.gillianbc.rothprojection.ledger.ProjectionState;
import com.gillianbc.rothprojection.model.AccountId;
import com.gillianbc.rothprojection.model.AccountYear;
import com.gillianbc.rothprojection.model.IncomeStream;
import com.gillianbc.rothprojection.model.MagiLookback;
import com.gillianbc.rothprojection.model.MedicareResult;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.model.Person;
import com.gillianbc.rothprojection.model.ScenarioConstants;
import com.gillianbc.rothprojection.model.TaxResult;
import com.gillianbc.rothprojection.model.YearRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a plan's record for one year from that year's account steps, the ledger and the MAGI
 * history. Every field is computed here; only Social Security and wages come from the
 * plan-invariant scenario constants.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YearRecordAssembler {

    private final TaxCalculator taxCalculator;
    private final SocialSecurityTaxCalculator socialSecurityTaxCalculator;
    private final MedicareCalculator medicareCalculator;
    private final ProjectionProperties properties;

    /**
     * @param year          the year being assembled; its balances must already be in the ledger
     * @param accountYears  every account's step for the year
     * @param incomeStreams fixed income streams of the scenario
     * @param state         the plan's ledger and MAGI history, with MAGI recorded up to the prior year
     * @param constants     plan-invariant scenario inputs
     */
    public YearRecord assemble(int year,
                               List<AccountYear> accountYears,
                               List<IncomeStream> incomeStreams,
                               ProjectionState state,
                               ScenarioConstants constants) {
        Objects.requireNonNull(accountYears, "accountYears must not be null");
        Objects.requireNonNull(incomeStreams, "incomeStreams must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(constants, "constants must not be null");

        AccountLedger ledger = state.getLedger();
        Map<AccountId, BigDecimal> balances = new LinkedHashMap<>();
        Map<AccountId, BigDecimal> rmds = new LinkedHashMap<>();
        Map<AccountId, BigDecimal> conversions = new LinkedHashMap<>();
        Map<AccountId, BigDecimal> withdrawals = new LinkedHashMap<>();
        Map<AccountId, BigDecimal> contributions = new LinkedHashMap<>();
        BigDecimal totalConversion = Money.ZERO;

        for (AccountYear step : accountYears) {
            if (step.getYear() != year) {
                throw new IllegalArgumentException("step for " + step.getAccountId() + " is for "
                        + step.getYear() + ", not " + year);
            }
            AccountId id = step.getAccountId();
            balances.put(id, ledger.getBalance(id, year));
            rmds.put(id, step.getRmd());
            conversions.put(id, step.getConversionOut());
            withdrawals.put(id, step.getWithdrawal());
            contributions.put(id, step.getRmd());
            totalConversion = totalConversion.add(step.getConversionOut());
        }
        for (IncomeStream stream : incomeStreams) {
            Person owner = constants.person(stream.getOwner());
            contributions.put(stream.getId(), stream.amountAtAge(owner.ageIn(year)));
        }

        BigDecimal wages = constants.wagesIn(year);
        BigDecimal grossIncome = contributions.values().stream().reduce(wages, BigDecimal::add);
        BigDecimal socialSecurity = constants.socialSecurityIn(year);
        BigDecimal taxableSocialSecurity = socialSecurityTaxCalculator.taxableAmount(
                socialSecurity, grossIncome, constants.getFilingStatus(), year);
        BigDecimal agi = grossIncome.add(taxableSocialSecurity).add(totalConversion);

        TaxResult tax = taxCalculator.compute(grossIncome, taxableSocialSecurity, totalConversion,
                constants.getFilingStatus(), constants.getStateCode(), year);

        MagiLookback lookback = state.getMagiHistory().lookbackFor(year);
        int enrollees = enrollees(constants, year);
        MedicareResult medicare = medicareCalculator.compute(lookback, year, constants.getFilingStatus(), enrollees);

        BigDecimal taxFreeWithdrawal = withdrawals.values().stream().reduce(Money.ZERO, BigDecimal::add);
        BigDecimal afterFederal = grossIncome.add(socialSecurity).subtract(tax.getTotalTax());
        BigDecimal afterState = afterFederal.subtract(tax.getStateTax());
        BigDecimal netIncome = afterState.subtract(medicare.getTotalMedicare()).add(taxFreeWithdrawal);

        log.debug("{}: gross {} ss {} (taxable {}) conversion {} agi {} federal {} state {} medicare {} net {}",
                year, grossIncome, socialSecurity, taxableSocialSecurity, totalConversion, agi,
                tax.getTotalTax(), tax.getStateTax(), medicare.getTotalMedicare(), netIncome);

        return YearRecord.builder()
                .year(year)
                .primaryAge(constants.getPrimary().ageIn(year))
                .spouseAge(constants.spouse().map(spouse -> spouse.ageIn(year)).orElse(null))
                .balances(Collections.unmodifiableMap(balances))
                .rmds(Collections.unmodifiableMap(rmds))
                .conversions(Collections.unmodifiableMap(conversions))
                .taxFreeWithdrawals(Collections.unmodifiableMap(withdrawals))
                .incomeContributions(Collections.unmodifiableMap(contributions))
                .totalConversion(totalConversion)
                .wages(wages)
                .socialSecurityIncome(socialSecurity)
                .taxableSocialSecurity(taxableSocialSecurity)
                .grossIncome(grossIncome)
                .agi(agi)
                .magi(agi)
                .tax(tax)
                .medicare(medicare)
                .incomeAfterFederalTax(afterFederal)
                .incomeAfterStateTax(afterState)
                .netIncome(netIncome)
                .build();
    }

    private int enrollees(ScenarioConstants constants, int year) {
        int eligibilityAge = properties.getMedicareEligibilityAge();
        int count = constants.getPrimary().ageIn(year) >= eligibilityAge ? 1 : 0;
        if (constants.spouse().map(spouse -> spouse.ageIn(year) >= eligibilityAge).orElse(false)) {
            count++;
        }
        return count;
    }
}
