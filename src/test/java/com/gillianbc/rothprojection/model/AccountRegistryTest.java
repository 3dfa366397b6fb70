package com.gillianbc.rothprojection.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccountRegistryTest {

    private static Account preTax(String id) {
        return Account.builder()
                .id(AccountId.of(id))
                .type(AccountType.PRE_TAX)
                .startingBalance(new BigDecimal("1000"))
                .growthRate(new BigDecimal("0.06"))
                .build();
    }

    @Test
    @DisplayName("Real ids may not use the synthetic namespace")
    void realId_reservedPrefix_rejected() {
        assertThrows(IllegalArgumentException.class, () -> AccountId.of("synthetic:tax-free:1"));
        assertThrows(IllegalArgumentException.class, () -> AccountId.of(" "));
    }

    @Test
    @DisplayName("Synthetic tax-free accounts get fresh ids that never match real ones")
    void newTaxFreeAccount_generatesDistinctIds() {
        AccountRegistry registry = new AccountRegistry().register(preTax("tax-free:1"));
        Account first = registry.newTaxFreeAccount("Roth", Owner.PRIMARY, new BigDecimal("0.06"));
        Account second = registry.newTaxFreeAccount("Roth", Owner.PRIMARY, new BigDecimal("0.06"));

        assertTrue(first.getId().isSynthetic());
        assertEquals("synthetic:tax-free:1", first.getId().getValue());
        assertNotEquals(first.getId(), second.getId());
        assertEquals(AccountType.TAX_FREE, first.getType());
        assertEquals(new BigDecimal("0.00"), first.getStartingBalance());
        assertEquals("Roth", first.getName());
        assertEquals(3, registry.accounts().size());
    }

    @Test
    @DisplayName("Accounts and income streams share one id namespace")
    void duplicateIds_rejectedAcrossKinds() {
        AccountRegistry registry = new AccountRegistry().register(preTax("ira"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(preTax("ira")));
        IncomeStream pension = IncomeStream.builder()
                .id(AccountId.of("ira"))
                .annualAmount(new BigDecimal("12000"))
                .startAge(65)
                .build();
        assertThrows(IllegalArgumentException.class, () -> registry.register(pension));
    }

    @Test
    @DisplayName("Scenario rejects duplicate ids and prior MAGI inside the projection")
    void scenario_validatesIds() {
        ScenarioConstants constants = ScenarioConstants.builder()
                .filingStatus(FilingStatus.SINGLE)
                .stateCode("FL")
                .primary(Person.builder().birthYear(1960).build())
                .startYear(2025)
                .endYear(2030)
                .build();
        assertThrows(IllegalArgumentException.class, () -> Scenario.builder()
                .account(preTax("ira"))
                .account(preTax("ira"))
                .constants(constants)
                .build());
        assertThrows(IllegalArgumentException.class, () -> Scenario.builder()
                .account(preTax("ira"))
                .priorMagi(2025, BigDecimal.ONE)
                .constants(constants)
                .build());
    }
}
