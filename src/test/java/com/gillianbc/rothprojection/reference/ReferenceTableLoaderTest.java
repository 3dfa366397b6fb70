package com.gillianbc.rothprojection.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.rothprojection.exception.ConfigurationException;
import com.gillianbc.rothprojection.model.FilingStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceTableLoaderTest {

    private static final String TABLES_2025 = "classpath:reference/tax-tables-2025.json";

    private final ReferenceTableLoader loader = new ReferenceTableLoader(new ObjectMapper(), new DefaultResourceLoader());
    private final ReferenceTables tables = loader.load(List.of(TABLES_2025));

    @Test
    @DisplayName("Later years use the latest table published on or before them")
    void forYear_usesLatestEarlierTable() {
        assertEquals(2025, tables.forYear(2025).getTaxYear());
        assertSame(tables.forYear(2025), tables.forYear(2070));
        assertThrows(ConfigurationException.class, () -> tables.forYear(2024));
    }

    @Test
    @DisplayName("Federal brackets and deductions are loaded per filing status")
    void federalTables_loaded() {
        TaxYearTables year = tables.forYear(2025);
        List<TaxBracket> single = year.bracketsFor(FilingStatus.SINGLE);
        assertEquals(7, single.size());
        assertEquals(0, new BigDecimal("11925").compareTo(single.get(0).getUpperBound()));
        assertNull(single.get(6).getUpperBound());
        assertEquals(0, new BigDecimal("30000").compareTo(year.standardDeductionFor(FilingStatus.MARRIED_FILING_JOINTLY)));
        assertEquals(0, new BigDecimal("22500").compareTo(year.standardDeductionFor(FilingStatus.HEAD_OF_HOUSEHOLD)));
    }

    @Test
    @DisplayName("RMD divisor rows, with the oldest row covering every older age")
    void rmdDivisors() {
        TaxYearTables year = tables.forYear(2025);
        assertEquals(0, new BigDecimal("26.5").compareTo(year.rmdDivisorFor(73)));
        assertEquals(0, new BigDecimal("2.0").compareTo(year.rmdDivisorFor(120)));
        assertEquals(0, new BigDecimal("2.0").compareTo(year.rmdDivisorFor(125)));
        assertThrows(ConfigurationException.class, () -> year.rmdDivisorFor(70));
    }

    @Test
    @DisplayName("State rules are found by code regardless of case; unknown states fail")
    void stateRules() {
        TaxYearTables year = tables.forYear(2025);
        StateTaxRule california = year.stateRuleFor("ca");
        assertEquals("California", california.getName());
        assertEquals(0, new BigDecimal("0.093").compareTo(california.getIncomeTaxRate()));
        assertTrue(year.stateRuleFor("PA").isRetirementIncomeExempt());
        assertFalse(year.stateRuleFor("NY").isSocialSecurityTaxed());
        assertThrows(ConfigurationException.class, () -> year.stateRuleFor("ZZ"));
    }

    @Test
    @DisplayName("IRMAA: joint and separate filers have their own tables, everyone else uses single")
    void irmaaTables() {
        TaxYearTables year = tables.forYear(2025);
        assertEquals(5, year.irmaaBracketsFor(FilingStatus.SINGLE).size());
        assertSame(year.irmaaBracketsFor(FilingStatus.SINGLE), year.irmaaBracketsFor(FilingStatus.HEAD_OF_HOUSEHOLD));
        assertSame(year.irmaaBracketsFor(FilingStatus.SINGLE), year.irmaaBracketsFor(FilingStatus.QUALIFYING_SURVIVING_SPOUSE));
        assertEquals(0, new BigDecimal("212000").compareTo(
                year.irmaaBracketsFor(FilingStatus.MARRIED_FILING_JOINTLY).get(0).getMagiThreshold()));
        assertEquals(2, year.irmaaBracketsFor(FilingStatus.MARRIED_FILING_SEPARATELY).size());
        assertEquals(0, new BigDecimal("185.00").compareTo(year.medicareBaseRates().getPartBMonthly()));
    }

    @Test
    @DisplayName("Loaded tables cannot be changed through what the lookups return")
    void tables_areUnmodifiable() {
        TaxYearTables year = tables.forYear(2025);
        List<TaxBracket> single = year.bracketsFor(FilingStatus.SINGLE);
        assertThrows(UnsupportedOperationException.class, () -> single.remove(0));
        assertThrows(UnsupportedOperationException.class,
                () -> year.irmaaBracketsFor(FilingStatus.SINGLE).clear());
        assertEquals(7, year.bracketsFor(FilingStatus.SINGLE).size());
    }

    @Test
    @DisplayName("Tables copy their inputs, so later changes to the source maps are not seen")
    void tables_copyTheirInputs() {
        Map<FilingStatus, BigDecimal> deductions = new HashMap<>();
        deductions.put(FilingStatus.SINGLE, new BigDecimal("15000"));
        TaxYearTables year = new TaxYearTables(2025, null, deductions, null, null, null, null, null);

        deductions.put(FilingStatus.SINGLE, new BigDecimal("99999"));
        deductions.put(FilingStatus.HEAD_OF_HOUSEHOLD, new BigDecimal("22500"));

        assertEquals(new BigDecimal("15000"), year.standardDeductionFor(FilingStatus.SINGLE));
        assertThrows(ConfigurationException.class, () -> year.standardDeductionFor(FilingStatus.HEAD_OF_HOUSEHOLD));
        assertThrows(ConfigurationException.class, () -> year.bracketsFor(FilingStatus.SINGLE));
        assertThrows(ConfigurationException.class, () -> year.rmdDivisorFor(73));
    }

    @Test
    @DisplayName("Missing documents and repeated tax years are configuration errors")
    void badLocations_throw() {
        assertThrows(ConfigurationException.class, () -> loader.load(List.of("classpath:reference/missing.json")));
        assertThrows(ConfigurationException.class, () -> loader.load(List.of(TABLES_2025, TABLES_2025)));
        assertThrows(ConfigurationException.class, () -> loader.load(List.of()));
    }
}
