package com.gillianbc.rothprojection.reference;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gillianbc.rothprojection.exception.ConfigurationException;
import com.gillianbc.rothprojection.model.FilingStatus;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Every reference table published for one tax year. Lookups that find nothing raise
 * {@link ConfigurationException}; nothing is defaulted.
 * <p>
 * The tables are copied on construction and never change afterwards, so one instance is shared by
 * every plan run.
 */
public class TaxYearTables {

    @Getter
    private final int taxYear;
    private final Map<FilingStatus, List<TaxBracket>> federalBrackets;
    private final Map<FilingStatus, BigDecimal> standardDeductions;
    private final Map<FilingStatus, SocialSecurityThresholds> socialSecurityThresholds;
    private final Map<String, StateTaxRule> stateRules;
    private final NavigableMap<Integer, BigDecimal> rmdDivisors;
    private final Map<FilingStatus, List<IrmaaBracket>> irmaaBrackets;
    private final MedicareBaseRates medicareBaseRates;

    @JsonCreator
    public TaxYearTables(@JsonProperty("taxYear") int taxYear,
                         @JsonProperty("federalBrackets") Map<FilingStatus, List<TaxBracket>> federalBrackets,
                         @JsonProperty("standardDeductions") Map<FilingStatus, BigDecimal> standardDeductions,
                         @JsonProperty("socialSecurityThresholds") Map<FilingStatus, SocialSecurityThresholds> socialSecurityThresholds,
                         @JsonProperty("stateRules") Map<String, StateTaxRule> stateRules,
                         @JsonProperty("rmdDivisors") Map<Integer, BigDecimal> rmdDivisors,
                         @JsonProperty("irmaaBrackets") Map<FilingStatus, List<IrmaaBracket>> irmaaBrackets,
                         @JsonProperty("medicareBaseRates") MedicareBaseRates medicareBaseRates) {
        this.taxYear = taxYear;
        this.federalBrackets = copyOfLists(federalBrackets);
        this.standardDeductions = copyOf(standardDeductions);
        this.socialSecurityThresholds = copyOf(socialSecurityThresholds);
        this.stateRules = copyOf(stateRules);
        this.rmdDivisors = rmdDivisors == null
                ? Collections.emptyNavigableMap()
                : Collections.unmodifiableNavigableMap(new TreeMap<>(rmdDivisors));
        this.irmaaBrackets = copyOfLists(irmaaBrackets);
        this.medicareBaseRates = medicareBaseRates;
    }

    public List<TaxBracket> bracketsFor(FilingStatus filingStatus) {
        return required(federalBrackets, filingStatus, "federal brackets");
    }

    public BigDecimal standardDeductionFor(FilingStatus filingStatus) {
        return required(standardDeductions, filingStatus, "standard deduction");
    }

    public SocialSecurityThresholds socialSecurityThresholdsFor(FilingStatus filingStatus) {
        return required(socialSecurityThresholds, filingStatus, "Social Security thresholds");
    }

    public StateTaxRule stateRuleFor(String stateCode) {
        return required(stateRules, stateCode.toUpperCase(), "state tax rule");
    }

    /**
     * IRMAA brackets in ascending threshold order, from the table the filing status uses.
     */
    public List<IrmaaBracket> irmaaBracketsFor(FilingStatus filingStatus) {
        return required(irmaaBrackets, filingStatus.irmaaTable(), "IRMAA brackets");
    }

    public MedicareBaseRates medicareBaseRates() {
        if (medicareBaseRates == null) {
            throw new ConfigurationException("no Medicare base rates for tax year " + taxYear);
        }
        return medicareBaseRates;
    }

    /**
     * Uniform Lifetime divisor for the age. The oldest row covers every older age.
     */
    public BigDecimal rmdDivisorFor(int age) {
        if (rmdDivisors.isEmpty()) {
            throw new ConfigurationException("no RMD divisors for tax year " + taxYear);
        }
        BigDecimal divisor = rmdDivisors.get(age);
        if (divisor != null) {
            return divisor;
        }
        if (age > rmdDivisors.lastKey()) {
            return rmdDivisors.lastEntry().getValue();
        }
        throw new ConfigurationException("no RMD divisor for age " + age + " in tax year " + taxYear);
    }

    private <K, V> V required(Map<K, V> table, K key, String what) {
        V value = table.get(key);
        if (value == null) {
            throw new ConfigurationException("no " + what + " for " + key + " in tax year " + taxYear);
        }
        return value;
    }

    private static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        return source == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static <K, V> Map<K, List<V>> copyOfLists(Map<K, List<V>> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        Map<K, List<V>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, values == null ? null : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
