package com.gillianbc.rothprojection.reference;

import com.gillianbc.rothprojection.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reference tables for every loaded tax year. A projection year uses the latest table published
 * at or before it.
 */
public class ReferenceTables {

    private final NavigableMap<Integer, TaxYearTables> byTaxYear;

    public ReferenceTables(Collection<TaxYearTables> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        NavigableMap<Integer, TaxYearTables> sorted = new TreeMap<>();
        for (TaxYearTables table : tables) {
            if (sorted.put(table.getTaxYear(), table) != null) {
                throw new ConfigurationException("reference tables for tax year " + table.getTaxYear() + " loaded twice");
            }
        }
        if (sorted.isEmpty()) {
            throw new ConfigurationException("no reference tables loaded");
        }
        this.byTaxYear = Collections.unmodifiableNavigableMap(sorted);
    }

    public TaxYearTables forYear(int year) {
        Map.Entry<Integer, TaxYearTables> entry = byTaxYear.floorEntry(year);
        if (entry == null) {
            throw new ConfigurationException("no reference tables for " + year
                    + "; earliest tax year is " + byTaxYear.firstKey());
        }
        return entry.getValue();
    }

    public int earliestTaxYear() {
        return byTaxYear.firstKey();
    }

    public int latestTaxYear() {
        return byTaxYear.lastKey();
    }
}
