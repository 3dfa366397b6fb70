package com.gillianbc.rothprojection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code projection} prefix.
 */
@Data
@ConfigurationProperties(prefix = "projection")
public class ProjectionProperties {

    /**
     * Locations of the reference-table documents, one per tax year.
     */
    private List<String> referenceTables = new ArrayList<>(List.of("classpath:reference/tax-tables-2025.json"));

    /**
     * Owners at or above this age pay Medicare premiums.
     */
    private int medicareEligibilityAge = 65;

    /**
     * Annual growth of Part B/D premiums and IRMAA surcharges after the table's tax year.
     */
    private BigDecimal medicalInflationRate = new BigDecimal("0.05");

    /**
     * Annual growth of IRMAA MAGI thresholds after the table's tax year.
     */
    private BigDecimal irmaaThresholdInflationRate = new BigDecimal("0.01");

    /**
     * Threads used to run the baseline and conversion plans side by side.
     */
    private int planParallelism = 2;
}
