package com.gillianbc.rothprojection.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.rothprojection.config.ProjectionProperties;
import com.gillianbc.rothprojection.reference.ReferenceTableLoader;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * Wires the engine by hand for unit tests, against the bundled 2025 tables and default properties.
 */
final class ProjectionFixtures {

    static final ReferenceTables TABLES = new ReferenceTableLoader(new ObjectMapper(), new DefaultResourceLoader())
            .load(new ProjectionProperties().getReferenceTables());

    private ProjectionFixtures() {
    }

    static RmdRuleEngine rmdRuleEngine() {
        return new RmdRuleEngine(TABLES);
    }

    static BalanceStepper balanceStepper() {
        return new BalanceStepper(rmdRuleEngine());
    }

    static TaxCalculator taxCalculator() {
        return new TaxCalculator(TABLES);
    }

    static SocialSecurityTaxCalculator socialSecurityTaxCalculator() {
        return new SocialSecurityTaxCalculator(TABLES);
    }

    static MedicareCalculator medicareCalculator() {
        return new MedicareCalculator(TABLES, new ProjectionProperties());
    }

    static YearRecordAssembler yearRecordAssembler() {
        return new YearRecordAssembler(taxCalculator(), socialSecurityTaxCalculator(), medicareCalculator(),
                new ProjectionProperties());
    }

    static ProjectionDriver projectionDriver() {
        return new ProjectionDriver(new ConversionScheduler(), balanceStepper(), yearRecordAssembler());
    }
}
