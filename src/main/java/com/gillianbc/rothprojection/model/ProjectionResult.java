package com.gillianbc.rothprojection.model;

import com.gillianbc.rothprojection.ledger.ProjectionState;
import lombok.Value;

import java.util.List;

/**
 * One plan's complete output: a year record per simulated year in increasing year order, the
 * state the run ended with, and any conversions that had to be clamped.
 */
@Value
public class ProjectionResult {

    PlanKind planKind;
    List<YearRecord> years;
    ProjectionState state;
    List<ClampedInputWarning> warnings;

    public ProjectionResult(PlanKind planKind,
                            List<YearRecord> years,
                            ProjectionState state,
                            List<ClampedInputWarning> warnings) {
        this.planKind = planKind;
        this.years = List.copyOf(years);
        this.state = state;
        this.warnings = List.copyOf(warnings);
    }

    public YearRecord yearRecord(int year) {
        if (years.isEmpty() || year < firstYear() || year > lastYear()) {
            throw new IllegalArgumentException("year " + year + " is outside the projection");
        }
        return years.get(year - firstYear());
    }

    public int firstYear() {
        return years.get(0).getYear();
    }

    public int lastYear() {
        return years.get(years.size() - 1).getYear();
    }

    public YearRecord finalYear() {
        return years.get(years.size() - 1);
    }
}
