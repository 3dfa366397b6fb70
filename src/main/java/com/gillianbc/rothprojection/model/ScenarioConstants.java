package com.gillianbc.rothprojection.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Plan-invariant scenario inputs shared by the baseline and conversion runs.
 */
@Getter
@ToString
public class ScenarioConstants {

    private final FilingStatus filingStatus;
    /** Two-letter state of residence code. */
    private final String stateCode;
    private final Person primary;
    @Getter(AccessLevel.NONE)
    private final Person spouse;
    private final int startYear;
    private final int endYear;
    /** Wages stop from this year onwards. */
    private final int retirementYear;
    private final BigDecimal preRetirementIncome;
    private final BigDecimal socialSecurityCola;

    @Builder
    public ScenarioConstants(FilingStatus filingStatus,
                             String stateCode,
                             Person primary,
                             Person spouse,
                             int startYear,
                             int endYear,
                             Integer retirementYear,
                             BigDecimal preRetirementIncome,
                             BigDecimal socialSecurityCola) {
        this.filingStatus = Objects.requireNonNull(filingStatus, "filingStatus must not be null");
        this.stateCode = Objects.requireNonNull(stateCode, "stateCode must not be null");
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.spouse = spouse;
        if (endYear < startYear) {
            throw new IllegalArgumentException("endYear must be >= startYear");
        }
        this.startYear = startYear;
        this.endYear = endYear;
        this.retirementYear = retirementYear == null ? startYear : retirementYear;
        BigDecimal wages = preRetirementIncome == null ? BigDecimal.ZERO : preRetirementIncome;
        if (wages.signum() < 0) {
            throw new IllegalArgumentException("preRetirementIncome must be >= 0");
        }
        this.preRetirementIncome = Money.round(wages);
        this.socialSecurityCola = socialSecurityCola == null ? BigDecimal.ZERO : socialSecurityCola;
    }

    public Optional<Person> spouse() {
        return Optional.ofNullable(spouse);
    }

    public Person person(Owner owner) {
        if (owner == Owner.SPOUSE) {
            if (spouse == null) {
                throw new IllegalArgumentException("scenario has no spouse but an item is owned by SPOUSE");
            }
            return spouse;
        }
        return primary;
    }

    public BigDecimal wagesIn(int year) {
        return year < retirementYear ? preRetirementIncome : Money.ZERO;
    }

    /**
     * Social Security received in the year by both owners. Identical across plans.
     */
    public BigDecimal socialSecurityIn(int year) {
        BigDecimal total = primary.socialSecurityIn(year, socialSecurityCola);
        if (spouse != null) {
            total = total.add(spouse.socialSecurityIn(year, socialSecurityCola));
        }
        return total;
    }
}
