package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * An account owner: birth year plus their Social Security benefit.
 */
@Getter
@ToString
public class Person {

    private final int birthYear;
    /** Annual benefit in the first year it is paid. */
    private final BigDecimal socialSecurityBenefit;
    private final int socialSecurityStartAge;

    @Builder
    public Person(int birthYear, BigDecimal socialSecurityBenefit, Integer socialSecurityStartAge) {
        if (birthYear < 1900) {
            throw new IllegalArgumentException("birthYear must be >= 1900");
        }
        this.birthYear = birthYear;
        BigDecimal benefit = socialSecurityBenefit == null ? BigDecimal.ZERO : socialSecurityBenefit;
        if (benefit.signum() < 0) {
            throw new IllegalArgumentException("socialSecurityBenefit must be >= 0");
        }
        this.socialSecurityBenefit = Money.round(benefit);
        this.socialSecurityStartAge = socialSecurityStartAge == null ? 67 : socialSecurityStartAge;
    }

    public int ageIn(int year) {
        return year - birthYear;
    }

    /**
     * Benefit paid in the given year, grown by the cost-of-living adjustment from the start age.
     */
    public BigDecimal socialSecurityIn(int year, BigDecimal cola) {
        int age = ageIn(year);
        if (age < socialSecurityStartAge || socialSecurityBenefit.signum() == 0) {
            return Money.ZERO;
        }
        return Money.round(socialSecurityBenefit.multiply(
                Money.compoundFactor(cola, age - socialSecurityStartAge), Money.MATH_CONTEXT));
    }
}
