package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A fixed, fully taxable income source such as a pension or annuity. Paid while the owner's age
 * is within [startAge, endAge], growing by the cost-of-living adjustment from the first paying age.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IncomeStream {

    private final AccountId id;
    private final String name;
    private final Owner owner;
    private final BigDecimal annualAmount;
    private final int startAge;
    private final int endAge;
    private final BigDecimal cola;

    @Builder
    public IncomeStream(AccountId id,
                        String name,
                        Owner owner,
                        BigDecimal annualAmount,
                        int startAge,
                        Integer endAge,
                        BigDecimal cola) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name == null ? id.getValue() : name;
        this.owner = owner == null ? Owner.PRIMARY : owner;
        Objects.requireNonNull(annualAmount, "annualAmount must not be null");
        if (annualAmount.signum() < 0) {
            throw new IllegalArgumentException("annualAmount must be >= 0 for income stream " + id);
        }
        this.annualAmount = Money.round(annualAmount);
        this.startAge = startAge;
        this.endAge = endAge == null ? Integer.MAX_VALUE : endAge;
        if (this.endAge < startAge) {
            throw new IllegalArgumentException("endAge must be >= startAge for income stream " + id);
        }
        this.cola = cola == null ? BigDecimal.ZERO : cola;
    }

    /**
     * @param ownerAge the owner's age in the year being projected
     * @return income paid in that year, zero outside the paying ages
     */
    public BigDecimal amountAtAge(int ownerAge) {
        if (ownerAge < startAge || ownerAge > endAge) {
            return Money.ZERO;
        }
        return Money.round(annualAmount.multiply(Money.compoundFactor(cola, ownerAge - startAge), Money.MATH_CONTEXT));
    }
}
