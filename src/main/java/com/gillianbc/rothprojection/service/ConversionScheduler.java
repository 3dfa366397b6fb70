package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.ConversionPlan;
import com.gillianbc.rothprojection.model.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Splits a conversion plan into yearly installments.
 */
@Service
public class ConversionScheduler {

    /**
     * Installment requested for the plan year, before any clamp. Every installment is
     * total / duration rounded down to the cent; the final one takes whatever remains so the
     * installments add up to the total exactly.
     */
    public BigDecimal requestedAmount(ConversionPlan plan, int yearIndex) {
        Objects.requireNonNull(plan, "plan must not be null");
        int duration = plan.getDurationYears();
        if (yearIndex < 0 || yearIndex >= duration) {
            return Money.ZERO;
        }
        BigDecimal installment = plan.getTotalAmount()
                .divide(BigDecimal.valueOf(duration), Money.SCALE, RoundingMode.DOWN);
        if (yearIndex == duration - 1) {
            return plan.getTotalAmount().subtract(installment.multiply(BigDecimal.valueOf(duration - 1L)));
        }
        return installment;
    }

    /**
     * @param plan           the conversion plan
     * @param accountBalance what the source account can give up this year
     * @param yearIndex      years since the plan's first conversion year
     * @return the installment clamped to the available balance; zero outside the plan's years
     */
    public BigDecimal amountForYear(ConversionPlan plan, BigDecimal accountBalance, int yearIndex) {
        Objects.requireNonNull(accountBalance, "accountBalance must not be null");
        BigDecimal available = Money.floorToZero(accountBalance);
        return requestedAmount(plan, yearIndex).min(available);
    }
}
