package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.Account;
import com.gillianbc.rothprojection.model.AccountYear;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.model.Person;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Advances one account by one year. The order never varies:
 * <ol>
 *     <li>conversion out of the prior balance</li>
 *     <li>growth on what is left</li>
 *     <li>RMD on the grown balance</li>
 *     <li>planned withdrawal, limited to what remains</li>
 *     <li>negative remainder clamped to zero</li>
 *     <li>conversions received, credited at year end</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceStepper {

    private final RmdRuleEngine rmdRuleEngine;

    public AccountYear step(Account account,
                            Person owner,
                            int year,
                            BigDecimal priorBalance,
                            BigDecimal conversionOut,
                            BigDecimal plannedWithdrawal,
                            BigDecimal transferIn) {
        Objects.requireNonNull(account, "account must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(priorBalance, "priorBalance must not be null");
        Objects.requireNonNull(conversionOut, "conversionOut must not be null");
        Objects.requireNonNull(plannedWithdrawal, "plannedWithdrawal must not be null");
        Objects.requireNonNull(transferIn, "transferIn must not be null");
        if (conversionOut.signum() < 0 || plannedWithdrawal.signum() < 0 || transferIn.signum() < 0) {
            throw new IllegalArgumentException("movements must be >= 0 for account " + account.getId() + " in " + year);
        }
        if (conversionOut.compareTo(priorBalance) > 0) {
            throw new IllegalArgumentException("conversion of " + conversionOut + " exceeds balance "
                    + priorBalance + " of account " + account.getId() + " in " + year);
        }

        BigDecimal balance = priorBalance.subtract(conversionOut);

        BigDecimal grown = Money.round(balance.multiply(BigDecimal.ONE.add(account.getGrowthRate()), Money.MATH_CONTEXT));
        BigDecimal growth = grown.subtract(balance);
        balance = grown;

        BigDecimal rmd = rmdRuleEngine.requiredWithdrawal(account, owner.ageIn(year), owner.getBirthYear(), balance);
        balance = balance.subtract(rmd);

        BigDecimal withdrawal = plannedWithdrawal.min(Money.floorToZero(balance));
        balance = balance.subtract(withdrawal);

        if (balance.signum() < 0) {
            log.warn("Balance of {} in {} came to {}; clamped to zero", account.getId(), year, balance);
            balance = Money.ZERO;
        }

        balance = Money.round(balance.add(transferIn));

        log.debug("{} {}: start {} conversion {} growth {} rmd {} withdrawal {} transfer {} end {}",
                account.getId(), year, priorBalance, conversionOut, growth, rmd, withdrawal, transferIn, balance);

        return AccountYear.builder()
                .accountId(account.getId())
                .year(year)
                .startingBalance(Money.round(priorBalance))
                .conversionOut(Money.round(conversionOut))
                .growth(growth)
                .rmd(rmd)
                .withdrawal(Money.round(withdrawal))
                .transferIn(Money.round(transferIn))
                .endingBalance(balance)
                .build();
    }
}
