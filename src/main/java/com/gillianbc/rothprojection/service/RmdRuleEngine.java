package com.gillianbc.rothprojection.service;

import com.gillianbc.rothprojection.model.Account;
import com.gillianbc.rothprojection.model.Money;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Required minimum distributions from pre-tax accounts under the Uniform Lifetime table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RmdRuleEngine {

    private final ReferenceTables referenceTables;

    /**
     * RMD start age by birth year: 72 up to 1950, 73 for 1951 to 1959, 75 from 1960.
     */
    public int startAge(int birthYear) {
        if (birthYear <= 1950) {
            return 72;
        }
        if (birthYear <= 1959) {
            return 73;
        }
        return 75;
    }

    /**
     * @param account        the account being stepped
     * @param ownerAge       the owner's age in the distribution year
     * @param ownerBirthYear the owner's birth year, which fixes the start age
     * @param balance        the balance the distribution is taken from
     * @return the withdrawal required this year, never more than the balance
     */
    public BigDecimal requiredWithdrawal(Account account, int ownerAge, int ownerBirthYear, BigDecimal balance) {
        Objects.requireNonNull(account, "account must not be null");
        Objects.requireNonNull(balance, "balance must not be null");
        if (!account.isRmdEligible() || balance.signum() <= 0 || ownerAge < startAge(ownerBirthYear)) {
            return Money.ZERO;
        }
        int year = ownerBirthYear + ownerAge;
        BigDecimal divisor = referenceTables.forYear(year).rmdDivisorFor(ownerAge);
        BigDecimal rmd = balance.divide(divisor, Money.SCALE, RoundingMode.HALF_UP).min(balance);
        log.debug("RMD for {} in {} at age {}: {} / {} = {}", account.getId(), year, ownerAge, balance, divisor, rmd);
        return rmd;
    }
}
