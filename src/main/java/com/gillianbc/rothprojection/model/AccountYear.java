package com.gillianbc.rothprojection.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One account's movement through one simulated year, in the order the stepper applies it.
 */
@Value
@Builder
public class AccountYear {

    AccountId accountId;
    int year;
    BigDecimal startingBalance;
    /** Moved out to a tax-free account before growth. */
    BigDecimal conversionOut;
    BigDecimal growth;
    BigDecimal rmd;
    /** Planned tax-free withdrawal taken after growth. */
    BigDecimal withdrawal;
    /** Conversions received, credited at year end without same-year growth. */
    BigDecimal transferIn;
    BigDecimal endingBalance;
}
