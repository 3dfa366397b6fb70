package com.gillianbc.rothprojection.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A requested conversion exceeded the source balance and was reduced to fit.
 */
@Value
public class ClampedInputWarning {

    AccountId accountId;
    int year;
    BigDecimal requested;
    BigDecimal applied;
}
