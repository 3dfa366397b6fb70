package com.gillianbc.rothprojection.reference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Provisional-income thresholds: up to 50% of benefits is taxable above base, up to 85% above additional.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class SocialSecurityThresholds {

    private BigDecimal base;
    private BigDecimal additional;
}
