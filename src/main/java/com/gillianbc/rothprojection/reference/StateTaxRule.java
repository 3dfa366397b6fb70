package com.gillianbc.rothprojection.reference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class StateTaxRule {

    private String stateCode;
    private String name;
    /** Flat rate applied to the state base. */
    private BigDecimal incomeTaxRate;
    /** Retirement income, and therefore everything this engine projects, is not taxed. */
    private boolean retirementIncomeExempt;
    private boolean socialSecurityTaxed;
}
