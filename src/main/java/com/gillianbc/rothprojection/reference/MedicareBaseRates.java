package com.gillianbc.rothprojection.reference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/** Standard monthly premiums per enrollee. */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class MedicareBaseRates {

    private BigDecimal partBMonthly;
    private BigDecimal partDMonthly;
}
