package com.gillianbc.rothprojection.reference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Monthly Part B and Part D surcharges for MAGI strictly above magiThreshold.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class IrmaaBracket {

    private BigDecimal magiThreshold;
    private BigDecimal partBMonthlySurcharge;
    private BigDecimal partDMonthlySurcharge;
}
