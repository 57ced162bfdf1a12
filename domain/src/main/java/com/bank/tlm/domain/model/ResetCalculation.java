package com.bank.tlm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Calculation period the observed rate applies to.
 * Accrual and day count fraction are supplied by the caller's calculators and stored as given.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResetCalculation {
    private LocalDate periodStartDate;
    private LocalDate periodEndDate;
    private BigDecimal notional;
    private String currency;
    private BigDecimal dayCountFraction;
    private BigDecimal accrualAmount;
    private LocalDate paymentDate;
}
