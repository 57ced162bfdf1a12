package com.bank.tlm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Economic terms agreed at execution
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EconomicTerms {
    private BigDecimal notional;
    private String currency;
    private LocalDate effectiveDate;
    private LocalDate maturityDate;
    private BigDecimal fixedRate;       // Optional, fixed leg rate
    private String floatingRateIndex;   // Optional, e.g. SOFR, EURIBOR-3M
}
