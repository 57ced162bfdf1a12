package com.bank.tlm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A floating rate fixing as observed from a rate source
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RateObservation {
    private LocalDate observationDate;
    private BigDecimal observedRate;
    private String rateIndex;
    private String rateSource;
}
