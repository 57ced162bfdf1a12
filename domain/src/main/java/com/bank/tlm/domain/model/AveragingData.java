package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.AveragingMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw observations behind an averaged or compounded reset rate
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AveragingData {
    private AveragingMethod method;
    private List<BigDecimal> observations;
    private List<BigDecimal> weights;       // Only for WEIGHTED
    private int compoundingPeriods;
    private BigDecimal finalRate;
}
