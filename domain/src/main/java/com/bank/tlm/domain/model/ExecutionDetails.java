package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.ConfirmationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Where, when and at what price a trade was executed
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionDetails {
    private String executionId;
    private String venue;
    private BigDecimal price;
    private Instant executionTimestamp;
    private ConfirmationMethod confirmationMethod;
}
