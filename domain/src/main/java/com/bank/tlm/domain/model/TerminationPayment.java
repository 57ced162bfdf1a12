package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.PaymentCalculationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Early termination amount and who pays it
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TerminationPayment {
    private PaymentCalculationMethod method;
    private BigDecimal amount;
    private String currency;
    private String payer;
    private String receiver;
    private boolean disputed;
    private String disputingParty;
    private String disputeReason;
}
