package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.TransferDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Amounts and value date of a payment obligation
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaymentDetails {
    private BigDecimal grossAmount;
    private BigDecimal netAmount;
    private String currency;
    private LocalDate valueDate;
    private TransferDirection direction;
    private String paymentReference; // External reference, globally unique when present
}
