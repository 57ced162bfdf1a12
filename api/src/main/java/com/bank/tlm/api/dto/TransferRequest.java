package com.bank.tlm.api.dto;

import com.bank.tlm.domain.enums.TransferType;
import com.bank.tlm.domain.model.PaymentDetails;
import com.bank.tlm.domain.model.TransferParties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {
    private String eventId;
    private TransferType transferType;
    private PaymentDetails payment;
    private TransferParties parties;
    private String initiator;
}
