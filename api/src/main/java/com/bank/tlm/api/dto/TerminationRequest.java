package com.bank.tlm.api.dto;

import com.bank.tlm.domain.model.TerminationDetails;
import com.bank.tlm.domain.model.TerminationPayment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminationRequest {
    private String eventId;
    private TerminationDetails details;
    private TerminationPayment payment;
    private String initiator;
}
