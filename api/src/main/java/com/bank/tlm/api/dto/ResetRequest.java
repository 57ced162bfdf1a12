package com.bank.tlm.api.dto;

import com.bank.tlm.domain.model.AveragingData;
import com.bank.tlm.domain.model.RateObservation;
import com.bank.tlm.domain.model.ResetCalculation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetRequest {
    private String eventId;
    private String payoutReference;
    private int resetNumber;
    private RateObservation observation;
    private ResetCalculation calculation;
    private AveragingData averaging;     // Optional
    private String initiator;
}
