package com.bank.tlm.api.dto;

import com.bank.tlm.domain.model.EconomicTerms;
import com.bank.tlm.domain.model.ExecutionDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequest {
    private String eventId;
    private ExecutionDetails executionDetails;
    private EconomicTerms economicTerms;
    private String buyer;
    private String seller;
    private String broker;
    private LocalDate tradeDate;
}
