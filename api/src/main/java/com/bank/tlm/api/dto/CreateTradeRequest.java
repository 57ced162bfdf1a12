package com.bank.tlm.api.dto;

import com.bank.tlm.domain.enums.ProductType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTradeRequest {
    private String tradeId;
    private ProductType productType;
    private List<String> parties;
    private LocalDate effectiveDate;
    private LocalDate maturityDate;
}
