package com.bank.tlm.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-text reason used when failing an event or failing/cancelling a transfer
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasonRequest {
    private String reason;
}
