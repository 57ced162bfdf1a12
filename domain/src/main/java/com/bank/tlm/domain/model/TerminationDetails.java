package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.TerminationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TerminationDetails {
    private TerminationType terminationType;
    private LocalDate terminationDate;
    private LocalDate notificationDate;
    private String reason;
}
