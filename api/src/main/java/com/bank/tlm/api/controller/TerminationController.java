package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.DisputeRequest;
import com.bank.tlm.api.dto.SettlementTransferLinkRequest;
import com.bank.tlm.api.dto.TerminationRequest;
import com.bank.tlm.application.service.TerminationService;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.TerminationEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for early termination
 */
@RestController
@RequestMapping("/api")
public class TerminationController {
    
    private static final Logger log = LoggerFactory.getLogger(TerminationController.class);
    
    private final TerminationService terminationService;
    
    public TerminationController(TerminationService terminationService) {
        this.terminationService = terminationService;
    }
    
    @PostMapping("/trades/{tradeId}/termination")
    public ResponseEntity<EventRecord> terminateTrade(@PathVariable String tradeId,
                                                      @RequestBody TerminationRequest request) {
        log.info("Termination received: tradeId={}, eventId={}, initiator={}",
                tradeId, request.getEventId(), request.getInitiator());
        EventRecord event = terminationService.terminateTrade(
                request.getEventId(),
                tradeId,
                request.getDetails(),
                request.getPayment(),
                request.getInitiator());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }
    
    @GetMapping("/trades/{tradeId}/termination")
    public ResponseEntity<TerminationEventData> getTermination(@PathVariable String tradeId) {
        return ResponseEntity.ok(terminationService.getTermination(tradeId));
    }
    
    @PostMapping("/terminations/{eventId}/confirmation")
    public ResponseEntity<TerminationEventData> confirm(@PathVariable String eventId) {
        log.info("Confirming termination {}", eventId);
        return ResponseEntity.ok(terminationService.confirmTermination(eventId));
    }
    
    @PostMapping("/terminations/{eventId}/dispute")
    public ResponseEntity<TerminationEventData> dispute(@PathVariable String eventId,
                                                        @RequestBody DisputeRequest request) {
        log.info("Termination {} disputed by {}", eventId, request.getDisputingParty());
        return ResponseEntity.ok(terminationService.disputeTermination(
                eventId, request.getDisputingParty(), request.getReason()));
    }
    
    /**
     * Links the settling transfer; moving the trade to SETTLED is a separate transition call
     */
    @PostMapping("/terminations/{eventId}/settlement-transfer")
    public ResponseEntity<TerminationEventData> linkSettlementTransfer(@PathVariable String eventId,
                                                                       @RequestBody SettlementTransferLinkRequest request) {
        log.info("Linking transfer {} to termination {}", request.getTransferEventId(), eventId);
        return ResponseEntity.ok(terminationService.linkSettlementTransfer(eventId, request.getTransferEventId()));
    }
}
