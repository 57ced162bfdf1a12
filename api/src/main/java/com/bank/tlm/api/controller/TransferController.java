package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.ReasonRequest;
import com.bank.tlm.api.dto.SettlementRequest;
import com.bank.tlm.api.dto.TransferRequest;
import com.bank.tlm.api.dto.VerificationRequest;
import com.bank.tlm.application.service.TransferService;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.TransferEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for payment transfers and their settlement progress
 */
@RestController
@RequestMapping("/api")
public class TransferController {
    
    private static final Logger log = LoggerFactory.getLogger(TransferController.class);
    
    private final TransferService transferService;
    
    public TransferController(TransferService transferService) {
        this.transferService = transferService;
    }
    
    @PostMapping("/trades/{tradeId}/transfers")
    public ResponseEntity<EventRecord> recordTransfer(@PathVariable String tradeId,
                                                      @RequestBody TransferRequest request) {
        log.info("Transfer received: tradeId={}, eventId={}, type={}",
                tradeId, request.getEventId(), request.getTransferType());
        EventRecord event = transferService.recordTransfer(
                request.getEventId(),
                tradeId,
                request.getTransferType(),
                request.getPayment(),
                request.getParties(),
                request.getInitiator());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }
    
    /**
     * All transfers of a trade, or only the unsettled ones when {@code outstanding=true}
     */
    @GetMapping("/trades/{tradeId}/transfers")
    public ResponseEntity<List<TransferEventData>> getTransfers(@PathVariable String tradeId,
                                                                @RequestParam(defaultValue = "false") boolean outstanding) {
        return ResponseEntity.ok(outstanding
                ? transferService.getOutstandingTransfers(tradeId)
                : transferService.getTransfers(tradeId));
    }
    
    @GetMapping("/transfers/{eventId}")
    public ResponseEntity<TransferEventData> getTransfer(@PathVariable String eventId) {
        return ResponseEntity.ok(transferService.getTransfer(eventId));
    }
    
    @PostMapping("/transfers/{eventId}/initiation")
    public ResponseEntity<TransferEventData> initiate(@PathVariable String eventId) {
        log.info("Initiating transfer {}", eventId);
        return ResponseEntity.ok(transferService.initiateTransfer(eventId));
    }
    
    @PostMapping("/transfers/{eventId}/settlement")
    public ResponseEntity<TransferEventData> settle(@PathVariable String eventId,
                                                    @RequestBody SettlementRequest request) {
        log.info("Settling transfer {} with reference {}", eventId, request.getSettlementReference());
        return ResponseEntity.ok(transferService.settleTransfer(
                eventId, request.getSettlementDate(), request.getSettlementReference()));
    }
    
    @PostMapping("/transfers/{eventId}/failure")
    public ResponseEntity<TransferEventData> fail(@PathVariable String eventId,
                                                  @RequestBody ReasonRequest request) {
        log.info("Failing transfer {}: {}", eventId, request.getReason());
        return ResponseEntity.ok(transferService.failTransfer(eventId, request.getReason()));
    }
    
    @PostMapping("/transfers/{eventId}/cancellation")
    public ResponseEntity<TransferEventData> cancel(@PathVariable String eventId,
                                                    @RequestBody ReasonRequest request) {
        log.info("Cancelling transfer {}: {}", eventId, request.getReason());
        return ResponseEntity.ok(transferService.cancelTransfer(eventId, request.getReason()));
    }
    
    @PostMapping("/transfers/{eventId}/verification")
    public ResponseEntity<TransferEventData> verify(@PathVariable String eventId,
                                                    @RequestBody VerificationRequest request) {
        return ResponseEntity.ok(transferService.verifyTransfer(eventId, request.getVerifier()));
    }
}
