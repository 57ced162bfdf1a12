package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.ResetRequest;
import com.bank.tlm.api.dto.VerificationRequest;
import com.bank.tlm.application.service.ResetService;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.ResetEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for floating rate resets
 */
@RestController
@RequestMapping("/api")
public class ResetController {
    
    private static final Logger log = LoggerFactory.getLogger(ResetController.class);
    
    private final ResetService resetService;
    
    public ResetController(ResetService resetService) {
        this.resetService = resetService;
    }
    
    @PostMapping("/trades/{tradeId}/resets")
    public ResponseEntity<EventRecord> recordReset(@PathVariable String tradeId,
                                                   @RequestBody ResetRequest request) {
        log.info("Reset received: tradeId={}, resetNumber={}, eventId={}",
                tradeId, request.getResetNumber(), request.getEventId());
        EventRecord event = resetService.recordReset(
                request.getEventId(),
                tradeId,
                request.getPayoutReference(),
                request.getResetNumber(),
                request.getObservation(),
                request.getCalculation(),
                request.getAveraging(),
                request.getInitiator());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }
    
    /**
     * Resets of a trade in reset number order
     */
    @GetMapping("/trades/{tradeId}/resets")
    public ResponseEntity<List<ResetEventData>> getResets(@PathVariable String tradeId) {
        return ResponseEntity.ok(resetService.getResets(tradeId));
    }
    
    @GetMapping("/trades/{tradeId}/resets/{resetNumber}")
    public ResponseEntity<ResetEventData> getReset(@PathVariable String tradeId,
                                                   @PathVariable int resetNumber) {
        return ResponseEntity.ok(resetService.getReset(tradeId, resetNumber));
    }
    
    @PostMapping("/resets/{eventId}/verification")
    public ResponseEntity<ResetEventData> verifyRate(@PathVariable String eventId,
                                                     @RequestBody VerificationRequest request) {
        log.info("Rate verification for reset event {} by {}", eventId, request.getVerifier());
        return ResponseEntity.ok(resetService.verifyRate(eventId, request.getVerifier()));
    }
}
