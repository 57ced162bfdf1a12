package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.CreateTradeRequest;
import com.bank.tlm.api.dto.TradeStatusResponse;
import com.bank.tlm.api.dto.TransitionRequest;
import com.bank.tlm.application.service.AuditTrailService;
import com.bank.tlm.application.service.TradeStateService;
import com.bank.tlm.domain.model.StateTransition;
import com.bank.tlm.domain.model.TradeAuditTrail;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for trade state: creation, snapshots, transitions and audit trail
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {
    
    private static final Logger log = LoggerFactory.getLogger(TradeController.class);
    
    private final TradeStateService tradeStateService;
    private final AuditTrailService auditTrailService;
    private final Clock clock;
    
    public TradeController(TradeStateService tradeStateService,
                          AuditTrailService auditTrailService,
                          Clock clock) {
        this.tradeStateService = tradeStateService;
        this.auditTrailService = auditTrailService;
        this.clock = clock;
    }
    
    @PostMapping
    public ResponseEntity<TradeStateSnapshot> createTrade(@RequestBody CreateTradeRequest request) {
        log.info("Creating trade: tradeId={}, productType={}", request.getTradeId(), request.getProductType());
        TradeStateSnapshot snapshot = tradeStateService.createTrade(
                request.getTradeId(),
                request.getProductType(),
                request.getParties(),
                request.getEffectiveDate(),
                request.getMaturityDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
    }
    
    @GetMapping("/{tradeId}")
    public ResponseEntity<TradeStateSnapshot> getCurrentState(@PathVariable String tradeId) {
        return ResponseEntity.ok(tradeStateService.getCurrentState(tradeId));
    }
    
    /**
     * Snapshot chain, oldest first
     */
    @GetMapping("/{tradeId}/snapshots")
    public ResponseEntity<List<TradeStateSnapshot>> getSnapshots(@PathVariable String tradeId) {
        return ResponseEntity.ok(tradeStateService.getSnapshotHistory(tradeId));
    }
    
    @GetMapping("/{tradeId}/transitions")
    public ResponseEntity<List<StateTransition>> getTransitions(@PathVariable String tradeId) {
        return ResponseEntity.ok(tradeStateService.getTransitionHistory(tradeId));
    }
    
    @PostMapping("/{tradeId}/transitions")
    public ResponseEntity<TradeStateSnapshot> transition(@PathVariable String tradeId,
                                                         @RequestBody TransitionRequest request) {
        log.info("Transition requested: tradeId={}, target={}, initiator={}",
                tradeId, request.getTargetState(), request.getInitiator());
        return ResponseEntity.ok(tradeStateService.transitionState(
                tradeId, request.getTargetState(), request.getCausingEventId(), request.getInitiator()));
    }
    
    @GetMapping("/{tradeId}/status")
    public ResponseEntity<TradeStatusResponse> getStatus(
            @PathVariable String tradeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate today = asOf != null ? asOf : LocalDate.now(clock);
        TradeStateSnapshot current = tradeStateService.getCurrentState(tradeId);
        return ResponseEntity.ok(TradeStatusResponse.builder()
                .tradeId(tradeId)
                .state(current.getState())
                .asOf(today)
                .active(tradeStateService.isActive(tradeId))
                .terminated(tradeStateService.isTerminated(tradeId))
                .settled(tradeStateService.isSettled(tradeId))
                .effective(tradeStateService.isEffective(tradeId, today))
                .maturityReached(tradeStateService.hasReachedMaturity(tradeId, today))
                .daysToMaturity(tradeStateService.getDaysToMaturity(tradeId, today))
                .ageSeconds(tradeStateService.getTradeAge(tradeId, clock.instant()).getSeconds())
                .snapshotChainValid(tradeStateService.verifySnapshotChain(tradeId))
                .build());
    }
    
    @GetMapping("/{tradeId}/audit")
    public ResponseEntity<TradeAuditTrail> getAuditTrail(@PathVariable String tradeId) {
        return ResponseEntity.ok(auditTrailService.getAuditTrail(tradeId));
    }
}
