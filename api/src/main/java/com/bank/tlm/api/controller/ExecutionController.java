package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.ExecutionRequest;
import com.bank.tlm.application.service.ExecutionService;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.ExecutionEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/trades/{tradeId}/execution")
public class ExecutionController {
    
    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);
    
    private final ExecutionService executionService;
    
    public ExecutionController(ExecutionService executionService) {
        this.executionService = executionService;
    }
    
    @PostMapping
    public ResponseEntity<EventRecord> executeTrade(@PathVariable String tradeId,
                                                    @RequestBody ExecutionRequest request) {
        log.info("Execution received: tradeId={}, eventId={}", tradeId, request.getEventId());
        EventRecord event = executionService.executeTrade(
                request.getEventId(),
                tradeId,
                request.getExecutionDetails(),
                request.getEconomicTerms(),
                request.getBuyer(),
                request.getSeller(),
                request.getBroker(),
                request.getTradeDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }
    
    @GetMapping
    public ResponseEntity<ExecutionEventData> getExecution(@PathVariable String tradeId) {
        return ResponseEntity.ok(executionService.getExecution(tradeId));
    }
}
