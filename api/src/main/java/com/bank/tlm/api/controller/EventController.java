package com.bank.tlm.api.controller;

import com.bank.tlm.api.dto.ReasonRequest;
import com.bank.tlm.application.service.EventLedgerService;
import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read access to the event ledger, plus marking a pending event failed
 */
@RestController
@RequestMapping("/api/events")
public class EventController {
    
    private static final Logger log = LoggerFactory.getLogger(EventController.class);
    
    private final EventLedgerService eventLedgerService;
    
    public EventController(EventLedgerService eventLedgerService) {
        this.eventLedgerService = eventLedgerService;
    }
    
    @GetMapping("/{eventId}")
    public ResponseEntity<EventRecord> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(eventLedgerService.getEvent(eventId));
    }
    
    @GetMapping
    public ResponseEntity<List<EventRecord>> getEventsForTrade(@RequestParam String tradeId,
                                                               @RequestParam(required = false) EventType type) {
        List<EventRecord> events = type != null
                ? eventLedgerService.getEventsForTrade(tradeId, type)
                : eventLedgerService.getEventsForTrade(tradeId);
        log.debug("Found {} events for trade {}", events.size(), tradeId);
        return ResponseEntity.ok(events);
    }
    
    @PostMapping("/{eventId}/failure")
    public ResponseEntity<EventRecord> markFailed(@PathVariable String eventId,
                                                  @RequestBody ReasonRequest request) {
        log.info("Marking event {} failed", eventId);
        return ResponseEntity.ok(eventLedgerService.markFailed(eventId, request.getReason()));
    }
}
