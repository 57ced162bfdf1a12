package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.AveragingMethod;
import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.AveragingData;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.RateObservation;
import com.bank.tlm.domain.model.ResetCalculation;
import com.bank.tlm.domain.model.ResetEventData;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.store.ResetEventStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.bank.tlm.application.service.LedgerPreconditions.isPositive;
import static com.bank.tlm.application.service.LedgerPreconditions.requirePresent;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Records floating rate observations per calculation period.
 *
 * Reset numbers are supplied by the caller (they follow the trade's external period numbering)
 * and are unique per trade. Recording a reset never moves the trade.
 */
@Service
public class ResetService extends AbstractEventRecorder {

    private final ResetEventStore resetEventStore;

    public ResetService(ResetEventStore resetEventStore,
                        TradeStateService tradeStateService,
                        EventLedgerService eventLedgerService,
                        TradeWriteScope writeScope,
                        MetricsService metricsService,
                        LifecycleNotificationService notificationService,
                        Clock clock) {
        super(tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
        this.resetEventStore = resetEventStore;
    }

    public EventRecord recordReset(String eventId,
                                   String tradeId,
                                   String payoutReference,
                                   int resetNumber,
                                   RateObservation observation,
                                   ResetCalculation calculation,
                                   String initiator) {
        return recordReset(eventId, tradeId, payoutReference, resetNumber, observation, calculation, null, initiator);
    }

    /**
     * Record a reset whose rate was averaged or compounded from several observations
     *
     * @param averaging optional; when present its final rate must equal the observed rate
     */
    public EventRecord recordReset(String eventId,
                                   String tradeId,
                                   String payoutReference,
                                   int resetNumber,
                                   RateObservation observation,
                                   ResetCalculation calculation,
                                   AveragingData averaging,
                                   String initiator) {
        if (resetNumber <= 0) {
            metricsService.recordEventRejected("recordReset", ErrorCode.INVALID_RESET_NUMBER);
            log.warn("recordReset rejected for trade {}: reset number {}", tradeId, resetNumber);
            throw TradeLifecycleException.of(ErrorCode.INVALID_RESET_NUMBER,
                    "Reset number must be positive, was %d", resetNumber);
        }
        requireText(eventId, "eventId");
        requireText(tradeId, "tradeId");
        requireText(initiator, "initiator");
        requirePresent(observation, "observation");
        requirePresent(calculation, "calculation");

        return recordEvent("recordReset", tradeId, () -> {
            TradeStateSnapshot current = tradeStateService.lockCurrent(tradeId);
            if (resetEventStore.existsByTradeIdAndResetNumber(tradeId, resetNumber)) {
                throw TradeLifecycleException.of(ErrorCode.RESET_ALREADY_EXISTS,
                        "Reset %d already recorded for trade %s", resetNumber, tradeId);
            }
            if (eventLedgerService.eventExists(eventId)) {
                throw TradeLifecycleException.of(ErrorCode.DUPLICATE_EVENT_ID, "Event %s already recorded", eventId);
            }
            if (current.getState() != TradeState.ACTIVE) {
                throw TradeLifecycleException.of(ErrorCode.TRADE_NOT_ACTIVE,
                        "Trade %s must be ACTIVE to record a reset, is %s", tradeId, current.getState());
            }
            validateObservation(observation);
            validateCalculation(calculation);
            if (averaging != null) {
                validateAveraging(averaging, observation);
            }

            String previousResetEventId = resetEventStore.findByTradeIdAndResetNumber(tradeId, resetNumber - 1)
                    .map(ResetEventData::getEventId)
                    .orElse(null);
            resetEventStore.save(ResetEventData.builder()
                    .eventId(eventId)
                    .tradeId(tradeId)
                    .payoutReference(payoutReference)
                    .resetNumber(resetNumber)
                    .observation(observation)
                    .calculation(calculation)
                    .averaging(averaging)
                    .previousResetEventId(previousResetEventId)
                    .recordedAt(clock.instant())
                    .build());

            eventLedgerService.append(EventRecord.builder()
                    .eventId(eventId)
                    .eventType(EventType.RESET)
                    .effectiveDate(observation.getObservationDate())
                    .tradeId(tradeId)
                    .involvedParties(current.getParties())
                    .initiator(initiator)
                    .beforeStateId(current.getSnapshotId())
                    .message(String.format("Reset %d: %s observed at %s", resetNumber,
                            observation.getRateIndex(), observation.getObservedRate()))
                    .build());
            return eventLedgerService.finalizeProcessed(eventId, current.getSnapshotId());
        });
    }

    private void validateObservation(RateObservation observation) {
        LocalDate observationDate = observation.getObservationDate();
        if (observationDate == null || observationDate.isAfter(LocalDate.now(clock))) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_OBSERVATION_DATE,
                    "Observation date %s must not be in the future", observationDate);
        }
        requirePresent(observation.getObservedRate(), "observedRate");
    }

    private void validateCalculation(ResetCalculation calculation) {
        LocalDate start = calculation.getPeriodStartDate();
        LocalDate end = calculation.getPeriodEndDate();
        if (start == null || end == null || !end.isAfter(start)) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PERIOD_DATES,
                    "Period end %s must be after period start %s", end, start);
        }
        if (!isPositive(calculation.getNotional())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_NOTIONAL,
                    "Notional must be positive, was %s", calculation.getNotional());
        }
    }

    private void validateAveraging(AveragingData averaging, RateObservation observation) {
        if (averaging.getMethod() == null) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_AVERAGING_DATA, "Averaging method is required");
        }
        if (averaging.getFinalRate() == null || averaging.getFinalRate().compareTo(observation.getObservedRate()) != 0) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_AVERAGING_DATA,
                    "Final rate %s does not match observed rate %s", averaging.getFinalRate(), observation.getObservedRate());
        }
        if (averaging.getMethod() == AveragingMethod.NONE) {
            return;
        }
        List<?> observations = averaging.getObservations();
        if (observations == null || observations.isEmpty()) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_AVERAGING_DATA,
                    "%s averaging needs raw observations", averaging.getMethod());
        }
        if (averaging.getMethod() == AveragingMethod.WEIGHTED
                && (averaging.getWeights() == null || averaging.getWeights().size() != observations.size())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_AVERAGING_DATA,
                    "Weighted averaging needs one weight per observation (%d observations)", observations.size());
        }
    }

    /**
     * Record an independent confirmation of the observed rate. The event status is unaffected.
     * A repeat verification replaces the verifier and time.
     */
    public ResetEventData verifyRate(String eventId, String verifier) {
        requireText(verifier, "verifier");
        String tradeId = getResetByEvent(eventId).getTradeId();

        ResetEventData verified = inWriteScope("verifyRate", tradeId, () -> {
            tradeStateService.lockCurrent(tradeId);
            ResetEventData reset = getResetByEvent(eventId);
            reset.setRateVerified(true);
            reset.setVerifiedBy(verifier);
            reset.setVerifiedAt(clock.instant());
            return resetEventStore.save(reset);
        });

        log.info("Reset event {} rate verified by {}", eventId, verifier);
        notificationService.eventUpdated(eventLedgerService.getEvent(eventId), "rate verified by " + verifier);
        return verified;
    }

    // ---- Queries ----

    public Optional<ResetEventData> findReset(String tradeId, int resetNumber) {
        return resetEventStore.findByTradeIdAndResetNumber(tradeId, resetNumber);
    }

    public ResetEventData getReset(String tradeId, int resetNumber) {
        return findReset(tradeId, resetNumber).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND,
                        "Reset %d not found for trade %s", resetNumber, tradeId));
    }

    public ResetEventData getResetByEvent(String eventId) {
        return resetEventStore.findByEventId(eventId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "Reset event %s not found", eventId));
    }

    /**
     * Resets of a trade ordered by reset number
     */
    public List<ResetEventData> getResets(String tradeId) {
        return resetEventStore.findByTradeId(tradeId);
    }

    public int getResetCount(String tradeId) {
        return getResets(tradeId).size();
    }

    public Optional<ResetEventData> getLatestReset(String tradeId) {
        return getResets(tradeId).stream().max(Comparator.comparingInt(ResetEventData::getResetNumber));
    }
}
