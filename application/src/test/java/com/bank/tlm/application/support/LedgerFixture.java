package com.bank.tlm.application.support;

import com.bank.tlm.application.service.AuditTrailService;
import com.bank.tlm.application.service.CorrelationIdService;
import com.bank.tlm.application.service.EventLedgerService;
import com.bank.tlm.application.service.ExecutionService;
import com.bank.tlm.application.service.LifecycleNotificationService;
import com.bank.tlm.application.service.MetricsService;
import com.bank.tlm.application.service.ResetService;
import com.bank.tlm.application.service.TerminationService;
import com.bank.tlm.application.service.TradeStateService;
import com.bank.tlm.application.service.TradeWriteScope;
import com.bank.tlm.application.service.TransferService;
import com.bank.tlm.application.statemachine.TradeStateMachine;
import com.bank.tlm.domain.enums.AveragingMethod;
import com.bank.tlm.domain.enums.ConfirmationMethod;
import com.bank.tlm.domain.enums.PaymentCalculationMethod;
import com.bank.tlm.domain.enums.ProductType;
import com.bank.tlm.domain.enums.TerminationType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.enums.TransferDirection;
import com.bank.tlm.domain.enums.TransferType;
import com.bank.tlm.domain.model.AveragingData;
import com.bank.tlm.domain.model.EconomicTerms;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.ExecutionDetails;
import com.bank.tlm.domain.model.PaymentDetails;
import com.bank.tlm.domain.model.RateObservation;
import com.bank.tlm.domain.model.ResetCalculation;
import com.bank.tlm.domain.model.TerminationDetails;
import com.bank.tlm.domain.model.TerminationPayment;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.model.TransferParties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Fully wired ledger over in-memory stores, a fixed clock and a recording message producer,
 * plus sample inputs for every event kind
 */
public class LedgerFixture {

    public static final Instant NOW = Instant.parse("2025-03-14T10:15:30Z");
    public static final LocalDate TODAY = LocalDate.of(2025, 3, 14);
    public static final LocalDate EFFECTIVE = TODAY.plusDays(2);
    public static final LocalDate MATURITY = EFFECTIVE.plusYears(5);
    public static final String PARTY_A = "PARTY-A";
    public static final String PARTY_B = "PARTY-B";

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final RecordingMessageProducer messageProducer = new RecordingMessageProducer();

    public final InMemoryTradeStateStore stateStore = new InMemoryTradeStateStore();
    public final InMemoryEventRecordStore eventRecordStore = new InMemoryEventRecordStore();
    public final InMemoryExecutionEventStore executionStore = new InMemoryExecutionEventStore();
    public final InMemoryResetEventStore resetStore = new InMemoryResetEventStore();
    public final InMemoryTransferEventStore transferStore = new InMemoryTransferEventStore();
    public final InMemoryTerminationEventStore terminationStore = new InMemoryTerminationEventStore();

    public final TradeStateMachine stateMachine = new TradeStateMachine();
    public final CorrelationIdService correlationIdService = new CorrelationIdService();
    public final MetricsService metricsService = new MetricsService(meterRegistry);
    public final TradeWriteScope writeScope = new TradeWriteScope(TransactionOperations.withoutTransaction(), 16);
    public final LifecycleNotificationService notificationService = new LifecycleNotificationService(
            Optional.of(messageProducer), CircuitBreaker.ofDefaults("notification"),
            correlationIdService, metricsService, clock, "trade-lifecycle-events");

    public final TradeStateService tradeStateService = new TradeStateService(
            stateStore, stateMachine, writeScope, metricsService, notificationService, clock);
    public final EventLedgerService eventLedgerService = new EventLedgerService(
            eventRecordStore, tradeStateService, writeScope, correlationIdService, notificationService, clock);
    public final ExecutionService executionService = new ExecutionService(
            executionStore, tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
    public final ResetService resetService = new ResetService(
            resetStore, tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
    public final TransferService transferService = new TransferService(
            transferStore, tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
    public final TerminationService terminationService = new TerminationService(
            terminationStore, transferService, tradeStateService, eventLedgerService, writeScope,
            metricsService, notificationService, clock);
    public final AuditTrailService auditTrailService = new AuditTrailService(tradeStateService, eventLedgerService);

    // ---- Lifecycle shortcuts ----

    public TradeStateSnapshot createTrade(String tradeId) {
        return tradeStateService.createTrade(tradeId, ProductType.IRS, List.of(PARTY_A, PARTY_B), EFFECTIVE, MATURITY);
    }

    public EventRecord execute(String tradeId) {
        return executionService.executeTrade("EXE-" + tradeId, tradeId, executionDetails(), economicTerms(),
                PARTY_A, PARTY_B, null, TODAY);
    }

    /**
     * Created, executed and activated
     */
    public TradeStateSnapshot activeTrade(String tradeId) {
        createTrade(tradeId);
        execute(tradeId);
        return tradeStateService.transitionState(tradeId, TradeState.ACTIVE, "ACT-" + tradeId, "ops-desk");
    }

    public EventRecord recordReset(String eventId, String tradeId, int resetNumber) {
        return resetService.recordReset(eventId, tradeId, "FLOAT-LEG", resetNumber,
                observation(new BigDecimal("0.0525")), calculation(), "rates-desk");
    }

    public EventRecord recordTransfer(String eventId, String tradeId, String paymentReference) {
        return transferService.recordTransfer(eventId, tradeId, TransferType.COUPON,
                payment(new BigDecimal("131250.00"), paymentReference), transferParties(PARTY_A, PARTY_B), "payments");
    }

    // ---- Sample inputs ----

    public static ExecutionDetails executionDetails() {
        return ExecutionDetails.builder()
                .executionId("X-1")
                .venue("TRADEWEB")
                .price(new BigDecimal("99.75"))
                .executionTimestamp(NOW)
                .confirmationMethod(ConfirmationMethod.ELECTRONIC)
                .build();
    }

    public static EconomicTerms economicTerms() {
        return EconomicTerms.builder()
                .notional(new BigDecimal("10000000"))
                .currency("USD")
                .effectiveDate(EFFECTIVE)
                .maturityDate(MATURITY)
                .fixedRate(new BigDecimal("0.0450"))
                .floatingRateIndex("SOFR")
                .build();
    }

    public static RateObservation observation(BigDecimal rate) {
        return RateObservation.builder()
                .observationDate(TODAY.minusDays(1))
                .observedRate(rate)
                .rateIndex("SOFR")
                .rateSource("FED")
                .build();
    }

    public static ResetCalculation calculation() {
        return ResetCalculation.builder()
                .periodStartDate(TODAY)
                .periodEndDate(TODAY.plusMonths(3))
                .notional(new BigDecimal("10000000"))
                .currency("USD")
                .dayCountFraction(new BigDecimal("0.25"))
                .accrualAmount(new BigDecimal("131250.00"))
                .paymentDate(TODAY.plusMonths(3).plusDays(2))
                .build();
    }

    public static AveragingData averaging(AveragingMethod method, BigDecimal finalRate,
                                          List<BigDecimal> observations, List<BigDecimal> weights) {
        return AveragingData.builder()
                .method(method)
                .observations(observations)
                .weights(weights)
                .compoundingPeriods(observations == null ? 0 : observations.size())
                .finalRate(finalRate)
                .build();
    }

    public static PaymentDetails payment(BigDecimal netAmount, String paymentReference) {
        return PaymentDetails.builder()
                .grossAmount(netAmount)
                .netAmount(netAmount)
                .currency("USD")
                .valueDate(TODAY.plusDays(2))
                .direction(TransferDirection.PAY)
                .paymentReference(paymentReference)
                .build();
    }

    public static TransferParties transferParties(String payer, String receiver) {
        return TransferParties.builder()
                .payer(payer)
                .receiver(receiver)
                .payerAccount(payer + "-ACC")
                .receiverAccount(receiver + "-ACC")
                .build();
    }

    public static TerminationDetails terminationDetails(LocalDate terminationDate) {
        return TerminationDetails.builder()
                .terminationType(TerminationType.MUTUAL_AGREEMENT)
                .terminationDate(terminationDate)
                .notificationDate(TODAY)
                .reason("Portfolio compression")
                .build();
    }

    public static TerminationPayment terminationPayment(BigDecimal amount) {
        return TerminationPayment.builder()
                .method(PaymentCalculationMethod.AGREED_AMOUNT)
                .amount(amount)
                .currency("USD")
                .payer(PARTY_A)
                .receiver(PARTY_B)
                .build();
    }
}
