package com.bank.tlm;

import com.bank.tlm.api.dto.CreateTradeRequest;
import com.bank.tlm.api.dto.ExecutionRequest;
import com.bank.tlm.api.dto.ResetRequest;
import com.bank.tlm.api.dto.SettlementRequest;
import com.bank.tlm.api.dto.TerminationRequest;
import com.bank.tlm.api.dto.TransferRequest;
import com.bank.tlm.api.dto.TransitionRequest;
import com.bank.tlm.domain.enums.ConfirmationMethod;
import com.bank.tlm.domain.enums.PaymentCalculationMethod;
import com.bank.tlm.domain.enums.ProductType;
import com.bank.tlm.domain.enums.TerminationType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.enums.TransferDirection;
import com.bank.tlm.domain.enums.TransferType;
import com.bank.tlm.domain.model.EconomicTerms;
import com.bank.tlm.domain.model.ExecutionDetails;
import com.bank.tlm.domain.model.PaymentDetails;
import com.bank.tlm.domain.model.RateObservation;
import com.bank.tlm.domain.model.ResetCalculation;
import com.bank.tlm.domain.model.TerminationDetails;
import com.bank.tlm.domain.model.TerminationPayment;
import com.bank.tlm.domain.model.TransferParties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full lifecycle against PostgreSQL through the REST layer
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class TradeLifecycleIntegrationTest {
    
    private static final String PARTY_A = "PARTY-A";
    private static final String PARTY_B = "PARTY-B";
    
    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:14-alpine"))
            .withDatabaseName("trade_lifecycle_test")
            .withUsername("postgres")
            .withPassword("postgres");
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9092");
    }
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private ObjectMapper objectMapper;
    
    private LocalDate today;
    private LocalDate effective;
    private LocalDate maturity;
    private String tradeId;
    
    @BeforeEach
    void setUp() {
        today = LocalDate.now(ZoneOffset.UTC);
        effective = today.plusDays(2);
        maturity = effective.plusYears(5);
        tradeId = "IT-" + UUID.randomUUID();
    }
    
    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }
    
    private void createTrade() throws Exception {
        postJson("/api/trades", CreateTradeRequest.builder()
                .tradeId(tradeId)
                .productType(ProductType.IRS)
                .parties(List.of(PARTY_A, PARTY_B))
                .effectiveDate(effective)
                .maturityDate(maturity)
                .build())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("CREATED"));
    }
    
    private ResultActions execute(String eventId) throws Exception {
        return postJson("/api/trades/" + tradeId + "/execution", ExecutionRequest.builder()
                .eventId(eventId)
                .executionDetails(ExecutionDetails.builder()
                        .executionId("X-" + eventId)
                        .venue("TRADEWEB")
                        .price(new BigDecimal("99.75"))
                        .executionTimestamp(Instant.now())
                        .confirmationMethod(ConfirmationMethod.ELECTRONIC)
                        .build())
                .economicTerms(EconomicTerms.builder()
                        .notional(new BigDecimal("10000000"))
                        .currency("USD")
                        .effectiveDate(effective)
                        .maturityDate(maturity)
                        .fixedRate(new BigDecimal("0.0450"))
                        .floatingRateIndex("SOFR")
                        .build())
                .buyer(PARTY_A)
                .seller(PARTY_B)
                .tradeDate(today)
                .build());
    }
    
    private void activate() throws Exception {
        postJson("/api/trades/" + tradeId + "/transitions", TransitionRequest.builder()
                .targetState(TradeState.ACTIVE)
                .causingEventId("ACT-" + tradeId)
                .initiator("ops-desk")
                .build())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ACTIVE"));
    }
    
    private ResultActions reset(String eventId, int resetNumber) throws Exception {
        return postJson("/api/trades/" + tradeId + "/resets", ResetRequest.builder()
                .eventId(eventId)
                .payoutReference("FLOAT-LEG")
                .resetNumber(resetNumber)
                .observation(RateObservation.builder()
                        .observationDate(today.minusDays(1))
                        .observedRate(new BigDecimal("0.0525"))
                        .rateIndex("SOFR")
                        .rateSource("FED")
                        .build())
                .calculation(ResetCalculation.builder()
                        .periodStartDate(today)
                        .periodEndDate(today.plusMonths(3))
                        .notional(new BigDecimal("10000000"))
                        .currency("USD")
                        .dayCountFraction(new BigDecimal("0.25"))
                        .accrualAmount(new BigDecimal("131250.00"))
                        .paymentDate(today.plusMonths(3).plusDays(2))
                        .build())
                .initiator("rates-desk")
                .build());
    }
    
    private ResultActions transfer(String eventId, String paymentReference) throws Exception {
        return postJson("/api/trades/" + tradeId + "/transfers", TransferRequest.builder()
                .eventId(eventId)
                .transferType(TransferType.COUPON)
                .payment(PaymentDetails.builder()
                        .grossAmount(new BigDecimal("131250.00"))
                        .netAmount(new BigDecimal("131250.00"))
                        .currency("USD")
                        .valueDate(today.plusDays(2))
                        .direction(TransferDirection.PAY)
                        .paymentReference(paymentReference)
                        .build())
                .parties(TransferParties.builder().payer(PARTY_A).receiver(PARTY_B).build())
                .initiator("payments")
                .build());
    }
    
    private ResultActions terminate(String eventId) throws Exception {
        return postJson("/api/trades/" + tradeId + "/termination", TerminationRequest.builder()
                .eventId(eventId)
                .details(TerminationDetails.builder()
                        .terminationType(TerminationType.MUTUAL_AGREEMENT)
                        .terminationDate(today.plusDays(7))
                        .notificationDate(today)
                        .reason("Portfolio compression")
                        .build())
                .payment(TerminationPayment.builder()
                        .method(PaymentCalculationMethod.AGREED_AMOUNT)
                        .amount(new BigDecimal("50000"))
                        .currency("USD")
                        .payer(PARTY_A)
                        .receiver(PARTY_B)
                        .build())
                .initiator("ops-desk")
                .build());
    }
    
    @Test
    void testExecutionConfirmsTradeOnce() throws Exception {
        createTrade();
        
        execute("EXE-" + tradeId)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventType").value("EXECUTION"))
                .andExpect(jsonPath("$.status").value("PROCESSED"))
                .andExpect(jsonPath("$.sequence").value(1));
        mockMvc.perform(get("/api/trades/" + tradeId))
                .andExpect(jsonPath("$.state").value("CONFIRMED"))
                .andExpect(jsonPath("$.sequence").value(2));
        
        execute("EXE2-" + tradeId)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_EXECUTED"));
    }
    
    @Test
    void testResetIsUniquePerNumber() throws Exception {
        createTrade();
        execute("EXE-" + tradeId).andExpect(status().isCreated());
        activate();
        
        reset("RST1-" + tradeId, 1)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventType").value("RESET"));
        reset("RST1B-" + tradeId, 1)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("RESET_ALREADY_EXISTS"));
        reset("RST0-" + tradeId, 0)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_RESET_NUMBER"));
        
        mockMvc.perform(get("/api/trades/" + tradeId + "/resets/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.observation.observedRate").value(0.0525));
        mockMvc.perform(get("/api/trades/" + tradeId))
                .andExpect(jsonPath("$.state").value("ACTIVE"));
    }
    
    @Test
    void testTransferSettlesOnceAndReferenceIsUnique() throws Exception {
        createTrade();
        execute("EXE-" + tradeId).andExpect(status().isCreated());
        activate();
        String reference = "CPN-" + tradeId;
        
        transfer("TRF1-" + tradeId, reference).andExpect(status().isCreated());
        transfer("TRF2-" + tradeId, reference)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DUPLICATE_REFERENCE"));
        
        postJson("/api/transfers/TRF1-" + tradeId + "/settlement",
                SettlementRequest.builder().settlementDate(today.plusDays(2)).settlementReference("SWIFT-1").build())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settlementStatus").value("SETTLED"));
        postJson("/api/transfers/TRF1-" + tradeId + "/settlement",
                SettlementRequest.builder().settlementReference("SWIFT-2").build())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_SETTLED"));
    }
    
    @Test
    void testTerminationThenSettlement() throws Exception {
        createTrade();
        execute("EXE-" + tradeId).andExpect(status().isCreated());
        activate();
        reset("RST1-" + tradeId, 1).andExpect(status().isCreated());
        
        terminate("TRM1-" + tradeId)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventType").value("TERMINATION"));
        terminate("TRM2-" + tradeId)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("TRADE_ALREADY_TERMINATED"));
        
        postJson("/api/trades/" + tradeId + "/transitions", TransitionRequest.builder()
                .targetState(TradeState.SETTLED)
                .causingEventId("STL-" + tradeId)
                .initiator("ops-desk")
                .build())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("SETTLED"));
        
        mockMvc.perform(get("/api/trades/" + tradeId + "/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settled").value(true))
                .andExpect(jsonPath("$.snapshotChainValid").value(true));
        mockMvc.perform(get("/api/trades/" + tradeId + "/transitions"))
                .andExpect(jsonPath("$[*].toState", contains("CONFIRMED", "ACTIVE", "TERMINATED", "SETTLED")));
        mockMvc.perform(get("/api/events").param("tradeId", tradeId))
                .andExpect(jsonPath("$[*].eventId", contains("EXE-" + tradeId, "RST1-" + tradeId, "TRM1-" + tradeId)));
        mockMvc.perform(get("/api/trades/" + tradeId + "/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tradeId").value(tradeId));
    }
    
    @Test
    void testUnknownTradeIsNotFound() throws Exception {
        mockMvc.perform(get("/api/trades/" + tradeId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("TRADE_NOT_FOUND"))
                .andExpect(jsonPath("$.correlationId", notNullValue()));
    }
}
