package com.bank.tlm.infrastructure.messaging.kafka;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Verifies that notifications are keyed by trade id and carry the correlation id
 */
@ExtendWith(MockitoExtension.class)
class KafkaMessageProducerTest {

    private static final String TOPIC = "trade-lifecycle-events";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaMessageProducer producer;

    @BeforeEach
    void setUp() {
        producer = new KafkaMessageProducer(kafkaTemplate);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @SuppressWarnings("unchecked")
    private List<ProducerRecord<String, Object>> sentRecords(int times) {
        ArgumentCaptor<ProducerRecord<String, Object>> recordCaptor =
            ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate, times(times)).send(recordCaptor.capture());
        return recordCaptor.getAllValues();
    }

    private void brokerAccepts() {
        CompletableFuture<SendResult<String, Object>> accepted = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(accepted);
    }

    @Test
    void testSendIsKeyedByTradeId() {
        brokerAccepts();

        producer.send(TOPIC, "T1", "{\"tradeId\":\"T1\"}");

        ProducerRecord<String, Object> record = sentRecords(1).get(0);
        assertEquals(TOPIC, record.topic());
        assertEquals("T1", record.key());
        assertEquals("{\"tradeId\":\"T1\"}", record.value());
    }

    @Test
    void testSendWithoutKey() {
        brokerAccepts();

        producer.send(TOPIC, "payload");

        assertNull(sentRecords(1).get(0).key());
    }

    @Test
    void testEventsOfOneTradeShareAKey() {
        brokerAccepts();

        producer.send(TOPIC, "T1", "created");
        producer.send(TOPIC, "T1", "executed");

        List<ProducerRecord<String, Object>> records = sentRecords(2);
        assertEquals(records.get(0).key(), records.get(1).key());
    }

    @Test
    void testCorrelationIdHeader() {
        brokerAccepts();
        MDC.put("correlationId", "corr-7");

        producer.send(TOPIC, "T1", "created");

        Header header = sentRecords(1).get(0).headers().lastHeader(KafkaMessageProducer.CORRELATION_ID_HEADER);
        assertNotNull(header);
        assertEquals("corr-7", new String(header.value(), StandardCharsets.UTF_8));
    }

    @Test
    void testNoCorrelationIdHeaderOutsideARequest() {
        brokerAccepts();

        producer.send(TOPIC, "T1", "created");

        assertNull(sentRecords(1).get(0).headers().lastHeader(KafkaMessageProducer.CORRELATION_ID_HEADER));
    }

    @Test
    void testTemplateFailureIsWrapped() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new RuntimeException("no metadata"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> producer.send(TOPIC, "T1", "created"));

        assertEquals("no metadata", ex.getCause().getMessage());
    }
}
