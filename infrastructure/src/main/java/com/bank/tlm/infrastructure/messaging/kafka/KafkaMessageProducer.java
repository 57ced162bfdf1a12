package com.bank.tlm.infrastructure.messaging.kafka;

import com.bank.tlm.domain.messaging.MessageProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka implementation of MessageProducer.
 * Records are keyed by trade id so every notification of a trade lands on one partition in order;
 * the request correlation id travels as a header.
 */
@Component("kafkaMessageProducer")
@ConditionalOnProperty(name = "app.messaging.kafka.enabled", havingValue = "true")
public class KafkaMessageProducer implements MessageProducer {
    
    private static final Logger log = LoggerFactory.getLogger(KafkaMessageProducer.class);
    
    static final String CORRELATION_ID_HEADER = "correlation-id";
    private static final String CORRELATION_ID_MDC_KEY = "correlationId";
    
    private final KafkaTemplate<String, Object> kafkaTemplate;
    
    public KafkaMessageProducer(KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }
    
    @Override
    public void send(String topic, String key, Object message) {
        try {
            ProducerRecord<String, Object> record;
            
            if (key != null) {
                record = new ProducerRecord<>(topic, key, message);
            } else {
                record = new ProducerRecord<>(topic, message);
            }
            
            String correlationId = MDC.get(CORRELATION_ID_MDC_KEY);
            if (correlationId != null) {
                record.headers().add(CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8));
            }
            
            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Kafka rejected message for topic: {}, key: {}", topic, key, ex);
                }
            });
            log.debug("Sent message to topic: {}, key: {}, correlationId: {}", topic, key, correlationId);
        } catch (Exception e) {
            log.error("Failed to send message to topic: {}", topic, e);
            throw new IllegalStateException("Failed to send message to Kafka", e);
        }
    }
}
