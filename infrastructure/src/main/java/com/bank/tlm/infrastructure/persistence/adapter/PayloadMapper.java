package com.bank.tlm.infrastructure.persistence.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads and writes the JSON text columns holding event payloads and party lists
 */
@Component
public class PayloadMapper {
    
    private static final Logger log = LoggerFactory.getLogger(PayloadMapper.class);
    
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public PayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} payload", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }
    
    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Error deserializing {} payload", type.getSimpleName(), e);
            throw new IllegalStateException("Failed to deserialize payload", e);
        }
    }
    
    public List<String> readStrings(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.error("Error deserializing party list", e);
            throw new IllegalStateException("Failed to deserialize party list", e);
        }
    }
}
