package com.bank.tlm.application.support;

import com.bank.tlm.application.config.JacksonConfig;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Deep copies mutable payloads so in-memory stores behave like a database: callers never hold
 * a reference into stored state
 */
final class PayloadCopier {

    private static final ObjectMapper MAPPER = JacksonConfig.configure(new ObjectMapper());

    private PayloadCopier() {
    }

    static <T> T copy(T value) {
        if (value == null) {
            return null;
        }
        try {
            @SuppressWarnings("unchecked")
            Class<T> type = (Class<T>) value.getClass();
            return MAPPER.readValue(MAPPER.writeValueAsBytes(value), type);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot copy " + value.getClass().getSimpleName(), e);
        }
    }
}
