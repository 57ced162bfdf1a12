package com.bank.tlm.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

/**
 * HTTP JSON conversion on top of the shared ObjectMapper.
 * ProblemDetail properties are written at the top level of error bodies.
 */
@Configuration
public class WebConfig {
    
    @Bean
    public MappingJackson2HttpMessageConverter mappingJackson2HttpMessageConverter(ObjectMapper objectMapper) {
        return new MappingJackson2HttpMessageConverter(webObjectMapper(objectMapper));
    }
    
    public static ObjectMapper webObjectMapper(ObjectMapper objectMapper) {
        return objectMapper.copy().addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
    }
}
