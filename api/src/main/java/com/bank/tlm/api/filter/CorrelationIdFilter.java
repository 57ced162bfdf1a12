package com.bank.tlm.api.filter;

import com.bank.tlm.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Binds the request's correlation ID to the logging MDC for the duration of the request.
 * Event records and notifications written by the request carry the same ID.
 *
 * <p>An incoming ID is used only if it fits the stored column and is printable; otherwise a
 * fresh one is generated.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {
    
    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,255}");
    
    private final CorrelationIdService correlationIdService;
    
    public CorrelationIdFilter(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }
    
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, 
                                   FilterChain filterChain) throws ServletException, IOException {
        String correlationId = bind(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            log.debug("{} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
        } finally {
            correlationIdService.clear();
        }
    }
    
    private String bind(String incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return correlationIdService.generateCorrelationId();
        }
        if (!ACCEPTED_ID.matcher(incoming).matches()) {
            String generated = correlationIdService.generateCorrelationId();
            log.warn("Replaced unusable {} header with {}", CORRELATION_ID_HEADER, generated);
            return generated;
        }
        correlationIdService.setCorrelationId(incoming);
        return incoming;
    }
}
