package com.bank.tlm.api.filter;

import com.bank.tlm.application.service.CorrelationIdService;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {
    
    private final CorrelationIdFilter filter = new CorrelationIdFilter(new CorrelationIdService());
    
    @Test
    void testIncomingIdIsBoundForRequestAndCleared() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/trades");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        
        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.set(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
            }
        });
        
        assertEquals("corr-1", seen.get());
        assertEquals("corr-1", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }
    
    @Test
    void testMissingIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        
        filter.doFilter(new MockHttpServletRequest("GET", "/api/trades/T-1"), response, new MockFilterChain());
        
        String generated = response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(36, generated.length());
        assertNull(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }
    
    @Test
    void testUnusableIdIsReplaced() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/trades/T-1");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "x".repeat(300));
        MockHttpServletResponse response = new MockHttpServletResponse();
        
        filter.doFilter(request, response, new MockFilterChain());
        
        assertEquals(36, response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER).length());
    }
}
