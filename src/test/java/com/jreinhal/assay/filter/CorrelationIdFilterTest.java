package com.jreinhal.assay.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CorrelationIdFilterTest {
    private static final String UUID_PATTERN = "^[0-9a-fA-F\\-]{36}$";

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void tearDown() {
        MDC.remove(CorrelationIdFilter.MDC_KEY);
    }

    @Test
    void preservesValidCorrelationId() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/rag/answer");
        req.addHeader(CorrelationIdFilter.HEADER_NAME, "abc-123_DEF.456");
        MockHttpServletResponse res = new MockHttpServletResponse();

        FilterChain chain = (request, response) -> {
            assertEquals("abc-123_DEF.456", MDC.get(CorrelationIdFilter.MDC_KEY));
            ((HttpServletResponse) response).setStatus(200);
        };

        filter.doFilter(req, res, chain);

        assertEquals("abc-123_DEF.456", res.getHeader(CorrelationIdFilter.HEADER_NAME));
        assertNull(MDC.get(CorrelationIdFilter.MDC_KEY));
    }

    @Test
    void replacesInvalidCorrelationIdAndCleansMdc() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/rag/answer");
        req.addHeader(CorrelationIdFilter.HEADER_NAME, "bad value with spaces");
        MockHttpServletResponse res = new MockHttpServletResponse();

        FilterChain chain = (request, response) -> {
            String cid = MDC.get(CorrelationIdFilter.MDC_KEY);
            assertNotNull(cid);
            assertTrue(cid.matches(UUID_PATTERN), "Expected UUID correlation id");
        };

        filter.doFilter(req, res, chain);

        String header = res.getHeader(CorrelationIdFilter.HEADER_NAME);
        assertNotNull(header);
        assertTrue(header.matches(UUID_PATTERN), "Expected UUID correlation id");
        assertNull(MDC.get(CorrelationIdFilter.MDC_KEY));
    }

    @Test
    void generatesIdForMissingOrOversizedHeader() {
        assertTrue(CorrelationIdFilter.resolve(null).matches(UUID_PATTERN));
        assertTrue(CorrelationIdFilter.resolve("a".repeat(65)).matches(UUID_PATTERN));
        assertEquals("a".repeat(64), CorrelationIdFilter.resolve("a".repeat(64)));
    }
}
