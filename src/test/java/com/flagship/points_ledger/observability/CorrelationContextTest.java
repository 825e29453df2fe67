package com.flagship.points_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Closing a scope restores the outer value")
    void testNestedScopesRestore() {
        try (CorrelationContext.Scope outer = CorrelationContext.with(CorrelationContext.JOB_ID_MDC_KEY, 1L)) {
            try (CorrelationContext.Scope inner = CorrelationContext.with(CorrelationContext.JOB_ID_MDC_KEY, 2L)) {
                assertEquals("2", MDC.get(CorrelationContext.JOB_ID_MDC_KEY));
            }
            assertEquals("1", MDC.get(CorrelationContext.JOB_ID_MDC_KEY));
        }
        assertNull(MDC.get(CorrelationContext.JOB_ID_MDC_KEY));
    }

    @Test
    @DisplayName("An existing correlation id is kept")
    void testEnsureCorrelationIdKeepsExisting() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, "abc12345");

        try (CorrelationContext.Scope scope = CorrelationContext.ensureCorrelationId()) {
            assertEquals("abc12345", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        }
        assertEquals("abc12345", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("A correlation id is generated and removed when none is active")
    void testEnsureCorrelationIdGenerates() {
        try (CorrelationContext.Scope scope = CorrelationContext.ensureCorrelationId()) {
            String id = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
            assertNotNull(id);
            assertEquals(8, id.length());
        }
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }
}
