package com.compound.enrichment.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set and remove run context")
    void testRunContext() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("run", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Should leave outer keys in place when an item context closes")
    void testNestedContexts() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext item = LogContext.forItem("42", 7).with("source", "pubchem")) {
                assertEquals("42", MDC.get("itemKey"));
                assertEquals("7", MDC.get("itemIndex"));
                assertEquals("pubchem", MDC.get("source"));
            }
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("run", MDC.get("operation"));
            assertNull(MDC.get("itemKey"));
            assertNull(MDC.get("source"));
        }
    }

    @Test
    @DisplayName("Should generate distinct run ids")
    void testGenerateRunId() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
