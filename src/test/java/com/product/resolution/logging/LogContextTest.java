package com.product.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-123")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBucket should set runId, bucketKey and operation in MDC")
    void forBucketSetsMDC() {
        try (LogContext ctx = LogContext.forBucket("run-123", "mfr:EATON|unspsc:3912")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("mfr:EATON|unspsc:3912", MDC.get("bucketKey"));
            assertEquals("score", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forComparison should set both record ids in MDC")
    void forComparisonSetsMDC() {
        try (LogContext ctx = LogContext.forComparison("A-1", "B-9")) {
            assertEquals("A-1", MDC.get("recordA"));
            assertEquals("B-9", MDC.get("recordB"));
            assertEquals("compare", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRun("run-123").with("phase", "score");
        assertEquals("score", MDC.get("phase"));

        ctx.close();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("generateRunId should produce unique ids")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
