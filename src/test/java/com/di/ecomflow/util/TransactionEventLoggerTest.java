package com.di.ecomflow.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransactionEventLogger Tests")
class TransactionEventLoggerTest {

    private final TransactionEventLogger eventLogger = new TransactionEventLogger();

    @Test
    @DisplayName("Event carries type, transaction, thread and context")
    @SuppressWarnings("unchecked")
    void testBuildEvent() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("durationMs", 42L);

        Map<String, Object> event = eventLogger.buildEvent("LOAD_COMPLETED", context, "run-1",
                Thread.currentThread(), "warehouse_load", "ecomflow-1234", null);

        assertEquals("LOAD_COMPLETED", event.get("eventType"));
        assertEquals("run-1", event.get("transactionId"));
        assertEquals("ecomflow-1234", event.get("applicationId"));
        assertEquals(Thread.currentThread().getName(), event.get("threadName"));
        assertInstanceOf(Instant.class, event.get("timestamp"));
        Map<String, Object> details = (Map<String, Object>) event.get("context");
        assertEquals(42L, details.get("durationMs"));
        assertEquals("warehouse_load", details.get("transactionContext"));
        assertFalse(details.containsKey("stackTraceSummary"));
    }

    @Test
    @DisplayName("Missing transaction id is reported as unknown")
    void testBuildEvent_NoTransactionId() {
        Map<String, Object> event = eventLogger.buildEvent("EXTRACT_STARTED", null, null,
                Thread.currentThread(), "", "ecomflow", null);

        assertEquals("unknown", event.get("transactionId"));
        assertFalse(event.containsKey("context"));
    }

    @Test
    @DisplayName("Failure events include a short stack trace summary")
    @SuppressWarnings("unchecked")
    void testBuildEvent_WithException() {
        Map<String, Object> event = eventLogger.buildEvent("LOAD_FAILED", Map.of(), "run-1",
                Thread.currentThread(), "warehouse_load", "ecomflow", new IllegalStateException("boom"));

        String summary = (String) ((Map<String, Object>) event.get("context")).get("stackTraceSummary");
        assertTrue(summary.startsWith("java.lang.IllegalStateException: boom"));
        assertTrue(summary.contains(" | "));
    }

    @Test
    @DisplayName("Events serialise to one JSON object with ISO timestamps")
    void testToJson() {
        Map<String, Object> event = eventLogger.buildEvent("TRANSFORM_COMPLETED", Map.of("datasets", 11),
                "run-1", Thread.currentThread(), "transform_all", "ecomflow", null);

        String json = eventLogger.toJson(event);

        assertTrue(json.startsWith("{\"eventType\":\"TRANSFORM_COMPLETED\""));
        assertTrue(json.contains("\"datasets\":11"));
        assertTrue(json.matches(".*\"timestamp\":\"\\d{4}-\\d{2}-\\d{2}T.*"));
    }
}
