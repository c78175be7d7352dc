package com.di.ecomflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one structured operation event per log line, prefixed {@code [TX] EVENT:}.
 *
 * <p>Each event carries its type (e.g. {@code LOAD_FAILED}), an ISO-8601 timestamp,
 * the application instance id, the run's transaction id, the emitting thread and
 * the caller-supplied context. Failure events add a short stack trace summary.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final int STACK_TRACE_LINES = 5;

    private final ObjectMapper objectMapper;

    public TransactionEventLogger() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         Thread thread, String transactionContext, String applicationId) {
        logEvent(eventType, context, transactionId, thread, transactionContext, applicationId, null);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         Thread thread, String transactionContext, String applicationId, Throwable exception) {
        String json = toJson(buildEvent(eventType, context, transactionId, thread,
                transactionContext, applicationId, exception));
        log.info("[TX] EVENT: {}", json);
    }

    Map<String, Object> buildEvent(String eventType, Map<String, Object> context, String transactionId,
                                   Thread thread, String transactionContext, String applicationId,
                                   Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now());
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> details = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (transactionContext != null && !transactionContext.isEmpty()) {
            details.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            details.put("stackTraceSummary", stackTraceSummary(exception));
        }
        if (!details.isEmpty()) {
            event.put("context", details);
        }
        return event;
    }

    String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[TX] Could not serialise event {}: {}", event.get("eventType"), e.getOriginalMessage());
            return String.valueOf(event);
        }
    }

    private static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int included = Math.min(STACK_TRACE_LINES, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < included; i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_TRACE_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_TRACE_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
