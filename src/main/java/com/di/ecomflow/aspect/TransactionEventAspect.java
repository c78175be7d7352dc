package com.di.ecomflow.aspect;

import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emits STARTED / COMPLETED / FAILED operation events around methods annotated
 * with {@link LogTransaction}.
 *
 * <p>Events carry the MDC transaction id, the calling thread, a summary of the
 * method arguments (tables are reduced to their row counts, secrets masked),
 * the duration and, on failure, the {@link ErrorCategory} and root cause.
 * The exception is always rethrown.
 */
@Slf4j
@Aspect
@Component
public class TransactionEventAspect {

    private final String applicationId;
    private final TransactionEventLogger eventLogger;

    @Autowired
    public TransactionEventAspect(TransactionEventLogger eventLogger,
                                  @Value("${spring.application.name:ecomflow}") String applicationName) {
        this.eventLogger = eventLogger;
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("TransactionEventAspect initialized with applicationId: {}", applicationId);
    }

    @Around("@annotation(com.di.ecomflow.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);

        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        long startTime = System.currentTimeMillis();

        String transactionId = MDC.get(annotation.transactionIdKey());
        if (transactionId == null) {
            transactionId = MDC.get("jobId");
        }
        Thread currentThread = Thread.currentThread();

        Map<String, Object> context = extractContext(joinPoint, method, annotation);
        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, currentThread,
                transactionContext, applicationId);

        try {
            Object result = joinPoint.proceed();

            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("resultType", result.getClass().getSimpleName());
                context.put("resultSize", sizeOf(result));
            }
            context.put("durationMs", durationMs);
            context.put("durationSeconds", durationMs / 1000.0);
            eventLogger.logEvent(eventType + "_COMPLETED", context, transactionId, currentThread,
                    transactionContext, applicationId);
            return result;

        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;

            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("errorCategoryName", errorCategory.getName());
            context.put("durationMs", durationMs);
            context.put("durationSeconds", durationMs / 1000.0);

            Throwable rootCause = ErrorCategory.rootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }
            if (rootCause instanceof SQLException) {
                SQLException sqlEx = (SQLException) rootCause;
                context.put("sqlState", sqlEx.getSQLState());
                context.put("errorCode", sqlEx.getErrorCode());
            }

            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, currentThread,
                    transactionContext, applicationId, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(ProceedingJoinPoint joinPoint, Method method, LogTransaction annotation) {
        Map<String, Object> context = new LinkedHashMap<>();
        Object[] args = joinPoint.getArgs();
        Parameter[] parameters = method.getParameters();
        String[] parameterNames = annotation.parameterNames();

        int count = parameterNames.length > 0
                ? Math.min(parameterNames.length, args.length)
                : Math.min(parameters.length, args.length);
        for (int i = 0; i < count; i++) {
            String name = parameterNames.length > 0 ? parameterNames[i] : parameters[i].getName();
            if (name == null || name.isEmpty()) {
                continue;
            }
            context.put(name, isSensitive(name) ? "***" : summarize(args[i]));
        }

        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }

    private static boolean isSensitive(String parameterName) {
        String lower = parameterName.toLowerCase();
        return lower.contains("password") || lower.contains("pwd")
                || lower.contains("secret") || lower.contains("credential");
    }

    /**
     * Reduces an argument to something small enough for one log line:
     * tables become row counts, a mapping of tables becomes name to row count.
     */
    private static Object summarize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof DataTable) {
            return ((DataTable) value).rowCount() + " rows";
        }
        if (value instanceof Map) {
            Map<String, Object> summary = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> summary.put(String.valueOf(k),
                    v instanceof DataTable ? ((DataTable) v).rowCount() : String.valueOf(v)));
            return summary;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

    private static Object sizeOf(Object result) {
        if (result instanceof Map) {
            return ((Map<?, ?>) result).size();
        }
        if (result instanceof Collection) {
            return ((Collection<?>) result).size();
        }
        return null;
    }
}
