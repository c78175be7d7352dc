package com.di.ecomflow.exception;

import com.di.ecomflow.aspect.ErrorCategory;
import com.di.ecomflow.config.MdcRequestFilter;
import com.di.ecomflow.load.LoadException;
import com.di.ecomflow.transform.TransformException;
import com.di.ecomflow.util.TransactionEventLogger;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns exceptions escaping the pipeline API into a categorised {@link ErrorResponse}
 * and a {@code *_EXCEPTION} operation event.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>{@link TransformException}: 422, the input data cannot be transformed</li>
 *   <li>{@link LoadException}, {@link DataAccessException}, {@link SQLException}: 502, the warehouse failed</li>
 *   <li>{@link IllegalArgumentException}, {@link IllegalStateException}: 400</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final TransactionEventLogger eventLogger;
    private final String applicationName;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger,
                                  @Value("${spring.application.name:ecomflow}") String applicationName) {
        this.eventLogger = eventLogger;
        this.applicationName = applicationName;
    }

    @ExceptionHandler(TransformException.class)
    public ResponseEntity<ErrorResponse> handleTransformException(TransformException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("TRANSFORM_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.UNPROCESSABLE_ENTITY);
        response.addDetail("stage", e.getStage());
        response.addDetail("table", e.getTable());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @ExceptionHandler(LoadException.class)
    public ResponseEntity<ErrorResponse> handleLoadException(LoadException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("LOAD_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        response.addDetail("table", e.getTable());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler({DataAccessException.class, SQLException.class})
    public ResponseEntity<ErrorResponse> handleDatabaseException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("SQL_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        Throwable root = ErrorCategory.rootCause(e);
        if (root instanceof SQLException) {
            response.addDetail("sqlState", ((SQLException) root).getSQLState());
            response.addDetail("errorCode", ((SQLException) root).getErrorCode());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        String transactionId = MDC.get("jobId");
        if (transactionId == null) {
            transactionId = MDC.get(MdcRequestFilter.REQUEST_ID);
        }
        if (transactionId == null) {
            transactionId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("errorCategoryName", category.getName());
        context.put("handler", "GlobalExceptionHandler");
        Throwable rootCause = ErrorCategory.rootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }

        eventLogger.logEvent(eventType, context, transactionId, Thread.currentThread(),
                "global_exception_handler", applicationName, exception);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        String path = MDC.get(MdcRequestFilter.REQUEST_PATH);
        response.setPath(path != null ? path : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = ErrorCategory.rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    /**
     * Structured error body returned by the pipeline API.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
