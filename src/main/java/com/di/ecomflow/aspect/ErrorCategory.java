package com.di.ecomflow.aspect;

import com.di.ecomflow.load.LoadException;
import com.di.ecomflow.transform.TransformException;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories attached to FAILED operation events and error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>A {@link LoadException} or {@link DataAccessException} is categorised by its
 * underlying {@link SQLException} when it has one.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation"),
    DATABASE_ERROR("Database error", "General database operation error"),
    DATA_ERROR("Data error", "Input dataset is missing required columns or violates a transform invariant"),
    FILE_ERROR("File error", "Source file missing, unreadable or malformed"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof TransformException, DATA_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isFileError, FILE_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "28", PERMISSION_ERROR
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        if (exception instanceof LoadException || exception instanceof DataAccessException) {
            Throwable root = rootCause(exception);
            return root instanceof SQLException ? categorizeSqlException((SQLException) root) : DATABASE_ERROR;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** Innermost cause of the chain, or the throwable itself. */
    public static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isFileError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.beans.factory.NoSuchBeanDefinitionException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
