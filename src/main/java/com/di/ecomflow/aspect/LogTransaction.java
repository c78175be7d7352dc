package com.di.ecomflow.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a pipeline stage method for operation event logging.
 *
 * <p>{@link TransactionEventAspect} emits {@code <eventType>_STARTED} before the call,
 * {@code <eventType>_COMPLETED} with its duration after it, or
 * {@code <eventType>_FAILED} with the {@link ErrorCategory} when it throws.
 * The events carry the run's {@code jobId} from MDC.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "EXTRACT", transactionContext = "csv_extract", parameterNames = {"dataDir"})
 * public Map<String, DataTable> extractAll(Path dataDir) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /**
     * Event type prefix, e.g. {@code "LOAD"} gives {@code LOAD_STARTED},
     * {@code LOAD_COMPLETED} and {@code LOAD_FAILED}.
     */
    String eventType();

    /** What the operation is doing, e.g. {@code "csv_extract"}. */
    String transactionContext() default "";

    /**
     * Names given to the leading method arguments in the event context.
     * Empty means every argument is recorded under its reflected name.
     */
    String[] parameterNames() default {};

    /** Whether the completed event records the result's size when it is a map or collection. */
    boolean includeResult() default false;

    /** MDC key holding the transaction id. Falls back to {@code jobId}. */
    String transactionIdKey() default "jobId";
}
