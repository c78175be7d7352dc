package com.di.ecomflow.load;

import lombok.Getter;

/**
 * A warehouse write failed. Names the table being loaded when it happened.
 */
@Getter
public class LoadException extends RuntimeException {

    private final String table;

    public LoadException(String table, String message, Throwable cause) {
        super("Failed to load " + table + ": " + message, cause);
        this.table = table;
    }
}
