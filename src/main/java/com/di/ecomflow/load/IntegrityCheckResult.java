package com.di.ecomflow.load;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one fact table foreign key check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityCheckResult {

    /** Fact column checked, e.g. {@code customer_key}. */
    private String  foreignKey;
    private String  dimensionTable;

    private long    totalRows;

    /** Rows whose key is set but matches no dimension row. */
    private long    orphanRows;

    /** Rows whose key is null. Reported, not a failure. */
    private long    missingKeys;

    private boolean passed;
    private String  detail;
}
