package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lenient date-time conversion. Each value is tried against the known
 * date-time patterns, then the date-only patterns (start of day). A value no
 * pattern accepts becomes null; conversion never fails a table.
 */
@Slf4j
@Component
public class DateConverter {

    /** Date-like columns per dataset, converted by {@link #convertRegistered}. */
    public static final Map<String, List<String>> DATE_COLUMNS = Map.of(
            DatasetNames.ORDERS, List.of(
                    "order_purchase_timestamp",
                    "order_approved_at",
                    "order_delivered_carrier_date",
                    "order_delivered_customer_date",
                    "order_estimated_delivery_date"),
            DatasetNames.ORDER_ITEMS, List.of("shipping_limit_date"),
            DatasetNames.ORDER_REVIEWS, List.of("review_creation_date", "review_answer_timestamp"));

    private static final List<DateTimeFormatter> DATE_TIME_PATTERNS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,    // 2017-10-02T10:56:33(.fraction)
            strict("uuuu-MM-dd HH:mm:ss[.SSSSSS][.SSS]"),
            strict("uuuu-MM-dd HH:mm"),
            strict("uuuu/MM/dd HH:mm:ss"),
            strict("dd/MM/uuuu HH:mm:ss"),
            strict("dd/MM/uuuu HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            strict("uuuu-MM-dd"),   // ISO standard
            strict("dd/MM/uuuu"),   // UK / EU / BR
            strict("MM-dd-uuuu"),   // US
            strict("uuuu/MM/dd"),
            strict("dd-MM-uuuu"),
            strict("dd.MM.uuuu"),
            strict("uuuuMMdd")
    );

    /** Impossible calendar dates such as 2017-02-30 are rejected, not clamped. */
    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Converts the registered date columns of {@code datasetName}; datasets
     * with no registered columns are returned unchanged.
     */
    public DataTable convertRegistered(DataTable table, String datasetName) {
        List<String> columns = DATE_COLUMNS.get(datasetName);
        return columns == null ? table : convertDates(table, columns);
    }

    /**
     * Converts each listed column that exists in {@code table} to
     * {@link ColumnType#DATETIME}. Listed columns that are absent are skipped.
     */
    public DataTable convertDates(DataTable table, List<String> columnNames) {
        DataTable result = table;
        for (String name : columnNames) {
            if (!result.hasColumn(name)) {
                continue;
            }
            Column source = result.column(name);
            if (source.type() == ColumnType.DATETIME) {
                continue;
            }
            List<LocalDateTime> converted = new ArrayList<>(source.size());
            int invalid = 0;
            for (Object raw : source.values()) {
                LocalDateTime value = parse(raw);
                if (value == null && raw != null && !raw.toString().isBlank()) {
                    invalid++;
                }
                converted.add(value);
            }
            result = result.withColumn(Column.of(name, ColumnType.DATETIME, converted));
            log.debug("Converted {} valid dates in {}", source.size() - source.nullCount() - invalid, name);
            if (invalid > 0) {
                log.info("{}: {} unparsable date values set to no value", name, invalid);
            }
        }
        return result;
    }

    /**
     * Parses one value. Returns null for null, blank or unrecognised input.
     */
    public static LocalDateTime parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter formatter : DATE_TIME_PATTERNS) {
            try {
                return LocalDateTime.parse(text, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date-time pattern {} rejected '{}': {}", formatter, text, e.getMessage());
            }
        }
        for (DateTimeFormatter formatter : DATE_PATTERNS) {
            try {
                return LocalDate.parse(text, formatter).atStartOfDay();
            } catch (DateTimeParseException e) {
                log.trace("Date pattern {} rejected '{}': {}", formatter, text, e.getMessage());
            }
        }
        return null;
    }
}
