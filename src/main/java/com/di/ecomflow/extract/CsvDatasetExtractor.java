package com.di.ecomflow.extract;

import com.di.ecomflow.aspect.LogTransaction;
import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the raw Olist CSV files into {@link DataTable}s.
 *
 * <p>A dataset whose file is missing, empty, unreadable or lacks an expected
 * column is dropped with an ERROR; the others are still returned. Empty cells
 * become null. A numeric column holding a value that does not parse is kept
 * as text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvDatasetExtractor {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(false)
            .build();

    private final PipelineProperties properties;

    /**
     * Extracts every configured dataset from {@code dataDir}, in configured order.
     *
     * @return dataset name to table; empty when the directory does not exist
     */
    @LogTransaction(eventType = "EXTRACT", transactionContext = "csv_extract",
            parameterNames = {"dataDir"}, includeResult = true)
    public Map<String, DataTable> extractAll(Path dataDir) {
        Map<String, DataTable> datasets = new LinkedHashMap<>();
        if (!Files.isDirectory(dataDir)) {
            log.error("[EXTRACT] Data directory not found: {}", dataDir.toAbsolutePath());
            return datasets;
        }

        Map<String, String> files = properties.getDatasets().isEmpty()
                ? DatasetSchemas.defaultFiles()
                : properties.getDatasets();
        log.info("[EXTRACT] Starting extraction from {}", dataDir.toAbsolutePath());
        long start = System.currentTimeMillis();

        files.forEach((datasetName, fileName) -> extract(dataDir.resolve(fileName), datasetName)
                .ifPresentOrElse(table -> datasets.put(datasetName, table),
                        () -> log.warn("[EXTRACT] Failed to extract {}", datasetName)));

        log.info("[EXTRACT] Completed in {} s: {}/{} datasets extracted",
                String.format(Locale.ROOT, "%.2f", (System.currentTimeMillis() - start) / 1000.0),
                datasets.size(), files.size());
        return datasets;
    }

    /**
     * Reads one CSV file. Every failure is logged and yields {@link Optional#empty()}.
     */
    public Optional<DataTable> extract(Path file, String datasetName) {
        log.info("[EXTRACT] Extracting {} from {}", datasetName, file);
        try {
            Optional<DataTable> table = read(file, datasetName);
            table.ifPresent(t -> logVolume(t, datasetName));
            return table;
        } catch (NoSuchFileException e) {
            log.error("[EXTRACT] File not found: {}", file);
        } catch (IOException | UncheckedIOException e) {
            log.error("[EXTRACT] Cannot read {}: {}", file, e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("[EXTRACT] Malformed CSV for {}: {}", datasetName, e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<DataTable> read(Path file, String datasetName) throws IOException {
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, FORMAT)) {
            List<String> header = parser.getHeaderNames();
            if (header.isEmpty()) {
                log.error("[EXTRACT] Empty file: {}", file);
                return Optional.empty();
            }

            Optional<DatasetSchema> schema = DatasetSchemas.find(datasetName);
            if (schema.isEmpty()) {
                log.warn("[EXTRACT] No schema registered for {}; columns are read as text", datasetName);
            } else {
                List<String> missing = schema.get().missingFrom(header);
                if (!missing.isEmpty()) {
                    log.error("[EXTRACT] {}: missing columns {}; schema validation failed", datasetName, missing);
                    return Optional.empty();
                }
                List<String> extra = schema.get().extraIn(header);
                if (!extra.isEmpty()) {
                    log.warn("[EXTRACT] {}: extra columns found {}", datasetName, extra);
                }
            }

            List<List<String>> cells = new ArrayList<>(header.size());
            for (int i = 0; i < header.size(); i++) {
                cells.add(new ArrayList<>());
            }
            for (CSVRecord record : parser) {
                for (int i = 0; i < header.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    cells.get(i).add(value == null || value.isEmpty() ? null : value);
                }
            }

            DataTable.Builder table = DataTable.builder();
            for (int i = 0; i < header.size(); i++) {
                String name = header.get(i);
                ColumnType type = schema.map(s -> s.typeOf(name)).orElse(ColumnType.STRING);
                table.column(typed(datasetName, name, type, cells.get(i)));
            }
            return Optional.of(table.build());
        }
    }

    /** Applies the declared type, keeping the column as text when a value does not parse. */
    static Column typed(String datasetName, String name, ColumnType type, List<String> raw) {
        if (type == ColumnType.STRING) {
            return Column.of(name, ColumnType.STRING, raw);
        }
        List<Object> values = new ArrayList<>(raw.size());
        try {
            for (String text : raw) {
                values.add(text == null ? null : parse(type, text.trim()));
            }
            return Column.of(name, type, values);
        } catch (NumberFormatException e) {
            log.warn("[EXTRACT] {}.{}: cannot apply type {} ({}); kept as text",
                    datasetName, name, type, e.getMessage());
            return Column.of(name, ColumnType.STRING, raw);
        }
    }

    private static Object parse(ColumnType type, String text) {
        switch (type) {
            case LONG:
                return parseLong(text);
            case DOUBLE:
                return Double.parseDouble(text);
            case BOOLEAN:
                return Boolean.parseBoolean(text);
            default:
                return text;
        }
    }

    /** Accepts integral decimals such as {@code 3.0}, as the export writes some counts that way. */
    private static Long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            double value = Double.parseDouble(text);
            if (value != Math.rint(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("not an integer: \"" + text + "\"");
            }
            return (long) value;
        }
    }

    private static void logVolume(DataTable table, String datasetName) {
        log.info("[EXTRACT] {}: {} rows | {} columns | {} missing values",
                datasetName.toUpperCase(Locale.ROOT),
                String.format(Locale.ROOT, "%,d", table.rowCount()),
                table.columnCount(),
                String.format(Locale.ROOT, "%,d", table.missingValueCount()));
    }
}
