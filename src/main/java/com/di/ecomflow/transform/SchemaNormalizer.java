package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Column-name standardisation and per-dataset missing-value policy.
 *
 * <ul>
 *   <li>{@code products}: missing category name becomes {@value #UNKNOWN}; numeric
 *       dimension and weight columns stay null.</li>
 *   <li>{@code order_reviews}: missing comment title or message becomes the empty string.</li>
 *   <li>{@code orders}: delivery dates stay null (not yet delivered).</li>
 *   <li>any other text column: remaining nulls become {@value #UNKNOWN}.</li>
 * </ul>
 * Registered date columns are never filled, whatever their current type.
 * Unknown dataset names only get the generic text rule.
 */
@Slf4j
@Component
public class SchemaNormalizer {

    public static final String UNKNOWN = "unknown";

    static final String STANDARDIZE_STAGE = "standardize_columns";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Dataset-specific fills, applied before the generic text rule. */
    private static final Map<String, Map<String, String>> DATASET_FILLS = Map.of(
            DatasetNames.PRODUCTS, Map.of("product_category_name", UNKNOWN),
            DatasetNames.ORDER_REVIEWS, Map.of(
                    "review_comment_title", "",
                    "review_comment_message", ""));

    /**
     * Lower-cases and trims every column name; inner whitespace runs become
     * an underscore.
     *
     * @throws TransformException when two raw names standardise to the same name
     */
    public DataTable standardizeColumns(DataTable table, String datasetName) {
        Map<String, String> seen = new HashMap<>();
        for (String raw : table.columnNames()) {
            String previous = seen.putIfAbsent(standardName(raw), raw);
            if (previous != null) {
                throw new TransformException(STANDARDIZE_STAGE, datasetName,
                        "columns '" + previous + "' and '" + raw + "' both standardise to '" + standardName(raw) + "'");
            }
        }
        DataTable renamed = table.renameColumns(SchemaNormalizer::standardName);
        log.debug("{}: columns standardised", datasetName);
        return renamed;
    }

    public DataTable handleMissingValues(DataTable table, String datasetName) {
        DataTable result = table;
        Map<String, String> fills = DATASET_FILLS.getOrDefault(datasetName, Map.of());
        for (Map.Entry<String, String> fill : fills.entrySet()) {
            if (result.hasColumn(fill.getKey()) && result.column(fill.getKey()).type() == ColumnType.STRING) {
                result = fillNulls(result, datasetName, fill.getKey(), fill.getValue());
            }
        }

        Set<String> dateColumns = Set.copyOf(DateConverter.DATE_COLUMNS.getOrDefault(datasetName, Collections.emptyList()));
        for (Column column : result.columns()) {
            if (column.type() == ColumnType.STRING && !dateColumns.contains(column.name())) {
                result = fillNulls(result, datasetName, column.name(), UNKNOWN);
            }
        }
        return result;
    }

    /** Standardises names, then applies the missing-value policy. */
    public DataTable normalize(DataTable table, String datasetName) {
        return handleMissingValues(standardizeColumns(table, datasetName), datasetName);
    }

    static String standardName(String raw) {
        return WHITESPACE.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    private static DataTable fillNulls(DataTable table, String datasetName, String columnName, String replacement) {
        Column column = table.column(columnName);
        long nulls = column.nullCount();
        if (nulls == 0) {
            return table;
        }
        List<Object> filled = new ArrayList<>(column.values());
        filled.replaceAll(value -> value == null ? replacement : value);
        log.debug("{}.{}: {} null values replaced by '{}'", datasetName, columnName, nulls, replacement);
        return table.withColumn(Column.of(columnName, column.type(), filled));
    }
}
