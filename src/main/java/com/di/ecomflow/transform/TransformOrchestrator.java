package com.di.ecomflow.transform;

import com.di.ecomflow.aspect.LogTransaction;
import com.di.ecomflow.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the transform over a dataset mapping, strictly in this order:
 * normalise names, handle missing values, convert registered dates, then the
 * guarded steps of {@link #steps()}. A step whose input tables are not all
 * available is skipped, so partial input yields partial output.
 *
 * <p>The input mapping and its tables are never modified. The returned mapping
 * holds {@code order_metrics} and {@code fact_orders} (when built) followed by
 * every input dataset in its transformed form.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransformOrchestrator {

    private final SchemaNormalizer schemaNormalizer;
    private final DateConverter dateConverter;
    private final CategoryEnricher categoryEnricher;
    private final OrderMetricAggregator orderMetricAggregator;
    private final DeliveryMetricCalculator deliveryMetricCalculator;
    private final RecurrenceClassifier recurrenceClassifier;
    private final GeolocationValidator geolocationValidator;
    private final FactTableBuilder factTableBuilder;

    @LogTransaction(eventType = "TRANSFORM", transactionContext = "transform_all")
    public Map<String, DataTable> transformAll(Map<String, DataTable> datasets) {
        log.info("[TRANSFORM] Starting transform of {} datasets: {}", datasets.size(), datasets.keySet());
        long start = System.currentTimeMillis();

        Map<String, DataTable> working = new LinkedHashMap<>(datasets);

        log.info("[TRANSFORM] Standardising columns...");
        working.replaceAll((name, table) -> schemaNormalizer.standardizeColumns(table, name));

        log.info("[TRANSFORM] Handling missing values...");
        working.replaceAll((name, table) -> schemaNormalizer.handleMissingValues(table, name));

        log.info("[TRANSFORM] Converting dates...");
        working.replaceAll((name, table) -> dateConverter.convertRegistered(table, name));

        for (TransformStep step : steps()) {
            if (step.isRunnable(working)) {
                log.info("[TRANSFORM] Step {}", step.name());
                step.action().accept(working);
            } else {
                log.info("[TRANSFORM] Step {} skipped: requires {}", step.name(), step.requiredTables());
            }
        }

        Map<String, DataTable> transformed = new LinkedHashMap<>();
        for (String derived : List.of(DatasetNames.ORDER_METRICS, DatasetNames.FACT_ORDERS)) {
            DataTable table = working.remove(derived);
            if (table != null) {
                transformed.put(derived, table);
            }
        }
        transformed.putAll(working);

        log.info("[TRANSFORM] Completed in {} s: {} datasets", String.format("%.2f", (System.currentTimeMillis() - start) / 1000.0),
                transformed.size());
        return transformed;
    }

    /** The guarded steps, in execution order. */
    List<TransformStep> steps() {
        return List.of(
                new TransformStep("enrich_products",
                        List.of(DatasetNames.PRODUCTS, DatasetNames.CATEGORY_TRANSLATION),
                        tables -> tables.put(DatasetNames.PRODUCTS, categoryEnricher.enrich(
                                tables.get(DatasetNames.PRODUCTS), tables.get(DatasetNames.CATEGORY_TRANSLATION)))),
                new TransformStep("order_metrics",
                        List.of(DatasetNames.ORDER_ITEMS),
                        tables -> tables.put(DatasetNames.ORDER_METRICS,
                                orderMetricAggregator.aggregate(tables.get(DatasetNames.ORDER_ITEMS)))),
                new TransformStep("delivery_metrics",
                        List.of(DatasetNames.ORDERS),
                        tables -> tables.put(DatasetNames.ORDERS,
                                deliveryMetricCalculator.calculate(tables.get(DatasetNames.ORDERS)))),
                new TransformStep("recurring_customers",
                        List.of(DatasetNames.ORDERS, DatasetNames.CUSTOMERS),
                        tables -> tables.put(DatasetNames.CUSTOMERS, recurrenceClassifier.classify(
                                tables.get(DatasetNames.ORDERS), tables.get(DatasetNames.CUSTOMERS)))),
                new TransformStep("validate_geolocation",
                        List.of(DatasetNames.GEOLOCATION),
                        tables -> tables.put(DatasetNames.GEOLOCATION,
                                geolocationValidator.validate(tables.get(DatasetNames.GEOLOCATION)))),
                new TransformStep("fact_orders",
                        DatasetNames.FACT_REQUIRED,
                        tables -> tables.put(DatasetNames.FACT_ORDERS, factTableBuilder.build(tables)))
        );
    }
}
