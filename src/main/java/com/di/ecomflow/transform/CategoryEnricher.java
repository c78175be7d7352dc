package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.table.TableOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds {@value #ENGLISH_CATEGORY} to products by left-joining the category
 * translation lookup. Fill order: translation, then the original category
 * name, then {@value SchemaNormalizer#UNKNOWN}.
 */
@Slf4j
@Component
public class CategoryEnricher {

    public static final String CATEGORY = "product_category_name";
    public static final String ENGLISH_CATEGORY = "product_category_name_english";

    private static final String STAGE = "enrich_products";

    public DataTable enrich(DataTable products, DataTable translation) {
        TransformException.requireColumns(STAGE, DatasetNames.PRODUCTS, products, CATEGORY);
        TransformException.requireColumns(STAGE, DatasetNames.CATEGORY_TRANSLATION, translation, CATEGORY);

        DataTable lookup = translation.hasColumn(ENGLISH_CATEGORY)
                ? translation.select(List.of(CATEGORY, ENGLISH_CATEGORY))
                : translation.select(List.of(CATEGORY))
                        .withColumn(Column.nulls(ENGLISH_CATEGORY, ColumnType.STRING, translation.rowCount()));
        // one translation per category keeps products one row per product_id
        lookup = TableOperations.distinctBy(lookup, CATEGORY);

        DataTable joined = TableOperations.leftJoin(products.withoutColumns(ENGLISH_CATEGORY), lookup, CATEGORY);

        Column original = joined.column(CATEGORY);
        Column english = joined.column(ENGLISH_CATEGORY);
        List<String> resolved = new ArrayList<>(joined.rowCount());
        int translated = 0;
        for (int row = 0; row < joined.rowCount(); row++) {
            String value = english.getString(row);
            if (value != null) {
                translated++;
            } else {
                value = original.getString(row);
            }
            resolved.add(value != null ? value : SchemaNormalizer.UNKNOWN);
        }
        DataTable enriched = joined.withColumn(Column.of(ENGLISH_CATEGORY, ColumnType.STRING, resolved));
        log.info("Products enriched: {} of {} categories translated", translated, enriched.rowCount());
        return enriched;
    }
}
