package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.table.TableOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reduces {@code order_items} to one row per order:
 * summed price and freight, item count, highest item sequence and
 * {@code order_total_value = total price + total freight}.
 * Orders without items do not appear.
 */
@Slf4j
@Component
public class OrderMetricAggregator {

    public static final String ORDER_ID = "order_id";
    public static final String TOTAL_PRICE = "order_items_total_price";
    public static final String TOTAL_FREIGHT = "order_items_total_freight";
    public static final String ITEMS_COUNT = "order_items_count";
    public static final String MAX_ITEM_ID = "order_max_item_id";
    public static final String TOTAL_VALUE = "order_total_value";

    private static final String STAGE = "order_metrics";

    public DataTable aggregate(DataTable orderItems) {
        TransformException.requireColumns(STAGE, DatasetNames.ORDER_ITEMS, orderItems, ORDER_ID, "price", "freight_value");

        Map<Object, List<Integer>> groups = TableOperations.groupRows(orderItems, ORDER_ID);
        Column price = orderItems.column("price");
        Column freight = orderItems.column("freight_value");
        Column product = orderItems.findColumn("product_id").orElse(null);
        Column itemId = orderItems.findColumn("order_item_id").orElse(null);

        List<Object> orderIds = new ArrayList<>(groups.size());
        List<Double> totalPrice = new ArrayList<>(groups.size());
        List<Double> totalFreight = new ArrayList<>(groups.size());
        List<Long> itemsCount = new ArrayList<>(groups.size());
        List<Long> maxItemId = new ArrayList<>(groups.size());
        List<Double> totalValue = new ArrayList<>(groups.size());

        for (Map.Entry<Object, List<Integer>> group : groups.entrySet()) {
            List<Integer> rows = group.getValue();
            double priceSum = sum(price, rows);
            double freightSum = sum(freight, rows);
            orderIds.add(group.getKey());
            totalPrice.add(priceSum);
            totalFreight.add(freightSum);
            itemsCount.add(product == null ? rows.size() : countPresent(product, rows));
            maxItemId.add(itemId == null ? null : max(itemId, rows));
            totalValue.add(priceSum + freightSum);
        }

        DataTable.Builder metrics = DataTable.builder()
                .column(ORDER_ID, orderItems.column(ORDER_ID).type(), orderIds)
                .column(TOTAL_PRICE, ColumnType.DOUBLE, totalPrice)
                .column(TOTAL_FREIGHT, ColumnType.DOUBLE, totalFreight)
                .column(ITEMS_COUNT, ColumnType.LONG, itemsCount);
        if (itemId != null) {
            metrics.column(MAX_ITEM_ID, ColumnType.LONG, maxItemId);
        }
        DataTable result = metrics.column(TOTAL_VALUE, ColumnType.DOUBLE, totalValue).build();

        log.info("Order metrics computed for {} orders", result.rowCount());
        if (result.rowCount() > 0) {
            double mean = totalValue.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            log.info("Average order total value: R$ {}", String.format("%.2f", mean));
        }
        return result;
    }

    /** Sum of the present values; a group with none sums to 0.0. */
    static double sum(Column column, List<Integer> rows) {
        double total = 0.0;
        for (int row : rows) {
            Double value = column.getDouble(row);
            if (value != null) {
                total += value;
            }
        }
        return total;
    }

    static long countPresent(Column column, List<Integer> rows) {
        long count = 0;
        for (int row : rows) {
            if (!column.isNull(row)) {
                count++;
            }
        }
        return count;
    }

    static Long max(Column column, List<Integer> rows) {
        Long max = null;
        for (int row : rows) {
            Long value = column.getLong(row);
            if (value != null && (max == null || value > max)) {
                max = value;
            }
        }
        return max;
    }
}
