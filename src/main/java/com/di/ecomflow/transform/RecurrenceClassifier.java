package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts distinct orders per {@code customer_unique_id} and writes
 * {@value #TOTAL_ORDERS} and {@value #IS_RECURRING} onto every customer row.
 * Customers without orders get 0 and false.
 */
@Slf4j
@Component
public class RecurrenceClassifier {

    public static final String TOTAL_ORDERS = "total_orders";
    public static final String IS_RECURRING = "is_recurring_customer";

    private static final String STAGE = "recurring_customers";

    public DataTable classify(DataTable orders, DataTable customers) {
        TransformException.requireColumns(STAGE, DatasetNames.ORDERS, orders, "order_id", "customer_id");
        TransformException.requireColumns(STAGE, DatasetNames.CUSTOMERS, customers, "customer_id", "customer_unique_id");

        Column customerId = customers.column("customer_id");
        Column uniqueId = customers.column("customer_unique_id");
        Map<Object, Object> uniqueIdByCustomer = new HashMap<>();
        for (int row = 0; row < customers.rowCount(); row++) {
            if (customerId.get(row) != null) {
                uniqueIdByCustomer.putIfAbsent(customerId.get(row), uniqueId.get(row));
            }
        }

        Column orderId = orders.column("order_id");
        Column orderCustomer = orders.column("customer_id");
        Map<Object, Set<Object>> ordersByUniqueId = new HashMap<>();
        for (int row = 0; row < orders.rowCount(); row++) {
            Object unique = orderCustomer.get(row) == null ? null : uniqueIdByCustomer.get(orderCustomer.get(row));
            if (unique != null && orderId.get(row) != null) {
                ordersByUniqueId.computeIfAbsent(unique, k -> new HashSet<>()).add(orderId.get(row));
            }
        }

        List<Long> totals = new ArrayList<>(customers.rowCount());
        List<Boolean> recurring = new ArrayList<>(customers.rowCount());
        int recurringCustomers = 0;
        for (int row = 0; row < customers.rowCount(); row++) {
            Set<Object> placed = uniqueId.get(row) == null ? null : ordersByUniqueId.get(uniqueId.get(row));
            long total = placed == null ? 0L : placed.size();
            totals.add(total);
            recurring.add(total > 1);
            if (total > 1) {
                recurringCustomers++;
            }
        }

        DataTable result = customers
                .withColumn(Column.of(TOTAL_ORDERS, ColumnType.LONG, totals))
                .withColumn(Column.of(IS_RECURRING, ColumnType.BOOLEAN, recurring));
        log.info("Recurring customers identified: {}", recurringCustomers);
        return result;
    }
}
