package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds delivery metrics to {@code orders}, in whole days rounded down:
 * <ul>
 *   <li>{@value #DELIVERY_TIME_DAYS}: delivered minus purchase, null outside [0, 365];</li>
 *   <li>{@value #DELIVERY_DELAY_DAYS}: delivered minus estimated, negative when early, never suppressed.</li>
 * </ul>
 * A missing input date gives a null result. Either metric is omitted when one of
 * its source columns is absent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryMetricCalculator {

    public static final String PURCHASE = "order_purchase_timestamp";
    public static final String DELIVERED = "order_delivered_customer_date";
    public static final String ESTIMATED = "order_estimated_delivery_date";
    public static final String DELIVERY_TIME_DAYS = "delivery_time_days";
    public static final String DELIVERY_DELAY_DAYS = "delivery_delay_days";

    static final long MAX_DELIVERY_DAYS = 365;

    private static final long SECONDS_PER_DAY = 86_400L;

    private final DateConverter dateConverter;

    public DataTable calculate(DataTable orders) {
        DataTable result = dateConverter.convertDates(orders, List.of(PURCHASE, DELIVERED, ESTIMATED));

        if (result.hasColumn(DELIVERED) && result.hasColumn(PURCHASE)) {
            Column purchase = result.column(PURCHASE);
            Column delivered = result.column(DELIVERED);
            List<Long> days = new ArrayList<>(result.rowCount());
            int suppressed = 0;
            for (int row = 0; row < result.rowCount(); row++) {
                Long value = daysBetween(purchase.getDateTime(row), delivered.getDateTime(row));
                if (value != null && (value < 0 || value > MAX_DELIVERY_DAYS)) {
                    suppressed++;
                    value = null;
                }
                days.add(value);
            }
            result = result.withColumn(Column.of(DELIVERY_TIME_DAYS, ColumnType.LONG, days));
            long valid = days.stream().filter(d -> d != null).count();
            log.info("Delivery time computed for {} delivered orders", valid);
            if (suppressed > 0) {
                log.info("Delivery time outliers suppressed: {} (outside 0..{} days)", suppressed, MAX_DELIVERY_DAYS);
            }
        }

        if (result.hasColumn(ESTIMATED) && result.hasColumn(DELIVERED)) {
            Column estimated = result.column(ESTIMATED);
            Column delivered = result.column(DELIVERED);
            List<Long> delay = new ArrayList<>(result.rowCount());
            for (int row = 0; row < result.rowCount(); row++) {
                delay.add(daysBetween(estimated.getDateTime(row), delivered.getDateTime(row)));
            }
            result = result.withColumn(Column.of(DELIVERY_DELAY_DAYS, ColumnType.LONG, delay));
            log.debug("Delivery delay against estimate computed");
        }
        return result;
    }

    /** Whole days from {@code start} to {@code end}, rounded toward negative infinity. */
    static Long daysBetween(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            return null;
        }
        return Math.floorDiv(Duration.between(start, end).getSeconds(), SECONDS_PER_DAY);
    }
}
