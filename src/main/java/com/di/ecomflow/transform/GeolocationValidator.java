package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags geolocation rows inside Brazil's bounding box. Rows are never dropped.
 */
@Slf4j
@Component
public class GeolocationValidator {

    public static final String IS_VALID_COORDINATE = "is_valid_coordinate";

    static final double MIN_LAT = -33.0;
    static final double MAX_LAT = 5.0;
    static final double MIN_LNG = -73.0;
    static final double MAX_LNG = -32.0;

    public DataTable validate(DataTable geolocation) {
        if (!geolocation.hasColumn("geolocation_lat") || !geolocation.hasColumn("geolocation_lng")) {
            log.warn("Geolocation has no latitude/longitude columns; coordinates not validated");
            return geolocation;
        }
        Column lat = geolocation.column("geolocation_lat");
        Column lng = geolocation.column("geolocation_lng");
        List<Boolean> flags = new ArrayList<>(geolocation.rowCount());
        int valid = 0;
        for (int row = 0; row < geolocation.rowCount(); row++) {
            boolean inside = isInsideBrazil(lat.getDouble(row), lng.getDouble(row));
            flags.add(inside);
            if (inside) {
                valid++;
            }
        }
        DataTable result = geolocation.withColumn(Column.of(IS_VALID_COORDINATE, ColumnType.BOOLEAN, flags));
        if (result.rowCount() > 0) {
            log.info("Valid coordinates: {} / {} ({}%)", valid, result.rowCount(),
                    String.format("%.1f", valid * 100.0 / result.rowCount()));
        }
        return result;
    }

    static boolean isInsideBrazil(Double lat, Double lng) {
        return lat != null && lng != null
                && lat >= MIN_LAT && lat <= MAX_LAT
                && lng >= MIN_LNG && lng <= MAX_LNG;
    }
}
