package com.di.ecomflow.load;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Referential integrity of {@code analytics.fact_orders} against its dimensions.
 * A check passes when no fact row points at a missing dimension row; null keys
 * are counted separately.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class IntegrityVerifier {

    record ForeignKey(String column, String dimensionTable) {
    }

    static final List<ForeignKey> FOREIGN_KEYS = List.of(
            new ForeignKey("time_id", "analytics.dim_time"),
            new ForeignKey("customer_key", "analytics.dim_customers"),
            new ForeignKey("product_key", "analytics.dim_products"),
            new ForeignKey("seller_key", "analytics.dim_sellers"),
            new ForeignKey("geography_key", "analytics.dim_geography"));

    private final JdbcTemplate jdbcTemplate;

    public List<IntegrityCheckResult> verify() {
        List<IntegrityCheckResult> results = new ArrayList<>(FOREIGN_KEYS.size());
        for (ForeignKey foreignKey : FOREIGN_KEYS) {
            results.add(check(foreignKey));
        }
        long failed = results.stream().filter(r -> !r.isPassed()).count();
        if (failed > 0) {
            log.warn("[VALIDATE] {} of {} foreign key checks failed", failed, results.size());
        } else {
            log.info("[VALIDATE] All {} foreign key checks passed", results.size());
        }
        return results;
    }

    IntegrityCheckResult check(ForeignKey foreignKey) {
        String sql = countSql(foreignKey);
        RowMapper<IntegrityCheckResult> mapper = (rs, n) -> {
            long total = rs.getLong("total_rows");
            long missing = total - rs.getLong("with_key");
            long orphans = rs.getLong("orphan_rows");
            return summarize(foreignKey, total, orphans, missing);
        };
        try {
            return jdbcTemplate.queryForObject(sql, mapper);
        } catch (DataAccessException e) {
            throw new LoadException("analytics.fact_orders", "integrity check on " + foreignKey.column() + " failed", e);
        }
    }

    static String countSql(ForeignKey foreignKey) {
        String column = foreignKey.column();
        return """
                SELECT COUNT(*) AS total_rows,
                       COUNT(fo.%1$s) AS with_key,
                       COUNT(*) FILTER (WHERE fo.%1$s IS NOT NULL AND d.%1$s IS NULL) AS orphan_rows
                FROM analytics.fact_orders fo
                LEFT JOIN %2$s d ON fo.%1$s = d.%1$s
                """.formatted(column, foreignKey.dimensionTable());
    }

    static IntegrityCheckResult summarize(ForeignKey foreignKey, long total, long orphans, long missing) {
        boolean passed = orphans == 0;
        String detail = String.format("%s -> %s: total=%,d orphans=%,d missing=%,d -> %s",
                foreignKey.column(), foreignKey.dimensionTable(), total, orphans, missing,
                passed ? "PASS" : "FAIL");
        log.info("[VALIDATE] {}", detail);
        return IntegrityCheckResult.builder()
                .foreignKey(foreignKey.column())
                .dimensionTable(foreignKey.dimensionTable())
                .totalRows(total)
                .orphanRows(orphans)
                .missingKeys(missing)
                .passed(passed)
                .detail(detail)
                .build();
    }
}
