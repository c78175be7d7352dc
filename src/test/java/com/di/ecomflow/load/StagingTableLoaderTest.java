package com.di.ecomflow.load;

import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.transform.DatasetNames;
import com.di.ecomflow.transform.DateConverter;
import com.di.ecomflow.transform.OlistFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StagingTableLoader Tests")
class StagingTableLoaderTest {

    private static final String SELLERS_INSERT = "INSERT INTO staging.sellers "
            + "(seller_id, seller_zip_code_prefix, seller_city, seller_state, source, load_timestamp) "
            + "VALUES (?, ?, ?, ?, ?, ?)";

    @Mock
    private JdbcTemplate jdbc;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<List<Object[]>> batchCaptor;

    private PipelineProperties properties;
    private StagingTableLoader loader;
    private final Timestamp loadTimestamp = Timestamp.valueOf(LocalDateTime.of(2024, 3, 1, 12, 0));

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        loader = new StagingTableLoader(jdbc, new TransactionTemplate(transactionManager), properties);
    }

    private StagingTableSpec spec(String dataset) {
        return StagingTableSpec.forDataset(dataset).orElseThrow();
    }

    // ============================================================================
    // Single table
    // ============================================================================

    @Test
    @DisplayName("Previous rows of the source are deleted before inserting")
    void testLoadTable_ReplacesSource() {
        int rows = loader.loadTable(spec(DatasetNames.SELLERS), OlistFixtures.sellers(), "csv", loadTimestamp);

        assertEquals(2, rows);
        verify(jdbc).update("DELETE FROM staging.sellers WHERE source = ?", "csv");
        verify(jdbc).batchUpdate(eq(SELLERS_INSERT), batchCaptor.capture());
        Object[] first = batchCaptor.getValue().get(0);
        assertArrayEquals(new Object[]{"s1", 3003L, "campinas", "SP", "csv", loadTimestamp}, first);
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("Duplicate keys keep the last row")
    void testLoadTable_LastWriteWins() {
        DataTable sellers = DataTable.builder()
                .column("seller_id", ColumnType.STRING, "s1", "s2", "s1")
                .column("seller_city", ColumnType.STRING, "campinas", "curitiba", "sorocaba")
                .build();

        int rows = loader.loadTable(spec(DatasetNames.SELLERS), sellers, "csv", loadTimestamp);

        assertEquals(2, rows);
        verify(jdbc).batchUpdate(anyString(), batchCaptor.capture());
        assertEquals("sorocaba", batchCaptor.getValue().get(0)[1]);
        assertEquals("s2", batchCaptor.getValue().get(1)[0]);
    }

    @Test
    @DisplayName("Only known columns are inserted")
    void testLoadTable_KnownColumnsOnly() {
        DataTable sellers = OlistFixtures.sellers()
                .withColumn(Column.of("note", ColumnType.STRING, "a", "b"));

        loader.loadTable(spec(DatasetNames.SELLERS), sellers, "csv", loadTimestamp);

        verify(jdbc).batchUpdate(eq(SELLERS_INSERT), anyList());
    }

    @Test
    @DisplayName("Rows are written in batches of the configured size")
    void testLoadTable_Batches() {
        properties.setBatchSize(1);

        loader.loadTable(spec(DatasetNames.SELLERS), OlistFixtures.sellers(), "csv", loadTimestamp);

        verify(jdbc, times(2)).batchUpdate(eq(SELLERS_INSERT), anyList());
    }

    @Test
    @DisplayName("Converted dates are written as timestamps")
    void testLoadTable_Timestamps() {
        DataTable orders = new DateConverter().convertRegistered(OlistFixtures.orders(), DatasetNames.ORDERS);

        loader.loadTable(spec(DatasetNames.ORDERS), orders, "csv", loadTimestamp);

        verify(jdbc).batchUpdate(anyString(), batchCaptor.capture());
        Object[] first = batchCaptor.getValue().get(0);
        assertEquals(Timestamp.valueOf(LocalDateTime.of(2017, 10, 2, 10, 0)), first[3]);
        assertNull(batchCaptor.getValue().get(2)[6]);
    }

    @Test
    @DisplayName("Empty table writes nothing")
    void testLoadTable_EmptyTable() {
        DataTable empty = DataTable.builder().column("seller_id", ColumnType.STRING).build();

        assertEquals(0, loader.loadTable(spec(DatasetNames.SELLERS), empty, "csv", loadTimestamp));
        verifyNoInteractions(jdbc);
    }

    @Test
    @DisplayName("Table without any expected column writes nothing")
    void testLoadTable_NoKnownColumns() {
        DataTable other = DataTable.builder().column("x", ColumnType.STRING, "1").build();

        assertEquals(0, loader.loadTable(spec(DatasetNames.SELLERS), other, "csv", loadTimestamp));
        verifyNoInteractions(jdbc);
    }

    @Test
    @DisplayName("Database failure is reported with the staging table")
    void testLoadTable_DatabaseFailure() {
        when(jdbc.batchUpdate(anyString(), anyList())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        LoadException e = assertThrows(LoadException.class,
                () -> loader.loadTable(spec(DatasetNames.SELLERS), OlistFixtures.sellers(), "csv", loadTimestamp));
        assertEquals("staging.sellers", e.getTable());
        assertInstanceOf(DataIntegrityViolationException.class, e.getCause());
        verify(transactionManager).rollback(any());
    }

    // ============================================================================
    // All tables
    // ============================================================================

    @Test
    @DisplayName("Only entity datasets are staged")
    void testLoad_EntityDatasetsOnly() {
        Map<String, DataTable> datasets = new LinkedHashMap<>();
        datasets.put(DatasetNames.SELLERS, OlistFixtures.sellers());
        datasets.put(DatasetNames.CATEGORY_TRANSLATION, OlistFixtures.categoryTranslation());
        datasets.put(DatasetNames.CUSTOMERS, OlistFixtures.customers());

        Map<String, Integer> loaded = loader.load(datasets, "csv");

        assertEquals(Map.of("staging.sellers", 2, "staging.customers", 3), loaded);
        assertEquals(List.of("staging.sellers", "staging.customers"), List.copyOf(loaded.keySet()));
    }
}
