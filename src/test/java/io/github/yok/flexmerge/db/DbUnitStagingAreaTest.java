package io.github.yok.flexmerge.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexmerge.core.BulkLoadException;
import io.github.yok.flexmerge.testutil.H2Database;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbUnitStagingAreaTest {

    private H2Database db;
    private DbUnitStagingArea staging;

    @BeforeEach
    void setUp() throws Exception {
        db = H2Database.create();
        H2DialectHandler dialect = new H2DialectHandler(new DbUnitConfigFactory());
        staging = new DbUnitStagingArea(
                new DriverManagerConnectionProvider(db.entry("h2"), dialect), dialect,
                new SqlStatementBuilder(dialect), "PUBLIC");
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void allocateName_正常ケース_接頭辞を指定する_プロセスIDと時刻を含む大文字の名前が返ること() throws Exception {
        String name = staging.allocateName("stg_merge_");

        assertTrue(name.matches("STG_MERGE_" + ProcessHandle.current().pid() + "_\\d+"), name);
    }

    @Test
    void createLoadDrop_正常ケース_ステージング表を作成して投入する_行が格納され削除後は残らないこと() throws Exception {
        String name = staging.allocateName("stg_merge_");
        List<String> columns = Arrays.asList("LOCATOR", "FLIGHT_ID", "SEAT");

        staging.create(name, "RESERVATION", columns);
        staging.load(name, columns, Arrays.asList(new Object[] {"AB123", 5L, "12B"},
                new Object[] {"CD456", 6L, null}));

        assertEquals(2, db.count(name));
        assertEquals("12B", db.queryString("SELECT SEAT FROM " + name + " WHERE LOCATOR = 'AB123'"));
        assertEquals(0, db.count("reservation"));

        staging.drop(name);
        assertFalse(db.tableNames().contains(name));
    }

    @Test
    void load_異常ケース_存在しない表に投入する_BulkLoadExceptionが送出されること() {
        BulkLoadException ex = assertThrows(BulkLoadException.class,
                () -> staging.load("STG_MERGE_MISSING", Collections.singletonList("LOCATOR"),
                        Collections.singletonList(new Object[] {"AB123"})));
        assertTrue(ex.getMessage().startsWith("Failed to load staging table STG_MERGE_MISSING"));
    }
}
