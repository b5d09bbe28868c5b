package io.github.yok.flexmerge.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexmerge.core.SchemaFetchException;
import io.github.yok.flexmerge.core.TableSchema;
import io.github.yok.flexmerge.testutil.H2Database;
import java.sql.Connection;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcSchemaSourceTest {

    private H2Database db;
    private Connection conn;

    @BeforeEach
    void setUp() throws Exception {
        db = H2Database.create();
        conn = db.open();
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
        db.close();
    }

    @Test
    void fetch_正常ケース_小文字の表名を指定する_カタログ表記の列が順序通り返ること() throws Exception {
        TableSchema schema = new JdbcSchemaSource(conn, "public").fetch("gate");

        assertEquals("GATE", schema.getTableName());
        assertEquals(Arrays.asList("ID", "TERMINAL_ID", "CODE", "ACTIVE"), schema.getColumns());
        assertTrue(schema.hasColumn("terminal_id"));
    }

    @Test
    void fetch_正常ケース_生成列を含む表_生成列が除外されること() throws Exception {
        db.execute("CREATE TABLE seat_map (id BIGINT PRIMARY KEY, seat_row INT,"
                + " seat_letter VARCHAR(1),"
                + " label VARCHAR(10) GENERATED ALWAYS AS"
                + " (CAST(seat_row AS VARCHAR) || seat_letter))");

        TableSchema schema = new JdbcSchemaSource(conn, "PUBLIC").fetch("seat_map");

        assertEquals(Arrays.asList("ID", "SEAT_ROW", "SEAT_LETTER"), schema.getColumns());
    }

    @Test
    void fetch_正常ケース_アンダースコアが別の表にも一致する_指定した表の列だけが返ること() throws Exception {
        db.execute("CREATE TABLE boardingXpass (id BIGINT PRIMARY KEY, extra VARCHAR(5))");

        TableSchema schema = new JdbcSchemaSource(conn, "PUBLIC").fetch("boarding_pass");

        assertEquals("BOARDING_PASS", schema.getTableName());
        assertEquals(Arrays.asList("ID", "RESERVATION_ID", "ISSUED_AT"), schema.getColumns());
    }

    @Test
    void fetch_正常ケース_スキーマを指定しない_全スキーマから表が見つかること() throws Exception {
        TableSchema schema = new JdbcSchemaSource(conn, null).fetch("Passenger");

        assertEquals("PASSENGER", schema.getTableName());
        assertEquals(3, schema.getColumns().size());
    }

    @Test
    void fetch_異常ケース_存在しない表を指定する_SchemaFetchExceptionが送出されること() {
        SchemaFetchException ex = assertThrows(SchemaFetchException.class,
                () -> new JdbcSchemaSource(conn, "PUBLIC").fetch("ghost"));
        assertEquals("ghost", ex.getTable());
        assertEquals("Table not found or has no columns: ghost", ex.getMessage());
    }
}
