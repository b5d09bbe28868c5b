package io.github.yok.flexmerge.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import io.github.yok.flexmerge.config.ConnectionConfig;
import java.util.Arrays;
import java.util.Collections;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class PostgresqlDialectHandlerTest {

    private final PostgresqlDialectHandler handler =
            new PostgresqlDialectHandler(mock(DbUnitConfigFactory.class));

    @Test
    void buildNaturalKeyUpdateSql_正常ケース_複合キーを指定する_FROM句付きUPDATE文が返ること() {
        String sql = handler.buildNaturalKeyUpdateSql("reservation", "stg_merge_1_2",
                Arrays.asList("locator", "flight_id"), Arrays.asList("seat"), "updated_at");

        assertEquals("UPDATE \"reservation\" AS d SET \"seat\" = s.\"seat\","
                + " \"updated_at\" = CURRENT_TIMESTAMP FROM \"stg_merge_1_2\" AS s"
                + " WHERE d.\"locator\" = s.\"locator\" AND d.\"flight_id\" = s.\"flight_id\"", sql);
    }

    @Test
    void buildNaturalKeyUpdateSql_正常ケース_更新日時列なし_可変列だけが設定されること() {
        String sql = handler.buildNaturalKeyUpdateSql("reservation", "stg",
                Collections.singletonList("locator"), Arrays.asList("seat", "status"), null);

        assertEquals("UPDATE \"reservation\" AS d SET \"seat\" = s.\"seat\","
                + " \"status\" = s.\"status\" FROM \"stg\" AS s"
                + " WHERE d.\"locator\" = s.\"locator\"", sql);
    }

    @Test
    void requiresSavepointPerRow_正常ケース_trueが返ること() {
        assertTrue(handler.requiresSavepointPerRow());
        assertEquals("public", handler.resolveSchema(new ConnectionConfig.Entry()));
        assertInstanceOf(PostgresqlDataTypeFactory.class, handler.getDataTypeFactory());
    }
}
