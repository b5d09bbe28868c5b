package io.github.yok.flexmerge.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.config.DialectMode;
import io.github.yok.flexmerge.config.MergeConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbDialectHandlerFactoryTest {

    private MergeConfig mergeConfig;
    private DbDialectHandlerFactory factory;

    @BeforeEach
    void setUp() {
        mergeConfig = new MergeConfig();
        factory = new DbDialectHandlerFactory(mergeConfig, new DbUnitConfigFactory());
    }

    private static ConnectionConfig.Entry entry(String url) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("airport");
        entry.setUrl(url);
        return entry;
    }

    @Test
    void create_正常ケース_MySQLURLを指定する_MySqlDialectHandlerが返ること() {
        assertInstanceOf(MySqlDialectHandler.class,
                factory.create(entry("jdbc:mysql://localhost:3306/airport")));
    }

    @Test
    void create_正常ケース_PostgreSQLURLを指定する_PostgresqlDialectHandlerが返ること() {
        assertInstanceOf(PostgresqlDialectHandler.class,
                factory.create(entry("jdbc:postgresql://localhost:5432/airport")));
    }

    @Test
    void create_正常ケース_H2URLを指定する_H2DialectHandlerが返ること() {
        assertInstanceOf(H2DialectHandler.class, factory.create(entry("jdbc:h2:mem:airport")));
    }

    @Test
    void create_正常ケース_方言を明示する_URLより設定が優先されること() {
        mergeConfig.setDialect(DialectMode.H2);
        assertInstanceOf(H2DialectHandler.class,
                factory.create(entry("jdbc:mysql://localhost:3306/airport")));
    }

    @Test
    void inferFromUrl_異常ケース_未対応のURLを指定する_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DbDialectHandlerFactory.inferFromUrl("jdbc:oracle:thin:@localhost:1521"));
        assertEquals("Cannot infer dialect from URL: jdbc:oracle:thin:@localhost:1521."
                + " Set 'merge.dialect'.", ex.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> DbDialectHandlerFactory.inferFromUrl(null));
    }
}
