package io.github.yok.flexmerge.db;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import io.github.yok.flexmerge.config.DbUnitConfigProperties;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConfigFactoryTest {

    @Test
    void configure_正常ケース_プロパティを指定する_全設定が反映されること() {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setAllowEmptyFields(false);
        props.setBatchedStatements(false);
        props.setBatchSize(50);
        DatabaseConfig cfg = mock(DatabaseConfig.class);
        IDataTypeFactory dtf = mock(IDataTypeFactory.class);

        new DbUnitConfigFactory(props).configure(cfg, dtf, "`?`");

        verify(cfg).setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dtf);
        verify(cfg).setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, "`?`");
        verify(cfg).setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, false);
        verify(cfg).setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, false);
        verify(cfg).setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, 50);
    }

    @Test
    void configure_正常ケース_引数なしで生成する_既定値が反映されること() {
        DatabaseConfig cfg = mock(DatabaseConfig.class);
        IDataTypeFactory dtf = mock(IDataTypeFactory.class);

        new DbUnitConfigFactory().configure(cfg, dtf, "\"?\"");

        verify(cfg).setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, true);
        verify(cfg).setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, true);
        verify(cfg).setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, 500);
    }
}
