package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.DbUnitConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Applies the application-wide settings to DBUnit's {@link DatabaseConfig} before a staging
 * table is bulk-loaded.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    private final DbUnitConfigProperties props;

    /**
     * Creates a factory bound to the configured properties.
     *
     * @param props DBUnit settings
     */
    @Autowired
    public DbUnitConfigFactory(DbUnitConfigProperties props) {
        this.props = props;
    }

    /**
     * Creates a factory with default properties, for use outside the Spring container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies the settings to the given {@link DatabaseConfig}.
     *
     * @param cfg DBUnit configuration
     * @param dataTypeFactory vendor-specific datatype factory
     * @param escapePattern identifier escape pattern, e.g. {@code "?"} in double quotes
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory,
            String escapePattern) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escapePattern);
        log.debug("DBUnit: escape pattern = {}", escapePattern);

        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batched statements = {}, batch size = {}", props.isBatchedStatements(),
                props.getBatchSize());
    }
}
