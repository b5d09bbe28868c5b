package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.ConnectionConfig;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * Dialect handler for H2, used for local runs and tests.
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class H2DialectHandler implements DbDialectHandler {

    private final DbUnitConfigFactory configFactory;

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Builds a correlated update: H2 has neither {@code UPDATE ... JOIN} nor
     * {@code UPDATE ... FROM}.
     *
     * <pre>
     * UPDATE t d SET c = (SELECT s.c FROM stg s WHERE keys), ...
     *  WHERE EXISTS (SELECT 1 FROM stg s WHERE keys)
     * </pre>
     */
    @Override
    public String buildNaturalKeyUpdateSql(String targetTable, String stagingTable,
            List<String> keyColumns, List<String> setColumns, String updatedColumn) {
        String staging = quoteIdentifier(stagingTable);
        String join = joinOnKeys("d", "s", keyColumns);
        List<String> assignments = new ArrayList<>();
        for (String c : setColumns) {
            String q = quoteIdentifier(c);
            assignments.add(
                    q + " = (SELECT s." + q + " FROM " + staging + " s WHERE " + join + ")");
        }
        if (updatedColumn != null) {
            assignments.add(quoteIdentifier(updatedColumn) + " = " + getCurrentTimestampFunction());
        }
        return "UPDATE " + quoteIdentifier(targetTable) + " d SET " + String.join(", ", assignments)
                + " WHERE EXISTS (SELECT 1 FROM " + staging + " s WHERE " + join + ")";
    }

    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "PUBLIC";
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(connection, schema);
        DatabaseConfig config = dbConn.getConfig();
        configFactory.configure(config, getDataTypeFactory(), "\"?\"");
        // H2 2.x reports ordinary tables as BASE TABLE
        config.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE,
                new String[] {"TABLE", "BASE TABLE"});
        return dbConn;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return new H2DataTypeFactory();
    }
}
