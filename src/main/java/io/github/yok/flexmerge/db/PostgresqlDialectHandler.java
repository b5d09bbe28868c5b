package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.ConnectionConfig;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Dialect handler for PostgreSQL.
 *
 * <p>
 * A failed statement puts a PostgreSQL transaction into the aborted state, so row writes run
 * under a savepoint each ({@link #requiresSavepointPerRow()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class PostgresqlDialectHandler implements DbDialectHandler {

    private final DbUnitConfigFactory configFactory;

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Builds {@code UPDATE d SET c = s.c, ... FROM s WHERE keys}. Target columns in the
     * {@code SET} list must not be qualified.
     */
    @Override
    public String buildNaturalKeyUpdateSql(String targetTable, String stagingTable,
            List<String> keyColumns, List<String> setColumns, String updatedColumn) {
        List<String> assignments = new ArrayList<>();
        for (String c : setColumns) {
            String q = quoteIdentifier(c);
            assignments.add(q + " = s." + q);
        }
        if (updatedColumn != null) {
            assignments.add(quoteIdentifier(updatedColumn) + " = " + getCurrentTimestampFunction());
        }
        return "UPDATE " + quoteIdentifier(targetTable) + " AS d SET "
                + String.join(", ", assignments) + " FROM " + quoteIdentifier(stagingTable)
                + " AS s WHERE " + joinOnKeys("d", "s", keyColumns);
    }

    @Override
    public boolean requiresSavepointPerRow() {
        return true;
    }

    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "public";
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(connection, schema);
        configFactory.configure(dbConn.getConfig(), getDataTypeFactory(), "\"?\"");
        return dbConn;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return new PostgresqlDataTypeFactory();
    }
}
