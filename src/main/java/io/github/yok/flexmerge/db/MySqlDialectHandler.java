package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;

/**
 * Dialect handler for MySQL.
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class MySqlDialectHandler implements DbDialectHandler {

    private final DbUnitConfigFactory configFactory;

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Builds {@code UPDATE d JOIN s ON keys SET d.c = s.c, ...}.
     */
    @Override
    public String buildNaturalKeyUpdateSql(String targetTable, String stagingTable,
            List<String> keyColumns, List<String> setColumns, String updatedColumn) {
        List<String> assignments = new ArrayList<>();
        for (String c : setColumns) {
            String q = quoteIdentifier(c);
            assignments.add("d." + q + " = s." + q);
        }
        if (updatedColumn != null) {
            assignments.add("d." + quoteIdentifier(updatedColumn) + " = "
                    + getCurrentTimestampFunction());
        }
        return "UPDATE " + quoteIdentifier(targetTable) + " d JOIN "
                + quoteIdentifier(stagingTable) + " s ON " + joinOnKeys("d", "s", keyColumns)
                + " SET " + String.join(", ", assignments);
    }

    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET NAMES utf8mb4");
        }
    }

    /**
     * Takes the database name from the JDBC URL path.
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        String url = entry.getUrl();
        if (url == null) {
            return null;
        }
        int slash = url.lastIndexOf('/');
        if (slash < 0 || slash == url.length() - 1) {
            return null;
        }
        String tail = url.substring(slash + 1);
        int q = tail.indexOf('?');
        String dbName = q >= 0 ? tail.substring(0, q) : tail;
        return dbName.isBlank() ? null : dbName;
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException {
        // MySQL has no schemas below the database; DBUnit reads the current catalog
        DatabaseConnection dbConn = new DatabaseConnection(connection);
        configFactory.configure(dbConn.getConfig(), getDataTypeFactory(), "`?`");
        return dbConn;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return new MySqlDataTypeFactory();
    }
}
