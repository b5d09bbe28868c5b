package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.core.BulkLoadException;
import io.github.yok.flexmerge.core.ConnectionProvider;
import io.github.yok.flexmerge.core.StagingArea;
import io.github.yok.flexmerge.util.MetadataIdentifiers;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link StagingArea} that bulk-loads with DBUnit.
 *
 * <p>
 * Every operation opens its own auto-commit connection, so the staging table and its rows are
 * committed before the caller's transaction reads them, and the drop runs after that transaction
 * has ended.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DbUnitStagingArea implements StagingArea {

    private final ConnectionProvider connections;
    private final DbDialectHandler dialect;
    private final SqlStatementBuilder sql;
    private final String schema;

    @Override
    public String allocateName(String prefix) throws SQLException {
        String name = prefix + ProcessHandle.current().pid() + "_" + Instant.now().getEpochSecond();
        try (Connection connection = connections.open()) {
            return MetadataIdentifiers.normalize(connection.getMetaData(), name);
        }
    }

    @Override
    public void create(String stagingTable, String targetTable, List<String> columns)
            throws SQLException {
        try (Connection connection = connections.open();
                Statement st = connection.createStatement()) {
            st.execute(sql.createStaging(stagingTable, targetTable, columns));
        }
        log.info("Staging table created: {}", stagingTable);
    }

    @Override
    public void load(String stagingTable, List<String> columns, List<Object[]> rows)
            throws BulkLoadException {
        Column[] cols = new Column[columns.size()];
        for (int i = 0; i < cols.length; i++) {
            cols[i] = new Column(columns.get(i), DataType.UNKNOWN);
        }
        try (Connection connection = connections.open()) {
            DefaultTable table = new DefaultTable(stagingTable, cols);
            for (Object[] row : rows) {
                table.addRow(row);
            }
            // the DBUnit connection is created after the table exists so its metadata sees it
            DatabaseConnection dbConn = dialect.createDbUnitConnection(connection, schema);
            DatabaseOperation.INSERT.execute(dbConn, new DefaultDataSet(table));
            log.info("Staging table loaded: {} ({} rows)", stagingTable, rows.size());
        } catch (DatabaseUnitException | SQLException e) {
            throw new BulkLoadException(
                    "Failed to load staging table " + stagingTable + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void drop(String stagingTable) throws SQLException {
        try (Connection connection = connections.open();
                Statement st = connection.createStatement()) {
            st.execute(sql.dropTable(stagingTable));
        }
        log.info("Staging table dropped: {}", stagingTable);
    }
}
