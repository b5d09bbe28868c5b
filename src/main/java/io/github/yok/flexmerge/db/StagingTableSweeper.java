package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.util.MetadataIdentifiers;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Drops staging tables left behind by runs that ended before their cleanup phase.
 *
 * <p>
 * Every table whose name starts with the staging prefix (case-insensitive) is dropped. Running
 * the sweep twice is harmless. A table that cannot be dropped is logged and skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class StagingTableSweeper {

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final SqlStatementBuilder sql;

    private final String stagingPrefix;

    /**
     * Lists the staging tables present in the given schema.
     *
     * @param connection JDBC connection
     * @param schema schema name; may be {@code null}
     * @return actual table names
     * @throws SQLException if metadata access fails
     */
    public List<String> findOrphans(Connection connection, String schema) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<String> found = new ArrayList<>();
        // "_" is a LIKE wildcard, so the prefix is matched here rather than in the pattern
        try (ResultSet rs = meta.getTables(connection.getCatalog(),
                MetadataIdentifiers.normalize(meta, schema), "%", TABLE_TYPES)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (StringUtils.startsWithIgnoreCase(name, stagingPrefix)) {
                    found.add(name);
                }
            }
        }
        return found;
    }

    /**
     * Drops every orphaned staging table.
     *
     * @param connection JDBC connection in auto-commit mode
     * @param schema schema name; may be {@code null}
     * @return number of tables dropped
     * @throws SQLException if the tables cannot be listed
     */
    public int sweep(Connection connection, String schema) throws SQLException {
        int dropped = 0;
        for (String table : findOrphans(connection, schema)) {
            try (Statement st = connection.createStatement()) {
                st.execute(sql.dropTable(table));
                dropped++;
                log.info("Orphaned staging table dropped: {}", table);
            } catch (SQLException | IllegalArgumentException e) {
                log.warn("Could not drop orphaned staging table {}: {}", table, e.getMessage());
            }
        }
        if (dropped == 0) {
            log.info("No orphaned staging tables found (prefix={})", stagingPrefix);
        }
        return dropped;
    }
}
