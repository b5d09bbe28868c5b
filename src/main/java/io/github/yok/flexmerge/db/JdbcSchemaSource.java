package io.github.yok.flexmerge.db;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexmerge.core.SchemaFetchException;
import io.github.yok.flexmerge.core.SchemaSource;
import io.github.yok.flexmerge.core.TableSchema;
import io.github.yok.flexmerge.util.MetadataIdentifiers;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the writable columns of a table from {@link DatabaseMetaData#getColumns}.
 *
 * <p>
 * The table name is normalized to the case the database stores unquoted identifiers in. The
 * returned {@link TableSchema} carries the catalog spelling of the table and its columns, in
 * ordinal order. Generated columns are left out.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcSchemaSource implements SchemaSource {

    private final Connection connection;

    // schema pattern passed to the metadata lookup; null matches every schema
    private final String schema;

    @Override
    public TableSchema fetch(String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String tableName = MetadataIdentifiers.normalize(meta, table);
        String schemaName = MetadataIdentifiers.normalize(meta, schema);

        TableSchema result = readColumns(meta, connection.getCatalog(), schemaName, tableName);
        if (result == null && connection.getCatalog() != null) {
            result = readColumns(meta, null, schemaName, tableName);
        }
        if (result == null) {
            throw new SchemaFetchException(table, "Table not found or has no columns: " + table,
                    null);
        }
        log.debug("Table[{}] columns={}", result.getTableName(), result.getColumns());
        return result;
    }

    private TableSchema readColumns(DatabaseMetaData meta, String catalog, String schemaName,
            String tableName) throws SQLException {
        // "_" in the name is a LIKE wildcard, so the pattern may match several tables
        Map<String, ImmutableList.Builder<String>> byTable = new LinkedHashMap<>();
        try (ResultSet rs = meta.getColumns(catalog, schemaName, tableName, null)) {
            while (rs.next()) {
                ImmutableList.Builder<String> columns = byTable
                        .computeIfAbsent(rs.getString("TABLE_NAME"), k -> ImmutableList.builder());
                if ("YES".equalsIgnoreCase(generated(rs))) {
                    continue;
                }
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        for (Map.Entry<String, ImmutableList.Builder<String>> e : byTable.entrySet()) {
            if (e.getKey().equalsIgnoreCase(tableName)) {
                List<String> columns = e.getValue().build();
                return columns.isEmpty() ? null : new TableSchema(e.getKey(), columns);
            }
        }
        return null;
    }

    private static String generated(ResultSet rs) {
        try {
            return rs.getString("IS_GENERATEDCOLUMN");
        } catch (SQLException e) {
            // pre-JDBC 4.1 drivers do not report the column
            return null;
        }
    }
}
