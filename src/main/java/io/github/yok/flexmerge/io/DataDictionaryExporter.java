package io.github.yok.flexmerge.io;

import io.github.yok.flexmerge.db.SqlStatementBuilder;
import io.github.yok.flexmerge.util.CsvUtils;
import io.github.yok.flexmerge.util.MetadataIdentifiers;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Exports a data dictionary of the target schema as CSV files.
 *
 * <ul>
 * <li>{@code tables.csv}: one line per table with its row count</li>
 * <li>{@code columns.csv}: every column of every table</li>
 * <li>{@code foreign_keys.csv}: declared foreign keys</li>
 * <li>{@code indexes.csv}: index columns</li>
 * <li>{@code tables/<table>.csv}: the columns of one table</li>
 * </ul>
 *
 * <p>
 * Staging tables are left out.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DataDictionaryExporter {

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    static final List<String> TABLE_HEADERS =
            Arrays.asList("table_name", "table_type", "row_count", "remarks");

    static final List<String> COLUMN_HEADERS = Arrays.asList("table_name", "position",
            "column_name", "type_name", "column_size", "decimal_digits", "nullable",
            "default_value", "auto_increment", "remarks");

    static final List<String> FK_HEADERS = Arrays.asList("constraint_name", "table_name",
            "column_name", "referenced_table", "referenced_column", "key_seq");

    static final List<String> INDEX_HEADERS = Arrays.asList("table_name", "index_name",
            "non_unique", "position", "column_name", "asc_or_desc");

    private final SqlStatementBuilder sql;

    private final String stagingPrefix;

    /**
     * Exports the dictionary.
     *
     * @param connection JDBC connection
     * @param schema schema name; may be {@code null}
     * @param outDir output directory
     * @return number of tables exported
     * @throws SQLException if metadata cannot be read
     * @throws IOException if a file cannot be written
     */
    public int export(Connection connection, String schema, Path outDir)
            throws SQLException, IOException {
        DatabaseMetaData meta = connection.getMetaData();
        String catalog = connection.getCatalog();
        String schemaName = MetadataIdentifiers.normalize(meta, schema);

        Map<String, List<Object>> tables = new LinkedHashMap<>();
        try (ResultSet rs = meta.getTables(catalog, schemaName, "%", TABLE_TYPES)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (StringUtils.startsWithIgnoreCase(name, stagingPrefix)) {
                    continue;
                }
                tables.put(name, new ArrayList<>(Arrays.asList(name, rs.getString("TABLE_TYPE"),
                        null, rs.getString("REMARKS"))));
            }
        }

        List<List<Object>> columnRows = new ArrayList<>();
        List<List<Object>> fkRows = new ArrayList<>();
        List<List<Object>> indexRows = new ArrayList<>();
        for (Map.Entry<String, List<Object>> table : tables.entrySet()) {
            String name = table.getKey();
            table.getValue().set(2, countRows(connection, name));

            List<List<Object>> perTable = readColumns(meta, catalog, schemaName, name);
            columnRows.addAll(perTable);
            CsvUtils.writeCsvUtf8(outDir.resolve("tables").resolve(name + ".csv"),
                    COLUMN_HEADERS, perTable);

            try (ResultSet rs = meta.getImportedKeys(catalog, schemaName, name)) {
                while (rs.next()) {
                    fkRows.add(Arrays.asList(rs.getString("FK_NAME"), name,
                            rs.getString("FKCOLUMN_NAME"), rs.getString("PKTABLE_NAME"),
                            rs.getString("PKCOLUMN_NAME"), rs.getInt("KEY_SEQ")));
                }
            }
            try (ResultSet rs = meta.getIndexInfo(catalog, schemaName, name, false, true)) {
                while (rs.next()) {
                    if (rs.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                        continue;
                    }
                    indexRows.add(Arrays.asList(name, rs.getString("INDEX_NAME"),
                            rs.getBoolean("NON_UNIQUE"), rs.getInt("ORDINAL_POSITION"),
                            rs.getString("COLUMN_NAME"), rs.getString("ASC_OR_DESC")));
                }
            }
        }

        CsvUtils.writeCsvUtf8(outDir.resolve("tables.csv"), TABLE_HEADERS,
                new ArrayList<>(tables.values()));
        CsvUtils.writeCsvUtf8(outDir.resolve("columns.csv"), COLUMN_HEADERS, columnRows);
        CsvUtils.writeCsvUtf8(outDir.resolve("foreign_keys.csv"), FK_HEADERS, fkRows);
        CsvUtils.writeCsvUtf8(outDir.resolve("indexes.csv"), INDEX_HEADERS, indexRows);
        log.info("Data dictionary exported: {} tables -> {}", tables.size(), outDir);
        return tables.size();
    }

    private List<List<Object>> readColumns(DatabaseMetaData meta, String catalog,
            String schemaName, String table) throws SQLException {
        List<List<Object>> rows = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(catalog, schemaName, table, "%")) {
            while (rs.next()) {
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                Object digits = rs.getObject("DECIMAL_DIGITS");
                rows.add(Arrays.asList(table, rs.getInt("ORDINAL_POSITION"),
                        rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME"),
                        rs.getInt("COLUMN_SIZE"), digits, rs.getString("IS_NULLABLE"),
                        rs.getString("COLUMN_DEF"), rs.getString("IS_AUTOINCREMENT"),
                        rs.getString("REMARKS")));
            }
        }
        return rows;
    }

    private Long countRows(Connection connection, String table) {
        try (PreparedStatement ps = connection.prepareStatement(sql.countRows(table));
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : null;
        } catch (SQLException | IllegalArgumentException e) {
            log.warn("Table[{}] row count unavailable: {}", table, e.getMessage());
            return null;
        }
    }
}
