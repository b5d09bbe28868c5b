package io.github.yok.flexmerge.db;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;

/**
 * Builds the statements the engine executes from validated identifier lists.
 *
 * <p>
 * Every identifier must match {@code [A-Za-z_][A-Za-z0-9_$]*} and is quoted by the dialect. Row
 * values are always bound as {@code ?} parameters and never become part of the SQL text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class SqlStatementBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private final DbDialectHandler dialect;

    /**
     * Validates and quotes an identifier.
     *
     * @param name table or column name
     * @return quoted identifier
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    public String identifier(String name) {
        Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                "Invalid identifier: %s", name);
        return dialect.quoteIdentifier(name);
    }

    /**
     * {@code INSERT INTO t (c1, c2) VALUES (?, ?)}.
     *
     * @param table table
     * @param columns columns in bind order
     * @return statement
     */
    public String insert(String table, List<String> columns) {
        Preconditions.checkArgument(!columns.isEmpty(), "No columns to insert into %s", table);
        return "INSERT INTO " + identifier(table) + " (" + columnList(columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    /**
     * {@code UPDATE t SET c1 = ?, c2 = ? WHERE id = ?}; the id is bound last.
     *
     * @param table table
     * @param setColumns updated columns in bind order
     * @param idColumn identifier column
     * @return statement
     */
    public String updateById(String table, List<String> setColumns, String idColumn) {
        Preconditions.checkArgument(!setColumns.isEmpty(), "No columns to update in %s", table);
        List<String> assignments = new ArrayList<>();
        for (String c : setColumns) {
            assignments.add(identifier(c) + " = ?");
        }
        return "UPDATE " + identifier(table) + " SET " + String.join(", ", assignments)
                + " WHERE " + identifier(idColumn) + " = ?";
    }

    /**
     * {@code SELECT 1 FROM t WHERE id = ?}.
     *
     * @param table table
     * @param idColumn identifier column
     * @return statement
     */
    public String existsById(String table, String idColumn) {
        return "SELECT 1 FROM " + identifier(table) + " WHERE " + identifier(idColumn) + " = ?";
    }

    /**
     * {@code SELECT id FROM t}.
     *
     * @param table table
     * @param idColumn identifier column
     * @return statement
     */
    public String selectIds(String table, String idColumn) {
        return "SELECT " + identifier(idColumn) + " FROM " + identifier(table);
    }

    /**
     * {@code SELECT COUNT(*) FROM t}.
     *
     * @param table table
     * @return statement
     */
    public String countRows(String table) {
        return "SELECT COUNT(*) FROM " + identifier(table);
    }

    /**
     * Empty staging table typed like the target columns.
     *
     * @param stagingTable staging table
     * @param targetTable destination table
     * @param columns merge columns
     * @return DDL statement
     */
    public String createStaging(String stagingTable, String targetTable, List<String> columns) {
        validate(stagingTable, targetTable, columns);
        return dialect.getCreateStagingTableSql(stagingTable, targetTable, columns);
    }

    /**
     * Inserts the staging rows that have no natural-key match in the destination.
     *
     * <pre>
     * INSERT INTO t (cols, created, updated)
     * SELECT s.cols, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
     *   FROM stg s LEFT JOIN t d ON keys
     *  WHERE d.k1 IS NULL
     * </pre>
     *
     * @param targetTable destination table
     * @param stagingTable staging table
     * @param columns merge columns
     * @param keyColumns natural-key columns
     * @param timestampColumns columns stamped with the current time
     * @return statement
     */
    public String insertMissingFromStaging(String targetTable, String stagingTable,
            List<String> columns, List<String> keyColumns, List<String> timestampColumns) {
        validate(stagingTable, targetTable, columns);
        validate(stagingTable, targetTable, keyColumns);
        Preconditions.checkArgument(!keyColumns.isEmpty(), "Natural key must not be empty");
        List<String> targetCols = new ArrayList<>();
        List<String> selectCols = new ArrayList<>();
        for (String c : columns) {
            targetCols.add(identifier(c));
            selectCols.add("s." + identifier(c));
        }
        for (String c : timestampColumns) {
            targetCols.add(identifier(c));
            selectCols.add(dialect.getCurrentTimestampFunction());
        }
        return "INSERT INTO " + identifier(targetTable) + " (" + String.join(", ", targetCols)
                + ") SELECT " + String.join(", ", selectCols) + " FROM " + identifier(stagingTable)
                + " s LEFT JOIN " + identifier(targetTable) + " d ON "
                + dialect.joinOnKeys("d", "s", keyColumns) + " WHERE d."
                + identifier(keyColumns.get(0)) + " IS NULL";
    }

    /**
     * Overwrites the mutable columns of every destination row matching a staging row.
     *
     * @param targetTable destination table
     * @param stagingTable staging table
     * @param keyColumns natural-key columns
     * @param setColumns mutable columns
     * @param updatedColumn timestamp column; may be {@code null}
     * @return statement
     */
    public String updateFromStaging(String targetTable, String stagingTable,
            List<String> keyColumns, List<String> setColumns, String updatedColumn) {
        validate(stagingTable, targetTable, keyColumns);
        validate(stagingTable, targetTable, setColumns);
        if (updatedColumn != null) {
            identifier(updatedColumn);
        }
        Preconditions.checkArgument(!keyColumns.isEmpty(), "Natural key must not be empty");
        Preconditions.checkArgument(!setColumns.isEmpty() || updatedColumn != null,
                "No columns to update in %s", targetTable);
        return dialect.buildNaturalKeyUpdateSql(targetTable, stagingTable, keyColumns, setColumns,
                updatedColumn);
    }

    /**
     * {@code DROP TABLE IF EXISTS t}.
     *
     * @param table table
     * @return statement
     */
    public String dropTable(String table) {
        return "DROP TABLE IF EXISTS " + identifier(table);
    }

    private String columnList(List<String> columns) {
        List<String> quoted = new ArrayList<>();
        for (String c : columns) {
            quoted.add(identifier(c));
        }
        return String.join(", ", quoted);
    }

    private void validate(String stagingTable, String targetTable, List<String> columns) {
        identifier(stagingTable);
        identifier(targetTable);
        for (String c : columns) {
            identifier(c);
        }
    }
}
