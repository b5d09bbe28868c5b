package io.github.yok.flexmerge.db;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL grammar operations that differ between database dialects.
 *
 * <p>
 * Identifiers passed to these methods are validated by {@link SqlStatementBuilder} and quoted
 * here; no row data is ever part of the generated text.
 * </p>
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns expression for current timestamp.
     *
     * @return current timestamp expression
     */
    default String getCurrentTimestampFunction() {
        return "CURRENT_TIMESTAMP";
    }

    /**
     * Returns SQL creating an empty staging table with the types of the given target columns.
     *
     * @param stagingTable staging table name
     * @param targetTable table the column types are copied from
     * @param columns columns to copy
     * @return DDL statement
     */
    default String getCreateStagingTableSql(String stagingTable, String targetTable,
            List<String> columns) {
        List<String> quoted = new ArrayList<>();
        for (String c : columns) {
            quoted.add(quoteIdentifier(c));
        }
        return "CREATE TABLE " + quoteIdentifier(stagingTable) + " AS SELECT "
                + String.join(", ", quoted) + " FROM " + quoteIdentifier(targetTable)
                + " WHERE 1 = 0";
    }

    /**
     * Builds the set-based UPDATE that overwrites target rows from matching staging rows.
     *
     * @param targetTable destination table
     * @param stagingTable staging table
     * @param keyColumns natural-key columns used for matching
     * @param setColumns columns copied from staging
     * @param updatedColumn timestamp column set to the current time; may be {@code null}
     * @return UPDATE statement
     */
    String buildNaturalKeyUpdateSql(String targetTable, String stagingTable,
            List<String> keyColumns, List<String> setColumns, String updatedColumn);

    /**
     * Returns whether a failed statement poisons the surrounding transaction, so that each row
     * write has to run under its own savepoint.
     *
     * @return {@code true} when a savepoint per row is needed
     */
    default boolean requiresSavepointPerRow() {
        return false;
    }

    /**
     * Builds the {@code d.k1 = s.k1 AND d.k2 = s.k2} join condition.
     *
     * @param targetAlias alias of the destination table
     * @param stagingAlias alias of the staging table
     * @param keyColumns natural-key columns
     * @return join condition
     */
    default String joinOnKeys(String targetAlias, String stagingAlias, List<String> keyColumns) {
        List<String> predicates = new ArrayList<>();
        for (String k : keyColumns) {
            String q = quoteIdentifier(k);
            predicates.add(targetAlias + "." + q + " = " + stagingAlias + "." + q);
        }
        return String.join(" AND ", predicates);
    }
}
