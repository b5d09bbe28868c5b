package io.github.yok.flexmerge.core;

import java.sql.SQLException;
import java.util.List;

/**
 * Creates, fills and drops staging tables outside the caller's transaction.
 *
 * @author Yasuharu.Okawauchi
 */
public interface StagingArea {

    /**
     * Returns a fresh staging table name in the database's identifier case.
     *
     * @param prefix staging prefix
     * @return table name
     * @throws SQLException if metadata cannot be read
     */
    String allocateName(String prefix) throws SQLException;

    /**
     * Creates an empty staging table with the types of the given destination columns.
     *
     * @param stagingTable staging table
     * @param targetTable destination table
     * @param columns merge columns (catalog names)
     * @throws SQLException if the table cannot be created
     */
    void create(String stagingTable, String targetTable, List<String> columns)
            throws SQLException;

    /**
     * Bulk-loads rows into the staging table.
     *
     * @param stagingTable staging table
     * @param columns merge columns (catalog names)
     * @param rows row values in column order
     * @throws BulkLoadException if the load fails
     */
    void load(String stagingTable, List<String> columns, List<Object[]> rows)
            throws BulkLoadException;

    /**
     * Drops the staging table if it exists.
     *
     * @param stagingTable staging table
     * @throws SQLException if the drop fails
     */
    void drop(String stagingTable) throws SQLException;
}
