package io.github.yok.flexmerge.core;

import java.sql.SQLException;

/**
 * Supplies the writable columns of a table (metadata introspection).
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface SchemaSource {

    /**
     * Reads the schema of a table.
     *
     * @param table table name as configured by the caller
     * @return table schema
     * @throws SchemaFetchException when the table is unknown or its metadata cannot be read
     * @throws SQLException on other database errors
     */
    TableSchema fetch(String table) throws SQLException;
}
