package io.github.yok.flexmerge.core;

import java.sql.SQLException;

/**
 * Thrown when the columns of a destination or referenced table cannot be introspected.
 *
 * <p>
 * Fatal for the affected table's load only; nothing row-specific is quarantined.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaFetchException extends SQLException {

    private static final long serialVersionUID = 1L;

    /** Table whose metadata could not be read. */
    private final String table;

    /**
     * Creates the exception.
     *
     * @param table table name
     * @param message detail message
     * @param cause underlying failure; may be {@code null}
     */
    public SchemaFetchException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /**
     * Returns the table whose metadata could not be read.
     *
     * @return table name
     */
    public String getTable() {
        return table;
    }
}
