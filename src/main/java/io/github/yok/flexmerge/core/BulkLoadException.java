package io.github.yok.flexmerge.core;

import java.sql.SQLException;

/**
 * Thrown when a staging table cannot be created or populated. No set-based statement has run when
 * this is raised.
 *
 * @author Yasuharu.Okawauchi
 */
public class BulkLoadException extends SQLException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public BulkLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
