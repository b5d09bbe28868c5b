package io.github.yok.flexmerge.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens new connections to the target database, in auto-commit mode.
 */
public interface ConnectionProvider {

    /**
     * Opens a connection. The caller closes it.
     *
     * @return new connection
     * @throws SQLException if the connection cannot be opened
     */
    Connection open() throws SQLException;
}
