package io.github.yok.flexmerge.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run inside a {@link TransactionScope}.
 */
@FunctionalInterface
public interface SqlWork {

    /**
     * Runs the work.
     *
     * @param connection connection bound to the transaction
     * @throws SQLException on database errors
     */
    void run(Connection connection) throws SQLException;
}
