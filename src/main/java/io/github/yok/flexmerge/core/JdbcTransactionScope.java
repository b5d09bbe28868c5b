package io.github.yok.flexmerge.core;

import java.sql.Connection;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TransactionScope} on a single JDBC connection.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcTransactionScope implements TransactionScope {

    private final Connection connection;

    @Override
    public void execute(SqlWork work) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            work.run(connection);
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
                log.info("Transaction rolled back");
            } catch (SQLException re) {
                e.addSuppressed(re);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }
}
