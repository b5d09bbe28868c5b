package io.github.yok.flexmerge.core;

import java.sql.SQLException;

/**
 * Transaction owned by the caller and handed to engine operations.
 *
 * <p>
 * The work is committed when it returns normally and rolled back when it throws.
 * </p>
 */
public interface TransactionScope {

    /**
     * Runs {@code work} in one transaction.
     *
     * @param work unit of work
     * @throws SQLException the failure of the work, after rollback
     */
    void execute(SqlWork work) throws SQLException;
}
