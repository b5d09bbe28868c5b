package io.github.yok.flexmerge.core;

import java.sql.SQLException;
import java.util.Set;

/**
 * Read-only query capability used to preload all identifiers of a referenced table.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ReferenceIdSource {

    /**
     * Loads every identifier currently present in a table with a single query.
     *
     * @param table referenced table name
     * @return identifier set (never {@code null})
     * @throws SQLException when the query fails
     */
    Set<Long> loadIds(String table) throws SQLException;
}
