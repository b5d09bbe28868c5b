package io.github.yok.flexmerge.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * Composes the session/DBUnit contract and the SQL grammar contract so that the engine depends on
 * a single handler per database product.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations, DbDialectSqlOperations {
}
