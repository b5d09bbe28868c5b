package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.util.ValueCoercion;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers whether an identifier exists in a referenced table.
 *
 * <p>
 * The first question about a table loads its complete id set with one query; later questions are
 * answered from the {@link ResolutionCache} in memory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ForeignKeyResolver {

    private final ResolutionCache cache;
    private final ReferenceIdSource source;
    private final ValueCoercion coercion;

    /**
     * Creates a resolver.
     *
     * @param context run context supplying the cache and coercion rules
     * @param source query capability bound to the current connection
     */
    public ForeignKeyResolver(ReconciliationContext context, ReferenceIdSource source) {
        this.cache = context.getResolutionCache();
        this.coercion = context.getCoercion();
        this.source = source;
    }

    /**
     * Returns whether {@code id} exists in {@code referencedTable}.
     *
     * @param referencedTable referenced table name
     * @param id identifier; coerced to an integer first
     * @return {@code false} for {@code null} or non-integer ids and for unknown ids
     * @throws SQLException when the id set cannot be loaded
     */
    public boolean resolves(String referencedTable, Object id) throws SQLException {
        Long value = coercion.toInteger(id);
        if (value == null) {
            return false;
        }
        return idsOf(referencedTable).contains(value);
    }

    /**
     * Checks a record against its declared constraints, stopping at the first violation.
     *
     * <p>
     * Columns under {@link ForeignKeyPolicy#CLEAR} whose value does not resolve are set to
     * {@code null} in {@code record}; they never count as violations.
     * </p>
     *
     * @param record record whose FK columns are already coerced
     * @param constraints declared constraints
     * @return the first violated constraint, or {@code null} when the record is valid
     * @throws SQLException when an id set cannot be loaded
     */
    public ForeignKeyConstraint findViolation(Record record, List<ForeignKeyConstraint> constraints)
            throws SQLException {
        for (ForeignKeyConstraint fk : constraints) {
            Object value = record.get(fk.getColumn());
            switch (fk.getPolicy()) {
                case OPTIONAL:
                    if (value != null && !resolves(fk.getReferencedTable(), value)) {
                        return fk;
                    }
                    break;
                case CLEAR:
                    if (value != null && !resolves(fk.getReferencedTable(), value)) {
                        log.warn("{}={} not found in {}; clearing reference.", fk.getColumn(),
                                value, fk.getReferencedTable());
                        record.put(fk.getColumn(), null);
                    }
                    break;
                default:
                    if (!record.has(fk.getColumn()) || value == null
                            || !resolves(fk.getReferencedTable(), value)) {
                        return fk;
                    }
                    break;
            }
        }
        return null;
    }

    private Set<Long> idsOf(String table) throws SQLException {
        Set<Long> ids = cache.get(table);
        if (ids == null) {
            Set<Long> loaded = source.loadIds(table);
            cache.put(table, loaded);
            log.debug("Resolution cache loaded: table={}, ids={}", table, loaded.size());
            ids = cache.get(table);
        }
        return ids;
    }
}
