package io.github.yok.flexmerge.core;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Identifier sets of referenced tables, filled lazily and never invalidated within a run.
 *
 * <p>
 * If this process mutates a referenced table after its ids were cached, the cache becomes stale.
 * Loads must therefore be sequenced so that a table is complete before it is referenced.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ResolutionCache {

    private final Map<String, Set<Long>> idsByTable = new HashMap<>();

    /**
     * Returns whether ids of a table are cached.
     *
     * @param table table name (case-insensitive)
     * @return {@code true} when cached
     */
    public boolean isLoaded(String table) {
        return idsByTable.containsKey(key(table));
    }

    /**
     * Returns the cached ids of a table.
     *
     * @param table table name (case-insensitive)
     * @return unmodifiable id set, or {@code null} when not cached
     */
    public Set<Long> get(String table) {
        Set<Long> ids = idsByTable.get(key(table));
        return ids == null ? null : Collections.unmodifiableSet(ids);
    }

    /**
     * Caches ids of a table. Ids already cached for the table are kept; the set only grows.
     *
     * @param table table name
     * @param ids identifiers to add
     */
    public void put(String table, Collection<Long> ids) {
        idsByTable.computeIfAbsent(key(table), k -> new HashSet<>()).addAll(ids);
    }

    /**
     * Returns the number of cached tables.
     *
     * @return table count
     */
    public int size() {
        return idsByTable.size();
    }

    /**
     * Forgets every cached table. Intended for a new run or a test case.
     */
    public void clear() {
        idsByTable.clear();
    }

    private static String key(String table) {
        return table.toLowerCase(Locale.ROOT);
    }
}
