package io.github.yok.flexmerge.util;

import io.github.yok.flexmerge.core.ForeignKeyConstraint;
import io.github.yok.flexmerge.core.TableLoadSpec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Orders table loads so that referenced tables are loaded before the tables referencing them.
 *
 * <h2>Algorithm</h2>
 *
 * <p>
 * An edge {@code parent -> child} exists when {@code child} declares a foreign key to
 * {@code parent}. Kahn's topological sort is applied; tables that become eligible at the same time
 * are taken in alphabetical order (case-insensitive), so the result is deterministic.
 * </p>
 *
 * <h2>Rules</h2>
 *
 * <ul>
 * <li>Foreign keys to tables outside the given list are ignored; those tables are expected to be
 * loaded by an earlier phase.</li>
 * <li>Self references are ignored.</li>
 * <li>Duplicate table names (case-insensitive) keep the first occurrence.</li>
 * <li>Tables on a cycle are appended alphabetically after the acyclic part.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableDependencyResolver {

    private TableDependencyResolver() {
        throw new AssertionError("TableDependencyResolver must not be instantiated.");
    }

    /**
     * Resolves a parent-first load order.
     *
     * @param specs table load descriptions; may be {@code null} or empty
     * @return the same descriptions in load order
     * @throws IllegalArgumentException if a description has a blank table name
     */
    public static List<TableLoadSpec> resolveLoadOrder(List<TableLoadSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, TableLoadSpec> byName = new LinkedHashMap<>();
        for (TableLoadSpec spec : specs) {
            Validate.notBlank(spec.getTable(), "table must not be blank.");
            String lower = spec.getTable().toLowerCase(Locale.ROOT);
            if (byName.containsKey(lower)) {
                log.warn("Duplicate table name detected (case-insensitive): '{}' and '{}'. "
                        + "Using the first occurrence.", byName.get(lower).getTable(),
                        spec.getTable());
                continue;
            }
            byName.put(lower, spec);
        }

        Map<String, Set<String>> edges = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String lower : byName.keySet()) {
            edges.put(lower, new HashSet<>());
            inDegree.put(lower, 0);
        }
        for (Map.Entry<String, TableLoadSpec> entry : byName.entrySet()) {
            String child = entry.getKey();
            for (ForeignKeyConstraint fk : entry.getValue().getForeignKeys()) {
                String parent = fk.getReferencedTable().toLowerCase(Locale.ROOT);
                if (!byName.containsKey(parent) || parent.equals(child)) {
                    continue;
                }
                if (edges.get(parent).add(child)) {
                    inDegree.merge(child, 1, Integer::sum);
                    log.debug("FK dependency: parent='{}' -> child='{}'", parent, child);
                }
            }
        }

        PriorityQueue<String> queue = new PriorityQueue<>();
        for (String lower : byName.keySet()) {
            if (inDegree.get(lower) == 0) {
                queue.offer(lower);
            }
        }
        List<String> sorted = new ArrayList<>(byName.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String child : edges.get(current)) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.offer(child);
                }
            }
        }

        if (sorted.size() < byName.size()) {
            Set<String> done = new HashSet<>(sorted);
            List<String> cyclic = byName.keySet().stream().filter(t -> !done.contains(t)).sorted()
                    .collect(Collectors.toList());
            log.warn("Circular foreign key reference detected for tables: {}. "
                    + "These tables will be appended in alphabetical order.", cyclic);
            sorted.addAll(cyclic);
        }

        List<TableLoadSpec> result =
                sorted.stream().map(byName::get).collect(Collectors.toList());
        log.info("Resolved table order (parent-first): {}",
                result.stream().map(TableLoadSpec::getTable).collect(Collectors.toList()));
        return result;
    }
}
