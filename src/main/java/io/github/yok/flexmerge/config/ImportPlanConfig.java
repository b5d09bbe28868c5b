package io.github.yok.flexmerge.config;

import io.github.yok.flexmerge.core.ForeignKeyConstraint;
import io.github.yok.flexmerge.core.ForeignKeyPolicy;
import io.github.yok.flexmerge.core.LoadMode;
import io.github.yok.flexmerge.core.NaturalKeyMergeSpec;
import io.github.yok.flexmerge.core.TableLoadSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Import plan bound from the {@code plan} section of {@code application.yml}.
 *
 * <pre>
 * plan:
 *   masters:
 *     - table: gate
 *       foreign-keys:
 *         - column: terminal_id
 *           references: terminal
 *   natural-key-merge:
 *     table: reservation
 *     key-columns: [locator, flight_id]
 *     ...
 *   dependents:
 *     - table: boarding_pass
 *       ...
 * </pre>
 *
 * <p>
 * The nested classes are plain binding targets. {@link #toMasterSpecs()},
 * {@link #toDependentSpecs()} and {@link #toMergeSpec()} convert them into the immutable engine
 * types, applying the per-phase default load mode.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "plan")
@Data
public class ImportPlanConfig {

    private List<TableEntry> masters = new ArrayList<>();

    private MergeEntry naturalKeyMerge;

    private List<TableEntry> dependents = new ArrayList<>();

    /**
     * Converts master entries. Masters default to {@link LoadMode#INSERT_ONLY}.
     *
     * @return load specs in declaration order
     */
    public List<TableLoadSpec> toMasterSpecs() {
        return toSpecs(masters, LoadMode.INSERT_ONLY);
    }

    /**
     * Converts dependent entries. Dependents default to {@link LoadMode#UPSERT}.
     *
     * @return load specs in declaration order
     */
    public List<TableLoadSpec> toDependentSpecs() {
        return toSpecs(dependents, LoadMode.UPSERT);
    }

    /**
     * Converts the natural-key merge entry.
     *
     * @return merge spec, or {@code null} if none is configured
     */
    public NaturalKeyMergeSpec toMergeSpec() {
        if (naturalKeyMerge == null || naturalKeyMerge.getTable() == null) {
            return null;
        }
        NaturalKeyMergeSpec.NaturalKeyMergeSpecBuilder b = NaturalKeyMergeSpec.builder()
                .table(naturalKeyMerge.getTable()).source(naturalKeyMerge.getSource())
                .keyColumns(naturalKeyMerge.getKeyColumns())
                .mutableColumns(naturalKeyMerge.getMutableColumns())
                .requiredSourceColumns(naturalKeyMerge.getRequiredSourceColumns())
                .columnAliases(naturalKeyMerge.getAliases());
        for (ForeignKeyEntry fk : naturalKeyMerge.getForeignKeys()) {
            b.foreignKey(fk.toConstraint());
        }
        return b.build();
    }

    private static List<TableLoadSpec> toSpecs(List<TableEntry> entries, LoadMode defaultMode) {
        List<TableLoadSpec> specs = new ArrayList<>();
        for (TableEntry e : entries) {
            TableLoadSpec.TableLoadSpecBuilder b = TableLoadSpec.builder().table(e.getTable())
                    .source(e.getSource()).mode(e.getMode() != null ? e.getMode() : defaultMode)
                    .booleanColumns(e.getBooleans()).columnAliases(e.getAliases());
            if (e.getIdColumn() != null) {
                b.idColumn(e.getIdColumn());
            }
            for (ForeignKeyEntry fk : e.getForeignKeys()) {
                b.foreignKey(fk.toConstraint());
            }
            specs.add(b.build());
        }
        return specs;
    }

    /**
     * One table loaded row by row.
     */
    @Data
    public static class TableEntry {
        private String table;
        // CSV base name; defaults to the table name
        private String source;
        private LoadMode mode;
        private String idColumn;
        private List<ForeignKeyEntry> foreignKeys = new ArrayList<>();
        private List<String> booleans = new ArrayList<>();
        // source header -> destination column
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    /**
     * The table merged on its natural key.
     */
    @Data
    public static class MergeEntry {
        private String table;
        private String source;
        private List<String> keyColumns = new ArrayList<>();
        private List<String> mutableColumns = new ArrayList<>();
        private List<String> requiredSourceColumns = new ArrayList<>();
        private List<ForeignKeyEntry> foreignKeys = new ArrayList<>();
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    /**
     * A declared foreign key.
     */
    @Data
    public static class ForeignKeyEntry {
        private String column;
        private String references;
        private ForeignKeyPolicy policy = ForeignKeyPolicy.REQUIRED;

        ForeignKeyConstraint toConstraint() {
            return new ForeignKeyConstraint(column, references, policy);
        }
    }
}
