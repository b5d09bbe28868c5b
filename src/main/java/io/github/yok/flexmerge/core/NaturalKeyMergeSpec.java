package io.github.yok.flexmerge.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Description of a batch merged into its destination on a natural key.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
public final class NaturalKeyMergeSpec {

    private final String table;

    private final String source;

    /** Columns forming the natural key. */
    @Singular
    private final List<String> keyColumns;

    /** Business columns overwritten when a key already exists. */
    @Singular
    private final List<String> mutableColumns;

    /** Both referenced keys of the batch; every one must resolve. */
    @Singular
    private final List<ForeignKeyConstraint> foreignKeys;

    /** Source fields that must be present in the batch before anything is written. */
    @Singular
    private final List<String> requiredSourceColumns;

    @Singular("columnAlias")
    private final Map<String, String> columnAliases;

    /**
     * Returns the source name, falling back to the table name.
     *
     * @return source name
     */
    public String getSource() {
        return source == null || source.isBlank() ? table : source;
    }

    /**
     * Returns the columns the staging table is shaped by: key columns, then foreign-key columns,
     * then mutable columns, without duplicates.
     *
     * @return merge column set in load order
     */
    public List<String> getMergeColumns() {
        Set<String> lower = new LinkedHashSet<>();
        List<String> columns = new ArrayList<>();
        List<String> all = new ArrayList<>(keyColumns);
        for (ForeignKeyConstraint fk : foreignKeys) {
            all.add(fk.getColumn());
        }
        all.addAll(mutableColumns);
        for (String c : all) {
            if (lower.add(c.toLowerCase(Locale.ROOT))) {
                columns.add(c);
            }
        }
        return columns;
    }
}
