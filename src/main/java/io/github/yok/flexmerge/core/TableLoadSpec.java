package io.github.yok.flexmerge.core;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Caller-declared description of how one destination table is loaded on the single-row path.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
public final class TableLoadSpec {

    /** Destination table. */
    private final String table;

    /** Source name (file base name); defaults to the table name. */
    private final String source;

    @Builder.Default
    private final LoadMode mode = LoadMode.UPSERT;

    /** Surrogate identifier column. */
    @Builder.Default
    private final String idColumn = "id";

    @Singular
    private final List<ForeignKeyConstraint> foreignKeys;

    /** Business columns coerced to boolean when they look boolean. */
    @Singular
    private final List<String> booleanColumns;

    /** Source field name → destination column name. */
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
}
