package io.github.yok.flexmerge.core;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * Columns that may be written for one destination table, as reported by the database.
 *
 * <p>
 * Names are kept in the database's own spelling so that generated SQL always matches the catalog;
 * lookups by callers are case-insensitive.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TableSchema {

    /** Table name as stored in the database catalog. */
    @Getter
    private final String tableName;

    /** Column names in ordinal order. */
    @Getter
    private final List<String> columns;

    private final Map<String, String> byLowerName;

    /**
     * Creates a schema.
     *
     * @param tableName catalog table name
     * @param columns catalog column names in ordinal order
     */
    public TableSchema(String tableName, List<String> columns) {
        Validate.notBlank(tableName, "tableName must not be blank.");
        Validate.notEmpty(columns, "columns must not be empty: %s", tableName);
        this.tableName = tableName;
        this.columns = ImmutableList.copyOf(columns);
        this.byLowerName = new LinkedHashMap<>();
        for (String c : columns) {
            byLowerName.putIfAbsent(c.toLowerCase(Locale.ROOT), c);
        }
    }

    /**
     * Returns whether the table has the column.
     *
     * @param name column name (case-insensitive)
     * @return {@code true} when known
     */
    public boolean hasColumn(String name) {
        return name != null && byLowerName.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Maps a caller-supplied column name to the catalog spelling.
     *
     * @param name column name (case-insensitive)
     * @return catalog column name, or {@code null} when unknown
     */
    public String columnName(String name) {
        return name == null ? null : byLowerName.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Maps a column name to the catalog spelling, failing when the column does not exist.
     *
     * @param name column name (case-insensitive)
     * @return catalog column name
     * @throws IllegalArgumentException when the column is unknown
     */
    public String requireColumn(String name) {
        String actual = columnName(name);
        Validate.isTrue(actual != null, "Column '%s' does not exist in table '%s'.", name,
                tableName);
        return actual;
    }

    @Override
    public String toString() {
        return tableName + columns;
    }
}
