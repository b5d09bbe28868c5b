package io.github.yok.flexmerge.core;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Aligns records with the columns of their destination table.
 *
 * <p>
 * Schemas are fetched once per table through the {@link SchemaSource} and kept in the run's
 * {@link ReconciliationContext}. Unknown fields are dropped without quarantining the row; they are
 * usually extra source columns.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaProjector {

    private final SchemaSource source;
    private final Map<String, TableSchema> cache;

    /**
     * Creates a projector backed by the context's schema cache.
     *
     * @param source metadata source
     * @param context run context
     */
    public SchemaProjector(SchemaSource source, ReconciliationContext context) {
        this.source = source;
        this.cache = context.getSchemaCache();
    }

    /**
     * Returns the schema of a table, fetching it on first use.
     *
     * @param table table name
     * @return schema
     * @throws SchemaFetchException when the schema cannot be read
     * @throws SQLException on other database errors
     */
    public TableSchema schemaOf(String table) throws SQLException {
        String key = table.toLowerCase(Locale.ROOT);
        TableSchema cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        TableSchema fetched;
        try {
            fetched = source.fetch(table);
        } catch (SchemaFetchException e) {
            throw e;
        } catch (SQLException e) {
            throw new SchemaFetchException(table,
                    "Failed to read metadata of table '" + table + "': " + e.getMessage(), e);
        }
        cache.put(key, fetched);
        log.debug("Table[{}] schema cached: {}", table, fetched.getColumns());
        return fetched;
    }

    /**
     * Returns a copy of {@code record} holding only the fields that are columns of {@code schema},
     * renamed to the catalog spelling.
     *
     * @param record input record
     * @param schema destination schema
     * @return projected record
     */
    public Record project(Record record, TableSchema schema) {
        Record projected = new Record();
        for (Map.Entry<String, Object> e : record.asMap().entrySet()) {
            String column = schema.columnName(e.getKey());
            if (column == null) {
                log.trace("Table[{}] dropping unknown field '{}'", schema.getTableName(),
                        e.getKey());
                continue;
            }
            projected.put(column, e.getValue());
        }
        return projected;
    }
}
