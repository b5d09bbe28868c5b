package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.db.DbDialectHandler;
import io.github.yok.flexmerge.db.SqlStatementBuilder;
import io.github.yok.flexmerge.util.ValueCoercion;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies each record of a table and writes it on the single-row path.
 *
 * <p>
 * Per record:
 * </p>
 * <ol>
 * <li>source aliases are applied, foreign-key columns are coerced to integers and declared
 * boolean columns to booleans</li>
 * <li>the record is projected onto the destination columns</li>
 * <li>declared foreign keys are checked; a violation quarantines the record</li>
 * <li>a record whose id exists is updated (only non-null fields), or skipped on an insert-only
 * load; any other record is inserted</li>
 * </ol>
 *
 * <p>
 * Row results carry the record after aliasing and coercion, before projection: a quarantined row
 * holds the values the write would have used. A failed write quarantines the record and the load
 * continues. The executor writes through the
 * connection it is given and never commits or rolls back the surrounding transaction. On dialects
 * where a failed statement aborts the transaction, each write runs under a savepoint.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class UpsertExecutor {

    private final Connection connection;
    private final DbDialectHandler dialect;
    private final SqlStatementBuilder sql;
    private final SchemaProjector projector;
    private final ForeignKeyResolver resolver;
    private final ValueCoercion coercion;

    /**
     * Creates an executor bound to one connection.
     *
     * @param connection connection of the caller's transaction
     * @param dialect dialect handler
     * @param sql statement builder
     * @param projector schema projector
     * @param resolver foreign-key resolver
     * @param context run context
     */
    public UpsertExecutor(Connection connection, DbDialectHandler dialect,
            SqlStatementBuilder sql, SchemaProjector projector, ForeignKeyResolver resolver,
            ReconciliationContext context) {
        this.connection = connection;
        this.dialect = dialect;
        this.sql = sql;
        this.projector = projector;
        this.resolver = resolver;
        this.coercion = context.getCoercion();
    }

    /**
     * Loads all records of one table.
     *
     * @param spec table load description
     * @param records records in source order
     * @return counters and quarantined rows of the table
     * @throws SchemaFetchException when the destination schema cannot be read; nothing has been
     *         written for the table in that case
     * @throws SQLException when a referenced id set cannot be loaded
     */
    public TableOutcome load(TableLoadSpec spec, List<Record> records) throws SQLException {
        TableSchema schema = projector.schemaOf(spec.getTable());
        TableOutcome outcome = new TableOutcome(spec.getTable());
        for (Record record : records) {
            outcome.record(process(spec, schema, record));
        }
        log.info("{}", outcome);
        return outcome;
    }

    /**
     * Processes one record.
     *
     * @param spec table load description
     * @param schema destination schema
     * @param raw input record; left unmodified
     * @return row result
     * @throws SQLException when a referenced id set cannot be loaded
     */
    public RowResult process(TableLoadSpec spec, TableSchema schema, Record raw)
            throws SQLException {
        Record record = prepare(raw, spec.getColumnAliases(), spec.getForeignKeys(),
                spec.getBooleanColumns());
        Record projected = projector.project(record, schema);

        ForeignKeyConstraint violation = resolver.findViolation(projected, spec.getForeignKeys());
        if (violation != null) {
            String detail = violation.getColumn() + "=" + projected.get(violation.getColumn())
                    + " not found in " + violation.getReferencedTable();
            log.debug("Table[{}] quarantined: {}", schema.getTableName(), detail);
            return RowResult.quarantined(record, FailureKind.FK_UNRESOLVED, detail);
        }

        String idColumn = schema.columnName(spec.getIdColumn());
        Long id = idColumn == null ? null : coercion.toInteger(projected.get(idColumn));
        if (idColumn != null) {
            if (id == null) {
                projected.remove(idColumn);
            } else {
                projected.put(idColumn, id);
            }
        }

        Savepoint savepoint = null;
        if (dialect.requiresSavepointPerRow() && !connection.getAutoCommit()) {
            savepoint = connection.setSavepoint();
        }
        try {
            RowResult result = write(spec, schema, idColumn, id, projected, record);
            if (savepoint != null) {
                connection.releaseSavepoint(savepoint);
            }
            return result;
        } catch (SQLException e) {
            if (savepoint != null) {
                connection.rollback(savepoint);
            }
            log.warn("Table[{}] write failed: {} row={}", schema.getTableName(), e.getMessage(),
                    record);
            return RowResult.quarantined(record, FailureKind.WRITE_FAILED, e.getMessage());
        }
    }

    /**
     * Applies aliases and coercions to a copy of the record.
     *
     * @param raw input record
     * @param aliases source field → destination column
     * @param foreignKeys declared foreign keys
     * @param booleanColumns declared boolean columns
     * @return prepared copy
     */
    Record prepare(Record raw, Map<String, String> aliases, List<ForeignKeyConstraint> foreignKeys,
            List<String> booleanColumns) {
        Record record = raw.copy();
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            if (record.has(alias.getKey()) && !record.rename(alias.getKey(), alias.getValue())) {
                log.debug("Alias {} -> {} ignored: target field already present", alias.getKey(),
                        alias.getValue());
            }
        }
        for (ForeignKeyConstraint fk : foreignKeys) {
            if (record.has(fk.getColumn())) {
                record.put(fk.getColumn(), coercion.toInteger(record.get(fk.getColumn())));
            }
        }
        for (String column : booleanColumns) {
            Boolean b = coercion.toBoolean(record.get(column));
            if (b != null) {
                record.put(column, b);
            }
        }
        return record;
    }

    private RowResult write(TableLoadSpec spec, TableSchema schema, String idColumn, Long id,
            Record projected, Record prepared) throws SQLException {
        boolean exists = id != null && existsById(schema.getTableName(), idColumn, id);
        if (exists) {
            if (spec.getMode() == LoadMode.INSERT_ONLY) {
                return RowResult.skipped(prepared, SkipReason.ALREADY_PRESENT);
            }
            List<String> columns = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            for (Map.Entry<String, Object> e : projected.asMap().entrySet()) {
                if (e.getValue() != null && !e.getKey().equals(idColumn)) {
                    columns.add(e.getKey());
                    values.add(e.getValue());
                }
            }
            if (columns.isEmpty()) {
                return RowResult.skipped(prepared, SkipReason.NO_UPDATABLE_COLUMNS);
            }
            values.add(id);
            execute(sql.updateById(schema.getTableName(), columns, idColumn), values);
            return RowResult.updated(prepared);
        }

        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> e : projected.asMap().entrySet()) {
            if (e.getValue() != null) {
                columns.add(e.getKey());
                values.add(e.getValue());
            }
        }
        if (columns.isEmpty()) {
            return RowResult.skipped(prepared, SkipReason.EMPTY_RECORD);
        }
        execute(sql.insert(schema.getTableName(), columns), values);
        return RowResult.inserted(prepared);
    }

    private boolean existsById(String table, String idColumn, Long id) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql.existsById(table, idColumn))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void execute(String statement, List<Object> values) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(statement)) {
            for (int i = 0; i < values.size(); i++) {
                ps.setObject(i + 1, values.get(i));
            }
            ps.executeUpdate();
        }
    }
}
