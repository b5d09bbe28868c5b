package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.db.SqlStatementBuilder;
import io.github.yok.flexmerge.util.ValueCoercion;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges a whole batch into its destination table on a natural key.
 *
 * <ol>
 * <li>records sharing a natural key are collapsed; the last occurrence wins</li>
 * <li>records with an unresolved foreign key or an incomplete key are set aside as invalid, in
 * input order and with aliases and coercions applied</li>
 * <li>valid records are bulk-loaded into a staging table outside the caller's transaction</li>
 * <li>inside the caller's transaction, one {@code INSERT ... SELECT} adds the keys missing from
 * the destination and one {@code UPDATE} overwrites the mutable columns of the matching rows</li>
 * <li>the staging table is dropped whatever happened before</li>
 * </ol>
 *
 * <p>
 * Detected "created"/"updated" timestamp columns of the destination are set to the current time:
 * both on insert, the latter on update.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StagedBulkMerge {

    private final StagingArea staging;
    private final SqlStatementBuilder sql;
    private final SchemaProjector projector;
    private final ForeignKeyResolver resolver;
    private final ValueCoercion coercion;
    private final String stagingPrefix;
    private final List<String> createdColumnCandidates;
    private final List<String> updatedColumnCandidates;

    /**
     * Creates a merge.
     *
     * @param staging staging area
     * @param sql statement builder
     * @param projector schema projector
     * @param resolver foreign-key resolver
     * @param context run context
     * @param stagingPrefix staging table name prefix
     * @param createdColumnCandidates candidate names of the creation timestamp column
     * @param updatedColumnCandidates candidate names of the update timestamp column
     */
    public StagedBulkMerge(StagingArea staging, SqlStatementBuilder sql, SchemaProjector projector,
            ForeignKeyResolver resolver, ReconciliationContext context, String stagingPrefix,
            List<String> createdColumnCandidates, List<String> updatedColumnCandidates) {
        this.staging = staging;
        this.sql = sql;
        this.projector = projector;
        this.resolver = resolver;
        this.coercion = context.getCoercion();
        this.stagingPrefix = stagingPrefix;
        this.createdColumnCandidates = createdColumnCandidates;
        this.updatedColumnCandidates = updatedColumnCandidates;
    }

    /**
     * Runs the merge.
     *
     * @param spec merge description
     * @param records batch in source order
     * @param tx caller's transaction for the set-based statements
     * @return counters and invalid rows
     * @throws BulkLoadException when required source columns are missing, or the staging table
     *         cannot be created or loaded; nothing has been written to the destination
     * @throws SQLException when the schema, the referenced ids or the set-based statements fail;
     *         the transaction has been rolled back
     */
    public MergeOutcome merge(NaturalKeyMergeSpec spec, List<Record> records, TransactionScope tx)
            throws SQLException {
        List<Record> aliased = new ArrayList<>();
        for (Record raw : records) {
            aliased.add(applyAliases(raw, spec.getColumnAliases()));
        }
        checkRequiredColumns(spec, aliased);

        TableSchema schema = projector.schemaOf(spec.getTable());
        List<String> columns = new ArrayList<>();
        for (String c : spec.getMergeColumns()) {
            if (!schema.hasColumn(c)) {
                throw new BulkLoadException(
                        "Merge column " + c + " does not exist in " + schema.getTableName(), null);
            }
            columns.add(schema.columnName(c));
        }
        List<String> keyColumns = catalogNames(schema, spec.getKeyColumns());
        List<String> mutableColumns = catalogNames(schema, spec.getMutableColumns());

        // input index -> rejection, so invalid rows are reported in input order
        Map<Integer, RowResult> rejected = new TreeMap<>();
        Map<List<Object>, Record> byKey = new LinkedHashMap<>();
        Map<List<Object>, Integer> indexByKey = new LinkedHashMap<>();
        for (int i = 0; i < aliased.size(); i++) {
            Record prepared = coerce(aliased.get(i), spec);
            Record projected = projector.project(prepared, schema);
            List<Object> key = keyOf(projected, keyColumns);
            if (key == null) {
                rejected.put(i, RowResult.quarantined(prepared,
                        FailureKind.REQUIRED_COLUMN_MISSING, "natural key incomplete"));
                continue;
            }
            byKey.remove(key);
            byKey.put(key, projected);
            indexByKey.put(key, i);
        }
        int duplicates = records.size() - rejected.size() - byKey.size();

        List<Object[]> rows = new ArrayList<>();
        for (Map.Entry<List<Object>, Record> e : byKey.entrySet()) {
            ForeignKeyConstraint violation = resolver.findViolation(e.getValue(),
                    spec.getForeignKeys());
            if (violation != null) {
                int index = indexByKey.get(e.getKey());
                rejected.put(index, RowResult.quarantined(aliased.get(index),
                        FailureKind.FK_UNRESOLVED, violation.getColumn() + "="
                                + e.getValue().get(violation.getColumn()) + " not found in "
                                + violation.getReferencedTable()));
                continue;
            }
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < row.length; c++) {
                row[c] = e.getValue().get(columns.get(c));
            }
            rows.add(row);
        }
        List<RowResult> rejections = new ArrayList<>(rejected.values());
        if (!rejections.isEmpty()) {
            log.warn("Table[{}] {} invalid rows removed before staging", schema.getTableName(),
                    rejections.size());
        }
        if (rows.isEmpty()) {
            log.info("Table[{}] nothing to merge", schema.getTableName());
            return new MergeOutcome(spec.getTable(), records.size(), duplicates, 0, null,
                    null, rejections);
        }

        String created = detectColumn(schema, createdColumnCandidates, columns);
        String updated = detectColumn(schema, updatedColumnCandidates, columns);
        log.info("Table[{}] timestamp columns: created={}, updated={}", schema.getTableName(),
                created, updated);
        List<String> stamps = new ArrayList<>();
        if (created != null) {
            stamps.add(created);
        }
        if (updated != null) {
            stamps.add(updated);
        }

        String stagingTable = staging.allocateName(stagingPrefix);
        Integer[] counts = new Integer[2];
        try {
            try {
                staging.create(stagingTable, schema.getTableName(), columns);
            } catch (SQLException e) {
                throw new BulkLoadException("Failed to create staging table " + stagingTable
                        + ": " + e.getMessage(), e);
            }
            staging.load(stagingTable, columns, rows);

            String insert = sql.insertMissingFromStaging(schema.getTableName(), stagingTable,
                    columns, keyColumns, stamps);
            String update = mutableColumns.isEmpty() && updated == null ? null
                    : sql.updateFromStaging(schema.getTableName(), stagingTable, keyColumns,
                            mutableColumns, updated);
            tx.execute(connection -> {
                try (Statement st = connection.createStatement()) {
                    counts[0] = advisory(st.executeUpdate(insert));
                    if (update != null) {
                        counts[1] = advisory(st.executeUpdate(update));
                    }
                }
            });
        } finally {
            try {
                staging.drop(stagingTable);
            } catch (SQLException e) {
                log.warn("Could not drop staging table {}: {}", stagingTable, e.getMessage());
            }
        }
        MergeOutcome outcome = new MergeOutcome(spec.getTable(), records.size(), duplicates,
                rows.size(), counts[0], counts[1], rejections);
        log.info("{}", outcome);
        return outcome;
    }

    private Record applyAliases(Record raw, Map<String, String> aliases) {
        Record record = raw.copy();
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            record.rename(alias.getKey(), alias.getValue());
        }
        return record;
    }

    private void checkRequiredColumns(NaturalKeyMergeSpec spec, List<Record> records)
            throws BulkLoadException {
        if (records.isEmpty()) {
            return;
        }
        Set<String> present = new LinkedHashSet<>();
        for (Record r : records) {
            for (String f : r.fieldNames()) {
                present.add(f.toLowerCase(Locale.ROOT));
            }
        }
        List<String> missing = new ArrayList<>();
        for (String c : spec.getRequiredSourceColumns()) {
            if (!present.contains(c.toLowerCase(Locale.ROOT))) {
                missing.add(c);
            }
        }
        if (!missing.isEmpty()) {
            throw new BulkLoadException("Required source columns missing for " + spec.getTable()
                    + ": " + missing, null);
        }
    }

    private Record coerce(Record record, NaturalKeyMergeSpec spec) {
        for (ForeignKeyConstraint fk : spec.getForeignKeys()) {
            if (record.has(fk.getColumn())) {
                record.put(fk.getColumn(), coercion.toInteger(record.get(fk.getColumn())));
            }
        }
        return record;
    }

    private static List<Object> keyOf(Record record, List<String> keyColumns) {
        Object[] key = new Object[keyColumns.size()];
        for (int i = 0; i < key.length; i++) {
            key[i] = record.get(keyColumns.get(i));
            if (key[i] == null) {
                return null;
            }
        }
        return Arrays.asList(key);
    }

    private static List<String> catalogNames(TableSchema schema, List<String> names) {
        List<String> result = new ArrayList<>();
        for (String n : names) {
            result.add(schema.requireColumn(n));
        }
        return result;
    }

    private static String detectColumn(TableSchema schema, List<String> candidates,
            List<String> mergeColumns) {
        for (String candidate : candidates) {
            String column = schema.columnName(candidate);
            if (column != null && !mergeColumns.contains(column)) {
                return column;
            }
        }
        return null;
    }

    private static Integer advisory(int count) {
        return count < 0 ? null : count;
    }
}
