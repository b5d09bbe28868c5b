package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.config.ImportPlanConfig;
import io.github.yok.flexmerge.config.MergeConfig;
import io.github.yok.flexmerge.config.PathsConfig;
import io.github.yok.flexmerge.db.DbDialectHandler;
import io.github.yok.flexmerge.db.DbUnitStagingArea;
import io.github.yok.flexmerge.db.DriverManagerConnectionProvider;
import io.github.yok.flexmerge.db.JdbcReferenceIdSource;
import io.github.yok.flexmerge.db.JdbcSchemaSource;
import io.github.yok.flexmerge.db.SqlStatementBuilder;
import io.github.yok.flexmerge.db.StagingTableSweeper;
import io.github.yok.flexmerge.io.CsvQuarantineWriter;
import io.github.yok.flexmerge.io.CsvRecordSource;
import io.github.yok.flexmerge.io.RecordSource;
import io.github.yok.flexmerge.util.ErrorHandler;
import io.github.yok.flexmerge.util.TableDependencyResolver;
import io.github.yok.flexmerge.util.ValueCoercion;
import java.io.IOException;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an import against each target database.
 *
 * <ol>
 * <li>orphaned staging tables are dropped (when enabled)</li>
 * <li>master tables are loaded parent-first in one transaction</li>
 * <li>the natural-key batch is merged through a staging table</li>
 * <li>dependent tables are loaded parent-first in one transaction</li>
 * <li>rejected rows are exported and a summary is logged</li>
 * </ol>
 *
 * <p>
 * A table whose schema cannot be read is recorded as failed and the phase goes on without it.
 * Any other database error rolls the phase back: a failed master phase ends the run, since the
 * later phases reference master rows, whereas a failed merge or dependent phase is recorded and
 * the run continues. The resolution and schema caches live in one {@link ReconciliationContext}
 * per run and are never invalidated within it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportRunner {

    static final String MASTER_PHASE = "master";
    static final String DEPENDENT_PHASE = "dependent";

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final MergeConfig mergeConfig;
    private final ImportPlanConfig plan;
    private final Function<ConnectionConfig.Entry, DbDialectHandler> dialectFactory;

    /**
     * Creates a runner.
     *
     * @param pathsConfig data directories
     * @param connectionConfig target databases
     * @param mergeConfig engine settings
     * @param plan import plan
     * @param dialectFactory dialect handler per connection entry
     */
    public ImportRunner(PathsConfig pathsConfig, ConnectionConfig connectionConfig,
            MergeConfig mergeConfig, ImportPlanConfig plan,
            Function<ConnectionConfig.Entry, DbDialectHandler> dialectFactory) {
        this.pathsConfig = pathsConfig;
        this.connectionConfig = connectionConfig;
        this.mergeConfig = mergeConfig;
        this.plan = plan;
        this.dialectFactory = dialectFactory;
    }

    /**
     * Imports into every targeted database.
     *
     * @param targetDbIds database ids; empty means all
     * @return one summary per database that completed
     */
    public List<ImportSummary> execute(List<String> targetDbIds) {
        log.info("=== Import started (target DBs={}) ===", targetDbIds);
        List<ImportSummary> summaries = new ArrayList<>();
        for (ConnectionConfig.Entry entry : connectionConfig.getConnections()) {
            String dbId = entry.getId();
            if (targetDbIds != null && !targetDbIds.isEmpty() && !targetDbIds.contains(dbId)) {
                log.info("[{}] Not targeted → skipping", dbId);
                continue;
            }
            try {
                summaries.add(run(entry));
            } catch (SQLException e) {
                log.error("[{}] Import failed: {}", dbId, e.getMessage(), e);
                ErrorHandler.errorAndExit("Import failed (DB=" + dbId + ")", e);
            }
        }
        log.info("=== Import finished ===");
        return summaries;
    }

    /**
     * Imports into one database, reading sources from the {@code load} directory.
     *
     * @param entry connection entry
     * @return run summary
     * @throws SQLException if the database cannot be reached
     */
    public ImportSummary run(ConnectionConfig.Entry entry) throws SQLException {
        return run(entry, new CsvRecordSource(Paths.get(pathsConfig.getLoad())));
    }

    /**
     * Imports into one database.
     *
     * @param entry connection entry
     * @param source record source
     * @return run summary
     * @throws SQLException if the database cannot be reached
     */
    public ImportSummary run(ConnectionConfig.Entry entry, RecordSource source)
            throws SQLException {
        String dbId = entry.getId();
        DbDialectHandler dialect = dialectFactory.apply(entry);
        ConnectionProvider connections = new DriverManagerConnectionProvider(entry, dialect);
        String schema = dialect.resolveSchema(entry);
        SqlStatementBuilder sql = new SqlStatementBuilder(dialect);
        ReconciliationContext context =
                new ReconciliationContext(new ValueCoercion(mergeConfig.getTruthyExtras()));
        ImportSummary summary = new ImportSummary(dbId);

        try (Connection connection = connections.open()) {
            if (mergeConfig.isSweepOrphansOnStart()) {
                new StagingTableSweeper(sql, mergeConfig.getStagingPrefix()).sweep(connection,
                        schema);
            }
            SchemaProjector projector =
                    new SchemaProjector(new JdbcSchemaSource(connection, schema), context);
            ForeignKeyResolver resolver = new ForeignKeyResolver(context,
                    new JdbcReferenceIdSource(connection, sql, projector));
            UpsertExecutor executor =
                    new UpsertExecutor(connection, dialect, sql, projector, resolver, context);
            TransactionScope tx = new JdbcTransactionScope(connection);

            boolean mastersDone = runPhase(dbId, MASTER_PHASE, plan.toMasterSpecs(), source,
                    executor, tx, summary, true);
            if (mastersDone) {
                StagedBulkMerge merge = new StagedBulkMerge(
                        new DbUnitStagingArea(connections, dialect, sql, schema), sql, projector,
                        resolver, context, mergeConfig.getStagingPrefix(),
                        mergeConfig.getCreatedColumnCandidates(),
                        mergeConfig.getUpdatedColumnCandidates());
                runMerge(dbId, plan.toMergeSpec(), source, merge, tx, summary);
                runPhase(dbId, DEPENDENT_PHASE, plan.toDependentSpecs(), source, executor, tx,
                        summary, false);
            }
        }

        exportQuarantine(dbId, summary);
        summary.log();
        return summary;
    }

    private boolean runPhase(String dbId, String phase, List<TableLoadSpec> specs,
            RecordSource source, UpsertExecutor executor, TransactionScope tx,
            ImportSummary summary, boolean abortOnFailure) {
        if (specs.isEmpty()) {
            return true;
        }
        List<TableLoadSpec> ordered = TableDependencyResolver.resolveLoadOrder(specs);
        Map<TableLoadSpec, List<Record>> batches = new LinkedHashMap<>();
        for (TableLoadSpec spec : ordered) {
            try {
                batches.put(spec, source.read(spec.getSource()));
            } catch (IOException e) {
                log.error("[{}] Table[{}] source could not be read: {}", dbId, spec.getTable(),
                        e.getMessage(), e);
                TableOutcome failed = new TableOutcome(spec.getTable());
                failed.markFailed("source unreadable: " + e.getMessage());
                summary.add(failed);
            }
        }

        log.info("[{}] --- {} phase: {} tables ---", dbId, phase, batches.size());
        List<String> written = new ArrayList<>();
        try {
            tx.execute(connection -> {
                for (Map.Entry<TableLoadSpec, List<Record>> batch : batches.entrySet()) {
                    String table = batch.getKey().getTable();
                    if (batch.getValue().isEmpty()) {
                        log.info("[{}] Table[{}] no source rows; skipped", dbId, table);
                        continue;
                    }
                    try {
                        summary.add(executor.load(batch.getKey(), batch.getValue()));
                        written.add(table);
                    } catch (SchemaFetchException e) {
                        log.error("[{}] Table[{}] aborted: {}", dbId, table, e.getMessage());
                        TableOutcome failed = new TableOutcome(table);
                        failed.markFailed(e.getMessage());
                        summary.add(failed);
                    }
                }
            });
            log.info("[{}] {} phase committed", dbId, phase);
            return true;
        } catch (SQLException e) {
            log.error("[{}] {} phase rolled back: {}", dbId, phase, e.getMessage(), e);
            summary.markPhaseFailed(phase, e.getMessage(), written, abortOnFailure);
            return !abortOnFailure;
        }
    }

    private void runMerge(String dbId, NaturalKeyMergeSpec spec, RecordSource source,
            StagedBulkMerge merge, TransactionScope tx, ImportSummary summary) {
        if (spec == null) {
            return;
        }
        List<Record> batch;
        try {
            batch = source.read(spec.getSource());
        } catch (IOException e) {
            log.error("[{}] Table[{}] source could not be read: {}", dbId, spec.getTable(),
                    e.getMessage(), e);
            summary.markMergeFailed("source unreadable: " + e.getMessage());
            return;
        }
        if (batch.isEmpty()) {
            log.info("[{}] Table[{}] no source rows; merge skipped", dbId, spec.getTable());
            return;
        }
        log.info("[{}] --- natural-key merge: Table[{}] ({} rows) ---", dbId, spec.getTable(),
                batch.size());
        try {
            summary.setMerge(merge.merge(spec, batch, tx));
        } catch (SQLException e) {
            log.error("[{}] Table[{}] merge failed: {}", dbId, spec.getTable(), e.getMessage(),
                    e);
            summary.markMergeFailed(e.getMessage());
        }
    }

    private void exportQuarantine(String dbId, ImportSummary summary) {
        CsvQuarantineWriter writer =
                new CsvQuarantineWriter(Paths.get(pathsConfig.getQuarantine()));
        try {
            for (TableOutcome outcome : summary.getTables()) {
                writer.write(outcome.getTable(), outcome.getRejections());
            }
            if (summary.getMerge() != null) {
                writer.write(summary.getMerge().getTable(), summary.getMerge().getRejections());
            }
        } catch (IOException e) {
            log.error("[{}] Quarantine export failed: {}", dbId, e.getMessage(), e);
        }
    }
}
