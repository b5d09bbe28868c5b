package io.github.yok.flexmerge.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Result of one import run against one database.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportSummary {

    @Getter
    private final String dbId;

    private final Map<String, TableOutcome> tables = new LinkedHashMap<>();

    @Getter
    @Setter
    private MergeOutcome merge;

    @Getter
    private String mergeFailure;

    private final List<String> phaseFailures = new ArrayList<>();

    // set when a phase failure stopped the run before its last phase
    @Getter
    private boolean aborted;

    /**
     * Creates an empty summary.
     *
     * @param dbId database identifier
     */
    public ImportSummary(String dbId) {
        this.dbId = dbId;
    }

    /**
     * Adds or replaces the outcome of a table.
     *
     * @param outcome table outcome
     */
    public void add(TableOutcome outcome) {
        tables.put(outcome.getTable(), outcome);
    }

    /**
     * Returns the outcome of a table.
     *
     * @param table table name as declared
     * @return outcome, or {@code null} when the table was not processed
     */
    public TableOutcome getTable(String table) {
        return tables.get(table);
    }

    /**
     * Returns all table outcomes in processing order.
     *
     * @return unmodifiable list
     */
    public List<TableOutcome> getTables() {
        return Collections.unmodifiableList(new ArrayList<>(tables.values()));
    }

    /**
     * Records a failed merge.
     *
     * @param reason failure description
     */
    public void markMergeFailed(String reason) {
        this.mergeFailure = reason;
    }

    /**
     * Records a rolled-back phase. The tables written in that phase are marked failed, since none
     * of their rows was kept.
     *
     * @param phase phase name
     * @param reason failure description
     * @param phaseTables tables of the phase
     * @param abortRun whether later phases were skipped
     */
    public void markPhaseFailed(String phase, String reason, List<String> phaseTables,
            boolean abortRun) {
        phaseFailures.add(phase + ": " + reason);
        for (String table : phaseTables) {
            TableOutcome outcome = tables.get(table);
            if (outcome != null && !outcome.isFailed()) {
                outcome.markFailed("rolled back (" + phase + ")");
            }
        }
        if (abortRun) {
            aborted = true;
        }
    }

    public List<String> getPhaseFailures() {
        return Collections.unmodifiableList(phaseFailures);
    }

    /**
     * Returns whether everything ran without a table, merge or phase failure. Quarantined rows do
     * not count as failures.
     *
     * @return {@code true} when nothing failed
     */
    public boolean isClean() {
        if (aborted || mergeFailure != null || !phaseFailures.isEmpty()) {
            return false;
        }
        for (TableOutcome t : tables.values()) {
            if (t.isFailed()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Logs the per-table counters as an aligned table.
     */
    public void log() {
        log.info("[{}] ===== Import summary =====", dbId);
        int nameLen = 5;
        for (String name : tables.keySet()) {
            nameLen = Math.max(nameLen, name.length());
        }
        String fmt = "  Table[%-" + nameLen + "s] inserted=%d updated=%d skipped=%d invalid=%d%s";
        for (TableOutcome t : tables.values()) {
            log.info(String.format(fmt, t.getTable(), t.getInserted(), t.getUpdated(),
                    t.getSkipped(), t.getInvalidCount(),
                    t.isFailed() ? " FAILED: " + t.getFailure() : t.skipBreakdown()));
        }
        if (merge != null) {
            log.info("  Merge {}", merge);
        }
        if (mergeFailure != null) {
            log.info("  Merge FAILED: {}", mergeFailure);
        }
        for (String failure : phaseFailures) {
            log.info("  Phase FAILED: {}", failure);
        }
    }
}
