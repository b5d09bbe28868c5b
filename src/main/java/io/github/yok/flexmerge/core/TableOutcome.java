package io.github.yok.flexmerge.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Counters and quarantined rows accumulated for one destination table during one run.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableOutcome {

    @Getter
    private final String table;

    @Getter
    private int inserted;

    @Getter
    private int updated;

    @Getter
    private int skipped;

    private final Map<SkipReason, Integer> skipReasons = new EnumMap<>(SkipReason.class);

    private final List<RowResult> rejections = new ArrayList<>();

    // set when the table's load was aborted as a whole
    @Getter
    private String failure;

    /**
     * Creates an empty outcome.
     *
     * @param table destination table
     */
    public TableOutcome(String table) {
        this.table = table;
    }

    /**
     * Adds one row result to the counters.
     *
     * @param result row result
     */
    public void record(RowResult result) {
        switch (result.getOutcome()) {
            case INSERTED:
                inserted++;
                break;
            case UPDATED:
                updated++;
                break;
            case SKIPPED:
                skipped++;
                skipReasons.merge(result.getSkipReason(), 1, Integer::sum);
                break;
            default:
                rejections.add(result);
                break;
        }
    }

    /**
     * Marks the whole table as failed (e.g. its schema could not be read).
     *
     * @param reason failure description
     */
    public void markFailed(String reason) {
        this.failure = reason;
    }

    public boolean isFailed() {
        return failure != null;
    }

    /**
     * Returns the number of quarantined rows.
     *
     * @return invalid count
     */
    public int getInvalidCount() {
        return rejections.size();
    }

    /**
     * Returns the quarantined rows with their failure kinds, in processing order.
     *
     * @return unmodifiable list
     */
    public List<RowResult> getRejections() {
        return Collections.unmodifiableList(rejections);
    }

    /**
     * Returns the quarantined records in processing order.
     *
     * @return quarantine set
     */
    public List<Record> getQuarantine() {
        return rejections.stream().map(RowResult::getRecord).collect(Collectors.toList());
    }

    /**
     * Returns how many rows were skipped for a reason.
     *
     * @param reason skip reason
     * @return count
     */
    public int getSkipped(SkipReason reason) {
        return skipReasons.getOrDefault(reason, 0);
    }

    /**
     * Returns the skip counts per reason for log output.
     *
     * @return {@code " {REASON=n, ...}"}, or an empty string when nothing was skipped
     */
    public String skipBreakdown() {
        return skipReasons.isEmpty() ? "" : " " + skipReasons;
    }

    @Override
    public String toString() {
        return String.format("Table[%s] inserted=%d, updated=%d, skipped=%d%s, invalid=%d%s",
                table, inserted, updated, skipped, skipReasons.isEmpty() ? "" : skipReasons,
                getInvalidCount(), failure == null ? "" : ", FAILED: " + failure);
    }
}
