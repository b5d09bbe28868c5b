package io.github.yok.flexmerge.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of one staged natural-key merge.
 *
 * <p>
 * {@code inserted} and {@code updated} are driver-reported and advisory; they are {@code null}
 * when the driver reports no count.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class MergeOutcome {

    private final String table;
    private final int received;
    private final int duplicatesDropped;
    private final int staged;
    private final Integer inserted;
    private final Integer updated;
    private final List<RowResult> rejections;

    MergeOutcome(String table, int received, int duplicatesDropped, int staged, Integer inserted,
            Integer updated, List<RowResult> rejections) {
        this.table = table;
        this.received = received;
        this.duplicatesDropped = duplicatesDropped;
        this.staged = staged;
        this.inserted = inserted;
        this.updated = updated;
        this.rejections = Collections.unmodifiableList(new ArrayList<>(rejections));
    }

    /**
     * Returns the number of rows removed before staging.
     *
     * @return invalid row count
     */
    public int getInvalidCount() {
        return rejections.size();
    }

    /**
     * Returns the invalid rows in input order, with aliases and coercions applied.
     *
     * @return invalid records
     */
    public List<Record> getInvalidRecords() {
        List<Record> list = new ArrayList<>();
        for (RowResult r : rejections) {
            list.add(r.getRecord());
        }
        return list;
    }

    @Override
    public String toString() {
        return String.format("Table[%s] received=%d duplicates=%d invalid=%d staged=%d"
                + " inserted(approx)=%s updated(approx)=%s", table, received, duplicatesDropped,
                getInvalidCount(), staged, inserted, updated);
    }
}
