package io.github.yok.flexmerge.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of processing one record. Row-level problems are reported through this type instead of
 * exceptions.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RowResult {

    /**
     * Terminal state of a row.
     */
    public enum Outcome {
        INSERTED, UPDATED, SKIPPED, QUARANTINED
    }

    private final Outcome outcome;
    private final Record record;
    private final SkipReason skipReason;
    private final FailureKind failureKind;
    private final String detail;

    public static RowResult inserted(Record record) {
        return new RowResult(Outcome.INSERTED, record, null, null, null);
    }

    public static RowResult updated(Record record) {
        return new RowResult(Outcome.UPDATED, record, null, null, null);
    }

    public static RowResult skipped(Record record, SkipReason reason) {
        return new RowResult(Outcome.SKIPPED, record, reason, null, null);
    }

    public static RowResult quarantined(Record record, FailureKind kind, String detail) {
        return new RowResult(Outcome.QUARANTINED, record, null, kind, detail);
    }

    public boolean isQuarantined() {
        return outcome == Outcome.QUARANTINED;
    }
}
