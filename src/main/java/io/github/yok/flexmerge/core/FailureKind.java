package io.github.yok.flexmerge.core;

/**
 * Why a row was quarantined.
 *
 * <ul>
 * <li>{@link #REQUIRED_COLUMN_MISSING} and {@link #FK_UNRESOLVED} are validation failures: nothing
 * was sent to the database.</li>
 * <li>{@link #WRITE_FAILED} is a write failure reported by the database for this row only.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum FailureKind {
    REQUIRED_COLUMN_MISSING,
    FK_UNRESOLVED,
    WRITE_FAILED
}
