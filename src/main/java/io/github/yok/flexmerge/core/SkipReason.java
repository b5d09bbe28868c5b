package io.github.yok.flexmerge.core;

/**
 * Why a row was counted as skipped rather than written.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SkipReason {
    // Update target exists but the row carries no non-null column besides the id
    NO_UPDATABLE_COLUMNS,
    // Insert-only load and a row with the same id already exists
    ALREADY_PRESENT,
    // Insert requested for a row without any non-null column
    EMPTY_RECORD
}
