package io.github.yok.flexmerge.core;

/**
 * Write strategy of the single-row path.
 *
 * @author Yasuharu.Okawauchi
 */
public enum LoadMode {
    // Insert rows whose id is absent; rows whose id exists are skipped (master data, change log)
    INSERT_ONLY,
    // Update rows whose id exists, insert the rest
    UPSERT
}
