package io.github.yok.flexmerge.core;

/**
 * How a declared foreign-key column is enforced for a row.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ForeignKeyPolicy {
    // Column must be present, non-null and resolvable; otherwise the row is quarantined
    REQUIRED,
    // Null is accepted; a non-null value must resolve or the row is quarantined
    OPTIONAL,
    // Null is accepted; an unresolvable value is cleared to null and the row is kept
    CLEAR
}
