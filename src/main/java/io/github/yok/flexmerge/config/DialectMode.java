package io.github.yok.flexmerge.config;

/**
 * Supported database products.
 */
public enum DialectMode {
    MYSQL, POSTGRESQL, H2
}
