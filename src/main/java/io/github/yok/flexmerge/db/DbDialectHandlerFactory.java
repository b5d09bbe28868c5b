package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.config.DialectMode;
import io.github.yok.flexmerge.config.MergeConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link DbDialectHandler} for a connection entry.
 *
 * <p>
 * The dialect is taken from {@code merge.dialect}. When it is not set, it is inferred from the
 * JDBC URL prefix ({@code jdbc:mysql:}, {@code jdbc:postgresql:}, {@code jdbc:h2:}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDialectHandlerFactory {

    private final MergeConfig mergeConfig;

    private final DbUnitConfigFactory configFactory;

    /**
     * Creates a handler for the given connection entry.
     *
     * @param entry connection entry
     * @return dialect handler
     * @throws IllegalArgumentException if the dialect is neither configured nor inferable
     */
    public DbDialectHandler create(ConnectionConfig.Entry entry) {
        DialectMode mode = mergeConfig.getDialect();
        if (mode == null) {
            mode = inferFromUrl(entry.getUrl());
            log.debug("[{}] Dialect inferred from URL: {}", entry.getId(), mode);
        }
        switch (mode) {
            case MYSQL:
                return new MySqlDialectHandler(configFactory);
            case POSTGRESQL:
                return new PostgresqlDialectHandler(configFactory);
            case H2:
                return new H2DialectHandler(configFactory);
            default:
                String msg = "Unsupported dialect: " + mode;
                log.error(msg);
                throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Infers the dialect from a JDBC URL.
     *
     * @param url JDBC URL
     * @return dialect
     * @throws IllegalArgumentException if the URL belongs to no supported product
     */
    static DialectMode inferFromUrl(String url) {
        if (url != null) {
            if (url.startsWith("jdbc:mysql:")) {
                return DialectMode.MYSQL;
            }
            if (url.startsWith("jdbc:postgresql:")) {
                return DialectMode.POSTGRESQL;
            }
            if (url.startsWith("jdbc:h2:")) {
                return DialectMode.H2;
            }
        }
        throw new IllegalArgumentException(
                "Cannot infer dialect from URL: " + url + ". Set 'merge.dialect'.");
    }
}
