package io.github.yok.flexmerge.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} when bulk-loading staging tables.
 *
 * <ul>
 * <li>{@code dbunit.batched-statements}: whether inserts are sent as JDBC batches</li>
 * <li>{@code dbunit.batch-size}: number of statements per batch</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Whether empty strings are accepted as field values.
     */
    private boolean allowEmptyFields = true;

    /**
     * Whether DBUnit's batched statement execution is enabled.
     */
    private boolean batchedStatements = true;

    /**
     * Statements per batch when batching is enabled.
     */
    private int batchSize = 500;
}
