package io.github.yok.flexmerge.config;

import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages DB connection settings loaded from {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: airport
 *     url: jdbc:mysql://localhost:3306/airport
 *     user: loader
 *     password: password
 *     driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * One target database.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "airport")
        private String id;
        // JDBC connection URL
        private String url;
        private String user;
        private String password;
        // Fully qualified JDBC driver class name; optional for JDBC 4 drivers
        private String driverClass;
    }
}
