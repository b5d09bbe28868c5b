package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.core.ConnectionProvider;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens connections with {@link DriverManager} from a connection entry and applies the dialect's
 * session initialization.
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class DriverManagerConnectionProvider implements ConnectionProvider {

    private final ConnectionConfig.Entry entry;

    private final DbDialectHandler dialect;

    @Override
    public Connection open() throws SQLException {
        if (StringUtils.isNotBlank(entry.getDriverClass())) {
            try {
                Class.forName(entry.getDriverClass());
            } catch (ClassNotFoundException e) {
                throw new SQLException("JDBC driver not found: " + entry.getDriverClass(), e);
            }
        }
        Connection connection =
                DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        try {
            dialect.prepareConnection(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }
}
