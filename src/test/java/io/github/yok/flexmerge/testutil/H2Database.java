package io.github.yok.flexmerge.testutil;

import io.github.yok.flexmerge.config.ConnectionConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.apache.commons.io.IOUtils;

/**
 * Private in-memory H2 database holding the airport test schema.
 */
public final class H2Database implements AutoCloseable {

    private final String url;

    // keeps the in-memory database alive
    private final Connection keepAlive;

    private H2Database(String url) throws SQLException {
        this.url = url;
        this.keepAlive = DriverManager.getConnection(url, "sa", "");
    }

    /**
     * Creates a fresh database with {@code schema-airport.sql} applied.
     *
     * @return database
     * @throws Exception if the schema cannot be applied
     */
    public static H2Database create() throws Exception {
        String name = "fm_" + UUID.randomUUID().toString().replace("-", "");
        H2Database db = new H2Database("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1");
        db.runScript("/schema-airport.sql");
        return db;
    }

    public String getUrl() {
        return url;
    }

    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, "sa", "");
    }

    /**
     * Returns a connection entry for this database.
     *
     * @param id entry id
     * @return entry
     */
    public ConnectionConfig.Entry entry(String id) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(id);
        entry.setUrl(url);
        entry.setUser("sa");
        entry.setPassword("");
        entry.setDriverClass("org.h2.Driver");
        return entry;
    }

    public void execute(String sql) throws SQLException {
        try (Statement st = keepAlive.createStatement()) {
            st.execute(sql);
        }
    }

    public long count(String table) throws SQLException {
        return queryLong("SELECT COUNT(*) FROM " + table);
    }

    public long queryLong(String sql) throws SQLException {
        try (Statement st = keepAlive.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public String queryString(String sql) throws SQLException {
        try (Statement st = keepAlive.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    /**
     * Returns the names of the tables in PUBLIC.
     *
     * @return upper-case table names
     * @throws SQLException on failure
     */
    public List<String> tableNames() throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement st = keepAlive.createStatement(); ResultSet rs = st.executeQuery(
                "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC'")) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private void runScript(String resource) throws IOException, SQLException {
        String script;
        try (InputStream in = H2Database.class.getResourceAsStream(resource)) {
            script = IOUtils.toString(in, StandardCharsets.UTF_8);
        }
        for (String statement : script.split(";")) {
            if (!statement.isBlank()) {
                execute(statement);
            }
        }
    }

    @Override
    public void close() throws SQLException {
        try (Statement st = keepAlive.createStatement()) {
            st.execute("SHUTDOWN");
        }
        keepAlive.close();
    }
}
