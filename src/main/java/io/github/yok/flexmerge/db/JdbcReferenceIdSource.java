package io.github.yok.flexmerge.db;

import io.github.yok.flexmerge.core.ReferenceIdSource;
import io.github.yok.flexmerge.core.SchemaFetchException;
import io.github.yok.flexmerge.core.SchemaProjector;
import io.github.yok.flexmerge.core.TableSchema;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * Loads all identifiers of a referenced table with a single {@code SELECT id FROM t}.
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class JdbcReferenceIdSource implements ReferenceIdSource {

    private final Connection connection;
    private final SqlStatementBuilder sql;
    private final SchemaProjector projector;
    private final String idColumn;

    /**
     * Creates a source reading the {@code id} column.
     *
     * @param connection connection bound to the current run
     * @param sql statement builder
     * @param projector projector used to resolve catalog names
     */
    public JdbcReferenceIdSource(Connection connection, SqlStatementBuilder sql,
            SchemaProjector projector) {
        this(connection, sql, projector, "id");
    }

    @Override
    public Set<Long> loadIds(String table) throws SQLException {
        TableSchema schema = projector.schemaOf(table);
        if (!schema.hasColumn(idColumn)) {
            throw new SchemaFetchException(table,
                    "Referenced table " + table + " has no column " + idColumn, null);
        }
        Set<Long> ids = new HashSet<>();
        try (PreparedStatement ps = connection.prepareStatement(
                sql.selectIds(schema.getTableName(), schema.requireColumn(idColumn)));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong(1);
                if (!rs.wasNull()) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }
}
