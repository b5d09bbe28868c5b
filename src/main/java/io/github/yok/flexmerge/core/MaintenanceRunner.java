package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.config.MergeConfig;
import io.github.yok.flexmerge.config.PathsConfig;
import io.github.yok.flexmerge.db.DbDialectHandler;
import io.github.yok.flexmerge.db.DriverManagerConnectionProvider;
import io.github.yok.flexmerge.db.SqlStatementBuilder;
import io.github.yok.flexmerge.db.StagingTableSweeper;
import io.github.yok.flexmerge.io.DataDictionaryExporter;
import io.github.yok.flexmerge.util.ErrorHandler;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Commands that do not import: the orphaned staging sweep and the data dictionary export.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class MaintenanceRunner {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final MergeConfig mergeConfig;
    private final Function<ConnectionConfig.Entry, DbDialectHandler> dialectFactory;

    /**
     * Drops orphaned staging tables in every targeted database.
     *
     * @param targetDbIds database ids; empty means all
     * @return total number of tables dropped
     */
    public int sweep(List<String> targetDbIds) {
        log.info("=== Staging sweep started (target DBs={}) ===", targetDbIds);
        int total = 0;
        for (ConnectionConfig.Entry entry : connectionConfig.getConnections()) {
            if (!isTargeted(entry, targetDbIds)) {
                continue;
            }
            DbDialectHandler dialect = dialectFactory.apply(entry);
            try (Connection connection =
                    new DriverManagerConnectionProvider(entry, dialect).open()) {
                int dropped = new StagingTableSweeper(new SqlStatementBuilder(dialect),
                        mergeConfig.getStagingPrefix()).sweep(connection,
                                dialect.resolveSchema(entry));
                log.info("[{}] {} staging tables dropped", entry.getId(), dropped);
                total += dropped;
            } catch (SQLException e) {
                ErrorHandler.errorAndExit("Staging sweep failed (DB=" + entry.getId() + ")", e);
            }
        }
        log.info("=== Staging sweep finished ===");
        return total;
    }

    /**
     * Exports the data dictionary of every targeted database to
     * {@code <dictionary>/<dbId>}.
     *
     * @param targetDbIds database ids; empty means all
     */
    public void exportDictionary(List<String> targetDbIds) {
        log.info("=== Dictionary export started (target DBs={}) ===", targetDbIds);
        for (ConnectionConfig.Entry entry : connectionConfig.getConnections()) {
            if (!isTargeted(entry, targetDbIds)) {
                continue;
            }
            DbDialectHandler dialect = dialectFactory.apply(entry);
            Path outDir = Paths.get(pathsConfig.getDictionary(), entry.getId());
            try (Connection connection =
                    new DriverManagerConnectionProvider(entry, dialect).open()) {
                new DataDictionaryExporter(new SqlStatementBuilder(dialect),
                        mergeConfig.getStagingPrefix()).export(connection,
                                dialect.resolveSchema(entry), outDir);
            } catch (SQLException | IOException e) {
                ErrorHandler.errorAndExit("Dictionary export failed (DB=" + entry.getId() + ")",
                        e);
            }
        }
        log.info("=== Dictionary export finished ===");
    }

    private static boolean isTargeted(ConnectionConfig.Entry entry, List<String> targetDbIds) {
        if (targetDbIds == null || targetDbIds.isEmpty() || targetDbIds.contains(entry.getId())) {
            return true;
        }
        log.info("[{}] Not targeted → skipping", entry.getId());
        return false;
    }
}
