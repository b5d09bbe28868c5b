package io.github.yok.flexmerge;

import io.github.yok.flexmerge.config.ConnectionConfig;
import io.github.yok.flexmerge.config.ImportPlanConfig;
import io.github.yok.flexmerge.config.MergeConfig;
import io.github.yok.flexmerge.config.PathsConfig;
import io.github.yok.flexmerge.core.ImportRunner;
import io.github.yok.flexmerge.core.ImportSummary;
import io.github.yok.flexmerge.core.MaintenanceRunner;
import io.github.yok.flexmerge.db.DbDialectHandlerFactory;
import io.github.yok.flexmerge.util.ErrorHandler;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command line with {@link CommandLineOptions}, then runs the import through
 * {@link ImportRunner} or one of the maintenance commands of {@link MaintenanceRunner}. If
 * {@code --target} is omitted, every connection in {@code application.yml} is targeted.
 * </p>
 *
 * <p>
 * The configuration classes are {@code @Component}s bound by Spring Boot's configuration
 * properties support.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ImportPlanConfig
 * @see MergeConfig
 * @see DbDialectHandlerFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final MergeConfig mergeConfig;
    private final ImportPlanConfig importPlanConfig;
    private final DbDialectHandlerFactory dialectFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        CommandLineOptions options = CommandLineOptions.parse(args);
        List<String> targets = options.getTargetDbIds();
        if (targets.isEmpty()) {
            targets = connectionConfig.getConnections().stream()
                    .map(ConnectionConfig.Entry::getId).collect(Collectors.toList());
        }
        log.info("Mode: {}, Target DBs: {}", options.getMode(), targets);

        try {
            switch (options.getMode()) {
                case DICTIONARY:
                    new MaintenanceRunner(pathsConfig, connectionConfig, mergeConfig,
                            dialectFactory::create).exportDictionary(targets);
                    break;
                case SWEEP:
                    new MaintenanceRunner(pathsConfig, connectionConfig, mergeConfig,
                            dialectFactory::create).sweep(targets);
                    break;
                default:
                    List<ImportSummary> summaries = new ImportRunner(pathsConfig,
                            connectionConfig, mergeConfig, importPlanConfig,
                            dialectFactory::create).execute(targets);
                    for (ImportSummary summary : summaries) {
                        if (!summary.isClean()) {
                            log.warn("[{}] Import completed with failures", summary.getDbId());
                        }
                    }
                    break;
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", options.getMode(), e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
