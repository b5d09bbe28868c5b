package io.github.yok.flexmerge.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine settings bound from the {@code merge} section of {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "merge")
@Data
public class MergeConfig {

    /**
     * Database product. When {@code null}, it is inferred from the JDBC URL.
     */
    private DialectMode dialect;

    /**
     * Name prefix of staging tables. Every table starting with it is treated as an orphan by the
     * sweep, so it must not collide with real table names.
     */
    private String stagingPrefix = "stg_merge_";

    /**
     * Drops orphaned staging tables before each import.
     */
    private boolean sweepOrphansOnStart = true;

    /**
     * Additional tokens accepted as boolean {@code true} (e.g. {@code si}).
     */
    private List<String> truthyExtras = new ArrayList<>(Arrays.asList("si", "sí"));

    /**
     * Candidate names of the "created at" column, in priority order.
     */
    private List<String> createdColumnCandidates = new ArrayList<>(
            Arrays.asList("creado_en", "created_at", "created_on", "fecha_creacion"));

    /**
     * Candidate names of the "updated at" column, in priority order.
     */
    private List<String> updatedColumnCandidates = new ArrayList<>(
            Arrays.asList("actualizado_en", "updated_at", "updated_on", "fecha_modificacion"));
}
