package io.github.yok.flexmerge.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reads {@code data-path} and composes the directories used by an import run.
 *
 * <ul>
 * <li>{@code load}: source CSV files, one per table</li>
 * <li>{@code quarantine}: rejected rows written after a run</li>
 * <li>{@code dictionary}: data dictionary export</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base directory of the tool's data
    private String dataPath;

    /**
     * Returns the directory holding source CSV files.
     *
     * @return load directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getLoad() {
        return resolve("load");
    }

    /**
     * Returns the directory rejected rows are exported to.
     *
     * @return quarantine directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getQuarantine() {
        return resolve("quarantine");
    }

    /**
     * Returns the directory the data dictionary is exported to.
     *
     * @return dictionary directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getDictionary() {
        return resolve("dictionary");
    }

    private String resolve(String child) {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + child : dataPath + "/" + child;
    }
}
