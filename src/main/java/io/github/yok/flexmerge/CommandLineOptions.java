package io.github.yok.flexmerge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Parsed command-line arguments.
 *
 * <ul>
 * <li>{@code --import} / {@code -i}: import (default)</li>
 * <li>{@code --dictionary} / {@code -d}: export the data dictionary</li>
 * <li>{@code --sweep} / {@code -s}: drop orphaned staging tables</li>
 * <li>{@code --target} / {@code -t id[,id...]}: restrict to the given DB ids</li>
 * </ul>
 *
 * <p>
 * Unknown arguments are logged and ignored. When several modes are given, the last one wins.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class CommandLineOptions {

    /**
     * Command to run.
     */
    public enum Mode {
        IMPORT, DICTIONARY, SWEEP
    }

    private final Mode mode;

    private final List<String> targetDbIds;

    private CommandLineOptions(Mode mode, List<String> targetDbIds) {
        this.mode = mode;
        this.targetDbIds = Collections.unmodifiableList(targetDbIds);
    }

    /**
     * Parses arguments.
     *
     * @param args command-line arguments
     * @return options
     */
    public static CommandLineOptions parse(String... args) {
        Mode mode = Mode.IMPORT;
        List<String> targets = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--import":
                case "-i":
                    mode = Mode.IMPORT;
                    break;
                case "--dictionary":
                case "-d":
                    mode = Mode.DICTIONARY;
                    break;
                case "--sweep":
                case "-s":
                    mode = Mode.SWEEP;
                    break;
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targets = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    } else {
                        log.warn("{} requires a value; ignored", args[i]);
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        return new CommandLineOptions(mode, targets);
    }
}
