package io.hearthwarrio.pagelens.cli;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line.
 * <pre>
 * run --task &lt;file|-&gt; [--config path] [--pretty] [--engine chrome|static]
 * validate [--config path]
 * </pre>
 */
final class CliOptions {

    static final String RUN = "run";
    static final String VALIDATE = "validate";
    static final String STDIN = "-";
    static final Path DEFAULT_CONFIG = Path.of("config", "config.yaml");
    static final Set<String> ENGINES = Set.of("chrome", "static");

    static final String USAGE = "usage: pagelens run --task <file|-> [--config path] [--pretty] [--engine chrome|static]\n"
            + "       pagelens validate [--config path]";

    private final String command;
    private final String task;
    private final Path config;
    private final boolean pretty;
    private final String engine;

    private CliOptions(String command, String task, Path config, boolean pretty, String engine) {
        this.command = command;
        this.task = task;
        this.config = config;
        this.pretty = pretty;
        this.engine = engine;
    }

    /**
     * @throws IllegalArgumentException on unknown or incomplete options
     */
    static CliOptions parse(String... args) {
        String command = RUN;
        String task = null;
        Path config = DEFAULT_CONFIG;
        boolean pretty = false;
        String engine = null;

        int i = 0;
        if (args.length > 0 && !args[0].startsWith("--")) {
            command = args[0];
            i = 1;
        }
        if (!RUN.equals(command) && !VALIDATE.equals(command)) {
            throw new IllegalArgumentException("unknown command '" + command + "'");
        }
        for (; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--task":
                    task = value(args, ++i, arg);
                    break;
                case "--config":
                    config = Path.of(value(args, ++i, arg));
                    break;
                case "--pretty":
                    pretty = true;
                    break;
                case "--engine":
                    engine = value(args, ++i, arg).trim().toLowerCase(Locale.ROOT);
                    if (!ENGINES.contains(engine)) {
                        throw new IllegalArgumentException("--engine must be one of " + ENGINES + ", got '" + engine + "'");
                    }
                    break;
                default:
                    throw new IllegalArgumentException("unknown option '" + arg + "'");
            }
        }
        if (RUN.equals(command) && task == null) {
            throw new IllegalArgumentException("--task is required");
        }
        return new CliOptions(command, task, config, pretty, engine);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    String getCommand() {
        return command;
    }

    /**
     * @return task file path, or {@link #STDIN}
     */
    String getTask() {
        return task;
    }

    Path getConfig() {
        return config;
    }

    boolean isPretty() {
        return pretty;
    }

    /**
     * @return engine override, or null to use {@code browser.engine}
     */
    String getEngine() {
        return engine;
    }
}
