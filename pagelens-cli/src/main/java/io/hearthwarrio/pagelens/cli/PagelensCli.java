package io.hearthwarrio.pagelens.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.task.PagelensAgent;
import io.hearthwarrio.pagelens.core.task.TaskExecutor;
import io.hearthwarrio.pagelens.jsoup.PagelensJsoup;
import io.hearthwarrio.pagelens.webdriver.PagelensWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Command line entry point. Prints one JSON document on stdout; logs go to stderr.
 * <p>
 * Exit codes: 0 when the task succeeded (or the config is valid), 1 when it failed, 2 on usage errors.
 */
public final class PagelensCli {

    private static final Logger logger = LoggerFactory.getLogger(PagelensCli.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ConfigLoader configLoader = new ConfigLoader();

    public PagelensCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
    }

    public static void main(String[] args) {
        System.exit(new PagelensCli(System.in, System.out, System.err).run(args));
    }

    public int run(String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("pagelens: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return USAGE;
        }

        PagelensConfig config;
        try {
            config = configLoader.load(options.getConfig());
        } catch (IllegalArgumentException | UncheckedIOException e) {
            if (CliOptions.VALIDATE.equals(options.getCommand())) {
                ObjectNode invalid = mapper.createObjectNode();
                invalid.put("valid", false);
                invalid.put("error", e.getMessage());
                print(invalid, true);
                return FAILED;
            }
            err.println("pagelens: " + e.getMessage());
            return FAILED;
        }
        LogLevels.apply(config.getLogging().getLevel());

        if (CliOptions.VALIDATE.equals(options.getCommand())) {
            print(summary(config), true);
            return OK;
        }
        return runTask(options, config);
    }

    private int runTask(CliOptions options, PagelensConfig config) {
        String task;
        try {
            task = readTask(options.getTask());
        } catch (IOException e) {
            err.println("pagelens: cannot read task " + options.getTask() + ": " + e.getMessage());
            return FAILED;
        }

        String engine = options.getEngine() != null ? options.getEngine() : config.getBrowser().getEngine();
        logger.info("Running task with engine '{}'", engine);
        try (PagelensAgent agent = agent(engine, config);
             TaskExecutor executor = new TaskExecutor(agent)) {
            JsonNode envelope = executor.execute(task);
            print(envelope, options.isPretty());
            return TaskExecutor.STATUS_OK.equals(envelope.path("status").asText()) ? OK : FAILED;
        }
    }

    static PagelensAgent agent(String engine, PagelensConfig config) {
        if ("static".equals(engine)) {
            return PagelensJsoup.agent(config).build();
        }
        return PagelensWebDriver.chrome(config).build();
    }

    private String readTask(String source) throws IOException {
        if (CliOptions.STDIN.equals(source)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(source), StandardCharsets.UTF_8);
    }

    private JsonNode summary(PagelensConfig config) {
        ObjectNode root = mapper.createObjectNode();
        root.put("valid", true);
        ObjectNode s = root.putObject("summary");
        s.put("engine", config.getBrowser().getEngine());
        s.put("max_tabs", config.getBrowser().getMaxTabs());
        s.put("headless", config.getBrowser().isHeadless());
        s.put("resource_blocking", config.getPerformance().isEnableRequestBlocking());
        s.put("stealth", config.getStealth().isEnabled());
        s.put("self_healing", config.getSelfHealing().isEnabled());
        s.put("log_level", config.getLogging().getLevel());
        return root;
    }

    private void print(JsonNode node, boolean pretty) {
        ObjectWriter writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        try {
            out.println(writer.writeValueAsString(node));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize output", e);
        }
        out.flush();
    }
}
