package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.ErrorKind;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.PagelensException;
import io.hearthwarrio.pagelens.core.TaskTimeoutException;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs JSON tasks ({@code {"action", "target", "config_overrides"}}) and answers with a JSON envelope
 * ({@code {"status": "ok"|"error", "result", "error": {kind, message, retryable}}}).
 * <p>
 * Every failure becomes an error envelope; nothing escapes {@link #execute(JsonNode)}. Each task runs on a worker
 * thread and is interrupted when it exceeds {@code task.timeout_ms}; the interrupted action releases its page on the
 * way out and the resolver drops its pending cache write. The output never contains timestamps or generated ids.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskExecutor.class);

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final String SEQUENCE = "sequence";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final PagelensAgent agent;
    private final ConfigLoader configLoader;
    private final ObjectMapper mapper;
    private final Map<String, TaskAction> actions;
    private final ExecutorService workers;

    public TaskExecutor(PagelensAgent agent) {
        this(agent, new ConfigLoader(), new ObjectMapper());
    }

    public TaskExecutor(PagelensAgent agent, ConfigLoader configLoader, ObjectMapper mapper) {
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");

        Map<String, TaskAction> registry = new LinkedHashMap<>();
        NavigationActions.register(registry);
        ExtractionActions.register(registry);
        InteractionActions.register(registry);
        StateActions.register(registry);
        this.actions = Collections.unmodifiableMap(registry);

        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pagelens-task-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return supported action names, {@value #SEQUENCE} excluded
     */
    public Set<String> actions() {
        return actions.keySet();
    }

    /**
     * Parses and runs a task given as JSON text. Malformed JSON yields an {@code InvalidTask} envelope.
     */
    public JsonNode execute(String taskJson) {
        JsonNode task;
        try {
            task = mapper.readTree(taskJson);
        } catch (JsonProcessingException e) {
            return errorEnvelope(new InvalidTaskException("task is not valid JSON: " + e.getOriginalMessage(), e));
        }
        return execute(task);
    }

    public JsonNode execute(JsonNode task) {
        String action;
        PagelensConfig config;
        try {
            action = actionName(task);
            config = effectiveConfig(agent.config(), task);
        } catch (PagelensException e) {
            return errorEnvelope(e);
        }

        long timeoutMs = config.getTask().getTimeoutMs();
        long started = System.nanoTime();
        Future<JsonNode> future = workers.submit(() -> dispatch(action, task, config));
        JsonNode envelope;
        try {
            envelope = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Task '{}' exceeded {}ms and was interrupted", action, timeoutMs);
            envelope = errorEnvelope(new TaskTimeoutException("task '" + action + "' exceeded " + timeoutMs + "ms"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            envelope = errorEnvelope(new TaskTimeoutException("task '" + action + "' was interrupted"));
        } catch (CancellationException e) {
            envelope = errorEnvelope(new TaskTimeoutException("task '" + action + "' was cancelled"));
        } catch (ExecutionException e) {
            envelope = errorEnvelope(e.getCause() == null ? e : e.getCause());
        }
        logger.debug("Task '{}' finished with status {} in {}ms", action, envelope.path("status").asText(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return envelope;
    }

    private JsonNode dispatch(String action, JsonNode task, PagelensConfig config) {
        if (SEQUENCE.equals(action)) {
            return runSequence(task.get("target"), config);
        }
        try {
            return okEnvelope(run(action, task.get("target"), config));
        } catch (Exception e) {
            return errorEnvelope(e);
        }
    }

    private JsonNode run(String action, JsonNode target, PagelensConfig config) throws Exception {
        TaskAction handler = actions.get(action);
        if (handler == null) {
            throw new InvalidTaskException("unsupported action '" + action + "'");
        }
        logger.debug("Running action '{}'", action);
        return handler.run(new ActionContext(agent, config, target, mapper));
    }

    /**
     * Runs {@code target.steps} in order and stops at the first failed step. Each step may carry its own
     * {@code config_overrides}, merged over the sequence's configuration.
     */
    private JsonNode runSequence(JsonNode target, PagelensConfig config) {
        JsonNode steps = target == null ? null : target.get("steps");
        if (steps == null || !steps.isArray() || steps.isEmpty()) {
            return errorEnvelope(new InvalidTaskException("sequence needs a non-empty 'steps' array"));
        }

        ObjectNode result = mapper.createObjectNode();
        ArrayNode results = result.putArray("steps");
        int completed = 0;
        ObjectNode failure = null;

        for (JsonNode step : steps) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TaskTimeoutException("sequence was interrupted");
            }
            JsonNode envelope;
            try {
                String action = actionName(step);
                if (SEQUENCE.equals(action)) {
                    throw new InvalidTaskException("sequences cannot be nested");
                }
                envelope = okEnvelope(run(action, step.get("target"), effectiveConfig(config, step)));
            } catch (TaskTimeoutException e) {
                throw e;
            } catch (Exception e) {
                envelope = errorEnvelope(e);
            }
            ObjectNode entry = results.addObject();
            entry.put("action", step.path("action").asText(""));
            entry.setAll((ObjectNode) envelope);
            if (!STATUS_OK.equals(envelope.path("status").asText())) {
                failure = (ObjectNode) envelope.get("error");
                break;
            }
            completed++;
        }
        result.put("completed", completed);

        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("status", failure == null ? STATUS_OK : STATUS_ERROR);
        envelope.set("result", result);
        if (failure != null) {
            envelope.set("error", failure.deepCopy());
        }
        return envelope;
    }

    private static String actionName(JsonNode task) {
        if (task == null || !task.isObject()) {
            throw new InvalidTaskException("task must be a JSON object");
        }
        JsonNode action = task.get("action");
        if (action == null || !action.isTextual() || action.asText().isBlank()) {
            throw new InvalidTaskException("'action' is required");
        }
        return action.asText().trim();
    }

    private PagelensConfig effectiveConfig(PagelensConfig base, JsonNode task) {
        try {
            return configLoader.withOverrides(base, task.get("config_overrides"));
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException("invalid config_overrides: " + e.getMessage(), e);
        }
    }

    private ObjectNode okEnvelope(JsonNode result) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("status", STATUS_OK);
        envelope.set("result", result == null ? mapper.nullNode() : result);
        return envelope;
    }

    private ObjectNode errorEnvelope(Throwable error) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("status", STATUS_ERROR);
        envelope.putNull("result");
        envelope.set("error", errorJson(mapper, error));
        return envelope;
    }

    /**
     * Maps an exception to {@code {kind, message, retryable}}. Exceptions outside the agent's hierarchy are
     * reported as {@code Internal} and logged with their stack trace.
     */
    static ObjectNode errorJson(ObjectMapper mapper, Throwable error) {
        ErrorKind kind;
        if (error instanceof PagelensException) {
            kind = ((PagelensException) error).getKind();
        } else if (error instanceof IllegalArgumentException) {
            kind = ErrorKind.INVALID_TASK;
        } else if (error instanceof InterruptedException) {
            kind = ErrorKind.TIMEOUT;
        } else {
            kind = ErrorKind.INTERNAL;
            logger.error("Unexpected task failure", error);
        }
        String message = error.getMessage();
        ObjectNode json = mapper.createObjectNode();
        json.put("kind", kind.wireName());
        json.put("message", message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
        json.put("retryable", kind.isRetryable());
        return json;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
