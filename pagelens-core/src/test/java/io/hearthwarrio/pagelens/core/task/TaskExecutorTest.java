package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.fixture.FixturePageProvider;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.pool.PageState;
import io.hearthwarrio.pagelens.core.pool.PooledPage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class TaskExecutorTest {

    private static final String URL = "https://shop.example/kettle";
    private static final String MISSING_URL = "https://shop.example/gone";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ConfigLoader loader = new ConfigLoader();

    @TempDir
    Path dir;

    private FixturePageProvider provider;
    private PagelensAgent agent;
    private TaskExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        provider = new FixturePageProvider().page(URL, "Kettle", body(
                el("div").cls("product").child(
                        el("h1", "Acme Kettle"),
                        el("h2", "Price"),
                        el("span", "$19.99")
                )
        ));
        agent = PagelensAgent.builder(provider).config(config()).build();
        executor = new TaskExecutor(agent);
    }

    @AfterEach
    void tearDown() {
        executor.close();
        agent.close();
    }

    private PagelensConfig config() throws Exception {
        JsonNode overrides = mapper.readTree("{"
                + "\"self_healing\": {\"cache_file\": \"\"},"
                + "\"sessions\": {\"directory\": " + mapper.writeValueAsString(dir.resolve("sessions").toString()) + "},"
                + "\"task\": {\"timeout_ms\": 10000}"
                + "}");
        return loader.withOverrides(loader.defaults(), overrides);
    }

    private JsonNode run(String json) {
        return executor.execute(json.replace('\'', '"'));
    }

    private static void assertError(JsonNode envelope, String kind) {
        assertEquals("error", envelope.path("status").asText(), envelope.toString());
        assertEquals(kind, envelope.path("error").path("kind").asText(), envelope.toString());
    }

    @Test
    void navigateReportsUrlAndTitle() {
        JsonNode envelope = run("{'action': 'navigate', 'target': {'url': '" + URL + "'}}");

        assertEquals("ok", envelope.path("status").asText());
        assertEquals(URL, envelope.path("result").path("url").asText());
        assertEquals("Kettle", envelope.path("result").path("title").asText());
        assertEquals("default", envelope.path("result").path("tab_id").asText());
    }

    @Test
    void extractReturnsTypedDataWithProvenance() {
        JsonNode envelope = run("{'action': 'extract', 'target': {'url': '" + URL + "', 'fields': {"
                + "'title': 'h1',"
                + "'price': {'selector': 'div.product span', 'type': 'number'}"
                + "}}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        JsonNode data = envelope.path("result").path("data");
        assertEquals("Acme Kettle", data.path("title").asText());
        assertEquals(19.99, data.path("price").asDouble(), 1e-9);

        JsonNode title = envelope.path("result").path("meta").path("fields").path("title");
        assertEquals("direct", title.path("strategy").asText());
        assertEquals("h1", title.path("selector").asText());
        assertFalse(title.path("healed").asBoolean());
    }

    @Test
    void mandatoryFieldThatCannotBeResolvedFailsTheTask() {
        JsonNode envelope = run("{'action': 'extract', 'target': {'url': '" + URL + "', 'fields': {"
                + "'warranty': {'mandatory': true}}}}");

        assertError(envelope, "ResolutionFailure");
        assertTrue(envelope.path("result").isNull());
        assertFalse(envelope.path("error").path("retryable").asBoolean());
    }

    @Test
    void unknownActionIsInvalidTask() {
        JsonNode envelope = run("{'action': 'fly'}");

        assertError(envelope, "InvalidTask");
        assertTrue(envelope.path("error").path("message").asText().contains("unsupported action 'fly'"));
    }

    @Test
    void malformedJsonIsInvalidTask() {
        JsonNode envelope = executor.execute("{\"action\": ");

        assertError(envelope, "InvalidTask");
        assertTrue(envelope.path("error").path("message").asText().startsWith("task is not valid JSON"));
    }

    @Test
    void missingActionIsInvalidTask() {
        JsonNode envelope = run("{'target': {}}");

        assertError(envelope, "InvalidTask");
        assertEquals("'action' is required", envelope.path("error").path("message").asText());
    }

    @Test
    void invalidConfigOverridesAreRejectedBeforeRunning() {
        JsonNode envelope = run("{'action': 'navigate', 'target': {'url': '" + URL + "'}, 'config_overrides': [1]}");

        assertError(envelope, "InvalidTask");
        assertTrue(envelope.path("error").path("message").asText().startsWith("invalid config_overrides"));
        assertTrue(provider.navigations().isEmpty());
    }

    @Test
    void slowTaskTimesOut() {
        provider.navigationDelay(3000);

        JsonNode envelope = run("{'action': 'navigate', 'target': {'url': '" + URL + "'},"
                + " 'config_overrides': {'task': {'timeout_ms': 1000}}}");

        assertError(envelope, "Timeout");
        assertTrue(envelope.path("error").path("retryable").asBoolean());
        assertTrue(envelope.path("error").path("message").asText().contains("exceeded 1000ms"));
    }

    @Test
    void timedOutTaskReleasesItsPage() throws Exception {
        provider.navigationDelay(3000);

        JsonNode timedOut = run("{'action': 'navigate', 'target': {'url': '" + URL + "'},"
                + " 'config_overrides': {'task': {'timeout_ms': 1000}}}");
        assertError(timedOut, "Timeout");

        PooledPage page = awaitState(ActionContext.DEFAULT_TAB, PageState.IDLE, 2000);
        assertEquals(PageState.IDLE, page.getState(), page.toString());

        provider.navigationDelay(0);
        JsonNode next = run("{'action': 'navigate', 'target': {'url': '" + URL + "'}}");
        assertEquals("ok", next.path("status").asText(), next.toString());
        assertEquals(PageState.IDLE, awaitState(ActionContext.DEFAULT_TAB, PageState.IDLE, 2000).getState());
    }

    /**
     * The interrupted worker releases its lease shortly after the envelope is returned.
     */
    private PooledPage awaitState(String tabId, PageState state, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        PooledPage found = null;
        while (System.currentTimeMillis() < deadline) {
            found = agent.pool().pages().stream()
                    .filter(p -> tabId.equals(p.getTabId()))
                    .findFirst()
                    .orElse(null);
            if (found != null && found.getState() == state) {
                return found;
            }
            Thread.sleep(20);
        }
        assertNotNull(found, "no pool page for tab " + tabId);
        return found;
    }

    @Test
    void downloadNeedsUrlOrSelector() {
        JsonNode envelope = run("{'action': 'download', 'target': {'filename': 'a.pdf'}}");

        assertError(envelope, "InvalidTask");
        assertEquals("download needs 'url' or 'selector'", envelope.path("error").path("message").asText());
    }

    @Test
    void downloadRejectsFileUrls() {
        JsonNode envelope = run("{'action': 'download', 'target': {'url': 'file:///etc/passwd'}}");

        assertError(envelope, "InvalidTask");
        assertTrue(envelope.path("error").path("message").asText().contains("scheme 'file'"));
    }

    @Test
    void sequenceRunsStepsInOrder() {
        JsonNode envelope = run("{'action': 'sequence', 'target': {'steps': ["
                + "{'action': 'navigate', 'target': {'url': '" + URL + "'}},"
                + "{'action': 'extract', 'target': {'fields': {'title': 'h1'}}}"
                + "]}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        JsonNode result = envelope.path("result");
        assertEquals(2, result.path("completed").asInt());
        assertEquals("navigate", result.path("steps").get(0).path("action").asText());
        assertEquals("Acme Kettle", result.path("steps").get(1).path("result").path("data").path("title").asText());
    }

    @Test
    void sequenceStopsAtFirstFailedStep() {
        JsonNode envelope = run("{'action': 'sequence', 'target': {'steps': ["
                + "{'action': 'navigate', 'target': {'url': '" + MISSING_URL + "'}},"
                + "{'action': 'extract', 'target': {'fields': {'title': 'h1'}}}"
                + "]}}");

        assertError(envelope, "NavigationError");
        assertTrue(envelope.path("error").path("retryable").asBoolean());
        JsonNode result = envelope.path("result");
        assertEquals(0, result.path("completed").asInt());
        assertEquals(1, result.path("steps").size());
        assertEquals("error", result.path("steps").get(0).path("status").asText());
    }

    @Test
    void nestedSequenceIsRejected() {
        JsonNode envelope = run("{'action': 'sequence', 'target': {'steps': ["
                + "{'action': 'sequence', 'target': {'steps': []}}"
                + "]}}");

        assertError(envelope, "InvalidTask");
        assertEquals("sequences cannot be nested", envelope.path("error").path("message").asText());
    }

    @Test
    void sequenceWithoutStepsIsInvalid() {
        JsonNode envelope = run("{'action': 'sequence', 'target': {}}");

        assertError(envelope, "InvalidTask");
    }

    @Test
    void parallelExtractKeepsPerUrlOutcomes() {
        JsonNode envelope = run("{'action': 'parallel_extract', 'target': {"
                + "'urls': ['" + URL + "', '" + MISSING_URL + "'], 'fields': {'title': 'h1'}}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        JsonNode result = envelope.path("result");
        assertEquals(2, result.path("count").asInt());
        assertEquals(1, result.path("succeeded").asInt());

        JsonNode first = result.path("results").get(0);
        assertEquals(URL, first.path("url").asText());
        assertEquals("ok", first.path("status").asText());
        assertEquals("Acme Kettle", first.path("result").path("data").path("title").asText());

        JsonNode second = result.path("results").get(1);
        assertEquals(MISSING_URL, second.path("url").asText());
        assertEquals("NavigationError", second.path("error").path("kind").asText());
    }

    @Test
    void streamExtractStopsAtTokenBudget() {
        run("{'action': 'navigate', 'target': {'url': '" + URL + "'}}");

        JsonNode envelope = run("{'action': 'stream_extract', 'target': {'max_tokens': 5, 'chars_per_token': 4}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        JsonNode summary = envelope.path("result").path("summary");
        assertEquals(20, summary.path("char_budget").asInt());
        assertEquals(20, summary.path("emitted_chars").asInt());
        assertEquals("budget", summary.path("stop_reason").asText());
        assertTrue(summary.path("truncated").asBoolean());

        JsonNode chunks = envelope.path("result").path("chunks");
        assertTrue(chunks.get(chunks.size() - 1).path("is_final").asBoolean());
    }

    @Test
    void previewSummarizesOpenPage() {
        run("{'action': 'navigate', 'target': {'url': '" + URL + "'}}");

        JsonNode envelope = run("{'action': 'preview'}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        assertEquals("Kettle", envelope.path("result").path("title").asText());
        assertEquals("Acme Kettle", envelope.path("result").path("h1").asText());
    }

    @Test
    void sessionIsSavedAndLoaded() throws Exception {
        run("{'action': 'navigate', 'target': {'url': '" + URL + "'}}");

        JsonNode saved = run("{'action': 'save_session', 'target': {'session_name': 'shop'}}");
        assertEquals("ok", saved.path("status").asText(), saved.toString());
        Path file = Path.of(saved.path("result").path("session_path").asText());
        assertEquals(dir.resolve("sessions").resolve("shop.json"), file);
        assertTrue(new String(Files.readAllBytes(file), StandardCharsets.UTF_8).contains(URL));

        JsonNode loaded = run("{'action': 'load_session', 'target': {'session_name': 'shop', 'tab_id': 'other'}}");
        assertEquals("ok", loaded.path("status").asText(), loaded.toString());
        assertTrue(loaded.path("result").path("loaded").asBoolean());
    }

    @Test
    void loadingUnknownSessionIsInvalid() {
        JsonNode envelope = run("{'action': 'load_session', 'target': {'session_name': 'nope'}}");

        assertError(envelope, "InvalidTask");
        assertEquals("no saved session 'nope'", envelope.path("error").path("message").asText());
    }

    @Test
    void disabledSessionsAreUnsupported() {
        JsonNode envelope = run("{'action': 'save_session', 'config_overrides': {'sessions': {'enabled': false}}}");

        assertError(envelope, "Unsupported");
    }

    @Test
    void interactionsWithoutDriverAreUnsupported() {
        JsonNode envelope = run("{'action': 'click', 'target': {'selector': 'h1'}}");

        assertError(envelope, "Unsupported");
    }

    @Test
    void networkCallsAreEmptyWithoutObserver() {
        JsonNode envelope = run("{'action': 'network_calls'}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        assertEquals(0, envelope.path("result").path("count").asInt());
        assertEquals(0, envelope.path("result").path("calls").size());
    }

    @Test
    void invalidateSelectorDropsCachedEntry() {
        agent.cache().put("shop.example", "title", new LocatorCandidate(Locator.css("h1"), StrategyTag.TEXT, 0.8, 3));

        JsonNode envelope = run("{'action': 'invalidate_selector', 'target': {'url': '" + URL + "', 'logical_name': 'title'}}");

        assertEquals("ok", envelope.path("status").asText(), envelope.toString());
        assertEquals("shop.example", envelope.path("result").path("site").asText());
        assertTrue(envelope.path("result").path("invalidated").asBoolean());
        assertTrue(agent.cache().get("shop.example", "title").isEmpty());
    }

    @Test
    void closeTabReleasesThePage() {
        run("{'action': 'navigate', 'target': {'url': '" + URL + "', 'tab_id': 'a'}}");

        JsonNode envelope = run("{'action': 'close_tab', 'target': {'tab_id': 'a'}}");

        assertTrue(envelope.path("result").path("closed").asBoolean());
        assertEquals(0, provider.openPages());
    }
}
