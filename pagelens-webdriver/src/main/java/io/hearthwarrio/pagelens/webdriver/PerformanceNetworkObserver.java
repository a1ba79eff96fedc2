package io.hearthwarrio.pagelens.webdriver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.page.NetworkEvent;
import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.NetworkObserver;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.logging.LogEntry;
import org.openqa.selenium.logging.LogType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link NetworkObserver} reading Chrome's {@code performance} log.
 * <p>
 * DevTools {@code Network.requestWillBeSent} events are paired with the matching {@code Network.responseReceived} or
 * {@code Network.loadingFailed} event; failed requests are recorded with status 0. Sessions must be created with
 * performance logging enabled ({@link ChromeDrivers#options} does that).
 */
public class PerformanceNetworkObserver implements NetworkObserver {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceNetworkObserver.class);

    static final int MAX_PENDING = 2000;

    private final ObjectMapper mapper;
    private final int capacity;
    private final Map<String, PageTraffic> pages = new ConcurrentHashMap<>();

    public PerformanceNetworkObserver() {
        this(new ObjectMapper(), NetworkLog.DEFAULT_CAPACITY);
    }

    public PerformanceNetworkObserver(ObjectMapper mapper, int capacity) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.capacity = capacity;
    }

    @Override
    public NetworkLog record(PageHandle page) {
        PageTraffic traffic = pages.computeIfAbsent(page.id(), id -> new PageTraffic(new NetworkLog(capacity)));
        synchronized (traffic) {
            drain(WebDriverPage.driverOf(page), traffic);
        }
        return traffic.log;
    }

    @Override
    public void detach(PageHandle page) {
        pages.remove(page.id());
    }

    private void drain(WebDriver driver, PageTraffic traffic) {
        if (traffic.unsupported) {
            return;
        }
        Iterable<LogEntry> entries;
        try {
            entries = driver.manage().logs().get(LogType.PERFORMANCE);
        } catch (WebDriverException e) {
            traffic.unsupported = true;
            logger.info("Performance log is not available, network calls will not be recorded: {}",
                    WebDriverPageProvider.firstLine(e.getMessage()));
            return;
        }
        for (LogEntry entry : entries) {
            accept(entry.getMessage(), traffic);
        }
    }

    void accept(String rawMessage, PageTraffic traffic) {
        JsonNode message;
        try {
            message = mapper.readTree(rawMessage).path("message");
        } catch (JsonProcessingException e) {
            logger.debug("Skipping unreadable performance log entry");
            return;
        }
        String method = message.path("method").asText("");
        JsonNode params = message.path("params");
        String requestId = params.path("requestId").asText("");
        if (requestId.isEmpty()) {
            return;
        }
        switch (method) {
            case "Network.requestWillBeSent":
                if (traffic.pending.size() >= MAX_PENDING) {
                    // requests that never got a response
                    traffic.pending.clear();
                }
                traffic.pending.put(requestId, new Pending(
                        params.path("request").path("url").asText(""),
                        params.path("request").path("method").asText("GET"),
                        type(params),
                        params.path("timestamp").asDouble()
                ));
                break;
            case "Network.responseReceived":
                complete(traffic, requestId, params, params.path("response").path("status").asInt(0));
                break;
            case "Network.loadingFailed":
                complete(traffic, requestId, params, 0);
                break;
            default:
                break;
        }
    }

    private static void complete(PageTraffic traffic, String requestId, JsonNode params, int status) {
        Pending p = traffic.pending.remove(requestId);
        if (p == null || p.url.isEmpty()) {
            return;
        }
        String type = p.type.isEmpty() ? type(params) : p.type;
        long duration = Math.round((params.path("timestamp").asDouble(p.startedAt) - p.startedAt) * 1000.0);
        traffic.log.append(new NetworkEvent(p.url, p.method, type, status, duration));
    }

    private static String type(JsonNode params) {
        return params.path("type").asText("").toLowerCase(Locale.ROOT);
    }

    static final class PageTraffic {
        final NetworkLog log;
        final Map<String, Pending> pending = new HashMap<>();
        boolean unsupported;

        PageTraffic(NetworkLog log) {
            this.log = log;
        }
    }

    private static final class Pending {
        final String url;
        final String method;
        final String type;
        final double startedAt;

        Pending(String url, String method, String type, double startedAt) {
            this.url = url;
            this.method = method;
            this.type = type;
            this.startedAt = startedAt;
        }
    }
}
