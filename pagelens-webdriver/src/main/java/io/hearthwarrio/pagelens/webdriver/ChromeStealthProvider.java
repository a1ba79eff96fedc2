package io.hearthwarrio.pagelens.webdriver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.config.StealthSettings;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.StealthProvider;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chromium.HasCdp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link StealthProvider} hiding the usual automation markers of a Chrome session.
 * <p>
 * The script is registered with {@code Page.addScriptToEvaluateOnNewDocument} so it runs before page scripts on every
 * navigation. Sessions without DevTools access (remote grids) get it injected into the current document only.
 */
public class ChromeStealthProvider implements StealthProvider {

    private static final Logger logger = LoggerFactory.getLogger(ChromeStealthProvider.class);

    private final StealthSettings settings;
    private final String script;

    public ChromeStealthProvider(StealthSettings settings) {
        this(settings, new ObjectMapper());
    }

    public ChromeStealthProvider(StealthSettings settings, ObjectMapper mapper) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.script = buildScript(settings.getNavigatorOverrides(), Objects.requireNonNull(mapper, "mapper must not be null"));
    }

    /**
     * Builds the injected script. Override keys use snake case ({@code hardware_concurrency}); {@code language}
     * also sets {@code navigator.languages}.
     */
    static String buildScript(Map<String, Object> overrides, ObjectMapper mapper) {
        StringBuilder sb = new StringBuilder();
        sb.append("Object.defineProperty(navigator, 'webdriver', {get: () => undefined});");
        sb.append("window.chrome = window.chrome || {runtime: {}};");
        for (Map.Entry<String, Object> e : overrides.entrySet()) {
            String property = camelCase(e.getKey());
            String value;
            try {
                value = mapper.writeValueAsString(e.getValue());
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("stealth.navigator_overrides." + e.getKey() + " is not serializable", ex);
            }
            sb.append("Object.defineProperty(navigator, '").append(property).append("', {get: () => ").append(value).append("});");
            if ("language".equals(property)) {
                sb.append("Object.defineProperty(navigator, 'languages', {get: () => [").append(value).append("]});");
            }
        }
        return sb.toString();
    }

    static String camelCase(String key) {
        StringBuilder sb = new StringBuilder();
        boolean upper = false;
        for (char c : key.trim().toCharArray()) {
            if (c == '_' || c == '-') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    public String getScript() {
        return script;
    }

    @Override
    public void apply(PageHandle page) {
        if (!settings.isEnabled()) {
            return;
        }
        WebDriver driver = WebDriverPage.driverOf(page);
        try {
            if (driver instanceof HasCdp) {
                ((HasCdp) driver).executeCdpCommand("Page.addScriptToEvaluateOnNewDocument", Map.of("source", script));
            } else {
                ((JavascriptExecutor) driver).executeScript(script);
            }
            logger.debug("Stealth script applied to page {}", page.id());
        } catch (WebDriverException e) {
            logger.warn("Cannot apply stealth script to page {}: {}", page.id(), WebDriverPageProvider.firstLine(e.getMessage()));
        }
    }

    @Override
    public void humanDelay() throws InterruptedException {
        if (!settings.isEnabled()) {
            return;
        }
        long millis = nextDelay();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    long nextDelay() {
        int min = settings.getDelayRangeMs().getMin();
        int max = settings.getDelayRangeMs().getMax();
        return max <= min ? min : ThreadLocalRandom.current().nextLong(min, max + 1L);
    }
}
