package io.hearthwarrio.pagelens.webdriver;

import io.hearthwarrio.pagelens.core.config.BrowserSettings;
import io.hearthwarrio.pagelens.core.config.PerformanceSettings;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.logging.LogType;
import org.openqa.selenium.logging.LoggingPreferences;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Chrome session factory driven by the {@code browser} and {@code performance} configuration sections.
 * <p>
 * Local Chrome by default, a Selenium Grid when {@code browser.remote_url} is set. Performance logging is always
 * enabled so that {@link PerformanceNetworkObserver} can read network traffic. Request blocking uses the DevTools
 * protocol and is therefore only available for local sessions.
 */
public final class ChromeDrivers {

    private static final Logger logger = LoggerFactory.getLogger(ChromeDrivers.class);

    /**
     * URL patterns blocked for each {@code performance.block_resource_types} entry.
     */
    static final Map<String, List<String>> RESOURCE_PATTERNS = Map.of(
            "image", List.of("*.png", "*.jpg", "*.jpeg", "*.gif", "*.webp", "*.svg", "*.ico", "*.bmp", "*.avif"),
            "media", List.of("*.mp4", "*.webm", "*.ogg", "*.mp3", "*.wav", "*.m4a", "*.mov"),
            "font", List.of("*.woff", "*.woff2", "*.ttf", "*.otf", "*.eot"),
            "stylesheet", List.of("*.css")
    );

    private ChromeDrivers() {
        // utility class
    }

    /**
     * @return factory creating one configured session per call
     */
    public static Supplier<WebDriver> factory(BrowserSettings browser, PerformanceSettings performance) {
        Objects.requireNonNull(browser, "browser must not be null");
        Objects.requireNonNull(performance, "performance must not be null");
        return () -> create(browser, performance);
    }

    public static WebDriver create(BrowserSettings browser, PerformanceSettings performance) {
        ChromeOptions options = options(browser);
        WebDriver driver;
        String remote = browser.getRemoteUrl();
        if (remote != null && !remote.isBlank()) {
            driver = new RemoteWebDriver(remoteUrl(remote), options);
        } else {
            driver = new ChromeDriver(options);
        }
        driver.manage().timeouts().pageLoadTimeout(Duration.ofMillis(browser.getNavigationTimeoutMs()));
        driver.manage().timeouts().scriptTimeout(Duration.ofMillis(browser.getNavigationTimeoutMs()));
        if (performance.isEnableRequestBlocking()) {
            applyBlocking(driver, blockedPatterns(performance));
        }
        return driver;
    }

    /**
     * Builds Chrome options from the {@code browser} section.
     */
    public static ChromeOptions options(BrowserSettings browser) {
        ChromeOptions options = new ChromeOptions();
        List<String> args = new ArrayList<>(browser.getLaunchArgs());
        if (browser.isHeadless()) {
            args.add("--headless=new");
        }
        String userAgent = browser.getUserAgent();
        if (userAgent != null && !userAgent.isBlank()) {
            args.add("--user-agent=" + userAgent);
        }
        options.addArguments(args);
        String binary = browser.getExecutablePath();
        if (binary != null && !binary.isBlank()) {
            options.setBinary(binary);
        }
        options.setPageLoadStrategy(PageLoadStrategy.NORMAL);
        options.setExperimentalOption("excludeSwitches", List.of("enable-automation"));

        LoggingPreferences logs = new LoggingPreferences();
        logs.enable(LogType.PERFORMANCE, Level.ALL);
        options.setCapability("goog:loggingPrefs", logs);
        return options;
    }

    /**
     * Maps resource types and ad domains to DevTools {@code Network.setBlockedURLs} patterns.
     */
    public static List<String> blockedPatterns(PerformanceSettings performance) {
        Set<String> patterns = new LinkedHashSet<>();
        for (String type : performance.getBlockResourceTypes()) {
            List<String> p = RESOURCE_PATTERNS.get(type.trim().toLowerCase(Locale.ROOT));
            if (p == null) {
                logger.warn("Unknown resource type '{}' in performance.block_resource_types, ignored", type);
                continue;
            }
            patterns.addAll(p);
        }
        for (String domain : performance.getBlockAdDomains()) {
            String d = domain.trim().toLowerCase(Locale.ROOT);
            if (!d.isEmpty()) {
                patterns.add("*://" + d + "/*");
                patterns.add("*://*." + d + "/*");
            }
        }
        return new ArrayList<>(patterns);
    }

    static void applyBlocking(WebDriver driver, List<String> patterns) {
        if (patterns.isEmpty()) {
            return;
        }
        if (!(driver instanceof HasCdp)) {
            logger.info("Request blocking needs a local Chrome session, skipped");
            return;
        }
        HasCdp cdp = (HasCdp) driver;
        try {
            cdp.executeCdpCommand("Network.enable", Map.of());
            cdp.executeCdpCommand("Network.setBlockedURLs", Map.of("urls", patterns));
            logger.debug("Blocking {} URL patterns", patterns.size());
        } catch (WebDriverException e) {
            logger.warn("Cannot enable request blocking: {}", WebDriverPageProvider.firstLine(e.getMessage()));
        }
    }

    private static URL remoteUrl(String remote) {
        try {
            return new URL(remote);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("browser.remote_url is not a valid URL: " + remote, e);
        }
    }
}
