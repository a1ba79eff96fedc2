package io.hearthwarrio.pagelens.webdriver;

import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.task.PagelensAgent;
import org.openqa.selenium.WebDriver;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Selenium entry point: wires the WebDriver collaborators into a {@link PagelensAgent}.
 * <p>
 * The returned builder is already configured; callers may still replace the cache, the listener or any collaborator
 * before {@code build()}.
 */
public final class PagelensWebDriver {

    private PagelensWebDriver() {
        // utility class
    }

    /**
     * Agent on local or remote Chrome, configured from the {@code browser}, {@code performance} and {@code stealth}
     * sections.
     */
    public static PagelensAgent.Builder chrome(PagelensConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return agent(config, ChromeDrivers.factory(config.getBrowser(), config.getPerformance()));
    }

    /**
     * Agent on sessions from a caller-provided factory (for example a pre-configured grid session supplier).
     */
    public static PagelensAgent.Builder agent(PagelensConfig config, Supplier<WebDriver> drivers) {
        Objects.requireNonNull(config, "config must not be null");
        WebDriverPageProvider provider =
                new WebDriverPageProvider(drivers, config.getPerformance().getWaitAfterNavigationMs());
        return PagelensAgent.builder(provider)
                .config(config)
                .interactions(new WebDriverInteractionDriver())
                .networkObserver(new PerformanceNetworkObserver())
                .stealth(new ChromeStealthProvider(config.getStealth()));
    }
}
