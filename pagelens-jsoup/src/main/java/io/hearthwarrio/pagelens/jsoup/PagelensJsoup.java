package io.hearthwarrio.pagelens.jsoup;

import io.hearthwarrio.pagelens.core.config.BrowserSettings;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.StealthProvider;
import io.hearthwarrio.pagelens.core.task.PagelensAgent;

import java.util.Objects;

/**
 * Browserless entry point: wires {@link JsoupPageProvider} into a {@link PagelensAgent}.
 * <p>
 * Static pages support every extraction action; element interactions report {@code Unsupported}.
 */
public final class PagelensJsoup {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) pagelens";

    private PagelensJsoup() {
        // utility class
    }

    public static PagelensAgent.Builder agent(PagelensConfig config) {
        return agent(config, provider(config));
    }

    /**
     * Agent on a caller-built provider, typically one with registered inline pages.
     */
    public static PagelensAgent.Builder agent(PagelensConfig config, JsoupPageProvider provider) {
        Objects.requireNonNull(config, "config must not be null");
        return PagelensAgent.builder(Objects.requireNonNull(provider, "provider must not be null"))
                .config(config)
                .interactions(InteractionDriver.unsupported())
                .networkObserver(new JsoupNetworkObserver())
                .stealth(StealthProvider.none());
    }

    public static JsoupPageProvider provider(PagelensConfig config) {
        BrowserSettings browser = Objects.requireNonNull(config, "config must not be null").getBrowser();
        String userAgent = browser.getUserAgent();
        return new JsoupPageProvider(
                userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent,
                browser.getNavigationTimeoutMs()
        );
    }
}
