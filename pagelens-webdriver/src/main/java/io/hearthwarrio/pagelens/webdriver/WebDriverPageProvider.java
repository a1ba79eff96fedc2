package io.hearthwarrio.pagelens.webdriver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.TextCursor;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link PageProvider} backed by Selenium WebDriver sessions.
 * <p>
 * Every opened page gets a fresh session from the driver factory (see {@link ChromeDrivers}); the session is quit
 * when the page is closed. DOM snapshots and locator evaluation run as one script each, so a snapshot costs a single
 * round trip regardless of the page size.
 */
public class WebDriverPageProvider implements PageProvider {

    private static final Logger logger = LoggerFactory.getLogger(WebDriverPageProvider.class);

    /**
     * Upper bound on the text kept per snapshot node.
     */
    public static final int DEFAULT_MAX_NODE_TEXT = 4000;

    private final Supplier<WebDriver> drivers;
    private final long waitAfterNavigationMs;
    private final int maxNodeText;
    private final ObjectMapper mapper;
    private final AtomicInteger ids = new AtomicInteger();

    public WebDriverPageProvider(Supplier<WebDriver> drivers, long waitAfterNavigationMs) {
        this(drivers, waitAfterNavigationMs, DEFAULT_MAX_NODE_TEXT, new ObjectMapper());
    }

    public WebDriverPageProvider(Supplier<WebDriver> drivers, long waitAfterNavigationMs, int maxNodeText,
                                 ObjectMapper mapper) {
        this.drivers = Objects.requireNonNull(drivers, "drivers must not be null");
        this.waitAfterNavigationMs = Math.max(0, waitAfterNavigationMs);
        this.maxNodeText = Math.max(1, maxNodeText);
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public PageHandle open(String url) {
        WebDriver driver;
        try {
            driver = drivers.get();
        } catch (WebDriverException e) {
            throw new NavigationException(url, "cannot start browser session: " + e.getMessage(), e);
        }
        WebDriverPage page = new WebDriverPage("wd-" + ids.incrementAndGet(), driver);
        logger.debug("Opened page {}", page.id());
        if (!BLANK_URL.equals(url)) {
            try {
                navigate(page, url);
            } catch (NavigationException e) {
                close(page);
                throw e;
            }
        }
        return page;
    }

    @Override
    public void navigate(PageHandle page, String url) {
        WebDriver driver = WebDriverPage.driverOf(page);
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new NavigationException(url, firstLine(e.getMessage()), e);
        }
        if (waitAfterNavigationMs > 0) {
            try {
                Thread.sleep(waitAfterNavigationMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NavigationException(url, "interrupted while waiting for the page to settle", e);
            }
        }
        logger.debug("Page {} navigated to {}", page.id(), url);
    }

    @Override
    public String currentUrl(PageHandle page) {
        try {
            String url = WebDriverPage.driverOf(page).getCurrentUrl();
            return url == null ? "" : url;
        } catch (WebDriverException e) {
            logger.debug("Cannot read URL of page {}: {}", page.id(), firstLine(e.getMessage()));
            return "";
        }
    }

    @Override
    public String title(PageHandle page) {
        try {
            String title = WebDriverPage.driverOf(page).getTitle();
            return title == null ? "" : title;
        } catch (WebDriverException e) {
            return "";
        }
    }

    @Override
    public List<PageNode> evaluate(PageHandle page, Locator locator) {
        String mode = locator.getKind() == Locator.Kind.XPATH ? DomScripts.MODE_XPATH : DomScripts.MODE_CSS;
        return walk(page, mode, locator.getExpression(), Integer.MAX_VALUE);
    }

    @Override
    public List<PageNode> snapshot(PageHandle page, int maxNodes) {
        return walk(page, DomScripts.MODE_ALL, "", Math.max(1, maxNodes));
    }

    private List<PageNode> walk(PageHandle page, String mode, String expression, int maxNodes) {
        Object raw;
        try {
            raw = js(page).executeScript(DomScripts.WALK, mode, expression, maxNodes, maxNodeText);
        } catch (JavascriptException e) {
            // invalid selector or XPath
            logger.debug("Locator {}:{} failed on page {}: {}", mode, expression, page.id(), firstLine(e.getMessage()));
            return Collections.emptyList();
        }
        return toNodes(raw);
    }

    /**
     * Converts the maps returned by {@link DomScripts#WALK}.
     */
    static List<PageNode> toNodes(Object raw) {
        if (!(raw instanceof List)) {
            return Collections.emptyList();
        }
        List<?> items = (List<?>) raw;
        List<PageNode> out = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> m = (Map<?, ?>) item;
            PageNode.Builder b = PageNode.builder(intValue(m.get("i")), String.valueOf(m.get("tag")))
                    .parent(intValue(m.get("p")), intValue(m.get("d")))
                    .ownText(stringValue(m.get("own")))
                    .text(stringValue(m.get("text")))
                    .visible(Boolean.TRUE.equals(m.get("vis")));
            Object attrs = m.get("attrs");
            if (attrs instanceof Map) {
                for (Map.Entry<?, ?> a : ((Map<?, ?>) attrs).entrySet()) {
                    b.attribute(String.valueOf(a.getKey()), stringValue(a.getValue()));
                }
            }
            out.add(b.build());
        }
        return out;
    }

    @Override
    public TextCursor openText(PageHandle page, Locator scope) {
        String expression = scope == null ? null : scope.getExpression();
        String kind = scope == null ? DomScripts.MODE_CSS
                : scope.getKind() == Locator.Kind.XPATH ? DomScripts.MODE_XPATH : DomScripts.MODE_CSS;
        String cursorId;
        try {
            cursorId = String.valueOf(js(page).executeScript(DomScripts.OPEN_TEXT, expression, kind));
        } catch (JavascriptException e) {
            logger.debug("Text scope {} failed on page {}: {}", scope, page.id(), firstLine(e.getMessage()));
            return maxChars -> "";
        }
        return new ScriptTextCursor(js(page), cursorId);
    }

    @Override
    public void close(PageHandle page) {
        try {
            WebDriverPage.driverOf(page).quit();
            logger.debug("Closed page {}", page.id());
        } catch (WebDriverException e) {
            logger.warn("Failed to quit session of page {}: {}", page.id(), firstLine(e.getMessage()));
        }
    }

    @Override
    public Map<String, String> cookies(PageHandle page) {
        Map<String, String> cookies = new LinkedHashMap<>();
        for (Cookie c : WebDriverPage.driverOf(page).manage().getCookies()) {
            cookies.put(c.getName(), c.getValue());
        }
        return cookies;
    }

    /**
     * Exports {@code {url, cookies, local_storage}} as JSON.
     */
    @Override
    public byte[] exportState(PageHandle page) {
        WebDriver driver = WebDriverPage.driverOf(page);
        ObjectNode state = mapper.createObjectNode();
        state.put("url", currentUrl(page));
        ArrayNode cookies = state.putArray("cookies");
        for (Cookie c : driver.manage().getCookies()) {
            ObjectNode cookie = cookies.addObject();
            cookie.put("name", c.getName());
            cookie.put("value", c.getValue());
            cookie.put("domain", c.getDomain());
            cookie.put("path", c.getPath());
            if (c.getExpiry() != null) {
                cookie.put("expiry", c.getExpiry().getTime());
            }
            cookie.put("secure", c.isSecure());
            cookie.put("http_only", c.isHttpOnly());
            if (c.getSameSite() != null) {
                cookie.put("same_site", c.getSameSite());
            }
        }
        Object storage = null;
        try {
            storage = js(page).executeScript(DomScripts.LOCAL_STORAGE_EXPORT);
        } catch (JavascriptException e) {
            logger.debug("localStorage is not readable on page {}", page.id());
        }
        state.set("local_storage", storage instanceof Map ? mapper.valueToTree(storage) : mapper.createObjectNode());
        try {
            return mapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize session state", e);
        }
    }

    /**
     * Restores a blob written by {@link #exportState(PageHandle)}. WebDriver only accepts cookies for the current
     * domain, so a blank page is first navigated to the URL the state was saved from.
     */
    @Override
    public void importState(PageHandle page, byte[] state) {
        JsonNode root;
        try {
            root = mapper.readTree(state);
        } catch (IOException e) {
            throw new IllegalArgumentException("session state is not valid JSON", e);
        }
        String savedUrl = root.path("url").asText("");
        String current = currentUrl(page);
        if (!savedUrl.isBlank() && (current.isBlank() || current.startsWith("about:") || current.startsWith("data:"))) {
            navigate(page, savedUrl);
        }

        WebDriver driver = WebDriverPage.driverOf(page);
        int restored = 0;
        for (JsonNode c : root.path("cookies")) {
            Cookie.Builder b = new Cookie.Builder(c.path("name").asText(), c.path("value").asText())
                    .path(c.path("path").asText("/"))
                    .isSecure(c.path("secure").asBoolean(false))
                    .isHttpOnly(c.path("http_only").asBoolean(false));
            if (c.hasNonNull("domain")) {
                b.domain(c.get("domain").asText());
            }
            if (c.hasNonNull("expiry")) {
                b.expiresOn(new Date(c.get("expiry").asLong()));
            }
            if (c.hasNonNull("same_site")) {
                b.sameSite(c.get("same_site").asText());
            }
            try {
                driver.manage().addCookie(b.build());
                restored++;
            } catch (WebDriverException e) {
                logger.debug("Cookie '{}' rejected on page {}: {}", c.path("name").asText(), page.id(),
                        firstLine(e.getMessage()));
            }
        }

        Map<String, String> storage = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("local_storage").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            storage.put(e.getKey(), e.getValue().asText());
        }
        if (!storage.isEmpty()) {
            js(page).executeScript(DomScripts.LOCAL_STORAGE_IMPORT, storage);
        }
        logger.info("Restored {} cookies and {} storage items on page {}", restored, storage.size(), page.id());
    }

    private static JavascriptExecutor js(PageHandle page) {
        return (JavascriptExecutor) WebDriverPage.driverOf(page);
    }

    private static int intValue(Object o) {
        return o instanceof Number ? ((Number) o).intValue() : -1;
    }

    private static String stringValue(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    /**
     * Pulls slices of a text stored in the page by {@link DomScripts#OPEN_TEXT}.
     */
    static final class ScriptTextCursor implements TextCursor {
        private final JavascriptExecutor js;
        private final String cursorId;
        private long offset;
        private boolean exhausted;

        ScriptTextCursor(JavascriptExecutor js, String cursorId) {
            this.js = js;
            this.cursorId = cursorId;
        }

        @Override
        public String read(int maxChars) {
            if (exhausted || maxChars <= 0) {
                return "";
            }
            Object slice;
            try {
                slice = js.executeScript(DomScripts.READ_TEXT, cursorId, offset, maxChars);
            } catch (JavascriptException e) {
                exhausted = true;
                return "";
            }
            String s = slice == null ? "" : String.valueOf(slice);
            if (s.isEmpty()) {
                exhausted = true;
            }
            offset += s.length();
            return s;
        }

        @Override
        public void close() {
            try {
                js.executeScript(DomScripts.CLOSE_TEXT, cursorId);
            } catch (WebDriverException e) {
                logger.debug("Cannot release text cursor {}: {}", cursorId, firstLine(e.getMessage()));
            }
        }
    }
}
