package io.hearthwarrio.pagelens.jsoup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.NetworkEvent;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.TextCursor;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Browserless {@link PageProvider}: pages are fetched over HTTP (or read from {@code file:} URLs) and parsed with
 * jsoup. Scripts are not executed.
 * <p>
 * HTML registered with {@link #register(String, String)} is served for its URL without any I/O, which makes the
 * provider usable with offline fixtures.
 */
public class JsoupPageProvider implements PageProvider {

    private static final Logger logger = LoggerFactory.getLogger(JsoupPageProvider.class);

    public static final int DEFAULT_MAX_NODE_TEXT = 4000;
    public static final int DEFAULT_MAX_BODY_BYTES = 5 * 1024 * 1024;

    private final String userAgent;
    private final int timeoutMs;
    private final int maxNodeText;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> registered = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();

    public JsoupPageProvider(String userAgent, int timeoutMs) {
        this(userAgent, timeoutMs, DEFAULT_MAX_NODE_TEXT);
    }

    public JsoupPageProvider(String userAgent, int timeoutMs, int maxNodeText) {
        this.userAgent = userAgent == null ? "" : userAgent;
        this.timeoutMs = Math.max(1, timeoutMs);
        this.maxNodeText = Math.max(1, maxNodeText);
    }

    /**
     * Serves {@code html} for {@code url} instead of fetching it.
     */
    public JsoupPageProvider register(String url, String html) {
        registered.put(Objects.requireNonNull(url, "url must not be null"), Objects.requireNonNull(html, "html must not be null"));
        return this;
    }

    @Override
    public PageHandle open(String url) {
        JsoupPage page = new JsoupPage("jsoup-" + ids.incrementAndGet(), BLANK_URL, Document.createShell(BLANK_URL));
        if (!BLANK_URL.equals(url)) {
            navigate(page, url);
        }
        return page;
    }

    @Override
    public void navigate(PageHandle handle, String url) {
        JsoupPage page = JsoupPage.of(handle);
        if (BLANK_URL.equals(url)) {
            page.load(BLANK_URL, Document.createShell(BLANK_URL));
            return;
        }
        String html = registered.get(url);
        if (html != null) {
            page.load(url, Jsoup.parse(html, url));
            page.getNetworkLog().append(new NetworkEvent(url, "GET", "document", 200, 0));
            logger.debug("Page {} loaded registered document {}", page.id(), url);
            return;
        }
        String scheme = scheme(url);
        if ("file".equals(scheme)) {
            loadFile(page, url);
        } else if ("http".equals(scheme) || "https".equals(scheme)) {
            fetch(page, url);
        } else {
            throw new NavigationException(url, "unsupported URL scheme '" + scheme + "'");
        }
    }

    private void fetch(JsoupPage page, String url) {
        long started = System.nanoTime();
        Connection.Response response;
        Document document;
        try {
            response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .maxBodySize(DEFAULT_MAX_BODY_BYTES)
                    .followRedirects(true)
                    .cookies(page.getCookies())
                    .method(Connection.Method.GET)
                    .execute();
            document = response.parse();
        } catch (HttpStatusException e) {
            page.getNetworkLog().append(new NetworkEvent(url, "GET", "document", e.getStatusCode(), elapsedMs(started)));
            throw new NavigationException(url, "HTTP " + e.getStatusCode(), e);
        } catch (IOException | IllegalArgumentException e) {
            page.getNetworkLog().append(new NetworkEvent(url, "GET", "document", 0, elapsedMs(started)));
            throw new NavigationException(url, String.valueOf(e.getMessage()), e);
        }
        page.getCookies().putAll(response.cookies());
        String finalUrl = response.url().toString();
        page.load(finalUrl, document);
        page.getNetworkLog().append(new NetworkEvent(finalUrl, "GET", "document", response.statusCode(), elapsedMs(started)));
        logger.debug("Page {} fetched {} ({})", page.id(), finalUrl, response.statusCode());
    }

    private void loadFile(JsoupPage page, String url) {
        try {
            File file = new File(URI.create(url));
            page.load(url, Jsoup.parse(file, "UTF-8", url));
        } catch (IOException | IllegalArgumentException e) {
            throw new NavigationException(url, String.valueOf(e.getMessage()), e);
        }
        page.getNetworkLog().append(new NetworkEvent(url, "GET", "document", 200, 0));
    }

    private static String scheme(String url) {
        int colon = url.indexOf(':');
        return colon <= 0 ? "" : url.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    @Override
    public String currentUrl(PageHandle page) {
        return JsoupPage.of(page).getUrl();
    }

    @Override
    public String title(PageHandle page) {
        return JsoupPage.of(page).getDocument().title();
    }

    @Override
    public List<PageNode> evaluate(PageHandle handle, Locator locator) {
        Document document = JsoupPage.of(handle).getDocument();
        Elements matches = select(document, locator);
        if (matches.isEmpty()) {
            return Collections.emptyList();
        }
        Set<Element> wanted = Collections.newSetFromMap(new IdentityHashMap<>());
        wanted.addAll(matches);
        return walk(document.body(), wanted, Integer.MAX_VALUE);
    }

    @Override
    public List<PageNode> snapshot(PageHandle handle, int maxNodes) {
        return walk(JsoupPage.of(handle).getDocument().body(), null, Math.max(1, maxNodes));
    }

    static Elements select(Element root, Locator locator) {
        try {
            return locator.getKind() == Locator.Kind.XPATH
                    ? root.selectXpath(locator.getExpression())
                    : root.select(locator.getExpression());
        } catch (IllegalArgumentException | IllegalStateException e) {
            // jsoup reports unparsable selectors this way
            logger.debug("Locator {} is not valid for jsoup: {}", locator, e.getMessage());
            return new Elements();
        }
    }

    /**
     * Pre-order walk of {@code body}; emits every element, or only {@code wanted} ones when given.
     */
    private List<PageNode> walk(Element body, Set<Element> wanted, int maxNodes) {
        List<PageNode> out = new ArrayList<>();
        if (body == null) {
            return out;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(body, -1, 0, true));
        int index = 0;
        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            boolean visible = f.parentVisible && (f.element == body || !Visibility.hides(f.element));
            int i = index++;
            if (wanted == null || wanted.contains(f.element)) {
                out.add(toNode(f, i, visible));
                if (out.size() >= maxNodes || (wanted != null && out.size() == wanted.size())) {
                    break;
                }
            }
            Elements children = f.element.children();
            for (int c = children.size() - 1; c >= 0; c--) {
                stack.push(new Frame(children.get(c), i, f.depth + 1, visible));
            }
        }
        return out;
    }

    private PageNode toNode(Frame f, int index, boolean visible) {
        Element e = f.element;
        String text = e.text();
        PageNode.Builder b = PageNode.builder(index, e.normalName())
                .parent(f.parentIndex, f.depth)
                .ownText(e.ownText())
                .text(text.length() > maxNodeText ? text.substring(0, maxNodeText) : text)
                .visible(visible);
        e.attributes().forEach(a -> b.attribute(a.getKey(), a.getValue()));
        return b.build();
    }

    @Override
    public TextCursor openText(PageHandle handle, Locator scope) {
        Document document = JsoupPage.of(handle).getDocument();
        if (scope == null) {
            return new StreamingTextCursor(document.body());
        }
        Elements matches = select(document, scope);
        return matches.isEmpty() ? StreamingTextCursor.empty() : new StreamingTextCursor(matches.first());
    }

    @Override
    public void close(PageHandle page) {
        logger.debug("Closed page {}", page.id());
    }

    @Override
    public Map<String, String> cookies(PageHandle handle) {
        return new LinkedHashMap<>(JsoupPage.of(handle).getCookies());
    }

    /**
     * Exports {@code {url, cookies}}; there is no script storage to save.
     */
    @Override
    public byte[] exportState(PageHandle handle) {
        JsoupPage page = JsoupPage.of(handle);
        ObjectNode state = mapper.createObjectNode();
        state.put("url", page.getUrl());
        ObjectNode cookies = state.putObject("cookies");
        page.getCookies().forEach(cookies::put);
        try {
            return mapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize session state", e);
        }
    }

    /**
     * Restores cookies; they are sent with the next fetch of the page.
     */
    @Override
    public void importState(PageHandle handle, byte[] state) {
        JsonNode root;
        try {
            root = mapper.readTree(state);
        } catch (IOException e) {
            throw new IllegalArgumentException("session state is not valid JSON", e);
        }
        JsoupPage page = JsoupPage.of(handle);
        Iterator<Map.Entry<String, JsonNode>> it = root.path("cookies").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            page.getCookies().put(e.getKey(), e.getValue().asText());
        }
        logger.info("Restored {} cookies on page {}", page.getCookies().size(), page.id());
    }

    private static final class Frame {
        final Element element;
        final int parentIndex;
        final int depth;
        final boolean parentVisible;

        Frame(Element element, int parentIndex, int depth, boolean parentVisible) {
            this.element = element;
            this.parentIndex = parentIndex;
            this.depth = depth;
            this.parentVisible = parentVisible;
        }
    }
}
