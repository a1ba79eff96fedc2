package io.hearthwarrio.pagelens.jsoup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.NetworkEvent;
import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.TextCursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsoupPageProviderTest {

    private static final String URL = "https://shop.example/kettle";
    private static final String HTML = "<html><head><title>Kettle</title></head><body>"
            + "<div class=\"product\"><h1>Acme Kettle</h1>"
            + "<p style=\"display: none\">Secret</p>"
            + "<span id=\"price\">$19.99</span></div>"
            + "</body></html>";

    private final JsoupPageProvider provider = new JsoupPageProvider("pagelens-test", 5000).register(URL, HTML);

    @Test
    void openLoadsRegisteredDocument() {
        PageHandle page = provider.open(URL);

        assertEquals(URL, provider.currentUrl(page));
        assertEquals("Kettle", provider.title(page));
    }

    @Test
    void openBlankDoesNotNavigate() {
        PageHandle page = provider.open(PageProvider.BLANK_URL);

        assertEquals(PageProvider.BLANK_URL, provider.currentUrl(page));
        assertEquals(0, new JsoupNetworkObserver().record(page).size());
    }

    @Test
    void snapshotWalksBodyInDocumentOrder() {
        PageHandle page = provider.open(URL);

        List<PageNode> nodes = provider.snapshot(page, 100);

        assertEquals(5, nodes.size());
        assertEquals("body", nodes.get(0).getTagName());
        assertEquals(-1, nodes.get(0).getParentIndex());

        PageNode div = nodes.get(1);
        assertEquals("div", div.getTagName());
        assertEquals(0, div.getParentIndex());
        assertEquals(1, div.getDepth());
        assertEquals("product", div.getCssClasses());

        assertEquals("h1", nodes.get(2).getTagName());
        assertEquals(1, nodes.get(2).getParentIndex());
        assertEquals("Acme Kettle", nodes.get(2).getOwnText());

        assertEquals("p", nodes.get(3).getTagName());
        assertFalse(nodes.get(3).isVisible());
        assertTrue(nodes.get(4).isVisible());
        assertEquals("price", nodes.get(4).getId());
    }

    @Test
    void snapshotIsBoundedByMaxNodes() {
        PageHandle page = provider.open(URL);

        assertEquals(2, provider.snapshot(page, 2).size());
    }

    @Test
    void evaluateKeepsSnapshotIndexes() {
        PageHandle page = provider.open(URL);

        List<PageNode> css = provider.evaluate(page, Locator.css("span"));
        List<PageNode> xpath = provider.evaluate(page, Locator.xpath("//h1"));

        assertEquals(1, css.size());
        assertEquals(4, css.get(0).getIndex());
        assertEquals("$19.99", css.get(0).getText());
        assertEquals(1, xpath.size());
        assertEquals(2, xpath.get(0).getIndex());
    }

    @Test
    void unparsableSelectorMatchesNothing() {
        PageHandle page = provider.open(URL);

        assertTrue(provider.evaluate(page, Locator.css("div[")).isEmpty());
    }

    @Test
    void textCursorSkipsHiddenContent() throws Exception {
        PageHandle page = provider.open(URL);

        try (TextCursor cursor = provider.openText(page, null)) {
            assertEquals("Acme", cursor.read(4));
            assertEquals(" Kettle $19.99", cursor.read(14));
            assertEquals("", cursor.read(100).trim());
        }
    }

    @Test
    void textCursorIsScopedToFirstMatch() throws Exception {
        PageHandle page = provider.open(URL);

        try (TextCursor cursor = provider.openText(page, Locator.css("span"))) {
            assertEquals("$19.99", cursor.read(100).trim());
        }
        try (TextCursor cursor = provider.openText(page, Locator.css("table"))) {
            assertEquals("", cursor.read(100));
        }
    }

    @Test
    void fileUrlsAreRead(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("page.html");
        Files.write(file, HTML.getBytes(StandardCharsets.UTF_8));
        String url = file.toUri().toString();

        PageHandle page = provider.open(url);

        assertEquals("Kettle", provider.title(page));
        assertEquals(url, provider.currentUrl(page));
    }

    @Test
    void missingFileIsNavigationError(@TempDir Path dir) {
        String url = dir.resolve("missing.html").toUri().toString();

        NavigationException e = assertThrows(NavigationException.class, () -> provider.open(url));

        assertEquals(url, e.getUrl());
    }

    @Test
    void unsupportedSchemeIsNavigationError() {
        NavigationException e = assertThrows(NavigationException.class, () -> provider.open("ftp://shop.example/"));

        assertTrue(e.getMessage().contains("unsupported URL scheme 'ftp'"));
    }

    @Test
    void documentLoadsAreRecorded() {
        PageHandle page = provider.open(URL);

        NetworkLog log = new JsoupNetworkObserver().record(page);

        assertEquals(1, log.size());
        NetworkEvent event = log.recent(1).get(0);
        assertEquals(URL, event.getUrl());
        assertEquals("GET", event.getMethod());
        assertEquals("document", event.getResourceType());
        assertEquals(200, event.getStatus());
    }

    @Test
    void importedCookiesAreExportedAgain() throws Exception {
        PageHandle page = provider.open(URL);

        provider.importState(page, "{\"url\": \"https://shop.example/\", \"cookies\": {\"sid\": \"abc\"}}"
                .getBytes(StandardCharsets.UTF_8));
        JsonNode state = new ObjectMapper().readTree(provider.exportState(page));

        assertEquals(URL, state.path("url").asText());
        assertEquals("abc", state.path("cookies").path("sid").asText());
    }

    @Test
    void importRejectsInvalidState() {
        PageHandle page = provider.open(URL);

        assertThrows(IllegalArgumentException.class,
                () -> provider.importState(page, "not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void foreignHandlesAreRejected() {
        PageHandle foreign = () -> "other";

        assertThrows(IllegalArgumentException.class, () -> provider.title(foreign));
    }
}
