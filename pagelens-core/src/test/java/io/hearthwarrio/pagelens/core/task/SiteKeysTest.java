package io.hearthwarrio.pagelens.core.task;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SiteKeysTest {

    @Test
    void hostScopeUsesLowerCasedHostOnly() {
        assertEquals("shop.example", SiteKeys.of("https://Shop.Example/kettle?x=1#top", SiteKeys.HOST_SCOPE));
    }

    @Test
    void pageScopeAddsPathWithoutQuery() {
        assertEquals("shop.example/kettle", SiteKeys.of("https://shop.example/kettle?x=1", SiteKeys.PAGE_SCOPE));
        assertEquals("shop.example/", SiteKeys.of("https://shop.example", SiteKeys.PAGE_SCOPE));
    }

    @Test
    void urlsWithoutHostAreKeptWithoutQueryAndFragment() {
        assertEquals("about:blank", SiteKeys.of("about:blank", SiteKeys.HOST_SCOPE));
        assertEquals("file:/tmp/page.html", SiteKeys.of("file:/tmp/page.html?v=2#x", SiteKeys.HOST_SCOPE));
    }

    @Test
    void blankUrlMapsToUnknown() {
        assertEquals(SiteKeys.UNKNOWN, SiteKeys.of("  ", SiteKeys.HOST_SCOPE));
        assertEquals(SiteKeys.UNKNOWN, SiteKeys.of(null, SiteKeys.PAGE_SCOPE));
    }
}
