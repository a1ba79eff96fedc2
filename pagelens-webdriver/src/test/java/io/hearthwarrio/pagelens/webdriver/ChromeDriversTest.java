package io.hearthwarrio.pagelens.webdriver;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.chromium.HasCdp;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.withSettings;

public class ChromeDriversTest {

    private final ConfigLoader loader = new ConfigLoader();

    private PagelensConfig config(String overrides) throws Exception {
        return loader.withOverrides(loader.defaults(), new ObjectMapper().readTree(overrides));
    }

    @Test
    void defaultBlockingCoversImagesMediaAndFonts() {
        List<String> patterns = ChromeDrivers.blockedPatterns(loader.defaults().getPerformance());

        assertTrue(patterns.contains("*.png"));
        assertTrue(patterns.contains("*.mp4"));
        assertTrue(patterns.contains("*.woff2"));
        assertFalse(patterns.contains("*.css"));
    }

    @Test
    void adDomainsAndUnknownTypes() throws Exception {
        PagelensConfig config = config("{\"performance\": {\"block_resource_types\": [\"script\", \"Font\"],"
                + " \"block_ad_domains\": [\"ads.example\"]}}");

        List<String> patterns = ChromeDrivers.blockedPatterns(config.getPerformance());

        assertEquals(List.of("*.woff", "*.woff2", "*.ttf", "*.otf", "*.eot", "*://ads.example/*", "*://*.ads.example/*"),
                patterns);
    }

    @Test
    void optionsFollowBrowserSettings() throws Exception {
        PagelensConfig config = config("{\"browser\": {\"headless\": true, \"user_agent\": \"PagelensTest/1.0\","
                + " \"launch_args\": [\"--no-sandbox\"]}}");

        ChromeOptions options = ChromeDrivers.options(config.getBrowser());

        Object chrome = options.asMap().get(ChromeOptions.CAPABILITY);
        assertTrue(chrome instanceof Map, String.valueOf(chrome));
        Object args = ((Map<?, ?>) chrome).get("args");
        assertTrue(args instanceof List, String.valueOf(args));
        List<?> argList = (List<?>) args;
        assertTrue(argList.contains("--no-sandbox"));
        assertTrue(argList.contains("--headless=new"));
        assertTrue(argList.contains("--user-agent=PagelensTest/1.0"));
        assertNotNull(options.getCapability("goog:loggingPrefs"));
    }

    @Test
    void blockingUsesDevTools() {
        WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(HasCdp.class));
        List<String> patterns = List.of("*.png");

        ChromeDrivers.applyBlocking(driver, patterns);

        verify((HasCdp) driver).executeCdpCommand("Network.enable", Map.of());
        verify((HasCdp) driver).executeCdpCommand("Network.setBlockedURLs", Map.of("urls", patterns));
    }

    @Test
    void blockingIsSkippedWithoutDevTools() {
        WebDriver driver = mock(WebDriver.class);

        ChromeDrivers.applyBlocking(driver, List.of("*.png"));

        verifyNoInteractions(driver);
    }
}
