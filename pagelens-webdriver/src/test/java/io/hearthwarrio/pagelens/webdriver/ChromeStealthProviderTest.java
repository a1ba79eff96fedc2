package io.hearthwarrio.pagelens.webdriver;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.StealthSettings;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chromium.HasCdp;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.withSettings;

public class ChromeStealthProviderTest {

    private final ConfigLoader loader = new ConfigLoader();

    private StealthSettings settings(String overrides) throws Exception {
        return loader.withOverrides(loader.defaults(), new ObjectMapper().readTree(overrides)).getStealth();
    }

    @Test
    void scriptOverridesNavigatorProperties() {
        ChromeStealthProvider stealth = new ChromeStealthProvider(loader.defaults().getStealth());

        String script = stealth.getScript();
        assertTrue(script.contains("'webdriver', {get: () => undefined}"));
        assertTrue(script.contains("'hardwareConcurrency', {get: () => 4}"));
        assertTrue(script.contains("'platform', {get: () => \"Linux armv8l\"}"));
        assertTrue(script.contains("'languages', {get: () => [\"en-US\"]}"));
    }

    @Test
    void snakeCaseKeysBecomeCamelCase() {
        assertEquals("deviceMemory", ChromeStealthProvider.camelCase("device_memory"));
        assertEquals("platform", ChromeStealthProvider.camelCase("platform"));
        assertEquals("maxTouchPoints", ChromeStealthProvider.camelCase("max-touch-points"));
    }

    @Test
    void scriptIsRegisteredForNewDocuments() {
        WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(HasCdp.class));
        ChromeStealthProvider stealth = new ChromeStealthProvider(loader.defaults().getStealth());

        stealth.apply(new WebDriverPage("wd-1", driver));

        verify((HasCdp) driver).executeCdpCommand("Page.addScriptToEvaluateOnNewDocument", Map.of("source", stealth.getScript()));
    }

    @Test
    void remoteSessionsGetScriptInCurrentDocument() {
        WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        ChromeStealthProvider stealth = new ChromeStealthProvider(loader.defaults().getStealth());

        stealth.apply(new WebDriverPage("wd-1", driver));

        verify((JavascriptExecutor) driver).executeScript(stealth.getScript());
    }

    @Test
    void disabledStealthDoesNothing() throws Exception {
        WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(HasCdp.class));
        ChromeStealthProvider stealth = new ChromeStealthProvider(settings("{\"stealth\": {\"enabled\": false}}"));

        stealth.apply(new WebDriverPage("wd-1", driver));
        long started = System.nanoTime();
        stealth.humanDelay();

        verifyNoInteractions(driver);
        assertTrue(System.nanoTime() - started < 30_000_000L);
    }

    @Test
    void delaysStayInConfiguredRange() throws Exception {
        ChromeStealthProvider stealth = new ChromeStealthProvider(
                settings("{\"stealth\": {\"delay_range_ms\": {\"min\": 10, \"max\": 20}}}"));

        for (int i = 0; i < 200; i++) {
            long d = stealth.nextDelay();
            assertTrue(d >= 10 && d <= 20, "delay " + d);
        }
    }
}
