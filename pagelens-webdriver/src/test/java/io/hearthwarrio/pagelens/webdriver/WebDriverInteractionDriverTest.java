package io.hearthwarrio.pagelens.webdriver;

import io.hearthwarrio.pagelens.core.ErrorKind;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.PagelensException;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

public class WebDriverInteractionDriverTest {

    private final WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
    private final WebElement element = mock(WebElement.class);
    private final PageHandle page = new WebDriverPage("wd-1", driver);
    private final WebDriverInteractionDriver interactions = new WebDriverInteractionDriver();

    @Test
    void locatorKindSelectsByStrategy() {
        assertEquals(By.cssSelector("#buy"), WebDriverInteractionDriver.by(Locator.parse("#buy")));
        assertEquals(By.xpath("//button[1]"), WebDriverInteractionDriver.by(Locator.parse("//button[1]")));
    }

    @Test
    void clicksResolvedElement() {
        when(driver.findElement(By.cssSelector("#buy"))).thenReturn(element);

        interactions.click(page, Locator.css("#buy"));

        verify(element).click();
    }

    @Test
    void interceptedClickFallsBackToScript() {
        when(driver.findElement(By.cssSelector("#buy"))).thenReturn(element);
        doThrow(new ElementClickInterceptedException("overlay")).when(element).click();

        interactions.click(page, Locator.css("#buy"));

        verify((JavascriptExecutor) driver).executeScript(DomScripts.JS_CLICK, element);
    }

    @Test
    void missingElementIsInvalidTask() {
        when(driver.findElement(By.cssSelector("#gone"))).thenThrow(new NoSuchElementException("no such element"));

        InvalidTaskException ex = assertThrows(InvalidTaskException.class,
                () -> interactions.click(page, Locator.css("#gone")));
        assertTrue(ex.getMessage().contains("#gone"));
    }

    @Test
    void otherDriverFailuresAreRetryable() {
        when(driver.findElement(By.cssSelector("#name"))).thenReturn(element);
        doThrow(new ElementNotInteractableException("hidden")).when(element).sendKeys("Ada");

        PagelensException ex = assertThrows(PagelensException.class,
                () -> interactions.type(page, Locator.css("#name"), "Ada", false));
        assertEquals(ErrorKind.NAVIGATION_ERROR, ex.getKind());
        assertTrue(ex.isRetryable());
    }

    @Test
    void typeClearsFirstWhenAsked() {
        when(driver.findElement(By.cssSelector("#name"))).thenReturn(element);
        when(element.getAttribute("value")).thenReturn("");

        interactions.type(page, Locator.css("#name"), "Ada", true);

        verify(element).clear();
        verify(element).sendKeys("Ada");
    }

    @Test
    void checkboxIsOnlyToggledWhenNeeded() {
        when(driver.findElement(By.cssSelector("#terms"))).thenReturn(element);
        when(element.isSelected()).thenReturn(true);

        interactions.setChecked(page, Locator.css("#terms"), true);
        verify(element, never()).click();

        interactions.setChecked(page, Locator.css("#terms"), false);
        verify(element).click();
    }

    @Test
    void scrollHeightReadsDocumentHeight() {
        when(((JavascriptExecutor) driver).executeScript(DomScripts.SCROLL_HEIGHT)).thenReturn(2400L);

        assertEquals(2400L, interactions.scrollHeight(page));
    }
}
