package io.hearthwarrio.pagelens.webdriver;

import io.hearthwarrio.pagelens.core.ErrorKind;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.PagelensException;
import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InteractionDriver} on top of WebDriver element commands.
 * <p>
 * A locator that matches nothing is reported as an invalid task; other driver failures are retryable.
 */
public class WebDriverInteractionDriver implements InteractionDriver {

    private static final Logger logger = LoggerFactory.getLogger(WebDriverInteractionDriver.class);

    static By by(Locator locator) {
        return locator.getKind() == Locator.Kind.XPATH
                ? By.xpath(locator.getExpression())
                : By.cssSelector(locator.getExpression());
    }

    @Override
    public void click(PageHandle page, Locator locator) {
        WebDriver driver = WebDriverPage.driverOf(page);
        WebElement element = find(driver, locator);
        try {
            element.click();
        } catch (ElementClickInterceptedException e) {
            // overlays (cookie banners and the like) swallow native clicks
            logger.debug("Click on {} intercepted, falling back to a script click", locator);
            ((JavascriptExecutor) driver).executeScript(DomScripts.JS_CLICK, element);
        } catch (WebDriverException e) {
            throw failure("click", locator, e);
        }
    }

    @Override
    public void type(PageHandle page, Locator locator, String text, boolean clearFirst) {
        WebElement element = find(WebDriverPage.driverOf(page), locator);
        try {
            if (clearFirst) {
                element.clear();
                String left = element.getAttribute("value");
                if (left != null && !left.isEmpty()) {
                    element.sendKeys(Keys.chord(Keys.CONTROL, "a"), Keys.DELETE);
                }
            }
            element.sendKeys(text == null ? "" : text);
        } catch (WebDriverException e) {
            throw failure("type into", locator, e);
        }
    }

    @Override
    public void select(PageHandle page, Locator locator, String value) {
        WebElement element = find(WebDriverPage.driverOf(page), locator);
        try {
            Select select = new Select(element);
            try {
                select.selectByValue(value);
            } catch (NoSuchElementException byValue) {
                select.selectByVisibleText(value);
            }
        } catch (NoSuchElementException e) {
            throw new InvalidTaskException("no option '" + value + "' in " + locator.asString(), e);
        } catch (WebDriverException e) {
            throw failure("select in", locator, e);
        }
    }

    @Override
    public void setChecked(PageHandle page, Locator locator, boolean checked) {
        WebElement element = find(WebDriverPage.driverOf(page), locator);
        try {
            if (element.isSelected() != checked) {
                element.click();
            }
        } catch (WebDriverException e) {
            throw failure("toggle", locator, e);
        }
    }

    @Override
    public void scrollToBottom(PageHandle page) {
        ((JavascriptExecutor) WebDriverPage.driverOf(page)).executeScript(DomScripts.SCROLL_TO_BOTTOM);
    }

    @Override
    public long scrollHeight(PageHandle page) {
        Object height = ((JavascriptExecutor) WebDriverPage.driverOf(page)).executeScript(DomScripts.SCROLL_HEIGHT);
        return height instanceof Number ? ((Number) height).longValue() : 0L;
    }

    private static WebElement find(WebDriver driver, Locator locator) {
        try {
            return driver.findElement(by(locator));
        } catch (NoSuchElementException e) {
            throw new InvalidTaskException("no element matches '" + locator.asString() + "'", e);
        } catch (WebDriverException e) {
            throw failure("find", locator, e);
        }
    }

    private static PagelensException failure(String action, Locator locator, WebDriverException e) {
        return new PagelensException(
                ErrorKind.NAVIGATION_ERROR,
                "cannot " + action + " '" + locator.asString() + "': " + WebDriverPageProvider.firstLine(e.getMessage()),
                e
        );
    }
}
