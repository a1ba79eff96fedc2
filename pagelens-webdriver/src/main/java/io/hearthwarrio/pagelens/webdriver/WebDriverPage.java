package io.hearthwarrio.pagelens.webdriver;

import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Page handle owning one WebDriver session.
 * <p>
 * A WebDriver instance is not thread-safe, so every pool page gets its own session and the pool guarantees that a
 * page is used by one task at a time.
 */
public final class WebDriverPage implements PageHandle {

    private final String id;
    private final WebDriver driver;

    public WebDriverPage(String id, WebDriver driver) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
    }

    /**
     * Unwraps a handle created by this module.
     *
     * @throws IllegalArgumentException when the handle belongs to another provider
     */
    public static WebDriverPage of(PageHandle handle) {
        if (handle instanceof WebDriverPage) {
            return (WebDriverPage) handle;
        }
        throw new IllegalArgumentException("not a WebDriver page: " + handle);
    }

    public static WebDriver driverOf(PageHandle handle) {
        return of(handle).driver;
    }

    @Override
    public String id() {
        return id;
    }

    public WebDriver getDriver() {
        return driver;
    }

    @Override
    public String toString() {
        return id;
    }
}
