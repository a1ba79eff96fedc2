package io.hearthwarrio.pagelens.core;

/**
 * Thrown by page providers when a page cannot be opened or loaded.
 */
public class NavigationException extends PagelensException {

    private final String url;

    public NavigationException(String url, String message) {
        super(ErrorKind.NAVIGATION_ERROR, "Navigation to '" + url + "' failed: " + message);
        this.url = url;
    }

    public NavigationException(String url, String message, Throwable cause) {
        super(ErrorKind.NAVIGATION_ERROR, "Navigation to '" + url + "' failed: " + message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
