package io.hearthwarrio.pagelens.core.page;

/**
 * Opaque reference to a page owned by a {@link PageProvider}.
 * <p>
 * Handles are only meaningful to the provider that created them.
 */
public interface PageHandle {

    /**
     * @return provider-specific identifier used in logs
     */
    String id();
}
