package io.hearthwarrio.pagelens.core.page;

import io.hearthwarrio.pagelens.core.UnsupportedCapabilityException;

/**
 * Low-level user interactions. Higher-level flows (form filling, auto scroll) live in the core.
 */
public interface InteractionDriver {

    void click(PageHandle page, Locator locator);

    void type(PageHandle page, Locator locator, String text, boolean clearFirst);

    /**
     * Selects an option of a {@code select} element by value or visible text.
     */
    void select(PageHandle page, Locator locator, String value);

    void setChecked(PageHandle page, Locator locator, boolean checked);

    void scrollToBottom(PageHandle page);

    /**
     * @return current scrollable height of the document in pixels
     */
    long scrollHeight(PageHandle page);

    /**
     * Driver for engines without interaction support; every call fails with {@link UnsupportedCapabilityException}.
     */
    static InteractionDriver unsupported() {
        return new InteractionDriver() {
            @Override
            public void click(PageHandle page, Locator locator) {
                throw fail();
            }

            @Override
            public void type(PageHandle page, Locator locator, String text, boolean clearFirst) {
                throw fail();
            }

            @Override
            public void select(PageHandle page, Locator locator, String value) {
                throw fail();
            }

            @Override
            public void setChecked(PageHandle page, Locator locator, boolean checked) {
                throw fail();
            }

            @Override
            public void scrollToBottom(PageHandle page) {
                throw fail();
            }

            @Override
            public long scrollHeight(PageHandle page) {
                throw fail();
            }

            private UnsupportedCapabilityException fail() {
                return new UnsupportedCapabilityException("page engine does not support interactions");
            }
        };
    }
}
