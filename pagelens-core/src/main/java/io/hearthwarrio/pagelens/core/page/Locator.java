package io.hearthwarrio.pagelens.core.page;

import java.util.Objects;

/**
 * Engine-executable locator expression.
 * <p>
 * Expressions starting with {@code //}, {@code (/}, {@code ./} or {@code xpath=} are treated as XPath, everything else as
 * CSS.
 */
public final class Locator {

    public enum Kind {
        CSS,
        XPATH
    }

    private static final String XPATH_PREFIX = "xpath=";

    private final Kind kind;
    private final String expression;

    private Locator(Kind kind, String expression) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("expression must not be blank");
        }
    }

    public static Locator css(String expression) {
        return new Locator(Kind.CSS, Objects.requireNonNull(expression, "expression must not be null").trim());
    }

    public static Locator xpath(String expression) {
        return new Locator(Kind.XPATH, Objects.requireNonNull(expression, "expression must not be null").trim());
    }

    /**
     * Detects the locator kind from a raw selector string.
     *
     * @param raw CSS selector or XPath expression
     * @return parsed locator
     */
    public static Locator parse(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        String s = raw.trim();
        if (s.regionMatches(true, 0, XPATH_PREFIX, 0, XPATH_PREFIX.length())) {
            return xpath(s.substring(XPATH_PREFIX.length()));
        }
        if (s.startsWith("//") || s.startsWith("(/") || s.startsWith("./")) {
            return xpath(s);
        }
        return css(s);
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Round-trippable form: XPath expressions carry the {@code xpath=} prefix only when ambiguous.
     */
    public String asString() {
        if (kind == Kind.XPATH && !expression.startsWith("/") && !expression.startsWith("(/")) {
            return XPATH_PREFIX + expression;
        }
        return expression;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(java.util.Locale.ROOT) + ":" + expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Locator)) {
            return false;
        }
        Locator that = (Locator) o;
        return kind == that.kind && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expression);
    }
}
