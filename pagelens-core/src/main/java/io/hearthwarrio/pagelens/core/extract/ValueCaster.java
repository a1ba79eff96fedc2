package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.Tokens;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw element text into typed field values.
 */
public final class ValueCaster {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern NUMERIC_CELL = Pattern.compile("[\\d.\\-$€£¥₹+% ]+");

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1", "on", "enabled", "checked", "in stock", "available");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0", "off", "disabled", "unchecked", "out of stock", "unavailable");

    private final int maxTextLength;

    public ValueCaster(int maxTextLength) {
        if (maxTextLength <= 0) {
            throw new IllegalArgumentException("maxTextLength must be positive: " + maxTextLength);
        }
        this.maxTextLength = maxTextLength;
    }

    /**
     * @param raw  text or attribute value, {@code null} when absent
     * @param type declared field type
     * @return {@code Double} for numbers, {@code Boolean} for booleans, truncated text otherwise; {@code null} when
     * {@code raw} is null or a number cannot be parsed
     */
    public Object cast(String raw, FieldType type) {
        if (raw == null) {
            return null;
        }
        String text = Tokens.normalizeWhitespace(raw);
        switch (type) {
            case NUMBER:
                return parseNumber(text);
            case BOOLEAN:
                return parseBoolean(text);
            default:
                return Tokens.truncate(text, maxTextLength);
        }
    }

    /**
     * Finds the first decimal number in {@code text}. Thousands separators ({@code ,}) are ignored.
     *
     * @return parsed number or {@code null}
     */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = Tokens.normalizeWhitespace(text).replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        Matcher m = NUMBER.matcher(cleaned);
        if (!m.find()) {
            return null;
        }
        try {
            double v = Double.parseDouble(m.group());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseBoolean(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lowered)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(lowered)) {
            return Boolean.FALSE;
        }
        return !text.isEmpty();
    }

    /**
     * Table cells become numbers only when they contain nothing but digits, signs and currency symbols.
     */
    static Object normalizeCell(String value) {
        String text = Tokens.normalizeWhitespace(value);
        if (text.isEmpty()) {
            return "";
        }
        Double numeric = parseNumber(text);
        if (numeric != null && NUMERIC_CELL.matcher(text.replace(",", "")).matches()) {
            return numeric;
        }
        return text;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }
}
