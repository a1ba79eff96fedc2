package io.hearthwarrio.pagelens.core.nlq;

import io.hearthwarrio.pagelens.core.FieldType;

/**
 * Optional per-field overrides supplied next to a field query. Blank values mean "infer".
 */
public final class FieldSpec {

    private static final FieldSpec EMPTY = new FieldSpec(null, null, null, null, null, false);

    private final String selector;
    private final FieldType type;
    private final String attribute;
    private final String textHint;
    private final String semanticHint;
    private final boolean mandatory;

    public FieldSpec(String selector, FieldType type, String attribute, String textHint, String semanticHint, boolean mandatory) {
        this.selector = blankToNull(selector);
        this.type = type;
        this.attribute = blankToNull(attribute);
        this.textHint = blankToNull(textHint);
        this.semanticHint = blankToNull(semanticHint);
        this.mandatory = mandatory;
    }

    public static FieldSpec empty() {
        return EMPTY;
    }

    public static FieldSpec selector(String selector) {
        return new FieldSpec(selector, null, null, null, null, false);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    public String getSelector() {
        return selector;
    }

    public FieldType getType() {
        return type;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getTextHint() {
        return textHint;
    }

    public String getSemanticHint() {
        return semanticHint;
    }

    public boolean isMandatory() {
        return mandatory;
    }
}
