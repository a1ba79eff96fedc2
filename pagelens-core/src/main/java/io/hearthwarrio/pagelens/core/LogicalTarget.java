package io.hearthwarrio.pagelens.core;

import java.util.Objects;

/**
 * What the caller wants to locate: a logical name plus optional hints for each resolution tier.
 * <p>
 * Immutable. Build instances with {@link #named(String)}.
 */
public final class LogicalTarget {

    private final String logicalName;
    private final String selectorHint;
    private final String textHint;
    private final String semanticHint;
    private final FieldType fieldType;
    private final String attribute;
    private final boolean mandatory;

    private LogicalTarget(Builder b) {
        this.logicalName = b.logicalName;
        this.selectorHint = normalize(b.selectorHint);
        this.textHint = normalize(b.textHint);
        this.semanticHint = normalize(b.semanticHint);
        this.fieldType = b.fieldType == null ? FieldType.TEXT : b.fieldType;
        this.attribute = normalize(b.attribute);
        this.mandatory = b.mandatory;
    }

    public static Builder named(String logicalName) {
        return new Builder(logicalName);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim();
    }

    public String getLogicalName() {
        return logicalName;
    }

    /**
     * @return raw CSS/XPath hint, empty when absent
     */
    public String getSelectorHint() {
        return selectorHint;
    }

    public boolean hasSelectorHint() {
        return !selectorHint.isEmpty();
    }

    public String getTextHint() {
        return textHint;
    }

    /**
     * Role, landmark or archetype description (e.g. {@code price}, {@code button}, {@code main}).
     */
    public String getSemanticHint() {
        return semanticHint;
    }

    public FieldType getFieldType() {
        return fieldType;
    }

    /**
     * @return attribute to read instead of the text content, empty for text
     */
    public String getAttribute() {
        return attribute;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public Builder toBuilder() {
        return new Builder(logicalName)
                .selectorHint(selectorHint)
                .textHint(textHint)
                .semanticHint(semanticHint)
                .fieldType(fieldType)
                .attribute(attribute)
                .mandatory(mandatory);
    }

    @Override
    public String toString() {
        return "LogicalTarget{" +
                "name='" + logicalName + '\'' +
                (selectorHint.isEmpty() ? "" : ", selector='" + selectorHint + '\'') +
                (textHint.isEmpty() ? "" : ", text='" + textHint + '\'') +
                (semanticHint.isEmpty() ? "" : ", semantic='" + semanticHint + '\'') +
                ", type=" + fieldType.wireName() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogicalTarget)) {
            return false;
        }
        LogicalTarget that = (LogicalTarget) o;
        return mandatory == that.mandatory
                && logicalName.equals(that.logicalName)
                && selectorHint.equals(that.selectorHint)
                && textHint.equals(that.textHint)
                && semanticHint.equals(that.semanticHint)
                && fieldType == that.fieldType
                && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logicalName, selectorHint, textHint, semanticHint, fieldType, attribute, mandatory);
    }

    public static final class Builder {
        private final String logicalName;
        private String selectorHint;
        private String textHint;
        private String semanticHint;
        private FieldType fieldType;
        private String attribute;
        private boolean mandatory;

        private Builder(String logicalName) {
            Objects.requireNonNull(logicalName, "logicalName must not be null");
            if (logicalName.isBlank()) {
                throw new IllegalArgumentException("logicalName must not be blank");
            }
            this.logicalName = logicalName.trim();
        }

        public Builder selectorHint(String selectorHint) {
            this.selectorHint = selectorHint;
            return this;
        }

        public Builder textHint(String textHint) {
            this.textHint = textHint;
            return this;
        }

        public Builder semanticHint(String semanticHint) {
            this.semanticHint = semanticHint;
            return this;
        }

        public Builder fieldType(FieldType fieldType) {
            this.fieldType = fieldType;
            return this;
        }

        public Builder attribute(String attribute) {
            this.attribute = attribute;
            return this;
        }

        public Builder mandatory(boolean mandatory) {
            this.mandatory = mandatory;
            return this;
        }

        public LogicalTarget build() {
            return new LogicalTarget(this);
        }
    }
}
