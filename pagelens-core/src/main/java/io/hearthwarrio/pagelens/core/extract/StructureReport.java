package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Structural description of one resolved element: identity, paths and selectors a scraper could reuse.
 */
@JsonPropertyOrder({"resolved_by", "healed", "confidence", "tag", "id", "classes", "attributes", "text_preview",
        "css_path", "xpath", "parent", "children_count", "suggested_selectors"})
public final class StructureReport {

    private final String resolvedBy;
    private final boolean healed;
    private final double confidence;
    private final String tag;
    private final String id;
    private final List<String> classes;
    private final Map<String, String> attributes;
    private final String textPreview;
    private final String cssPath;
    private final String xpath;
    private final Map<String, Object> parent;
    private final int childrenCount;
    private final List<String> suggestedSelectors;

    StructureReport(
            String resolvedBy,
            boolean healed,
            double confidence,
            String tag,
            String id,
            List<String> classes,
            Map<String, String> attributes,
            String textPreview,
            String cssPath,
            String xpath,
            Map<String, Object> parent,
            int childrenCount,
            List<String> suggestedSelectors
    ) {
        this.resolvedBy = resolvedBy;
        this.healed = healed;
        this.confidence = confidence;
        this.tag = tag;
        this.id = id;
        this.classes = classes;
        this.attributes = attributes;
        this.textPreview = textPreview;
        this.cssPath = cssPath;
        this.xpath = xpath;
        this.parent = parent;
        this.childrenCount = childrenCount;
        this.suggestedSelectors = suggestedSelectors;
    }

    @JsonProperty("resolved_by")
    public String getResolvedBy() {
        return resolvedBy;
    }

    @JsonProperty("healed")
    public boolean isHealed() {
        return healed;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("tag")
    public String getTag() {
        return tag;
    }

    /**
     * @return element id or {@code null}
     */
    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("classes")
    public List<String> getClasses() {
        return classes;
    }

    @JsonProperty("attributes")
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @JsonProperty("text_preview")
    public String getTextPreview() {
        return textPreview;
    }

    @JsonProperty("css_path")
    public String getCssPath() {
        return cssPath;
    }

    @JsonProperty("xpath")
    public String getXpath() {
        return xpath;
    }

    /**
     * @return {@code tag}, {@code id} and {@code classes} of the parent, or {@code null} for {@code body}
     */
    @JsonProperty("parent")
    public Map<String, Object> getParent() {
        return parent;
    }

    @JsonProperty("children_count")
    public int getChildrenCount() {
        return childrenCount;
    }

    @JsonProperty("suggested_selectors")
    public List<String> getSuggestedSelectors() {
        return suggestedSelectors;
    }
}
