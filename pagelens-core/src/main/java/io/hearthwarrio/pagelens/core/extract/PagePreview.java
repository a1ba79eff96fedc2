package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Cheap overview of a page: headings, first paragraphs and an outline of text-bearing sections.
 */
@JsonPropertyOrder({"title", "h1", "h2_headings", "paragraph_preview", "total_sections", "sections"})
public final class PagePreview {

    private final String title;
    private final String h1;
    private final List<String> h2Headings;
    private final List<String> paragraphPreview;
    private final List<Section> sections;

    PagePreview(String title, String h1, List<String> h2Headings, List<String> paragraphPreview, List<Section> sections) {
        this.title = title;
        this.h1 = h1;
        this.h2Headings = List.copyOf(h2Headings);
        this.paragraphPreview = List.copyOf(paragraphPreview);
        this.sections = List.copyOf(sections);
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("h1")
    public String getH1() {
        return h1;
    }

    @JsonProperty("h2_headings")
    public List<String> getH2Headings() {
        return h2Headings;
    }

    @JsonProperty("paragraph_preview")
    public List<String> getParagraphPreview() {
        return paragraphPreview;
    }

    @JsonProperty("total_sections")
    public int getTotalSections() {
        return sections.size();
    }

    @JsonProperty("sections")
    public List<Section> getSections() {
        return sections;
    }

    @JsonPropertyOrder({"index", "tag", "selector", "text_preview"})
    public static final class Section {
        private final int index;
        private final String tag;
        private final String selector;
        private final String textPreview;

        Section(int index, String tag, String selector, String textPreview) {
            this.index = index;
            this.tag = tag;
            this.selector = selector;
            this.textPreview = textPreview;
        }

        @JsonProperty("index")
        public int getIndex() {
            return index;
        }

        @JsonProperty("tag")
        public String getTag() {
            return tag;
        }

        @JsonProperty("selector")
        public String getSelector() {
            return selector;
        }

        @JsonProperty("text_preview")
        public String getTextPreview() {
            return textPreview;
        }
    }
}
