package io.hearthwarrio.pagelens.core.nlq;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups of interchangeable field words, each mapped to one canonical logical name.
 * <p>
 * A word listed in several clusters belongs to the first one declared.
 */
public final class SynonymClusters {

    private final Map<String, String> canonicalByWord;

    public SynonymClusters(Map<String, List<String>> clusters) {
        Map<String, String> m = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : clusters.entrySet()) {
            m.put(e.getKey(), e.getKey());
            for (String word : e.getValue()) {
                m.putIfAbsent(word, e.getKey());
            }
        }
        this.canonicalByWord = Collections.unmodifiableMap(m);
    }

    /**
     * Built-in clusters for common product, article and listing fields.
     */
    public static SynonymClusters defaults() {
        Map<String, List<String>> c = new LinkedHashMap<>();
        c.put("price", List.of("cost", "amount", "pricing", "fee", "fare", "msrp"));
        c.put("rating", List.of("ratings", "rate", "stars", "star", "score"));
        c.put("title", List.of("name", "headline", "heading"));
        c.put("description", List.of("desc", "summary", "details", "overview", "about"));
        c.put("image", List.of("img", "photo", "picture", "thumbnail"));
        c.put("link", List.of("url", "href"));
        c.put("availability", List.of("stock", "instock", "available", "availability"));
        c.put("review", List.of("reviews", "comment", "comments", "feedback"));
        c.put("date", List.of("published", "updated", "posted"));
        c.put("author", List.of("writer", "byline"));
        c.put("quantity", List.of("qty", "count"));
        return new SynonymClusters(c);
    }

    public Optional<String> canonical(String word) {
        return Optional.ofNullable(canonicalByWord.get(word));
    }
}
