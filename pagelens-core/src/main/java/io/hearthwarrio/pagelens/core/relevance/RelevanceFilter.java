package io.hearthwarrio.pagelens.core.relevance;

import io.hearthwarrio.pagelens.core.Tokens;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores content blocks against keywords and keeps the most relevant ones.
 * <p>
 * Score components:
 * <ul>
 *   <li>keyword coverage: {@code 0.6 * found / keywords} (without keywords: {@code 0.6 * min(length / 500, 1)})</li>
 *   <li>keyword density bonus, at most {@code 0.15}</li>
 *   <li>structural salience of the block ({@link BlockKind})</li>
 *   <li>length adjustment: short blocks lose {@code 0.1}, very long ones {@code 0.15}</li>
 * </ul>
 * The filter is a pure function; the output is in document order.
 */
public class RelevanceFilter {

    static final double COVERAGE_WEIGHT = 0.6;
    static final double MAX_DENSITY_BONUS = 0.15;
    static final int SHORT_BLOCK_CHARS = 40;
    static final int LONG_BLOCK_CHARS = 3000;
    static final double SHORT_PENALTY = 0.1;
    static final double LONG_PENALTY = 0.15;
    static final int REFERENCE_LENGTH = 500;

    /**
     * @param blocks   candidate blocks
     * @param keywords keywords or phrases, case-insensitive; may be empty
     * @param minScore blocks below this score are dropped
     * @param maxItems upper bound on returned blocks, non-negative
     * @return surviving blocks with their scores, in document order
     */
    public List<ScoredBlock> filter(List<ContentBlock> blocks, List<String> keywords, double minScore, int maxItems) {
        Objects.requireNonNull(blocks, "blocks must not be null");
        if (maxItems < 0) {
            throw new IllegalArgumentException("maxItems must not be negative: " + maxItems);
        }
        List<String> normalized = normalizeKeywords(keywords);

        List<ScoredBlock> kept = new ArrayList<>();
        for (ContentBlock block : blocks) {
            double score = score(block, normalized);
            if (score >= minScore) {
                kept.add(new ScoredBlock(block, score));
            }
        }

        kept.sort(Comparator.comparingDouble(ScoredBlock::getScore).reversed()
                .thenComparingInt(s -> s.getBlock().getIndex()));
        List<ScoredBlock> top = new ArrayList<>(kept.subList(0, Math.min(maxItems, kept.size())));
        top.sort(Comparator.comparingInt(s -> s.getBlock().getIndex()));
        return top;
    }

    public double score(ContentBlock block, List<String> keywords) {
        String text = block.getText().toLowerCase(Locale.ROOT);
        int length = text.length();

        double score;
        if (keywords.isEmpty()) {
            score = COVERAGE_WEIGHT * Math.min((double) length / REFERENCE_LENGTH, 1.0);
        } else {
            int found = 0;
            int occurrences = 0;
            for (String k : keywords) {
                int n = countOccurrences(text, k);
                if (n > 0) {
                    found++;
                    occurrences += n;
                }
            }
            int words = Math.max(1, Tokens.words(text).size());
            score = COVERAGE_WEIGHT * found / keywords.size()
                    + Math.min(MAX_DENSITY_BONUS, (double) occurrences / words);
        }

        score += block.getKind().salience();

        if (length < SHORT_BLOCK_CHARS) {
            score -= SHORT_PENALTY;
        } else if (length > LONG_BLOCK_CHARS) {
            score -= LONG_PENALTY;
        }
        return Math.round(Math.max(0.0, score) * 1000.0) / 1000.0;
    }

    private static List<String> normalizeKeywords(List<String> keywords) {
        List<String> out = new ArrayList<>();
        if (keywords == null) {
            return out;
        }
        for (String k : keywords) {
            String n = Tokens.normalizeWhitespace(k).toLowerCase(Locale.ROOT);
            if (!n.isEmpty() && !out.contains(n)) {
                out.add(n);
            }
        }
        return out;
    }

    private static int countOccurrences(String text, String keyword) {
        int count = 0;
        int from = 0;
        while (true) {
            int i = text.indexOf(keyword, from);
            if (i < 0) {
                return count;
            }
            count++;
            from = i + keyword.length();
        }
    }
}
