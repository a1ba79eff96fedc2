package io.hearthwarrio.pagelens.core.relevance;

import java.util.Objects;

public final class ScoredBlock {

    private final ContentBlock block;
    private final double score;

    public ScoredBlock(ContentBlock block, double score) {
        this.block = Objects.requireNonNull(block, "block must not be null");
        this.score = score;
    }

    public ContentBlock getBlock() {
        return block;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "ScoredBlock{" + block + ", score=" + score + '}';
    }
}
