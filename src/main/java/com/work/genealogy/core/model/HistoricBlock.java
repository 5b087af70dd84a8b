package com.work.genealogy.core.model;

import java.util.Objects;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNegative;

/**
 * Network 记录时所在的区块（hash + 高度）。
 */
public class HistoricBlock {

    private final String hash;
    private final long height;

    public HistoricBlock(String hash, long height) {
        this.hash = requireNonEmpty(hash, "hash");
        this.height = requireNonNegative(height, "height");
    }

    public String getHash() {
        return hash;
    }

    public long getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoricBlock)) return false;
        HistoricBlock that = (HistoricBlock) o;
        return height == that.height && hash.equals(that.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, height);
    }

    @Override
    public String toString() {
        return "HistoricBlock{height=" + height + ", hash=" + hash + "}";
    }
}
