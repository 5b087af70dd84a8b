package com.work.genealogy.core.process;

import com.work.genealogy.core.chain.ChainBlock;

import java.util.Optional;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNegative;

/**
 * 链上查询：eth_getBlockByNumber(height, fullTransactions)。
 */
public class BlockLookupEffect implements Effect<Optional<ChainBlock>> {

    private final long height;
    private final boolean fullTransactions;

    public BlockLookupEffect(long height, boolean fullTransactions) {
        this.height = requireNonNegative(height, "height");
        this.fullTransactions = fullTransactions;
    }

    public static BlockLookupEffect hashOnly(long height) {
        return new BlockLookupEffect(height, false);
    }

    public long getHeight() {
        return height;
    }

    public boolean isFullTransactions() {
        return fullTransactions;
    }

    @Override
    public Optional<ChainBlock> accept(EffectVisitor visitor) {
        return visitor.visitBlockLookup(this);
    }

    @Override
    public String describe() {
        return "eth_getBlockByNumber(" + height + ", " + fullTransactions + ")";
    }
}
