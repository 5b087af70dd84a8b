package com.work.genealogy.core.chain;

/**
 * eth_getBlockByNumber 返回中本组件关心的部分。
 */
public class ChainBlock {

    private final long number;
    private final String hash;

    public ChainBlock(long number, String hash) {
        this.number = number;
        this.hash = hash;
    }

    public long getNumber() {
        return number;
    }

    public String getHash() {
        return hash;
    }
}
