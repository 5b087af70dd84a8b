package com.work.genealogy.host.chain;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.chain.ChainBlockClient;
import org.web3j.crypto.Hash;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Demo 级链客户端：区块 hash 由 seed + 高度推导，可单独覆盖某个高度。
 *
 * <p>{@link #reset(String)} 更换 seed，相当于链被重置，之前记录的 network 将不再能被确认。</p>
 */
public class MockChainBlockClient implements ChainBlockClient {

    private final Map<Long, String> overrides = new ConcurrentHashMap<>();
    private volatile String seed;
    private volatile long headHeight;

    public MockChainBlockClient(String seed, long headHeight) {
        this.seed = seed;
        this.headHeight = headHeight;
    }

    @Override
    public Optional<ChainBlock> getBlockByNumber(long height, boolean fullTransactions) {
        if (height < 0 || height > headHeight) {
            return Optional.empty();
        }
        String hash = overrides.get(height);
        if (hash == null) {
            hash = Hash.sha3String(seed + ":" + height);
        }
        return Optional.of(new ChainBlock(height, hash));
    }

    public void putBlock(long height, String hash) {
        overrides.put(height, hash);
        if (height > headHeight) {
            headHeight = height;
        }
    }

    public void reset(String newSeed) {
        overrides.clear();
        this.seed = newSeed;
    }

    public long getHeadHeight() {
        return headHeight;
    }
}
