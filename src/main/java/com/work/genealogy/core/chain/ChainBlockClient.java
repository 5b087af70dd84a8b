package com.work.genealogy.core.chain;

import java.util.Optional;

/**
 * 抽象的链上区块查询客户端，由宿主应用实现。
 *
 * <p>组件 core 不依赖具体链 SDK（如 web3j）。</p>
 */
public interface ChainBlockClient {

    /**
     * 按高度查询当前所连链上的区块（EVM: eth_getBlockByNumber）。
     *
     * @param fullTransactions 是否需要完整交易体；族谱解析只需要 hash，始终传 false
     * @return Optional.empty 表示当前链不认识该高度；查询失败可抛出异常
     */
    Optional<ChainBlock> getBlockByNumber(long height, boolean fullTransactions);
}
