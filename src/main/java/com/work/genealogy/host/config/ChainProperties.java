package com.work.genealogy.host.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 链连接配置。
 *
 * mode=mock: 使用 MockChainBlockClient
 * mode=web3j: 使用 Web3jChainBlockClient
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * mock 链的 hash 种子
     */
    private String mockSeed = "genesis";

    /**
     * mock 链的最新高度
     */
    private long mockHeadHeight = 1_000_000L;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getMockSeed() {
        return mockSeed;
    }

    public void setMockSeed(String mockSeed) {
        this.mockSeed = mockSeed;
    }

    public long getMockHeadHeight() {
        return mockHeadHeight;
    }

    public void setMockHeadHeight(long mockHeadHeight) {
        this.mockHeadHeight = mockHeadHeight;
    }
}
