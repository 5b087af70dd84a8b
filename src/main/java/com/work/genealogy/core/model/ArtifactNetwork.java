package com.work.genealogy.core.model;

/**
 * 单个 artifact 在某条链上的部署记录：部署所在区块高度 + 对应 Network 的引用。
 *
 * <p>两个字段都可能缺失；缺失任意一个的记录不参与族谱构建。</p>
 */
public class ArtifactNetwork {

    private final Long blockHeight;
    private final NetworkRef network;

    public ArtifactNetwork(Long blockHeight, NetworkRef network) {
        this.blockHeight = blockHeight;
        this.network = network;
    }

    public Long getBlockHeight() {
        return blockHeight;
    }

    public NetworkRef getNetwork() {
        return network;
    }

    public boolean isComplete() {
        return blockHeight != null && network != null;
    }

    @Override
    public String toString() {
        return "ArtifactNetwork{blockHeight=" + blockHeight + ", network=" + network + "}";
    }
}
