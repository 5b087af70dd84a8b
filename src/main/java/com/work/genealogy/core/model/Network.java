package com.work.genealogy.core.model;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 一次被记录下来的链状态：某条链（networkId）在某个历史区块上的快照。
 */
public class Network {

    private final String id;
    private final String networkId;
    private final String name;
    private final HistoricBlock historicBlock;

    public Network(String id, String networkId, String name, HistoricBlock historicBlock) {
        this.id = requireNonEmpty(id, "id");
        this.networkId = requireNonEmpty(networkId, "networkId");
        this.name = name;
        this.historicBlock = requireNonNull(historicBlock, "historicBlock");
    }

    public String getId() {
        return id;
    }

    public String getNetworkId() {
        return networkId;
    }

    public String getName() {
        return name;
    }

    public HistoricBlock getHistoricBlock() {
        return historicBlock;
    }

    public NetworkRef toRef() {
        return NetworkRef.of(id);
    }

    @Override
    public String toString() {
        return "Network{id=" + id + ", networkId=" + networkId + ", " + historicBlock + "}";
    }
}
