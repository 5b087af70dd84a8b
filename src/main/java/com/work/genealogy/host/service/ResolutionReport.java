package com.work.genealogy.host.service;

import java.util.Collections;
import java.util.List;

/**
 * 一次族谱解析的结果：写入的族谱 id + 按顺序发出的 effect 描述。
 */
public class ResolutionReport {

    private final String networkId;
    private final List<String> genealogyIds;
    private final List<String> effects;

    public ResolutionReport(String networkId, List<String> genealogyIds, List<String> effects) {
        this.networkId = networkId;
        this.genealogyIds = Collections.unmodifiableList(genealogyIds);
        this.effects = Collections.unmodifiableList(effects);
    }

    public String getNetworkId() {
        return networkId;
    }

    public List<String> getGenealogyIds() {
        return genealogyIds;
    }

    public List<String> getEffects() {
        return effects;
    }
}
