package com.work.genealogy.host.web.dto;

import java.util.List;

public class ResolveGenealogyResponse {

    private String networkId;
    private List<String> genealogyIds;
    private List<String> effects;

    public String getNetworkId() {
        return networkId;
    }

    public void setNetworkId(String networkId) {
        this.networkId = networkId;
    }

    public List<String> getGenealogyIds() {
        return genealogyIds;
    }

    public void setGenealogyIds(List<String> genealogyIds) {
        this.genealogyIds = genealogyIds;
    }

    public List<String> getEffects() {
        return effects;
    }

    public void setEffects(List<String> effects) {
        this.effects = effects;
    }
}
