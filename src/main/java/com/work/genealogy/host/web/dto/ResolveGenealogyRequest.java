package com.work.genealogy.host.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.List;

/**
 * 族谱解析请求：当前所连链的标识 + 本批 artifact。
 */
public class ResolveGenealogyRequest {

    @NotBlank(message = "networkId 不能为空")
    private String networkId;

    @NotNull(message = "artifacts 不能为null")
    private List<ArtifactPayload> artifacts;

    public String getNetworkId() {
        return networkId;
    }

    public void setNetworkId(String networkId) {
        this.networkId = networkId;
    }

    public List<ArtifactPayload> getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(List<ArtifactPayload> artifacts) {
        this.artifacts = artifacts;
    }
}
