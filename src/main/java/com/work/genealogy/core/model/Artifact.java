package com.work.genealogy.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个编译/部署产物，按链标识（networkId）保存各条链上的部署记录。
 */
public class Artifact {

    private final String contractName;
    private final Map<String, ArtifactNetwork> networks;

    public Artifact(String contractName, Map<String, ArtifactNetwork> networks) {
        this.contractName = contractName;
        this.networks = networks == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(networks));
    }

    public String getContractName() {
        return contractName;
    }

    public Map<String, ArtifactNetwork> getNetworks() {
        return networks;
    }

    /**
     * @return 该链上的部署记录，没有则返回 null
     */
    public ArtifactNetwork networkFor(String networkId) {
        return networks.get(networkId);
    }
}
