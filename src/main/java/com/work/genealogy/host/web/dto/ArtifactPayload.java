package com.work.genealogy.host.web.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * artifact 中与族谱相关的部分：networks[chainId] = { block: { height }, network: { id } }。
 */
public class ArtifactPayload {

    private String contractName;

    private Map<String, ArtifactNetworkPayload> networks = new LinkedHashMap<>();

    public String getContractName() {
        return contractName;
    }

    public void setContractName(String contractName) {
        this.contractName = contractName;
    }

    public Map<String, ArtifactNetworkPayload> getNetworks() {
        return networks;
    }

    public void setNetworks(Map<String, ArtifactNetworkPayload> networks) {
        this.networks = networks;
    }

    public static class ArtifactNetworkPayload {

        private BlockPayload block;

        private NetworkIdPayload network;

        public BlockPayload getBlock() {
            return block;
        }

        public void setBlock(BlockPayload block) {
            this.block = block;
        }

        public NetworkIdPayload getNetwork() {
            return network;
        }

        public void setNetwork(NetworkIdPayload network) {
            this.network = network;
        }
    }

    public static class BlockPayload {

        private Long height;

        public Long getHeight() {
            return height;
        }

        public void setHeight(Long height) {
            this.height = height;
        }
    }

    public static class NetworkIdPayload {

        private String id;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }
    }
}
