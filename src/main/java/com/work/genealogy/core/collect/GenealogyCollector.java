package com.work.genealogy.core.collect;

import com.work.genealogy.core.config.ConsistencyPolicy;
import com.work.genealogy.core.exception.InconsistentHistoryException;
import com.work.genealogy.core.model.ArtifactNetwork;
import com.work.genealogy.core.model.CollectedNetworks;
import com.work.genealogy.core.model.NetworkGenealogyInput;
import com.work.genealogy.core.model.NetworkRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 把同一条链上零散的 artifact network 整理成一条线性族谱。
 *
 * <p>前提（由调用方保证）：所有输入属于同一链标识、同一段链历史，高度越大越晚。
 * 按高度稳定排序后，只在相邻两项之间建边，n 个不同 Network 恰好 n-1 条边。</p>
 *
 * <p>纯函数，不发出任何 effect。</p>
 */
public class GenealogyCollector {

    private static final Logger log = LoggerFactory.getLogger(GenealogyCollector.class);

    private final ConsistencyPolicy consistencyPolicy;

    public GenealogyCollector(ConsistencyPolicy consistencyPolicy) {
        this.consistencyPolicy = requireNonNull(consistencyPolicy, "consistencyPolicy");
    }

    /**
     * @param artifactNetworks 允许包含 null 或缺字段的记录，它们会被忽略
     * @return 没有任何有效记录时返回 empty
     */
    public Optional<CollectedNetworks> collect(List<ArtifactNetwork> artifactNetworks) {
        requireNonNull(artifactNetworks, "artifactNetworks");

        List<ArtifactNetwork> ordered = new ArrayList<>();
        for (ArtifactNetwork artifactNetwork : artifactNetworks) {
            if (artifactNetwork != null && artifactNetwork.isComplete()) {
                ordered.add(artifactNetwork);
            }
        }
        if (ordered.isEmpty()) {
            return Optional.empty();
        }

        // List.sort 是稳定排序：同高度保持输入顺序
        ordered.sort(Comparator.comparingLong(ArtifactNetwork::getBlockHeight));
        checkConsistency(ordered);

        // 相邻的同一 Network 合并，避免产生自环
        List<NetworkRef> networks = new ArrayList<>(ordered.size());
        for (ArtifactNetwork artifactNetwork : ordered) {
            NetworkRef network = artifactNetwork.getNetwork();
            if (networks.isEmpty() || !networks.get(networks.size() - 1).equals(network)) {
                networks.add(network);
            }
        }

        List<NetworkGenealogyInput> genealogies = new ArrayList<>(networks.size() - 1);
        for (int i = 1; i < networks.size(); i++) {
            genealogies.add(new NetworkGenealogyInput(networks.get(i - 1), networks.get(i)));
        }

        return Optional.of(new CollectedNetworks(networks.get(0), networks.get(networks.size() - 1), genealogies));
    }

    private void checkConsistency(List<ArtifactNetwork> ordered) {
        if (consistencyPolicy == ConsistencyPolicy.IGNORE) {
            return;
        }
        List<String> problems = new ArrayList<>();
        Map<NetworkRef, Long> heightByNetwork = new HashMap<>();
        Map<Long, NetworkRef> networkByHeight = new HashMap<>();
        for (ArtifactNetwork artifactNetwork : ordered) {
            NetworkRef network = artifactNetwork.getNetwork();
            Long height = artifactNetwork.getBlockHeight();

            Long knownHeight = heightByNetwork.putIfAbsent(network, height);
            if (knownHeight != null && !knownHeight.equals(height)) {
                problems.add(network.getId() + " observed at heights " + knownHeight + " and " + height);
            }
            NetworkRef knownNetwork = networkByHeight.putIfAbsent(height, network);
            if (knownNetwork != null && !knownNetwork.equals(network)) {
                problems.add("height " + height + " observed for " + knownNetwork.getId() + " and " + network.getId());
            }
        }
        if (problems.isEmpty()) {
            return;
        }
        if (consistencyPolicy == ConsistencyPolicy.REJECT) {
            throw new InconsistentHistoryException("artifact networks do not form one chain history: " + problems);
        }
        log.warn("artifact networks may not form one chain history problems={}", problems);
    }
}
