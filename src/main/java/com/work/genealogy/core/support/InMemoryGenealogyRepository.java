package com.work.genealogy.core.support;

import com.work.genealogy.core.exception.NetworkNotFoundException;
import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.model.NetworkGenealogyInput;
import com.work.genealogy.core.model.RelationDirection;
import com.work.genealogy.core.repository.GenealogyRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;
import static com.work.genealogy.core.support.ValidationUtils.requirePositive;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示组件行为。
 * 注意：该实现不具备跨进程一致性。
 */
public class InMemoryGenealogyRepository implements GenealogyRepository {

    private final Map<String, Network> networks = new LinkedHashMap<>();
    private final Map<String, NetworkGenealogyInput> genealogies = new LinkedHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public synchronized CandidateSearchResult findPossibleRelations(RelationDirection direction,
                                                                    String anchorId,
                                                                    Set<String> alreadyTried,
                                                                    int limit) {
        requireNonNull(direction, "direction");
        requireNonNull(alreadyTried, "alreadyTried");
        requirePositive(limit, "limit");
        Network anchor = networks.get(requireNonEmpty(anchorId, "anchorId"));
        if (anchor == null) {
            throw new NetworkNotFoundException(anchorId);
        }
        long height = anchor.getHistoricBlock().getHeight();

        Comparator<Network> byHeight = Comparator.comparingLong(n -> n.getHistoricBlock().getHeight());
        List<Network> candidates = networks.values().stream()
                .filter(n -> n.getNetworkId().equals(anchor.getNetworkId()))
                .filter(n -> !alreadyTried.contains(n.getId()))
                .filter(n -> direction == RelationDirection.ANCESTOR
                        ? n.getHistoricBlock().getHeight() < height
                        : n.getHistoricBlock().getHeight() > height)
                .sorted(direction == RelationDirection.ANCESTOR ? byHeight.reversed() : byHeight)
                .limit(limit)
                .collect(Collectors.toList());

        Set<String> tried = new LinkedHashSet<>(alreadyTried);
        candidates.forEach(n -> tried.add(n.getId()));
        return new CandidateSearchResult(candidates, tried);
    }

    @Override
    public synchronized List<String> loadGenealogies(List<NetworkGenealogyInput> inputs) {
        requireNonNull(inputs, "genealogies");
        // 与表上的外键一致：任一端不存在则整批不写
        for (NetworkGenealogyInput input : inputs) {
            requireKnown(input.getAncestor().getId());
            requireKnown(input.getDescendant().getId());
        }
        List<String> ids = new ArrayList<>(inputs.size());
        for (NetworkGenealogyInput input : inputs) {
            String id = "genealogy-" + idGenerator.getAndIncrement();
            genealogies.put(id, input);
            ids.add(id);
        }
        return ids;
    }

    @Override
    public synchronized Network addNetwork(String networkId, String name, HistoricBlock historicBlock) {
        Network network = new Network("network-" + idGenerator.getAndIncrement(), networkId, name, historicBlock);
        networks.put(network.getId(), network);
        return network;
    }

    @Override
    public synchronized Optional<Network> findNetwork(String id) {
        return Optional.ofNullable(networks.get(id));
    }

    private void requireKnown(String id) {
        if (!networks.containsKey(id)) {
            throw new NetworkNotFoundException(id);
        }
    }

    /**
     * 已写入的族谱边（按写入顺序）。
     */
    public synchronized List<NetworkGenealogyInput> listGenealogies() {
        return new ArrayList<>(genealogies.values());
    }
}
