package com.work.genealogy.core.repository.impl;

import com.work.genealogy.core.exception.GenealogyStoreException;
import com.work.genealogy.core.exception.NetworkNotFoundException;
import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.model.NetworkGenealogyInput;
import com.work.genealogy.core.model.RelationDirection;
import com.work.genealogy.core.repository.GenealogyRepository;
import com.work.genealogy.core.repository.entity.NetworkEntity;
import com.work.genealogy.core.repository.mapper.NetworkGenealogyMapper;
import com.work.genealogy.core.repository.mapper.NetworkMapper;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;
import static com.work.genealogy.core.support.ValidationUtils.requirePositive;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 GenealogyRepository 实现。
 *
 * 由 {@code MybatisStoreConfiguration} 在 genealogy.store.mode=mybatis 时装配。
 */
public class MybatisGenealogyRepository implements GenealogyRepository {

    private final NetworkMapper networkMapper;
    private final NetworkGenealogyMapper genealogyMapper;

    public MybatisGenealogyRepository(NetworkMapper networkMapper, NetworkGenealogyMapper genealogyMapper) {
        this.networkMapper = networkMapper;
        this.genealogyMapper = genealogyMapper;
    }

    @Override
    public CandidateSearchResult findPossibleRelations(RelationDirection direction,
                                                       String anchorId,
                                                       Set<String> alreadyTried,
                                                       int limit) {
        requireNonNull(direction, "direction");
        requireNonEmpty(anchorId, "anchorId");
        requireNonNull(alreadyTried, "alreadyTried");
        requirePositive(limit, "limit");

        NetworkEntity anchor = networkMapper.selectByNetworkRecordId(anchorId);
        if (anchor == null) {
            throw new NetworkNotFoundException(anchorId);
        }

        List<NetworkEntity> rows = direction == RelationDirection.ANCESTOR
                ? networkMapper.listPossibleAncestors(anchor.getNetworkId(), anchor.getHistoricBlockHeight(), alreadyTried, limit)
                : networkMapper.listPossibleDescendants(anchor.getNetworkId(), anchor.getHistoricBlockHeight(), alreadyTried, limit);

        List<Network> networks = new ArrayList<>(rows.size());
        Set<String> tried = new LinkedHashSet<>(alreadyTried);
        for (NetworkEntity row : rows) {
            networks.add(convertToNetwork(row));
            tried.add(row.getId());
        }
        return new CandidateSearchResult(networks, tried);
    }

    @Override
    @Transactional
    public List<String> loadGenealogies(List<NetworkGenealogyInput> genealogies) {
        requireNonNull(genealogies, "genealogies");
        Set<String> referenced = new LinkedHashSet<>();
        for (NetworkGenealogyInput genealogy : genealogies) {
            referenced.add(genealogy.getAncestor().getId());
            referenced.add(genealogy.getDescendant().getId());
        }
        // 两端 network 必须都已登记
        for (String id : referenced) {
            if (networkMapper.selectByNetworkRecordId(id) == null) {
                throw new NetworkNotFoundException(id);
            }
        }
        Instant now = Instant.now();
        List<String> ids = new ArrayList<>(genealogies.size());
        for (NetworkGenealogyInput genealogy : genealogies) {
            String id = UUID.randomUUID().toString();
            int rows = genealogyMapper.insertGenealogy(id, genealogy.getAncestor().getId(),
                    genealogy.getDescendant().getId(), now);
            if (rows != 1) {
                throw new GenealogyStoreException("写入 network genealogy 失败: " + genealogy);
            }
            ids.add(id);
        }
        return ids;
    }

    @Override
    public Network addNetwork(String networkId, String name, HistoricBlock historicBlock) {
        requireNonEmpty(networkId, "networkId");
        requireNonNull(historicBlock, "historicBlock");
        String id = UUID.randomUUID().toString();
        int rows = networkMapper.insertNetwork(id, networkId, name, historicBlock.getHash(),
                historicBlock.getHeight(), Instant.now());
        if (rows != 1) {
            throw new GenealogyStoreException("写入 network 失败: networkId=" + networkId);
        }
        return new Network(id, networkId, name, historicBlock);
    }

    @Override
    public Optional<Network> findNetwork(String id) {
        requireNonEmpty(id, "id");
        NetworkEntity entity = networkMapper.selectByNetworkRecordId(id);
        return entity == null ? Optional.empty() : Optional.of(convertToNetwork(entity));
    }

    private Network convertToNetwork(NetworkEntity entity) {
        return new Network(entity.getId(), entity.getNetworkId(), entity.getName(),
                new HistoricBlock(entity.getHistoricBlockHash(), entity.getHistoricBlockHeight()));
    }
}
