package com.work.genealogy.core.repository;

import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.model.NetworkGenealogyInput;
import com.work.genealogy.core.model.RelationDirection;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 抽象出所有与存储交互的操作，真实项目中由 MyBatis 实现。
 */
public interface GenealogyRepository {

    /**
     * 查询与 anchorId 对应 Network 可能相关的已记录 Network。
     *
     * <p>约定：只返回同一 networkId 下、高度严格更低（ANCESTOR，按高度倒序）或严格更高
     * （DESCENDANT，按高度正序）的 Network，排除 alreadyTried，最多 limit 条；
     * 返回的 alreadyTried = 入参 alreadyTried + 本批返回的 id。</p>
     */
    CandidateSearchResult findPossibleRelations(RelationDirection direction,
                                                String anchorId,
                                                Set<String> alreadyTried,
                                                int limit);

    /**
     * 写入族谱边，按输入顺序返回分配的 id。不做去重。
     */
    List<String> loadGenealogies(List<NetworkGenealogyInput> genealogies);

    /**
     * 记录一个 Network，id 由存储分配。
     */
    Network addNetwork(String networkId, String name, HistoricBlock historicBlock);

    Optional<Network> findNetwork(String id);
}
