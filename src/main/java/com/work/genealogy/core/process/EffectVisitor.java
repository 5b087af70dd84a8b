package com.work.genealogy.core.process;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.model.CandidateSearchResult;

import java.util.List;
import java.util.Optional;

/**
 * 三类 effect 的分派入口，由驱动方实现。
 */
public interface EffectVisitor {

    CandidateSearchResult visitRelationQuery(RelationQueryEffect effect);

    List<String> visitGenealogyLoad(GenealogyLoadEffect effect);

    Optional<ChainBlock> visitBlockLookup(BlockLookupEffect effect);
}
