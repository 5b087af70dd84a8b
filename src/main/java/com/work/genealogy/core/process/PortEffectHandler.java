package com.work.genealogy.core.process;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.chain.ChainBlockClient;
import com.work.genealogy.core.exception.GenealogyException;
import com.work.genealogy.core.exception.GenealogyStoreException;
import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.repository.GenealogyRepository;

import java.util.List;
import java.util.Optional;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 默认驱动方：把 effect 直接同步分派给 {@link GenealogyRepository} 与 {@link ChainBlockClient}。
 *
 * <p>存储侧的非组件异常统一包装为 {@link GenealogyStoreException}；链侧异常原样抛出，
 * 由 process 决定如何处理。</p>
 */
public class PortEffectHandler implements EffectHandler, EffectVisitor {

    private final GenealogyRepository repository;
    private final ChainBlockClient chain;

    public PortEffectHandler(GenealogyRepository repository, ChainBlockClient chain) {
        this.repository = requireNonNull(repository, "repository");
        this.chain = requireNonNull(chain, "chain");
    }

    @Override
    public <R> R perform(Effect<R> effect) {
        return effect.accept(this);
    }

    @Override
    public CandidateSearchResult visitRelationQuery(RelationQueryEffect effect) {
        try {
            return repository.findPossibleRelations(effect.getDirection(), effect.getNetwork().getId(),
                    effect.getAlreadyTried(), effect.getLimit());
        } catch (GenealogyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenealogyStoreException(effect.describe() + " failed", e);
        }
    }

    @Override
    public List<String> visitGenealogyLoad(GenealogyLoadEffect effect) {
        try {
            return repository.loadGenealogies(effect.getGenealogies());
        } catch (GenealogyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenealogyStoreException(effect.describe() + " failed", e);
        }
    }

    @Override
    public Optional<ChainBlock> visitBlockLookup(BlockLookupEffect effect) {
        return chain.getBlockByNumber(effect.getHeight(), effect.isFullTransactions());
    }
}
