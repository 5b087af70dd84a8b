package com.work.genealogy.core.relation;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.config.GenealogyConfig;
import com.work.genealogy.core.config.StoreFailurePolicy;
import com.work.genealogy.core.exception.GenealogyException;
import com.work.genealogy.core.exception.GenealogyStoreException;
import com.work.genealogy.core.exception.NetworkNotFoundException;
import com.work.genealogy.core.exception.ProcessAbortedException;
import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.model.NetworkRef;
import com.work.genealogy.core.model.RelationDirection;
import com.work.genealogy.core.process.BlockLookupEffect;
import com.work.genealogy.core.process.ProcessContext;
import com.work.genealogy.core.process.RelationQueryEffect;
import com.work.genealogy.core.process.ResolutionProcess;
import com.work.genealogy.core.support.metrics.GenealogyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 为链的一个端点查找最近的、已被记录过且经链上数据确认的相关 Network。
 *
 * <p>循环：
 * <ol>
 *   <li>向存储查询一批 possible relation（排除 alreadyTried）；</li>
 *   <li>按存储返回顺序逐个用 eth_getBlockByNumber 校验候选的历史区块 hash，第一个匹配即返回；</li>
 *   <li>整批都不匹配则带着扩大后的 alreadyTried 继续查询；</li>
 *   <li>存储返回空批次时结束，结果为“没有相关 Network”。</li>
 * </ol>
 * 校验严格串行，不能并发：同一批里可能有多个候选都能通过校验，先到者胜。</p>
 */
public class RelationFinder {

    private static final Logger log = LoggerFactory.getLogger(RelationFinder.class);

    private final GenealogyConfig config;
    private final GenealogyMetrics metrics;

    public RelationFinder(GenealogyConfig config, GenealogyMetrics metrics) {
        this.config = requireNonNull(config, "config");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public ResolutionProcess<Optional<NetworkRef>> find(RelationDirection direction, NetworkRef network) {
        requireNonNull(direction, "direction");
        requireNonNull(network, "network");
        return context -> search(context, direction, network);
    }

    private Optional<NetworkRef> search(ProcessContext context, RelationDirection direction, NetworkRef network) {
        Set<String> alreadyTried = new LinkedHashSet<>();
        int round = 0;
        while (true) {
            round++;
            Optional<CandidateSearchResult> next = queryNextPossiblyRelatedNetworks(context, direction, network, alreadyTried);
            if (!next.isPresent()) {
                metrics.relationSearch(direction, "store_error");
                return Optional.empty();
            }
            CandidateSearchResult batch = next.get();

            // 存储可能把已试过的候选再发一次：只校验新候选，alreadyTried 只增不减
            List<Network> candidates = new ArrayList<>(batch.getNetworks().size());
            Set<String> batchIds = new HashSet<>();
            for (Network candidate : batch.getNetworks()) {
                if (!alreadyTried.contains(candidate.getId()) && batchIds.add(candidate.getId())) {
                    candidates.add(candidate);
                }
            }
            alreadyTried.addAll(batch.getAlreadyTried());
            alreadyTried.addAll(batchIds);

            log.debug("{} round={} network={} candidates={} alreadyTried={}",
                    direction.getQueryName(), round, network.getId(), candidates.size(), alreadyTried.size());

            Optional<NetworkRef> match = findMatchingCandidateOnChain(context, candidates);
            if (match.isPresent()) {
                log.info("relation found direction={} network={} relation={} rounds={}",
                        direction, network.getId(), match.get().getId(), round);
                metrics.relationSearch(direction, "found");
                return match;
            }

            if (batch.isEmpty()) {
                log.info("no relation found direction={} network={} rounds={}", direction, network.getId(), round);
                metrics.relationSearch(direction, "not_found");
                return Optional.empty();
            }
            if (candidates.isEmpty()) {
                log.warn("store re-offered only tried candidates, stop searching direction={} network={} round={}",
                        direction, network.getId(), round);
                metrics.relationSearch(direction, "not_found");
                return Optional.empty();
            }
        }
    }

    /**
     * 存储查询失败按 {@link StoreFailurePolicy} 处理，与驱动方如何包装异常无关；
     * 驱动中止与锚点不存在不受策略影响，直接抛出。
     *
     * @return empty 表示查询失败且按 TREAT_AS_NO_RELATION 策略结束查找
     */
    private Optional<CandidateSearchResult> queryNextPossiblyRelatedNetworks(ProcessContext context,
                                                                             RelationDirection direction,
                                                                             NetworkRef network,
                                                                             Set<String> alreadyTried) {
        RelationQueryEffect query = new RelationQueryEffect(direction, network, alreadyTried, config.getCandidateBatchSize());
        try {
            CandidateSearchResult result = context.perform(query);
            if (result == null) {
                throw new GenealogyStoreException(query.describe() + " returned no result");
            }
            return Optional.of(result);
        } catch (ProcessAbortedException | NetworkNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            if (config.getStoreFailurePolicy() == StoreFailurePolicy.PROPAGATE) {
                throw e instanceof GenealogyException
                        ? (GenealogyException) e
                        : new GenealogyStoreException(query.describe() + " failed", e);
            }
            log.warn("{} failed, treating as no relation network={} err={}",
                    direction.getQueryName(), network.getId(), e.toString());
            return Optional.empty();
        }
    }

    private Optional<NetworkRef> findMatchingCandidateOnChain(ProcessContext context, List<Network> candidates) {
        for (Network candidate : candidates) {
            HistoricBlock historicBlock = candidate.getHistoricBlock();
            Optional<ChainBlock> block;
            try {
                block = context.perform(BlockLookupEffect.hashOnly(historicBlock.getHeight()));
            } catch (ProcessAbortedException e) {
                throw e;
            } catch (RuntimeException e) {
                // 链上查询失败只说明该候选无法确认，继续下一个
                log.warn("block lookup failed candidate={} height={} err={}",
                        candidate.getId(), historicBlock.getHeight(), e.toString());
                metrics.candidateCheck("error");
                continue;
            }

            if (block == null || !block.isPresent()) {
                metrics.candidateCheck("absent");
                continue;
            }
            if (historicBlock.getHash().equals(block.get().getHash())) {
                metrics.candidateCheck("confirmed");
                return Optional.of(candidate.toRef());
            }
            metrics.candidateCheck("mismatch");
        }
        return Optional.empty();
    }
}
