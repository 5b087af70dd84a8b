package com.work.genealogy.host.service;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.chain.ChainBlockClient;
import com.work.genealogy.core.exception.GenealogyException;
import com.work.genealogy.core.model.Artifact;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.process.EffectHandler;
import com.work.genealogy.core.process.ProcessContext;
import com.work.genealogy.core.repository.GenealogyRepository;
import com.work.genealogy.core.resolve.NetworkGenealogyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNegative;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 宿主侧入口：驱动族谱解析 process，并提供 network 登记。
 *
 * <p>每次解析使用独立的 {@link ProcessContext}，不同请求之间不共享可变状态。</p>
 */
@Service
public class NetworkGenealogyService {

    private static final Logger log = LoggerFactory.getLogger(NetworkGenealogyService.class);

    private final NetworkGenealogyResolver resolver;
    private final EffectHandler effectHandler;
    private final GenealogyRepository repository;
    private final ChainBlockClient chain;

    public NetworkGenealogyService(NetworkGenealogyResolver resolver,
                                   EffectHandler effectHandler,
                                   GenealogyRepository repository,
                                   ChainBlockClient chain) {
        this.resolver = resolver;
        this.effectHandler = effectHandler;
        this.repository = repository;
        this.chain = chain;
    }

    /**
     * 为当前所连链（networkId）上的一批 artifact 生成并写入族谱。
     */
    public ResolutionReport resolve(String networkId, List<Artifact> artifacts) {
        requireNonEmpty(networkId, "networkId");
        requireNonNull(artifacts, "artifacts");
        ProcessContext context = new ProcessContext(effectHandler);
        List<String> ids = context.run(resolver.resolve(networkId, artifacts));
        log.info("genealogy resolution finished networkId={} artifacts={} genealogies={} effects={}",
                networkId, artifacts.size(), ids.size(), context.getTrace().size());
        return new ResolutionReport(networkId, ids, context.getTrace());
    }

    /**
     * 登记一个 network。未给出 hash 时从链上读取该高度的区块 hash。
     */
    public Network registerNetwork(String networkId, String name, long height, String hash) {
        requireNonEmpty(networkId, "networkId");
        requireNonNegative(height, "height");
        String blockHash = hash;
        if (blockHash == null || blockHash.trim().isEmpty()) {
            Optional<ChainBlock> block = chain.getBlockByNumber(height, false);
            if (!block.isPresent()) {
                throw new GenealogyException("链上不存在该高度的区块: height=" + height);
            }
            blockHash = block.get().getHash();
        }
        Network network = repository.addNetwork(networkId, name, new HistoricBlock(blockHash, height));
        log.info("network registered id={} networkId={} height={}", network.getId(), networkId, height);
        return network;
    }

    public Optional<Network> getNetwork(String id) {
        requireNonEmpty(id, "id");
        return repository.findNetwork(id);
    }
}
