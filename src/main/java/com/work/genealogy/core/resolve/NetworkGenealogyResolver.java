package com.work.genealogy.core.resolve;

import com.work.genealogy.core.collect.GenealogyCollector;
import com.work.genealogy.core.model.Artifact;
import com.work.genealogy.core.model.ArtifactNetwork;
import com.work.genealogy.core.model.CollectedNetworks;
import com.work.genealogy.core.model.NetworkGenealogyInput;
import com.work.genealogy.core.model.NetworkRef;
import com.work.genealogy.core.model.RelationDirection;
import com.work.genealogy.core.process.GenealogyLoadEffect;
import com.work.genealogy.core.process.ProcessContext;
import com.work.genealogy.core.process.ResolutionProcess;
import com.work.genealogy.core.relation.RelationFinder;
import com.work.genealogy.core.support.metrics.GenealogyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;
import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 为一批 artifact 在当前所连链上生成 NetworkGenealogy 记录。
 *
 * <p>流程：
 * <ol>
 *   <li>取出每个 artifact 在目标链标识下的部署记录；</li>
 *   <li>{@link GenealogyCollector} 排序并生成相邻两两的族谱边，得到最早/最晚 Network；</li>
 *   <li>为最早的 Network 查找已知祖先，为最晚的 Network 查找已知后代，找到则各补一条边；</li>
 *   <li>所有边一次性写入存储。</li>
 * </ol>
 * 没有任何有效部署记录时不发出任何 effect，返回空列表。</p>
 *
 * <p>返回值是存储分配的族谱 id，调用方通常可以忽略。</p>
 */
public class NetworkGenealogyResolver {

    private static final Logger log = LoggerFactory.getLogger(NetworkGenealogyResolver.class);

    private final GenealogyCollector collector;
    private final RelationFinder relationFinder;
    private final GenealogyMetrics metrics;

    public NetworkGenealogyResolver(GenealogyCollector collector, RelationFinder relationFinder, GenealogyMetrics metrics) {
        this.collector = requireNonNull(collector, "collector");
        this.relationFinder = requireNonNull(relationFinder, "relationFinder");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public ResolutionProcess<List<String>> resolve(String networkId, List<Artifact> artifacts) {
        requireNonEmpty(networkId, "networkId");
        requireNonNull(artifacts, "artifacts");
        return context -> load(context, networkId, artifacts);
    }

    private List<String> load(ProcessContext context, String networkId, List<Artifact> artifacts) {
        List<ArtifactNetwork> artifactNetworks = new ArrayList<>();
        for (Artifact artifact : artifacts) {
            ArtifactNetwork artifactNetwork = artifact == null ? null : artifact.networkFor(networkId);
            if (artifactNetwork != null) {
                artifactNetworks.add(artifactNetwork);
            }
        }

        Optional<CollectedNetworks> collected = collector.collect(artifactNetworks);
        if (!collected.isPresent()) {
            log.info("no artifact networks observed, skip genealogy load networkId={} artifacts={}",
                    networkId, artifacts.size());
            return Collections.emptyList();
        }
        CollectedNetworks networks = collected.get();
        List<NetworkGenealogyInput> genealogies = new ArrayList<>(networks.getGenealogies());
        log.debug("collected genealogies networkId={} genealogies={}", networkId, genealogies);

        Optional<NetworkRef> ancestorAncestor =
                context.run(relationFinder.find(RelationDirection.ANCESTOR, networks.getAncestor()));
        if (ancestorAncestor.isPresent() && !ancestorAncestor.get().equals(networks.getAncestor())) {
            genealogies.add(new NetworkGenealogyInput(ancestorAncestor.get(), networks.getAncestor()));
        }

        Optional<NetworkRef> descendantDescendant =
                context.run(relationFinder.find(RelationDirection.DESCENDANT, networks.getDescendant()));
        if (descendantDescendant.isPresent() && !descendantDescendant.get().equals(networks.getDescendant())) {
            genealogies.add(new NetworkGenealogyInput(networks.getDescendant(), descendantDescendant.get()));
        }

        List<String> ids = context.perform(new GenealogyLoadEffect(genealogies));
        metrics.genealogiesLoaded(ids.size());
        log.info("network genealogies loaded networkId={} count={}", networkId, ids.size());
        return ids;
    }
}
