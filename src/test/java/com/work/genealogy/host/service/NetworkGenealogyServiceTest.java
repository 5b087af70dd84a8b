package com.work.genealogy.host.service;

import com.work.genealogy.core.collect.GenealogyCollector;
import com.work.genealogy.core.config.ConsistencyPolicy;
import com.work.genealogy.core.config.GenealogyConfig;
import com.work.genealogy.core.exception.GenealogyException;
import com.work.genealogy.core.model.Artifact;
import com.work.genealogy.core.model.ArtifactNetwork;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.process.PortEffectHandler;
import com.work.genealogy.core.relation.RelationFinder;
import com.work.genealogy.core.resolve.NetworkGenealogyResolver;
import com.work.genealogy.core.support.InMemoryGenealogyRepository;
import com.work.genealogy.core.support.metrics.GenealogyMetrics;
import com.work.genealogy.host.chain.MockChainBlockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class NetworkGenealogyServiceTest {

    private InMemoryGenealogyRepository repository;
    private MockChainBlockClient chain;
    private GenealogyMetrics metrics;
    private NetworkGenealogyService service;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryGenealogyRepository();
        chain = new MockChainBlockClient("genesis", 100);
        metrics = mock(GenealogyMetrics.class);
        NetworkGenealogyResolver resolver = new NetworkGenealogyResolver(
                new GenealogyCollector(ConsistencyPolicy.WARN),
                new RelationFinder(GenealogyConfig.defaultConfig(), metrics),
                metrics);
        service = new NetworkGenealogyService(resolver, new PortEffectHandler(repository, chain), repository, chain);
    }

    private static Artifact deployed(Network network) {
        return new Artifact("Contract", Collections.singletonMap(network.getNetworkId(),
                new ArtifactNetwork(network.getHistoricBlock().getHeight(), network.toRef())));
    }

    @Test
    public void register_reads_block_hash_from_chain_when_missing() {
        Network network = service.registerNetwork("1337", "dev", 12, null);

        assertEquals(chain.getBlockByNumber(12, false).get().getHash(), network.getHistoricBlock().getHash());
        assertTrue(service.getNetwork(network.getId()).isPresent());
    }

    @Test
    public void register_keeps_given_hash() {
        Network network = service.registerNetwork("1337", null, 12, "0xgiven");

        assertEquals("0xgiven", network.getHistoricBlock().getHash());
    }

    @Test
    public void register_fails_for_height_unknown_to_chain() {
        assertThrows(GenealogyException.class, () -> service.registerNetwork("1337", null, 500, ""));
    }

    @Test
    public void resolve_reports_ids_and_effect_trace() {
        Network earlier = service.registerNetwork("1337", null, 5, null);
        Network a = service.registerNetwork("1337", null, 10, null);
        Network b = service.registerNetwork("1337", null, 20, null);

        ResolutionReport report = service.resolve("1337", Arrays.asList(deployed(b), deployed(a)));

        assertEquals("1337", report.getNetworkId());
        assertEquals(2, report.getGenealogyIds().size());
        assertEquals(earlier.toRef(), repository.listGenealogies().get(1).getAncestor());
        assertEquals("load networkGenealogies(2)", report.getEffects().get(report.getEffects().size() - 1));
        verify(metrics).genealogiesLoaded(2);
    }

    @Test
    public void resolve_without_observations_is_a_no_op() {
        Map<String, ArtifactNetwork> none = Collections.emptyMap();

        ResolutionReport report = service.resolve("1337", Collections.singletonList(new Artifact("Contract", none)));

        assertTrue(report.getGenealogyIds().isEmpty());
        assertTrue(report.getEffects().isEmpty());
        verify(metrics, never()).genealogiesLoaded(anyInt());
    }
}
