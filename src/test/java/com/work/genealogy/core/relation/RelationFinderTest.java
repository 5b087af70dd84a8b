package com.work.genealogy.core.relation;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.chain.ChainBlockClient;
import com.work.genealogy.core.config.ConsistencyPolicy;
import com.work.genealogy.core.config.GenealogyConfig;
import com.work.genealogy.core.config.StoreFailurePolicy;
import com.work.genealogy.core.exception.GenealogyStoreException;
import com.work.genealogy.core.exception.NetworkNotFoundException;
import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.HistoricBlock;
import com.work.genealogy.core.model.Network;
import com.work.genealogy.core.model.NetworkRef;
import com.work.genealogy.core.model.RelationDirection;
import com.work.genealogy.core.process.Effect;
import com.work.genealogy.core.process.EffectHandler;
import com.work.genealogy.core.process.PortEffectHandler;
import com.work.genealogy.core.process.ProcessContext;
import com.work.genealogy.core.process.RelationQueryEffect;
import com.work.genealogy.core.repository.GenealogyRepository;
import com.work.genealogy.core.support.InMemoryGenealogyRepository;
import com.work.genealogy.core.support.metrics.GenealogyMetrics;
import com.work.genealogy.core.support.metrics.NoopGenealogyMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RelationFinderTest {

    private static final NetworkRef ANCHOR = NetworkRef.of("anchor");

    private GenealogyRepository repository;
    private ChainBlockClient chain;
    private ProcessContext context;
    private RelationFinder finder;

    @BeforeEach
    public void setUp() {
        repository = mock(GenealogyRepository.class);
        chain = mock(ChainBlockClient.class);
        context = new ProcessContext(new PortEffectHandler(repository, chain));
        finder = new RelationFinder(GenealogyConfig.defaultConfig(), new NoopGenealogyMetrics());
    }

    private static Network candidate(String id, long height, String hash) {
        return new Network(id, "1337", null, new HistoricBlock(hash, height));
    }

    private static Set<String> ids(String... ids) {
        return new LinkedHashSet<>(Arrays.asList(ids));
    }

    private void chainHas(long height, String hash) {
        when(chain.getBlockByNumber(eq(height), eq(false))).thenReturn(Optional.of(new ChainBlock(height, hash)));
    }

    @Test
    public void ancestor_search_checks_candidates_in_store_order() {
        when(repository.findPossibleRelations(eq(RelationDirection.ANCESTOR), eq("anchor"), anySet(), eq(5)))
                .thenReturn(new CandidateSearchResult(
                        Arrays.asList(candidate("n5", 5, "0x05"), candidate("n3", 3, "0x03")), ids("n5", "n3")));
        chainHas(5, "0xforked");
        chainHas(3, "0x03");

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR));

        assertEquals(Optional.of(NetworkRef.of("n3")), found);
        InOrder inOrder = inOrder(chain);
        inOrder.verify(chain).getBlockByNumber(5L, false);
        inOrder.verify(chain).getBlockByNumber(3L, false);
        verify(repository, times(1)).findPossibleRelations(any(), any(), anySet(), anyInt());
    }

    @Test
    public void stops_at_first_confirmed_candidate() {
        when(repository.findPossibleRelations(eq(RelationDirection.DESCENDANT), eq("anchor"), anySet(), anyInt()))
                .thenReturn(new CandidateSearchResult(Arrays.asList(
                        candidate("x", 10, "0x10"), candidate("y", 11, "0x11"), candidate("z", 12, "0x12")),
                        ids("x", "y", "z")));
        chainHas(10, "0xother");
        chainHas(11, "0x11");
        chainHas(12, "0x12");

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.DESCENDANT, ANCHOR));

        assertEquals(Optional.of(NetworkRef.of("y")), found);
        verify(chain).getBlockByNumber(10L, false);
        verify(chain).getBlockByNumber(11L, false);
        verify(chain, never()).getBlockByNumber(12L, false);
    }

    @Test
    public void empty_first_batch_means_no_relation_without_chain_lookup() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(CandidateSearchResult.exhausted(Collections.emptySet()));

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR));

        assertFalse(found.isPresent());
        verifyNoInteractions(chain);
        assertEquals(Collections.singletonList("possibleAncestors(network=anchor, alreadyTried=0, limit=5)"),
                context.getTrace());
    }

    @Test
    public void already_tried_grows_across_rounds_until_store_is_exhausted() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(new CandidateSearchResult(
                                Arrays.asList(candidate("a", 9, "0x09"), candidate("b", 8, "0x08")), ids("a", "b")),
                        new CandidateSearchResult(
                                Collections.singletonList(candidate("c", 7, "0x07")), ids("a", "b", "c")),
                        CandidateSearchResult.exhausted(ids("a", "b", "c")));

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR));

        assertFalse(found.isPresent());
        InOrder rounds = inOrder(repository);
        rounds.verify(repository).findPossibleRelations(RelationDirection.ANCESTOR, "anchor", Collections.emptySet(), 5);
        rounds.verify(repository).findPossibleRelations(RelationDirection.ANCESTOR, "anchor", ids("a", "b"), 5);
        rounds.verify(repository).findPossibleRelations(RelationDirection.ANCESTOR, "anchor", ids("a", "b", "c"), 5);
        verify(chain, times(3)).getBlockByNumber(anyLong(), eq(false));
    }

    @Test
    public void re_offered_candidates_are_not_checked_again_and_search_terminates() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(new CandidateSearchResult(Collections.singletonList(candidate("a", 9, "0x09")), ids("a")));
        chainHas(9, "0xother");

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR));

        assertFalse(found.isPresent());
        verify(repository, times(2)).findPossibleRelations(any(), any(), anySet(), anyInt());
        verify(chain, times(1)).getBlockByNumber(9L, false);
    }

    @Test
    public void chain_lookup_failure_only_skips_that_candidate() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(new CandidateSearchResult(
                        Arrays.asList(candidate("n5", 5, "0x05"), candidate("n3", 3, "0x03")), ids("n5", "n3")));
        when(chain.getBlockByNumber(5L, false)).thenThrow(new RuntimeException("rpc timeout"));
        chainHas(3, "0x03");

        Optional<NetworkRef> found = context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR));

        assertEquals(Optional.of(NetworkRef.of("n3")), found);
    }

    @Test
    public void unknown_height_on_chain_is_not_a_match() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(new CandidateSearchResult(Collections.singletonList(candidate("n5", 5, "0x05")), ids("n5")),
                        CandidateSearchResult.exhausted(ids("n5")));
        when(chain.getBlockByNumber(5L, false)).thenReturn(Optional.empty());

        assertFalse(context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR)).isPresent());
    }

    @Test
    public void store_failure_propagates_by_default() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenThrow(new RuntimeException("connection refused"));

        GenealogyStoreException e = assertThrows(GenealogyStoreException.class,
                () -> context.run(finder.find(RelationDirection.DESCENDANT, ANCHOR)));
        assertEquals("connection refused", e.getCause().getMessage());
        verifyNoInteractions(chain);
    }

    @Test
    public void store_failure_can_be_treated_as_no_relation() {
        GenealogyMetrics metrics = mock(GenealogyMetrics.class);
        RelationFinder lenient = new RelationFinder(
                new GenealogyConfig(StoreFailurePolicy.TREAT_AS_NO_RELATION, ConsistencyPolicy.WARN, 5), metrics);
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenThrow(new RuntimeException("connection refused"));

        Optional<NetworkRef> found = context.run(lenient.find(RelationDirection.DESCENDANT, ANCHOR));

        assertFalse(found.isPresent());
        verify(metrics).relationSearch(RelationDirection.DESCENDANT, "store_error");
        verifyNoInteractions(chain);
    }

    @Test
    public void missing_store_result_is_a_store_failure() {
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt())).thenReturn(null);

        assertThrows(GenealogyStoreException.class,
                () -> context.run(finder.find(RelationDirection.ANCESTOR, ANCHOR)));
    }

    @Test
    public void candidate_batch_size_is_passed_to_store() {
        RelationFinder small = new RelationFinder(
                new GenealogyConfig(StoreFailurePolicy.PROPAGATE, ConsistencyPolicy.WARN, 2), new NoopGenealogyMetrics());
        when(repository.findPossibleRelations(any(), any(), anySet(), anyInt()))
                .thenReturn(CandidateSearchResult.exhausted(Collections.emptySet()));

        context.run(small.find(RelationDirection.ANCESTOR, ANCHOR));

        verify(repository).findPossibleRelations(eq(RelationDirection.ANCESTOR), eq("anchor"), anySet(), eq(2));
    }

    private static EffectHandler storeDownDriver(ChainBlockClient chain) {
        return new EffectHandler() {
            @Override
            public <R> R perform(Effect<R> effect) {
                if (effect instanceof RelationQueryEffect) {
                    throw new IllegalStateException("store connection reset");
                }
                return new PortEffectHandler(mock(GenealogyRepository.class), chain).perform(effect);
            }
        };
    }

    @Test
    public void store_failure_policy_applies_to_any_driver() {
        RelationFinder lenient = new RelationFinder(
                new GenealogyConfig(StoreFailurePolicy.TREAT_AS_NO_RELATION, ConsistencyPolicy.WARN, 5),
                new NoopGenealogyMetrics());
        ProcessContext custom = new ProcessContext(storeDownDriver(chain));

        assertFalse(custom.run(lenient.find(RelationDirection.ANCESTOR, ANCHOR)).isPresent());
        verifyNoInteractions(chain);
    }

    @Test
    public void unwrapped_driver_failure_propagates_as_store_failure() {
        ProcessContext custom = new ProcessContext(storeDownDriver(chain));

        GenealogyStoreException e = assertThrows(GenealogyStoreException.class,
                () -> custom.run(finder.find(RelationDirection.DESCENDANT, ANCHOR)));
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertTrue(e.isRetryable());
    }

    @Test
    public void unknown_anchor_is_not_hidden_by_tolerant_policy() {
        RelationFinder lenient = new RelationFinder(
                new GenealogyConfig(StoreFailurePolicy.TREAT_AS_NO_RELATION, ConsistencyPolicy.WARN, 5),
                new NoopGenealogyMetrics());
        ProcessContext inMemory = new ProcessContext(new PortEffectHandler(new InMemoryGenealogyRepository(), chain));

        NetworkNotFoundException e = assertThrows(NetworkNotFoundException.class,
                () -> inMemory.run(lenient.find(RelationDirection.ANCESTOR, NetworkRef.of("no-such-network"))));
        assertFalse(e.isRetryable());
        assertEquals("no-such-network", e.getNetworkRecordId());
    }
}
