package com.work.genealogy.core.process;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.exception.ProcessAbortedException;
import com.work.genealogy.core.model.CandidateSearchResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ProcessContextTest {

    @Test
    public void nested_processes_linearize_effects_in_call_order() {
        EffectVisitor answers = new EffectVisitor() {
            @Override
            public CandidateSearchResult visitRelationQuery(RelationQueryEffect effect) {
                return CandidateSearchResult.exhausted(effect.getAlreadyTried());
            }

            @Override
            public List<String> visitGenealogyLoad(GenealogyLoadEffect effect) {
                return Collections.singletonList("id-1");
            }

            @Override
            public Optional<ChainBlock> visitBlockLookup(BlockLookupEffect effect) {
                return Optional.of(new ChainBlock(effect.getHeight(), "0x" + effect.getHeight()));
            }
        };
        EffectHandler handler = new EffectHandler() {
            @Override
            public <R> R perform(Effect<R> effect) {
                return effect.accept(answers);
            }
        };
        ProcessContext context = new ProcessContext(handler);

        ResolutionProcess<String> lookup = ctx -> ctx.perform(BlockLookupEffect.hashOnly(7)).get().getHash();
        String result = context.run(ctx -> {
            String first = ctx.run(lookup);
            ctx.perform(new GenealogyLoadEffect(Collections.emptyList()));
            String second = ctx.run(c -> c.perform(BlockLookupEffect.hashOnly(8)).get().getHash());
            return first + "," + second;
        });

        assertEquals("0x7,0x8", result);
        assertEquals(Arrays.asList(
                "eth_getBlockByNumber(7, false)",
                "load networkGenealogies(0)",
                "eth_getBlockByNumber(8, false)"), context.getTrace());
    }

    @Test
    public void interrupted_driver_aborts_before_issuing_effect() {
        EffectHandler handler = mock(EffectHandler.class);
        ProcessContext context = new ProcessContext(handler);

        Thread.currentThread().interrupt();
        try {
            assertThrows(ProcessAbortedException.class, () -> context.perform(BlockLookupEffect.hashOnly(1)));
        } finally {
            Thread.interrupted();
        }
        verify(handler, never()).perform(any());
        assertTrue(context.getTrace().isEmpty());
    }

    @Test
    public void second_effect_while_one_is_in_flight_is_refused() {
        ProcessContext[] holder = new ProcessContext[1];
        EffectHandler reentrant = new EffectHandler() {
            @Override
            public <R> R perform(Effect<R> effect) {
                holder[0].perform(BlockLookupEffect.hashOnly(2));
                return null;
            }
        };
        holder[0] = new ProcessContext(reentrant);

        assertThrows(IllegalStateException.class, () -> holder[0].perform(BlockLookupEffect.hashOnly(1)));
        // in-flight 标记在失败后释放
        assertThrows(IllegalStateException.class, () -> holder[0].perform(BlockLookupEffect.hashOnly(3)));
        assertEquals(Arrays.asList("eth_getBlockByNumber(1, false)", "eth_getBlockByNumber(3, false)"),
                holder[0].getTrace());
    }

    @Test
    public void handler_abort_propagates_unchanged() {
        EffectHandler handler = mock(EffectHandler.class);
        when(handler.perform(any())).thenThrow(new ProcessAbortedException("driver shutting down"));
        ProcessContext context = new ProcessContext(handler);

        ProcessAbortedException e = assertThrows(ProcessAbortedException.class,
                () -> context.perform(new GenealogyLoadEffect(Collections.emptyList())));
        assertEquals("driver shutting down", e.getMessage());
    }
}
