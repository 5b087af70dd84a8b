package com.work.genealogy.host.config;

import com.work.genealogy.core.chain.ChainBlockClient;
import com.work.genealogy.core.collect.GenealogyCollector;
import com.work.genealogy.core.config.GenealogyConfig;
import com.work.genealogy.core.process.PortEffectHandler;
import com.work.genealogy.core.relation.RelationFinder;
import com.work.genealogy.core.repository.GenealogyRepository;
import com.work.genealogy.core.resolve.NetworkGenealogyResolver;
import com.work.genealogy.core.support.InMemoryGenealogyRepository;
import com.work.genealogy.core.support.metrics.GenealogyMetrics;
import com.work.genealogy.core.support.metrics.NoopGenealogyMetrics;
import com.work.genealogy.host.chain.MockChainBlockClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将核心组件装配为 Spring Bean。core 包本身不依赖 Spring。
 */
@Configuration
@EnableConfigurationProperties({GenealogyProperties.class, ChainProperties.class})
public class GenealogyConfiguration {

    @Bean
    public GenealogyConfig genealogyConfig(GenealogyProperties properties) {
        GenealogyProperties.Resolver resolver = properties.getResolver();
        return new GenealogyConfig(
                resolver.getStoreFailurePolicy(),
                resolver.getConsistencyPolicy(),
                resolver.getCandidateBatchSize()
        );
    }

    @Bean
    @ConditionalOnMissingBean(GenealogyMetrics.class)
    public GenealogyMetrics genealogyMetrics() {
        return new NoopGenealogyMetrics();
    }

    @Bean
    public GenealogyCollector genealogyCollector(GenealogyConfig config) {
        return new GenealogyCollector(config.getConsistencyPolicy());
    }

    @Bean
    public RelationFinder relationFinder(GenealogyConfig config, GenealogyMetrics metrics) {
        return new RelationFinder(config, metrics);
    }

    @Bean
    public NetworkGenealogyResolver networkGenealogyResolver(GenealogyCollector collector,
                                                             RelationFinder relationFinder,
                                                             GenealogyMetrics metrics) {
        return new NetworkGenealogyResolver(collector, relationFinder, metrics);
    }

    /**
     * 默认使用 mock 链；chain.mode=web3j 时由 Web3jConfiguration 提供实现。
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public ChainBlockClient mockChainBlockClient(ChainProperties properties) {
        return new MockChainBlockClient(properties.getMockSeed(), properties.getMockHeadHeight());
    }

    @Bean
    @ConditionalOnProperty(prefix = "genealogy.store", name = "mode", havingValue = "memory")
    public GenealogyRepository inMemoryGenealogyRepository() {
        return new InMemoryGenealogyRepository();
    }

    @Bean
    public PortEffectHandler portEffectHandler(GenealogyRepository repository, ChainBlockClient chainBlockClient) {
        return new PortEffectHandler(repository, chainBlockClient);
    }
}
