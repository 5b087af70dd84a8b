package com.work.genealogy.host.config;

import com.work.genealogy.core.chain.ChainBlockClient;
import com.work.genealogy.host.chain.web3j.Web3jChainBlockClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public ChainBlockClient web3jChainBlockClient(Web3j web3j) {
        return new Web3jChainBlockClient(web3j);
    }
}
