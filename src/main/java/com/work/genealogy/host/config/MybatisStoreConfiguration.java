package com.work.genealogy.host.config;

import com.work.genealogy.core.repository.GenealogyRepository;
import com.work.genealogy.core.repository.impl.MybatisGenealogyRepository;
import com.work.genealogy.core.repository.mapper.NetworkGenealogyMapper;
import com.work.genealogy.core.repository.mapper.NetworkMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PostgreSQL 存储装配：genealogy.store.mode=mybatis（默认）时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "genealogy.store", name = "mode", havingValue = "mybatis", matchIfMissing = true)
@MapperScan("com.work.genealogy.core.repository.mapper")
public class MybatisStoreConfiguration {

    @Bean
    public GenealogyRepository mybatisGenealogyRepository(NetworkMapper networkMapper,
                                                          NetworkGenealogyMapper genealogyMapper) {
        return new MybatisGenealogyRepository(networkMapper, genealogyMapper);
    }
}
