package com.work.genealogy.core.config;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;
import static com.work.genealogy.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可。
 */
public class GenealogyConfig {

    private final StoreFailurePolicy storeFailurePolicy;
    private final ConsistencyPolicy consistencyPolicy;
    private final int candidateBatchSize;

    public GenealogyConfig(StoreFailurePolicy storeFailurePolicy,
                           ConsistencyPolicy consistencyPolicy,
                           int candidateBatchSize) {
        this.storeFailurePolicy = requireNonNull(storeFailurePolicy, "storeFailurePolicy");
        this.consistencyPolicy = requireNonNull(consistencyPolicy, "consistencyPolicy");
        this.candidateBatchSize = requirePositive(candidateBatchSize, "candidateBatchSize");
    }

    public static GenealogyConfig defaultConfig() {
        return new GenealogyConfig(StoreFailurePolicy.PROPAGATE, ConsistencyPolicy.WARN, 5);
    }

    public StoreFailurePolicy getStoreFailurePolicy() {
        return storeFailurePolicy;
    }

    public ConsistencyPolicy getConsistencyPolicy() {
        return consistencyPolicy;
    }

    public int getCandidateBatchSize() {
        return candidateBatchSize;
    }
}
