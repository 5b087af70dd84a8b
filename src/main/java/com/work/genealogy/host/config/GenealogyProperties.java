package com.work.genealogy.host.config;

import com.work.genealogy.core.config.ConsistencyPolicy;
import com.work.genealogy.core.config.StoreFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 族谱解析配置项。
 */
@ConfigurationProperties(prefix = "genealogy")
public class GenealogyProperties {

    private final Store store = new Store();

    private final Resolver resolver = new Resolver();

    public Store getStore() {
        return store;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public static class Store {

        /**
         * mybatis 或 memory
         */
        private String mode = "mybatis";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Resolver {

        /**
         * possible relation 查询失败时：PROPAGATE 终止整次解析，TREAT_AS_NO_RELATION 视为没有关系。
         */
        private StoreFailurePolicy storeFailurePolicy = StoreFailurePolicy.PROPAGATE;

        /**
         * 同一链历史前提的检查力度。
         */
        private ConsistencyPolicy consistencyPolicy = ConsistencyPolicy.WARN;

        /**
         * 每批 possible relation 的最大候选数。
         */
        private int candidateBatchSize = 5;

        public StoreFailurePolicy getStoreFailurePolicy() {
            return storeFailurePolicy;
        }

        public void setStoreFailurePolicy(StoreFailurePolicy storeFailurePolicy) {
            this.storeFailurePolicy = storeFailurePolicy;
        }

        public ConsistencyPolicy getConsistencyPolicy() {
            return consistencyPolicy;
        }

        public void setConsistencyPolicy(ConsistencyPolicy consistencyPolicy) {
            this.consistencyPolicy = consistencyPolicy;
        }

        public int getCandidateBatchSize() {
            return candidateBatchSize;
        }

        public void setCandidateBatchSize(int candidateBatchSize) {
            this.candidateBatchSize = candidateBatchSize;
        }
    }
}
