package com.work.genealogy.core.config;

/**
 * possible relation 查询失败时的处理方式。
 */
public enum StoreFailurePolicy {
    /**
     * 以 GenealogyStoreException 终止整次解析（默认）。
     */
    PROPAGATE,
    /**
     * 记录告警，并把本次查找当作“没有找到关系”结束。
     */
    TREAT_AS_NO_RELATION
}
