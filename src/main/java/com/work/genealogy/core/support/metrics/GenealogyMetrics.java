package com.work.genealogy.core.support.metrics;

import com.work.genealogy.core.model.RelationDirection;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可通过自定义 Bean 接入具体实现。
 */
public interface GenealogyMetrics {

    /**
     * @param result found / not_found / store_error
     */
    default void relationSearch(RelationDirection direction, String result) {
    }

    /**
     * @param result confirmed / mismatch / absent / error
     */
    default void candidateCheck(String result) {
    }

    default void genealogiesLoaded(int count) {
    }
}
