package com.work.genealogy.core.support.metrics;

/**
 * 默认 no-op 实现：保证工程在不引入任何 metrics 依赖时仍可运行。
 */
public class NoopGenealogyMetrics implements GenealogyMetrics {
}
