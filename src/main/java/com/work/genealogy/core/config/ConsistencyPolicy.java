package com.work.genealogy.core.config;

/**
 * 对“所有 artifact network 属于同一条链历史”这一前提的检查力度。
 */
public enum ConsistencyPolicy {
    IGNORE,
    WARN,
    REJECT
}
