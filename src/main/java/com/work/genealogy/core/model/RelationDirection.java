package com.work.genealogy.core.model;

/**
 * 查找方向：向更早的 network（ANCESTOR）或更晚的 network（DESCENDANT）。
 */
public enum RelationDirection {
    ANCESTOR("possibleAncestors"),
    DESCENDANT("possibleDescendants");

    private final String queryName;

    RelationDirection(String queryName) {
        this.queryName = queryName;
    }

    /**
     * 存储侧对应的查询名。
     */
    public String getQueryName() {
        return queryName;
    }
}
