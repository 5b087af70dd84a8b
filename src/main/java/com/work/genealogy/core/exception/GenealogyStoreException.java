package com.work.genealogy.core.exception;

/**
 * 存储侧查询/写入失败（possibleAncestors / possibleDescendants / load）。
 */
public class GenealogyStoreException extends GenealogyException {

    public GenealogyStoreException(String message) {
        super(message);
    }

    public GenealogyStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
