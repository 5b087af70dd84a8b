package com.work.genealogy.core.exception;

/**
 * artifact network 的区块高度与“同一条链历史”的前提矛盾（仅在 REJECT 策略下抛出）。
 */
public class InconsistentHistoryException extends GenealogyException {

    public InconsistentHistoryException(String message) {
        super(message);
    }
}
