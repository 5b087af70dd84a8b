package com.work.genealogy.core.exception;

/**
 * 驱动方拒绝恢复一个挂起中的 process（例如线程被中断），整次解析作废。
 */
public class ProcessAbortedException extends GenealogyException {

    public ProcessAbortedException(String message) {
        super(message);
    }

    public ProcessAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
