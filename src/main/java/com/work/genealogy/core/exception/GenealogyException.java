package com.work.genealogy.core.exception;

/**
 * 组件内部的统一异常类型，便于宿主侧捕获或转换为 HTTP 错误码。
 */
public class GenealogyException extends RuntimeException {

    public GenealogyException(String message) {
        super(message);
    }

    public GenealogyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试整次解析解决。
     * 默认不可重试；core 本身从不重试，重试策略由驱动方决定。
     */
    public boolean isRetryable() {
        return false;
    }
}
