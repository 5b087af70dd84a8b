package com.work.genealogy.host.web;

import com.work.genealogy.core.exception.GenealogyException;
import com.work.genealogy.core.exception.GenealogyStoreException;
import com.work.genealogy.core.exception.ProcessAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 组件异常 -> HTTP 状态码：参数/历史不一致/network 不存在=400，存储失败=502，解析被中止=503。
 */
@RestControllerAdvice
public class GenealogyExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GenealogyExceptionHandler.class);

    @ExceptionHandler(GenealogyStoreException.class)
    public ResponseEntity<String> handleStore(GenealogyStoreException e) {
        log.warn("genealogy store failure err={}", e.toString(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(e.getMessage());
    }

    @ExceptionHandler(ProcessAbortedException.class)
    public ResponseEntity<String> handleAborted(ProcessAbortedException e) {
        log.warn("genealogy resolution aborted err={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
    }

    @ExceptionHandler({GenealogyException.class, IllegalArgumentException.class})
    public ResponseEntity<String> handleBadRequest(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }
}
