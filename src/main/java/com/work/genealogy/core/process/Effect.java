package com.work.genealogy.core.process;

/**
 * process 在挂起点向驱动方发出的请求描述；驱动方执行后以 {@code R} 恢复 process。
 *
 * <p>effect 本身不做任何 I/O，只描述“要什么”。</p>
 *
 * @param <R> 驱动方恢复 process 时提供的结果类型
 */
public interface Effect<R> {

    R accept(EffectVisitor visitor);

    /**
     * 便于日志/trace 的单行描述。
     */
    String describe();
}
