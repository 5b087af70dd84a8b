package com.work.genealogy.core.process;

/**
 * 驱动方：执行 effect 并把结果交还给挂起中的 process。
 *
 * <p>实现可以是同步调用，也可以在内部等待异步/远程结果；但对同一个 process 而言，
 * 每次只会有一个 effect 在执行中。拒绝恢复时抛出
 * {@link com.work.genealogy.core.exception.ProcessAbortedException}。</p>
 */
public interface EffectHandler {

    <R> R perform(Effect<R> effect);
}
