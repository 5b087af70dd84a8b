package com.work.genealogy.core.process;

import com.work.genealogy.core.exception.ProcessAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 单次解析的运行上下文：把 process 的挂起点串行地交给 {@link EffectHandler}，并记录 effect trace。
 *
 * <p>约束：
 * <ul>
 *   <li>同一上下文内同一时刻最多一个 effect 在执行中，违反即 IllegalStateException；</li>
 *   <li>驱动线程被中断视为驱动方拒绝恢复，抛 ProcessAbortedException；</li>
 *   <li>不提供取消与超时。</li>
 * </ul>
 * 不同解析请求各自持有独立的上下文，互不共享状态。</p>
 */
public class ProcessContext {

    private static final Logger log = LoggerFactory.getLogger(ProcessContext.class);

    private final EffectHandler handler;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final List<String> trace = new ArrayList<>();

    public ProcessContext(EffectHandler handler) {
        this.handler = requireNonNull(handler, "handler");
    }

    /**
     * 挂起当前 process，直到驱动方返回 effect 的结果。
     */
    public <R> R perform(Effect<R> effect) {
        requireNonNull(effect, "effect");
        if (Thread.currentThread().isInterrupted()) {
            throw new ProcessAbortedException("driver interrupted before " + effect.describe());
        }
        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("another effect is still in flight, refusing " + effect.describe());
        }
        try {
            trace.add(effect.describe());
            log.debug("process step={} effect={}", trace.size(), effect.describe());
            return handler.perform(effect);
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * 在当前上下文内运行一个子 process。
     */
    public <T> T run(ResolutionProcess<T> process) {
        return requireNonNull(process, "process").run(this);
    }

    /**
     * 已发出的 effect 描述，按发出顺序排列。
     */
    public List<String> getTrace() {
        return Collections.unmodifiableList(new ArrayList<>(trace));
    }
}
