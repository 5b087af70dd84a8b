package com.work.genealogy.core.process;

/**
 * 一段可挂起的解析逻辑：只做控制流与数据变换，所有外部数据都通过
 * {@link ProcessContext#perform(Effect)} 获取。
 *
 * <p>一个 process 调用另一个 process（{@link ProcessContext#run(ResolutionProcess)}）时，
 * 二者的挂起点按调用顺序线性排列。</p>
 */
@FunctionalInterface
public interface ResolutionProcess<T> {

    T run(ProcessContext context);
}
