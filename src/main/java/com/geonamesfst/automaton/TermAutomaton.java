package com.geonamesfst.automaton;

/**
 * 按字节驱动的确定性自动机，与索引 FST 同步遍历。
 *
 * 遍历从 {@link #start()} 出发，沿检索词的 UTF-8 字节逐个调用 {@link #step}；
 * 读完整个检索词后状态满足 {@link #isMatch} 即命中。{@link #canMatch} 返回 false 的状态
 * 不可能再到达接受状态，遍历据此剪枝。
 *
 * 实现必须是无状态的（状态全部保存在 S 中），以便多个查询线程共享同一实例。
 *
 * @param <S> 自动机状态类型
 */
public interface TermAutomaton<S> {

    S start();

    /**
     * @param state 当前状态
     * @param label 下一个字节，取值 0-255
     * @return 后继状态
     */
    S step(S state, int label);

    boolean isMatch(S state);

    default boolean canMatch(S state) {
        return true;
    }
}
