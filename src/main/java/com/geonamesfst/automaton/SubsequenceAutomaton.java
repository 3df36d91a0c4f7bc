package com.geonamesfst.automaton;

import java.nio.charset.StandardCharsets;

/**
 * 子序列（"fuzzy"）自动机：查询串的字符按顺序（不要求连续）出现在检索词中即命中。
 *
 * 状态为已匹配的查询字节数。多字节字符必须作为连续字节整体匹配，中途失配时回到该字符的起始位置。
 * 任何状态都可能继续匹配，因此不做剪枝。
 */
public final class SubsequenceAutomaton implements TermAutomaton<Integer> {
    private final byte[] query;
    /** 每个字节位置所在字符的起始偏移 */
    private final int[] charStart;

    public SubsequenceAutomaton(String query) {
        this.query = query.getBytes(StandardCharsets.UTF_8);
        this.charStart = new int[this.query.length];
        int currentStart = 0;
        for (int index = 0; index < this.query.length; index++) {
            if ((this.query[index] & 0xC0) != 0x80) {
                currentStart = index;
            }
            charStart[index] = currentStart;
        }
    }

    @Override
    public Integer start() {
        return 0;
    }

    @Override
    public Integer step(Integer state, int label) {
        int matched = state;
        if (matched == query.length) {
            return matched;
        }
        if ((query[matched] & 0xFF) == label) {
            return matched + 1;
        }
        int start = charStart[matched];
        if (start != matched) {
            // 多字节字符中途失配，当前字节可能是同一字符的新起点
            return (query[start] & 0xFF) == label ? start + 1 : start;
        }
        return matched;
    }

    @Override
    public boolean isMatch(Integer state) {
        return state == query.length;
    }
}
