package com.geonamesfst.automaton;

import java.nio.charset.StandardCharsets;

/**
 * 前缀自动机：接受所有以查询串开头的检索词。
 *
 * 状态为已匹配的查询字节数，-1 表示失配；匹配完整个查询后保持接受。
 */
public final class PrefixAutomaton implements TermAutomaton<Integer> {
    private static final Integer FAILED = -1;

    private final byte[] prefix;

    public PrefixAutomaton(String prefix) {
        this.prefix = prefix.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Integer start() {
        return 0;
    }

    @Override
    public Integer step(Integer state, int label) {
        int matched = state;
        if (matched < 0) {
            return FAILED;
        }
        if (matched == prefix.length) {
            return matched;
        }
        return (prefix[matched] & 0xFF) == label ? matched + 1 : FAILED;
    }

    @Override
    public boolean isMatch(Integer state) {
        return state == prefix.length;
    }

    @Override
    public boolean canMatch(Integer state) {
        return state >= 0;
    }
}
