package com.geonamesfst.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 有界编辑距离（Levenshtein）自动机。
 *
 * 构建时在查询串的码点上预先展开完整的 DFA：状态是编辑距离动态规划表的一行（各值截断到 k+1），
 * 字母表为查询串中出现的不同码点加一个"其他字符"符号，所有值都超过 k 的行视为死状态并剪掉。
 * 展开过程中活状态数一旦超过调用方给定的上限即失败，不会静默截断。
 *
 * 遍历时在 DFA 之上解码 UTF-8：多字节字符的前导字节和后续字节先暂存在状态中，字符完整后才推进 DFA。
 */
public final class LevenshteinAutomaton implements TermAutomaton<LevenshteinAutomaton.State> {
    private static final State DEAD = new State(-1, 0, 0);

    private final String query;
    private final int maxDistance;
    /** 查询串中出现的不同码点，升序 */
    private final int[] alphabet;
    /** transitions[state][symbol]，-1 为死状态；最后一个 symbol 表示字母表之外的字符 */
    private final int[][] transitions;
    private final boolean[] accepting;
    /** 每个 DFA 状态在字符边界上的状态对象，避免遍历时重复分配 */
    private final State[] settled;

    private LevenshteinAutomaton(String query, int maxDistance, int[] alphabet, int[][] transitions,
                                 boolean[] accepting) {
        this.query = query;
        this.maxDistance = maxDistance;
        this.alphabet = alphabet;
        this.transitions = transitions;
        this.accepting = accepting;
        this.settled = new State[transitions.length];
        for (int index = 0; index < settled.length; index++) {
            settled[index] = new State(index, 0, 0);
        }
    }

    /**
     * 构建自动机。
     *
     * @param query 查询串
     * @param maxDistance 最大编辑距离 k
     * @param stateLimit 允许展开的最大状态数
     * @throws StateLimitExceededException 所需状态数超过 stateLimit
     */
    public static LevenshteinAutomaton build(String query, int maxDistance, int stateLimit) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance 不能为负数: " + maxDistance);
        }
        int[] codePoints = query.codePoints().toArray();
        int[] alphabet = Arrays.stream(codePoints).distinct().sorted().toArray();
        int symbolCount = alphabet.length + 1;
        int cap = maxDistance + 1;

        Map<List<Integer>, Integer> stateIds = new HashMap<>();
        List<int[]> rows = new ArrayList<>();
        List<int[]> transitionRows = new ArrayList<>();

        int[] initial = new int[codePoints.length + 1];
        for (int index = 0; index < initial.length; index++) {
            initial[index] = Math.min(index, cap);
        }
        register(initial, stateIds, rows, query, stateLimit);

        for (int state = 0; state < rows.size(); state++) {
            int[] row = rows.get(state);
            int[] next = new int[symbolCount];
            for (int symbol = 0; symbol < symbolCount; symbol++) {
                int codePoint = symbol < alphabet.length ? alphabet[symbol] : -1;
                int[] advanced = advance(row, codePoints, codePoint, cap);
                if (isDead(advanced, maxDistance)) {
                    next[symbol] = -1;
                } else {
                    Integer known = stateIds.get(asKey(advanced));
                    next[symbol] = known != null ? known : register(advanced, stateIds, rows, query, stateLimit);
                }
            }
            transitionRows.add(next);
        }

        boolean[] accepting = new boolean[rows.size()];
        for (int state = 0; state < rows.size(); state++) {
            int[] row = rows.get(state);
            accepting[state] = row[row.length - 1] <= maxDistance;
        }
        return new LevenshteinAutomaton(query, maxDistance, alphabet,
                transitionRows.toArray(new int[0][]), accepting);
    }

    private static int register(int[] row, Map<List<Integer>, Integer> stateIds, List<int[]> rows,
                                String query, int stateLimit) {
        if (rows.size() >= stateLimit) {
            throw new StateLimitExceededException(
                    "Levenshtein 自动机状态数超过上限 " + stateLimit + "，query='" + query + "'", stateLimit);
        }
        int id = rows.size();
        rows.add(row);
        stateIds.put(asKey(row), id);
        return id;
    }

    /**
     * 读入一个字符后计算动态规划表的下一行，各值截断到 cap。
     */
    private static int[] advance(int[] row, int[] query, int codePoint, int cap) {
        int[] next = new int[row.length];
        next[0] = Math.min(row[0] + 1, cap);
        for (int index = 1; index < row.length; index++) {
            int cost = query[index - 1] == codePoint ? 0 : 1;
            int value = Math.min(Math.min(row[index - 1] + cost, row[index] + 1), next[index - 1] + 1);
            next[index] = Math.min(value, cap);
        }
        return next;
    }

    private static boolean isDead(int[] row, int maxDistance) {
        for (int value : row) {
            if (value <= maxDistance) {
                return false;
            }
        }
        return true;
    }

    private static List<Integer> asKey(int[] row) {
        return Arrays.stream(row).boxed().toList();
    }

    public String query() {
        return query;
    }

    public int maxDistance() {
        return maxDistance;
    }

    /**
     * @return 展开后的 DFA 活状态数
     */
    public int stateCount() {
        return transitions.length;
    }

    @Override
    public State start() {
        return settled[0];
    }

    @Override
    public State step(State state, int label) {
        if (state.dfaState() < 0) {
            return DEAD;
        }
        if (state.pendingBytes() == 0) {
            if (label < 0x80) {
                return advance(state.dfaState(), label);
            }
            if ((label & 0xE0) == 0xC0) {
                return new State(state.dfaState(), label & 0x1F, 1);
            }
            if ((label & 0xF0) == 0xE0) {
                return new State(state.dfaState(), label & 0x0F, 2);
            }
            if ((label & 0xF8) == 0xF0) {
                return new State(state.dfaState(), label & 0x07, 3);
            }
            // 非法前导字节，按字母表之外的字符处理
            return advance(state.dfaState(), -1);
        }
        int codePoint = (state.pendingCodePoint() << 6) | (label & 0x3F);
        int remaining = state.pendingBytes() - 1;
        if (remaining == 0) {
            return advance(state.dfaState(), codePoint);
        }
        return new State(state.dfaState(), codePoint, remaining);
    }

    @Override
    public boolean isMatch(State state) {
        return state.dfaState() >= 0 && state.pendingBytes() == 0 && accepting[state.dfaState()];
    }

    @Override
    public boolean canMatch(State state) {
        return state.dfaState() >= 0;
    }

    private State advance(int dfaState, int codePoint) {
        int symbol = codePoint < 0 ? -1 : Arrays.binarySearch(alphabet, codePoint);
        if (symbol < 0) {
            symbol = alphabet.length;
        }
        int next = transitions[dfaState][symbol];
        return next < 0 ? DEAD : settled[next];
    }

    /**
     * 遍历状态：DFA 状态编号，以及尚未读完的多字节字符的部分码点和剩余字节数。
     */
    public record State(int dfaState, int pendingCodePoint, int pendingBytes) {
    }
}
