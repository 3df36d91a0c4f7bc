package com.geonamesfst.automaton;

import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.ByteRunAutomaton;
import org.apache.lucene.util.automaton.Operations;
import org.apache.lucene.util.automaton.RegExp;
import org.apache.lucene.util.automaton.TooComplexToDeterminizeException;

import java.util.ArrayList;
import java.util.List;

/**
 * 正则表达式自动机，查询前一次性编译为 UTF-8 字节级 DFA。
 *
 * 使用 Lucene {@link RegExp} 的基础语法。匹配总是延伸到检索词末尾；顶层分支以 {@code ^} 开头时从检索词开头匹配，
 * 否则可以从任意位置开始。分支结尾的 {@code $} 可写可不写。
 */
public final class RegexAutomaton implements TermAutomaton<Integer> {
    private static final Integer DEAD = -1;

    private final String pattern;
    private final ByteRunAutomaton runAutomaton;
    private final Integer startState;

    private RegexAutomaton(String pattern, ByteRunAutomaton runAutomaton) {
        this.pattern = pattern;
        this.runAutomaton = runAutomaton;
        // RunAutomaton 的初始状态固定为 0
        this.startState = 0;
    }

    /**
     * 编译正则表达式。
     *
     * 锚点按顶层分支各自处理：分支以 {@code ^} 开头时该分支从检索词开头匹配，分支结尾的 {@code $} 被忽略。
     * 其他位置出现的未转义锚点视为语法错误。
     *
     * @throws IllegalArgumentException 表达式语法错误
     * @throws StateLimitExceededException 表达式过于复杂，无法确定化
     */
    public static RegexAutomaton compile(String pattern) {
        List<String> alternatives = splitAlternatives(pattern);
        StringBuilder effective = new StringBuilder();
        for (String alternative : alternatives) {
            if (effective.length() > 0) {
                effective.append('|');
            }
            effective.append(anchor(alternative, pattern));
        }
        try {
            Automaton automaton = new RegExp(effective.toString(), RegExp.NONE).toAutomaton();
            return new RegexAutomaton(pattern, new ByteRunAutomaton(automaton));
        } catch (TooComplexToDeterminizeException exception) {
            throw new StateLimitExceededException("正则表达式过于复杂: " + pattern,
                    Operations.DEFAULT_DETERMINIZE_WORK_LIMIT, exception);
        }
    }

    private static String anchor(String alternative, String pattern) {
        boolean anchoredStart = alternative.startsWith("^");
        String body = anchoredStart ? alternative.substring(1) : alternative;
        if (endsWithUnescapedDollar(body)) {
            body = body.substring(0, body.length() - 1);
        }
        int stray = findAnchor(body);
        if (stray >= 0) {
            throw new IllegalArgumentException("anchor '" + body.charAt(stray)
                    + "' is only allowed at the start or end of a top-level alternative: " + pattern);
        }
        return (anchoredStart ? "" : ".*") + "(" + body + ")";
    }

    /**
     * 按括号外、字符类外、引号外的 {@code |} 切分顶层分支。
     */
    static List<String> splitAlternatives(String pattern) {
        List<String> alternatives = new ArrayList<>();
        int depth = 0;
        int begin = 0;
        PatternCursor cursor = new PatternCursor(pattern);
        while (cursor.next()) {
            char ch = pattern.charAt(cursor.position);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == '|' && depth == 0) {
                alternatives.add(pattern.substring(begin, cursor.position));
                begin = cursor.position + 1;
            }
        }
        alternatives.add(pattern.substring(begin));
        return alternatives;
    }

    private static int findAnchor(String body) {
        PatternCursor cursor = new PatternCursor(body);
        while (cursor.next()) {
            char ch = body.charAt(cursor.position);
            if (ch == '^' || ch == '$') {
                return cursor.position;
            }
        }
        return -1;
    }

    private static boolean endsWithUnescapedDollar(String body) {
        if (!body.endsWith("$")) {
            return false;
        }
        int backslashes = 0;
        for (int i = body.length() - 2; i >= 0 && body.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 0;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public Integer start() {
        return startState;
    }

    @Override
    public Integer step(Integer state, int label) {
        if (state < 0) {
            return DEAD;
        }
        return runAutomaton.step(state, label);
    }

    @Override
    public boolean isMatch(Integer state) {
        return state >= 0 && runAutomaton.isAccept(state);
    }

    @Override
    public boolean canMatch(Integer state) {
        return state >= 0;
    }

    /**
     * 逐个给出处于"结构位置"的字符：跳过转义字符、字符类 {@code [...]} 内部和引号串 {@code "..."} 内部。
     */
    private static final class PatternCursor {
        private final String text;
        private int position = -1;

        private PatternCursor(String text) {
            this.text = text;
        }

        private boolean next() {
            int i = position + 1;
            while (i < text.length()) {
                char ch = text.charAt(i);
                if (ch == '\\') {
                    i += 2;
                } else if (ch == '[') {
                    i = skipClass(i);
                } else if (ch == '"') {
                    int close = text.indexOf('"', i + 1);
                    i = close < 0 ? text.length() : close + 1;
                } else {
                    position = i;
                    return true;
                }
            }
            position = text.length();
            return false;
        }

        private int skipClass(int open) {
            int i = open + 1;
            if (i < text.length() && text.charAt(i) == '^') {
                i++;
            }
            while (i < text.length()) {
                char ch = text.charAt(i);
                if (ch == '\\') {
                    i += 2;
                } else if (ch == ']') {
                    return i + 1;
                } else {
                    i++;
                }
            }
            return text.length();
        }
    }
}
