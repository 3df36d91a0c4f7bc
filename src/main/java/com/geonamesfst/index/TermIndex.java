package com.geonamesfst.index;

import com.geonamesfst.automaton.TermAutomaton;
import com.geonamesfst.query.MatchType;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.Util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.ObjIntConsumer;

/**
 * 检索词索引：字节序有序、去重的检索词集合（Lucene FST，值为检索词序号）及与序号一一对应的命名来源分组。
 *
 * 构建后不可变，可被任意多个查询线程共享。FST 位于内存中，读取不会真正发生 I/O。
 */
public final class TermIndex {
    private final FST<Long> fst;
    private final List<List<MatchType>> groups;

    TermIndex(FST<Long> fst, List<List<MatchType>> groups) {
        this.fst = fst;
        this.groups = groups;
    }

    /**
     * 精确查找检索词。
     *
     * @return 检索词序号，不存在时返回 -1
     */
    public int lookup(String term) {
        if (fst == null || term.isEmpty()) {
            return -1;
        }
        try {
            Long ordinal = Util.get(fst, new BytesRef(term));
            return ordinal == null ? -1 : ordinal.intValue();
        } catch (IOException exception) {
            throw new UncheckedIOException("读取 FST 失败", exception);
        }
    }

    /**
     * 返回序号对应的命名来源分组（非空，保持导入时的先后顺序）。
     */
    public List<MatchType> group(int ordinal) {
        return groups.get(ordinal);
    }

    public int termCount() {
        return groups.size();
    }

    public long fstBytes() {
        return fst == null ? 0L : fst.ramBytesUsed();
    }

    /**
     * 用自动机与 FST 同步遍历，按字节序回调每个被接受的检索词及其序号。
     *
     * 使用显式栈：每层保存当前出边、进入该节点时的自动机状态和累计输出。
     * 自动机状态 {@link TermAutomaton#canMatch} 为 false 的分支整棵剪掉。
     */
    public <S> void search(TermAutomaton<S> automaton, ObjIntConsumer<String> visitor) {
        if (fst == null) {
            return;
        }
        try {
            walk(automaton, visitor);
        } catch (IOException exception) {
            throw new UncheckedIOException("遍历 FST 失败", exception);
        }
    }

    private <S> void walk(TermAutomaton<S> automaton, ObjIntConsumer<String> visitor) throws IOException {
        S startState = automaton.start();
        if (!automaton.canMatch(startState)) {
            return;
        }
        FST.BytesReader reader = fst.getBytesReader();
        FST.Arc<Long> root = fst.getFirstArc(new FST.Arc<>());
        if (!FST.targetHasArcs(root)) {
            return;
        }

        BytesRefBuilder key = new BytesRefBuilder();
        Deque<Frame<S>> stack = new ArrayDeque<>();
        Frame<S> rootFrame = new Frame<>(startState, root.output(), 0);
        fst.readFirstTargetArc(root, rootFrame.arc, reader);
        stack.push(rootFrame);

        while (!stack.isEmpty()) {
            Frame<S> frame = stack.peek();
            if (frame.fresh) {
                frame.fresh = false;
            } else if (frame.arc.isLast()) {
                stack.pop();
                continue;
            } else {
                fst.readNextArc(frame.arc, reader);
            }

            FST.Arc<Long> arc = frame.arc;
            if (arc.label() == FST.END_LABEL) {
                // 节点本身为终态时的占位边，终态已在父层处理
                continue;
            }
            S next = automaton.step(frame.state, arc.label());
            if (!automaton.canMatch(next)) {
                continue;
            }
            key.setLength(frame.depth);
            key.append((byte) arc.label());
            long output = frame.output + arc.output();
            if (arc.isFinal() && automaton.isMatch(next)) {
                visitor.accept(key.get().utf8ToString(), (int) (output + arc.nextFinalOutput()));
            }
            if (FST.targetHasArcs(arc)) {
                Frame<S> child = new Frame<>(next, output, frame.depth + 1);
                fst.readFirstTargetArc(arc, child.arc, reader);
                stack.push(child);
            }
        }
    }

    private static final class Frame<S> {
        private final FST.Arc<Long> arc = new FST.Arc<>();
        private final S state;
        private final long output;
        private final int depth;
        private boolean fresh = true;

        private Frame(S state, long output, int depth) {
            this.state = state;
            this.output = output;
            this.depth = depth;
        }
    }
}
