package com.geonamesfst.index;

import com.geonamesfst.ingest.GazetteerFormatException;
import com.geonamesfst.ingest.TermPair;
import com.geonamesfst.query.MatchType;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.FSTCompiler;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 检索词索引构建器。
 *
 * 1. 按 UTF-8 字节序稳定排序全部检索词对；
 * 2. 单趟扫描：跳过空检索词，与上一个检索词相同则追加到上一分组，否则开启新检索词和新分组；
 * 3. 以检索词序号为值构建 FST（FST 只接受已排序且唯一的输入）。
 */
public final class TermIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TermIndexBuilder.class);
    private static final String SOURCE = "term index";

    private TermIndexBuilder() {
    }

    public static TermIndex build(List<TermPair> pairs) throws IOException {
        logger.info("排序 {} 个检索词对", pairs.size());
        List<EncodedPair> sorted = new ArrayList<>(pairs.size());
        for (TermPair pair : pairs) {
            sorted.add(new EncodedPair(new BytesRef(pair.term()), pair.match()));
        }
        // List.sort 是稳定排序，同一检索词保持导入顺序
        sorted.sort(Comparator.comparing(EncodedPair::bytes));

        logger.info("合并检索词分组");
        List<BytesRef> terms = new ArrayList<>();
        List<List<MatchType>> groups = new ArrayList<>();
        BytesRef lastTerm = null;
        for (EncodedPair pair : sorted) {
            if (pair.bytes().length == 0) {
                continue;
            }
            if (lastTerm != null && lastTerm.bytesEquals(pair.bytes())) {
                groups.get(groups.size() - 1).add(pair.match());
            } else {
                terms.add(pair.bytes());
                List<MatchType> group = new ArrayList<>(1);
                group.add(pair.match());
                groups.add(group);
                lastTerm = pair.bytes();
            }
        }

        logger.info("构建 FST，共 {} 个唯一检索词", terms.size());
        FST<Long> fst = terms.isEmpty() ? null : compile(terms);
        List<List<MatchType>> frozenGroups = new ArrayList<>(groups.size());
        for (List<MatchType> group : groups) {
            frozenGroups.add(List.copyOf(group));
        }
        TermIndex index = new TermIndex(fst, Collections.unmodifiableList(frozenGroups));
        logger.info("FST 构建完成，占用 {} 字节", index.fstBytes());
        return index;
    }

    private static FST<Long> compile(List<BytesRef> terms) throws IOException {
        PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
        FSTCompiler<Long> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).build();
        IntsRefBuilder scratch = new IntsRefBuilder();
        BytesRef previous = null;
        for (int ordinal = 0; ordinal < terms.size(); ordinal++) {
            BytesRef term = terms.get(ordinal);
            if (previous != null && previous.compareTo(term) >= 0) {
                throw new GazetteerFormatException("检索词未严格递增，无法插入 FST: '"
                        + term.utf8ToString() + "' 位于 '" + previous.utf8ToString() + "' 之后", SOURCE, 0);
            }
            try {
                compiler.add(Util.toIntsRef(term, scratch), (long) ordinal);
            } catch (IllegalArgumentException exception) {
                throw new GazetteerFormatException("插入 FST 失败: '" + term.utf8ToString() + "'", SOURCE, 0, exception);
            }
            previous = term;
        }
        return FST.fromFSTReader(compiler.compile(), compiler.getFSTReader());
    }

    private record EncodedPair(BytesRef bytes, MatchType match) {
    }
}
