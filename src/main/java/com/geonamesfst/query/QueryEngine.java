package com.geonamesfst.query;

import com.geonamesfst.automaton.LevenshteinAutomaton;
import com.geonamesfst.automaton.PrefixAutomaton;
import com.geonamesfst.automaton.RegexAutomaton;
import com.geonamesfst.automaton.SubsequenceAutomaton;
import com.geonamesfst.automaton.TermAutomaton;
import com.geonamesfst.config.Constants;
import com.geonamesfst.config.EngineConfig;
import com.geonamesfst.entry.EntryStore;
import com.geonamesfst.entry.GeoNamesEntry;
import com.geonamesfst.index.IndexStats;
import com.geonamesfst.index.TermIndex;
import com.geonamesfst.index.TermIndexBuilder;
import com.geonamesfst.ingest.AlternateNamesParser;
import com.geonamesfst.ingest.GeoNamesParser;
import com.geonamesfst.ingest.PrimaryIngestResult;
import com.geonamesfst.ingest.TermPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 地名查询引擎：持有检索词索引与记录表，提供精确、前缀、子序列、编辑距离和正则五种查询。
 *
 * 构建完成后只读，可在多个线程间共享。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final EntryStore entryStore;
    private final TermIndex termIndex;
    private final int pairCount;
    private final int defaultMaxDistance;
    private final int defaultStateLimit;

    /**
     * 使用默认查询参数构造查询引擎。
     */
    public QueryEngine(EntryStore entryStore, TermIndex termIndex, int pairCount) {
        this(entryStore, termIndex, pairCount, EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入默认编辑距离和状态上限。
     */
    public QueryEngine(EntryStore entryStore, TermIndex termIndex, int pairCount, EngineConfig config) {
        this.entryStore = entryStore;
        this.termIndex = termIndex;
        this.pairCount = pairCount;
        this.defaultMaxDistance = config.getDefaultMaxDistance();
        this.defaultStateLimit = config.getDefaultStateLimit();
    }

    /**
     * 从配置中的数据文件构建索引：导入主数据、导入备选名、排序合并并构建 FST。
     */
    public static QueryEngine build(EngineConfig config) throws IOException {
        long startNanos = System.nanoTime();
        PrimaryIngestResult primary = GeoNamesParser.ingest(config.getGeonamesPaths());
        List<TermPair> pairs = new ArrayList<>(primary.pairs());
        pairs.addAll(AlternateNamesParser.ingest(config.getAlternatePaths(), primary.entryStore(), config.getLanguages()));
        TermIndex termIndex = TermIndexBuilder.build(pairs);
        QueryEngine engine = new QueryEngine(primary.entryStore(), termIndex, pairs.size(), config);
        logger.info("索引构建完成: 记录 {} 条, 检索词 {} 个, 耗时 {}ms",
                primary.entryStore().size(), termIndex.termCount(), (System.nanoTime() - startNanos) / 1_000_000);
        return engine;
    }

    /**
     * @param languages 允许的备选名语言，为 null 时接受所有语言
     */
    public static QueryEngine build(List<Path> geonamesPaths, List<Path> alternatePaths, Set<String> languages)
            throws IOException {
        EngineConfig config = EngineConfig.defaults();
        config.setGeonamesPaths(geonamesPaths);
        config.setAlternatePaths(alternatePaths);
        config.setLanguages(languages);
        return build(config);
    }

    /**
     * 精确查询：返回该检索词分组内全部命名来源，按导入顺序展开。
     */
    public List<SearchResult> find(String term) {
        validate(term);
        int ordinal = termIndex.lookup(term);
        List<SearchResult> results = new ArrayList<>();
        if (ordinal >= 0) {
            expand(term, ordinal, results);
        }
        logger.debug("find '{}' 命中 {} 条", term, results.size());
        return results;
    }

    /**
     * 正则查询。非法表达式抛出 {@link InvalidQueryException}，过于复杂的表达式抛出
     * {@link com.geonamesfst.automaton.StateLimitExceededException}。
     */
    public List<SearchResult> regex(String pattern) {
        validate(pattern);
        RegexAutomaton automaton;
        try {
            automaton = RegexAutomaton.compile(pattern);
        } catch (IllegalArgumentException exception) {
            throw new InvalidQueryException("Invalid regex: " + exception.getMessage(), pattern, exception);
        }
        return search(automaton);
    }

    public List<SearchResultWithDistance> startsWith(String query, Integer maxDistance) {
        validate(query);
        return searchWithDistance(new PrefixAutomaton(query), query, maxDistance);
    }

    public List<SearchResultWithDistance> fuzzy(String query, Integer maxDistance) {
        validate(query);
        return searchWithDistance(new SubsequenceAutomaton(query), query, maxDistance);
    }

    /**
     * 编辑距离查询。maxDistance 为 null 时使用默认距离构建自动机，结果过滤仍按调用方传入的值。
     */
    public List<SearchResultWithDistance> levenshtein(String query, Integer maxDistance, Integer stateLimit) {
        validate(query);
        validateDistance(query, maxDistance);
        int distance = maxDistance == null ? defaultMaxDistance : maxDistance;
        int limit = stateLimit == null ? defaultStateLimit : stateLimit;
        LevenshteinAutomaton automaton = LevenshteinAutomaton.build(query, distance, limit);
        logger.debug("Levenshtein 自动机 '{}' (k={}) 共 {} 个状态", query, distance, automaton.stateCount());
        return searchWithDistance(automaton, query, maxDistance);
    }

    /**
     * 通用自动机遍历，结果按命中键排序。
     */
    public <S> List<SearchResult> search(TermAutomaton<S> automaton) {
        long startNanos = System.nanoTime();
        List<SearchResult> results = new ArrayList<>();
        termIndex.search(automaton, (term, ordinal) -> expand(term, ordinal, results));
        results.sort(SearchResult.RANKING);
        logger.debug("自动机遍历命中 {} 条, 耗时 {}ms", results.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return results;
    }

    /**
     * 通用自动机遍历并计算与原始查询的编辑距离。maxDistance 为 null 或 0 时不按距离过滤，为负数时抛出
     * {@link InvalidQueryException}；结果按距离优先、命中键其次排序。
     */
    public <S> List<SearchResultWithDistance> searchWithDistance(TermAutomaton<S> automaton, String rawQuery,
                                                                 Integer maxDistance) {
        validateDistance(rawQuery, maxDistance);
        long startNanos = System.nanoTime();
        boolean filterByDistance = maxDistance != null && maxDistance != 0;
        List<SearchResultWithDistance> results = new ArrayList<>();
        List<SearchResult> expanded = new ArrayList<>();
        termIndex.search(automaton, (term, ordinal) -> {
            int distance = EditDistance.levenshtein(rawQuery, term);
            if (filterByDistance && distance > maxDistance) {
                return;
            }
            expanded.clear();
            expand(term, ordinal, expanded);
            for (SearchResult result : expanded) {
                results.add(result.withDistance(distance));
            }
        });
        results.sort(SearchResultWithDistance.RANKING);
        logger.debug("自动机遍历（含距离）命中 {} 条, 耗时 {}ms",
                results.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return results;
    }

    public IndexStats stats() {
        return new IndexStats(entryStore.size(), pairCount, termIndex.termCount(), termIndex.fstBytes());
    }

    public EntryStore getEntryStore() {
        return entryStore;
    }

    private void expand(String term, int ordinal, List<SearchResult> results) {
        for (MatchType match : termIndex.group(ordinal)) {
            GeoNamesEntry entry = entryStore.get(match.id())
                    .orElseThrow(() -> new IllegalStateException("检索词 '" + term + "' 指向不存在的记录: " + match.id()));
            results.add(new SearchResult(term, match, entry));
        }
    }

    private static void validateDistance(String query, Integer maxDistance) {
        if (maxDistance != null && maxDistance < 0) {
            throw new InvalidQueryException("max distance 不能为负数: " + maxDistance, query);
        }
    }

    private static void validate(String query) {
        if (query == null || query.isEmpty()) {
            throw InvalidQueryException.emptyQuery();
        }
        if (query.codePointCount(0, query.length()) > Constants.MAX_QUERY_LENGTH) {
            throw new InvalidQueryException("Query too long (max " + Constants.MAX_QUERY_LENGTH + " characters)", query);
        }
    }
}
