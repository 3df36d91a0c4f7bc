package com.geonamesfst.annotate;

import com.geonamesfst.query.QueryEngine;
import com.geonamesfst.query.ResultFilter;
import com.geonamesfst.query.SearchResult;
import com.geonamesfst.query.SearchResultWithDistance;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量标注使用的查询方式及其参数。
 */
public sealed interface SearchMode permits SearchMode.Find, SearchMode.StartsWith, SearchMode.Fuzzy,
        SearchMode.Levenshtein {

    /**
     * 对单个文本执行查询，返回已排序（尚未过滤）的结果。
     */
    List<SearchResultWithDistance> search(QueryEngine engine, String text);

    ResultFilter filter();

    /** 精确查询，结果距离恒为 0 */
    record Find(ResultFilter filter) implements SearchMode {
        @Override
        public List<SearchResultWithDistance> search(QueryEngine engine, String text) {
            List<SearchResult> found = engine.find(text);
            List<SearchResultWithDistance> results = new ArrayList<>(found.size());
            for (SearchResult result : found) {
                results.add(result.withDistance(0));
            }
            return results;
        }
    }

    record StartsWith(Integer maxDistance, ResultFilter filter) implements SearchMode {
        @Override
        public List<SearchResultWithDistance> search(QueryEngine engine, String text) {
            return engine.startsWith(text, maxDistance);
        }
    }

    record Fuzzy(Integer maxDistance, ResultFilter filter) implements SearchMode {
        @Override
        public List<SearchResultWithDistance> search(QueryEngine engine, String text) {
            return engine.fuzzy(text, maxDistance);
        }
    }

    record Levenshtein(Integer maxDistance, Integer stateLimit, ResultFilter filter) implements SearchMode {
        @Override
        public List<SearchResultWithDistance> search(QueryEngine engine, String text) {
            return engine.levenshtein(text, maxDistance, stateLimit);
        }
    }
}
