package com.geonamesfst.query;

import com.geonamesfst.entry.GeoNamesEntry;

import java.util.Comparator;

/**
 * 带编辑距离的查询结果，排序时距离优先于命名来源。
 */
public record SearchResultWithDistance(MatchKey key, GeoNamesEntry entry, int distance) implements EntryResult {

    public static final Comparator<SearchResultWithDistance> RANKING = Comparator
            .comparingInt(SearchResultWithDistance::distance)
            .thenComparing(SearchResultWithDistance::key);

    public SearchResultWithDistance {
        if (distance < 0) {
            throw new IllegalArgumentException("distance 不能为负数: " + distance);
        }
    }

    public SearchResultWithDistance(String term, MatchType match, GeoNamesEntry entry, int distance) {
        this(new MatchKey(term, match), entry, distance);
    }
}
