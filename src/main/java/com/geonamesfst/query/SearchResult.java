package com.geonamesfst.query;

import com.geonamesfst.entry.GeoNamesEntry;

import java.util.Comparator;

public record SearchResult(MatchKey key, GeoNamesEntry entry) implements EntryResult {

    public static final Comparator<SearchResult> RANKING = Comparator.comparing(SearchResult::key);

    public SearchResult(String term, MatchType match, GeoNamesEntry entry) {
        this(new MatchKey(term, match), entry);
    }

    /**
     * 转换为带距离的结果，精确命中的距离为 0。
     */
    public SearchResultWithDistance withDistance(int distance) {
        return new SearchResultWithDistance(key, entry, distance);
    }
}
