package com.geonamesfst.query;

import com.geonamesfst.entry.GeoNamesEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 按记录属性过滤结果。为 null 的字段不参与过滤，多个字段之间为 AND 关系，精确字符串比较。
 */
public record ResultFilter(String featureClass, String featureCode, String countryCode) {

    public static final ResultFilter NONE = new ResultFilter(null, null, null);

    public boolean isEmpty() {
        return featureClass == null && featureCode == null && countryCode == null;
    }

    public boolean accepts(GeoNamesEntry entry) {
        return (featureClass == null || featureClass.equals(entry.featureClass()))
                && (featureCode == null || featureCode.equals(entry.featureCode()))
                && (countryCode == null || countryCode.equals(entry.countryCode()));
    }

    /**
     * 过滤结果列表，保持幸存元素的相对顺序。filter 为 null 时原样返回。
     */
    public static <T extends EntryResult> List<T> apply(List<T> results, ResultFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return results;
        }
        List<T> filtered = new ArrayList<>(results.size());
        for (T result : results) {
            if (filter.accepts(result.entry())) {
                filtered.add(result);
            }
        }
        return filtered;
    }
}
