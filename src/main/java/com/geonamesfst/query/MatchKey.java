package com.geonamesfst.query;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Comparator;
import java.util.Map;

/**
 * 命中键：命中的检索词及其命名来源。排序只看命名来源。
 *
 * JSON 中命名来源的字段（含 {@code type} 判别字段）与 {@code name} 平铺在同一层。
 */
public record MatchKey(String name, @JsonIgnore MatchType match) implements Comparable<MatchKey> {

    public static final Comparator<MatchKey> ORDER = Comparator.comparing(MatchKey::match);

    private static final ObjectMapper MATCH_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<Map<String, Object>>() {
    };

    // @JsonUnwrapped 不输出多态值的 type 字段，先转成有序 Map 再平铺
    @JsonAnyGetter
    public Map<String, Object> matchFields() {
        return MATCH_MAPPER.convertValue(match, FIELDS);
    }

    @Override
    public int compareTo(MatchKey other) {
        return ORDER.compare(this, other);
    }
}
