package com.geonamesfst.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Comparator;

/**
 * 一个检索词命中某条记录的原因（命名来源），按类别携带各自的附加信息。
 *
 * 排序规则：先按类别优先级升序，再按记录标识升序。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MatchType.Name.class, name = "Name"),
        @JsonSubTypes.Type(value = MatchType.AsciiName.class, name = "AsciiName"),
        @JsonSubTypes.Type(value = MatchType.PreferredName.class, name = "PreferredName"),
        @JsonSubTypes.Type(value = MatchType.ShortName.class, name = "ShortName"),
        @JsonSubTypes.Type(value = MatchType.Colloquial.class, name = "Colloquial"),
        @JsonSubTypes.Type(value = MatchType.Historic.class, name = "Historic"),
        @JsonSubTypes.Type(value = MatchType.Alternate.class, name = "Alternate")
})
public sealed interface MatchType extends Comparable<MatchType> permits MatchType.Name, MatchType.AsciiName,
        MatchType.PreferredName, MatchType.ShortName, MatchType.Colloquial,
        MatchType.Historic, MatchType.Alternate {

    Comparator<MatchType> ORDER = Comparator
            .comparingInt((MatchType matchType) -> matchType.kind().rank())
            .thenComparingLong(MatchType::id);

    /** 所属记录标识 */
    long id();

    MatchKind kind();

    @Override
    default int compareTo(MatchType other) {
        return ORDER.compare(this, other);
    }

    /** GeoNames 主名称 */
    record Name(long id) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.NAME;
        }
    }

    /** 主名称的 ASCII 形式 */
    record AsciiName(long id) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.ASCII_NAME;
        }
    }

    /** 某语言下的首选名称 */
    record PreferredName(long id, String lang) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.PREFERRED_NAME;
        }
    }

    /** 某语言下的简称 */
    record ShortName(long id, String lang) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.SHORT_NAME;
        }
    }

    /** 口语名或俗称 */
    record Colloquial(long id, String lang) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.COLLOQUIAL;
        }
    }

    /** 历史名称，from/to 为数据源给出的有效期，缺失时为空字符串 */
    record Historic(long id, String lang, String from, String to) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.HISTORIC;
        }
    }

    /** 其他备选名称（无法归入以上类别的标志组合） */
    record Alternate(long id, String lang) implements MatchType {
        @Override
        public MatchKind kind() {
            return MatchKind.ALTERNATE;
        }
    }
}
