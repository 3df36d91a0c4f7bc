package com.geonamesfst.ingest;

import com.geonamesfst.query.MatchType;

/**
 * 导入阶段产出的（检索词，命名来源）对。
 */
public record TermPair(String term, MatchType match) {
}
