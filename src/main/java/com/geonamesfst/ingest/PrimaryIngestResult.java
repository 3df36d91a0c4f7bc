package com.geonamesfst.ingest;

import com.geonamesfst.entry.EntryStore;

import java.util.List;

/**
 * 主数据导入结果：检索词对与记录库。
 */
public record PrimaryIngestResult(List<TermPair> pairs, EntryStore entryStore) {
}
