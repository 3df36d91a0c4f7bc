package com.geonamesfst.query;

import com.geonamesfst.entry.GeoNamesEntry;

/**
 * 携带地名记录的查询结果，供属性过滤使用。
 */
public interface EntryResult {

    MatchKey key();

    GeoNamesEntry entry();
}
