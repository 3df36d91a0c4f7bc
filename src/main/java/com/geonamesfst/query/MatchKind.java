package com.geonamesfst.query;

/**
 * 命名来源类别，声明顺序即排序优先级（NAME 最高）。
 */
public enum MatchKind {
    NAME,
    ASCII_NAME,
    PREFERRED_NAME,
    SHORT_NAME,
    COLLOQUIAL,
    HISTORIC,
    ALTERNATE;

    public int rank() {
        return ordinal();
    }
}
