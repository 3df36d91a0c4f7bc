package com.geonamesfst.annotate;

import java.util.Locale;

/**
 * 每个实体保留的结果数量。
 */
public enum ResultSelection {
    /** 只保留排名第一的结果 */
    FIRST,
    /** 保留全部结果 */
    ALL;

    public static ResultSelection parse(String value) {
        if (value == null || value.isBlank()) {
            return FIRST;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
