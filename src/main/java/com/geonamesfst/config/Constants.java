package com.geonamesfst.config;

import java.util.Set;

/**
 * 全局常量定义
 * 
 * 包含数据源列号、缺省值哨兵、查询默认参数和输入限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 缺省值 ====================
    /** 主数据缺少 feature class / feature code / country code 列时使用的哨兵值 */
    public static final String MISSING_VALUE = "<missing>";
    /** 备选名标志位取值为真时的字面量 */
    public static final String FLAG_TRUE = "1";

    // ==================== GeoNames 主数据列 ====================
    public static final int GN_COL_ID = 0;
    public static final int GN_COL_NAME = 1;
    public static final int GN_COL_ASCII_NAME = 2;
    public static final int GN_COL_LATITUDE = 4;
    public static final int GN_COL_LONGITUDE = 5;
    public static final int GN_COL_FEATURE_CLASS = 6;
    public static final int GN_COL_FEATURE_CODE = 7;
    public static final int GN_COL_COUNTRY_CODE = 8;
    /** 四级行政区划起始列（10-13） */
    public static final int GN_COL_ADMIN_FIRST = 10;
    public static final int GN_COL_ELEVATION = 15;

    // ==================== alternateNames 列 ====================
    public static final int ALT_COL_ID = 1;
    public static final int ALT_COL_LANGUAGE = 2;
    public static final int ALT_COL_NAME = 3;
    public static final int ALT_COL_PREFERRED = 4;
    public static final int ALT_COL_SHORT = 5;
    public static final int ALT_COL_COLLOQUIAL = 6;
    public static final int ALT_COL_HISTORIC = 7;
    public static final int ALT_COL_FROM = 8;
    public static final int ALT_COL_TO = 9;

    // ==================== 查询参数 ====================
    /** Levenshtein 查询未指定距离时的默认最大编辑距离 */
    public static final int DEFAULT_MAX_DISTANCE = 1;
    /** Levenshtein 自动机默认状态数上限 */
    public static final int DEFAULT_STATE_LIMIT = 10_000;
    /** 命令行默认保留的备选名语言（空语言码、de、ger） */
    public static final Set<String> DEFAULT_ALTERNATE_LANGUAGES = Set.of("", "de", "ger");

    // ==================== 命令行限制 ====================
    /** 单次输出结果数量上限 */
    public static final int MAX_RESULT_LIMIT = 10_000;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 512;
}
