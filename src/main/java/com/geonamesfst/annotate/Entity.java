package com.geonamesfst.annotate;

/**
 * 待标注的文本片段。
 *
 * @param reference 调用方的引用编号（无符号 32 位），原样回填到标注结果中
 * @param text 用作查询的文本
 */
public record Entity(long reference, String text) {

    public static final long MAX_REFERENCE = 0xFFFF_FFFFL;

    public Entity {
        if (reference < 0 || reference > MAX_REFERENCE) {
            throw new IllegalArgumentException("reference 超出无符号 32 位范围: " + reference);
        }
    }
}
