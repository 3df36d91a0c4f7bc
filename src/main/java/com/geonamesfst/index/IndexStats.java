package com.geonamesfst.index;

/**
 * 索引统计信息。
 *
 * @param recordCount 记录数
 * @param pairCount 导入的检索词对数量（含空检索词）
 * @param termCount 唯一检索词数量
 * @param fstBytes FST 占用字节数
 */
public record IndexStats(int recordCount, int pairCount, int termCount, long fstBytes) {
}
