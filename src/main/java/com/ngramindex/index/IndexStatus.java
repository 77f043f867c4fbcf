package com.ngramindex.index;

import java.util.List;

/**
 * 索引统计信息。
 *
 * @param corpusSize 真实词元数，不含句子边界
 * @param sentenceCount 句子数
 * @param attributes 配置的简单属性
 * @param residentAttributes 已在内存中的属性（含复合属性）
 * @param indexSizeBytes 磁盘上索引文件总字节数
 */
public record IndexStatus(
    long corpusSize,
    long sentenceCount,
    List<String> attributes,
    List<String> residentAttributes,
    long indexSizeBytes
) {
}
