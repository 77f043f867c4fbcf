package com.ngramindex.query;

import java.util.List;

/**
 * n-gram 计数结果。
 *
 * @param query 原始查询文本
 * @param attribute 查询所用属性
 * @param words 可读形式的查询词
 * @param count 出现次数
 * @param first 后缀序区间起点，未命中为 -1
 * @param last 后缀序区间终点，未命中为 -1
 * @param positions 语料流中的起始位置（升序，至多 limit 个）
 * @param elapsedMs 查询用时
 */
public record CountResult(
        String query,
        String attribute,
        List<String> words,
        int count,
        int first,
        int last,
        List<Integer> positions,
        long elapsedMs
) {
    public boolean found() {
        return count > 0;
    }
}
