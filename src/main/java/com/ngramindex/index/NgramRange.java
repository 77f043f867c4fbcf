package com.ngramindex.index;

/**
 * 后缀序中以某个 n-gram 开头的连续区间，first 与 last 均为闭区间下标。
 */
public record NgramRange(int first, int last) {
    public NgramRange {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("非法区间: first=" + first + ", last=" + last);
        }
    }

    /**
     * 区间大小，即 n-gram 在语料中的出现次数。
     */
    public int count() {
        return last - first + 1;
    }
}
