package com.ngramindex.index;

import com.ngramindex.config.Constants;

/**
 * n-gram 比较器。
 *
 * 从两个位置起逐个比较符号ID，直到出现不同符号、任一侧耗尽或比较了 limit 个符号。
 * 数组末尾和句子边界 0 都视为耗尽，因此比较结果永远不会跨越句子。
 * 顺序由符号ID决定，而 ID 按首次出现分配，所以这不是字母序。
 */
public final class NgramComparator {
    /** A 先耗尽时的默认返回值：较短者较小 */
    public static final int A_SHORTER = -1;
    /** B 先耗尽时的默认返回值 */
    public static final int B_SHORTER = 1;
    /** 查询时 n-gram 耗尽即视为前缀命中 */
    public static final int PREFIX_MATCH = 0;

    private NgramComparator() {
    }

    /**
     * 使用默认耗尽返回值和 NGRAM_LIMIT 比较两个位置。
     */
    public static int compare(int[] streamA, int lengthA, int posA, int[] streamB, int lengthB, int posB) {
        return compare(streamA, lengthA, posA, streamB, lengthB, posB, A_SHORTER, B_SHORTER, Constants.NGRAM_LIMIT);
    }

    /**
     * 比较 streamA[posA..] 与 streamB[posB..]。
     *
     * @param lengthA streamA 的有效长度（可小于数组容量）
     * @param aExhausted 仅 A 耗尽时的返回值
     * @param bExhausted 仅 B 耗尽时的返回值
     * @param limit 最多比较的符号数，前 limit 个符号相同即返回 0
     * @return 负数、0 或正数；两侧均未耗尽时为两个不同符号ID之差
     */
    public static int compare(int[] streamA, int lengthA, int posA,
                              int[] streamB, int lengthB, int posB,
                              int aExhausted, int bExhausted, int limit) {
        for (int step = 0; step < limit; step++) {
            boolean endOfA = posA >= lengthA || streamA[posA] == Constants.SENTENCE_BOUNDARY;
            boolean endOfB = posB >= lengthB || streamB[posB] == Constants.SENTENCE_BOUNDARY;
            if (endOfA && endOfB) {
                return 0;
            }
            if (endOfA) {
                return aExhausted;
            }
            if (endOfB) {
                return bExhausted;
            }
            int symbolA = streamA[posA];
            int symbolB = streamB[posB];
            if (symbolA != symbolB) {
                return symbolA - symbolB;
            }
            posA++;
            posB++;
        }
        return 0;
    }
}
