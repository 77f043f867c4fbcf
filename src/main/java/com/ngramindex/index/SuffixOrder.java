package com.ngramindex.index;

import com.ngramindex.config.Constants;
import com.ngramindex.storage.IntArrayFile;
import it.unimi.dsi.fastutil.ints.IntArrays;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Optional;

/**
 * 后缀序：语料流全部位置的一个排列，按各位置起始的 n-gram 升序排列。
 *
 * 排序只比较前 NGRAM_LIMIT 个符号，前 NGRAM_LIMIT 个符号相同的后缀视为相等，相互之间顺序不定。
 * 因此长于 NGRAM_LIMIT 的 n-gram 查询结果不可靠。构建完成后只读。
 */
public final class SuffixOrder {
    private final int[] positions;

    private SuffixOrder(int[] positions) {
        this.positions = positions;
    }

    /**
     * 对语料流的全部位置排序。
     */
    public static SuffixOrder build(CorpusStream stream) {
        int length = stream.size();
        int[] corpus = stream.elements();
        int[] order = new int[length];
        for (int position = 0; position < length; position++) {
            order[position] = position;
        }
        IntArrays.quickSort(order, (left, right) ->
            NgramComparator.compare(corpus, length, left, corpus, length, right));
        return new SuffixOrder(order);
    }

    public int size() {
        return positions.length;
    }

    /**
     * 排名为 rank 的后缀在语料流中的起始位置。
     */
    public int positionAt(int rank) {
        return positions[rank];
    }

    public int[] toIntArray() {
        return Arrays.copyOf(positions, positions.length);
    }

    /**
     * 在整个后缀序中查找以 ngram 开头的区间。
     */
    public Optional<NgramRange> findRange(CorpusStream stream, int[] ngram) {
        if (positions.length == 0) {
            return Optional.empty();
        }
        return findRange(stream, ngram, 0, positions.length - 1);
    }

    /**
     * 在后缀序的 [min, max] 闭区间内查找以 ngram 开头的区间。
     *
     * @return 命中区间；没有后缀以 ngram 开头时为空
     */
    public Optional<NgramRange> findRange(CorpusStream stream, int[] ngram, int min, int max) {
        if (min < 0 || max >= positions.length || min > max) {
            throw new IllegalArgumentException("搜索范围非法: min=" + min + ", max=" + max + ", size=" + positions.length);
        }
        int first = leastSatisfying(stream, ngram, min, max, false);
        if (first < 0) {
            return Optional.empty();
        }
        int last = leastSatisfying(stream, ngram, min, max, true);
        last = last < 0 ? max : last - 1;
        if (first > last) {
            return Optional.empty();
        }
        return Optional.of(new NgramRange(first, last));
    }

    /**
     * 二分查找满足 suffix >= ngram（strict 时为 suffix > ngram）的最小排名，不存在时返回 -1。
     */
    private int leastSatisfying(CorpusStream stream, int[] ngram, int first, int last, boolean strict) {
        int[] corpus = stream.elements();
        int length = stream.size();
        int low = first;
        int high = last + 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            int comparison = NgramComparator.compare(corpus, length, positions[mid], ngram, ngram.length, 0,
                NgramComparator.A_SHORTER, NgramComparator.PREFIX_MATCH, Constants.NGRAM_LIMIT);
            boolean satisfies = strict ? comparison > 0 : comparison >= 0;
            if (satisfies) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low > last ? -1 : low;
    }

    public void writeTo(Path file) throws IOException {
        IntArrayFile.write(file, positions, positions.length);
    }

    /**
     * 读取后缀序文件并校验其为 [0, corpusLength) 的排列。
     *
     * @throws IOException 长度不符或不是排列
     */
    public static SuffixOrder readFrom(Path file, int corpusLength) throws IOException {
        int[] positions = IntArrayFile.read(file);
        if (positions.length != corpusLength) {
            throw new IOException("后缀序长度与语料流不一致: suffix=" + positions.length
                + ", corpus=" + corpusLength + ", file=" + file);
        }
        BitSet seen = new BitSet(corpusLength);
        for (int rank = 0; rank < positions.length; rank++) {
            int position = positions[rank];
            if (position >= corpusLength || seen.get(position)) {
                throw new IOException("后缀序不是合法排列: rank=" + rank + ", position=" + position + ", file=" + file);
            }
            seen.set(position);
        }
        return new SuffixOrder(positions);
    }
}
