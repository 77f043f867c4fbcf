package com.ngramindex.index;

import com.ngramindex.config.Constants;
import com.ngramindex.storage.IntArrayFile;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 单个属性的语料流：按语料顺序排列的符号ID，每个句子后追加一个 0。
 */
public final class CorpusStream {
    private final IntArrayList ids;

    public CorpusStream() {
        this.ids = new IntArrayList();
    }

    private CorpusStream(int[] ids) {
        this.ids = IntArrayList.wrap(ids);
    }

    /**
     * 追加一个真实词元的符号ID。
     */
    public void append(int symbolId) {
        if (symbolId <= Constants.SENTENCE_BOUNDARY) {
            throw new IllegalArgumentException("真实词元的符号ID必须大于0: " + symbolId);
        }
        ids.add(symbolId);
    }

    /**
     * 追加句子边界。
     */
    public void appendBoundary() {
        ids.add(Constants.SENTENCE_BOUNDARY);
    }

    public int get(int position) {
        return ids.getInt(position);
    }

    public boolean isBoundary(int position) {
        return ids.getInt(position) == Constants.SENTENCE_BOUNDARY;
    }

    public int size() {
        return ids.size();
    }

    /**
     * 返回底层数组，只有前 size() 个元素有效。调用方不得修改。
     */
    int[] elements() {
        return ids.elements();
    }

    public int[] toIntArray() {
        return ids.toIntArray();
    }

    public void writeTo(Path file) throws IOException {
        IntArrayFile.write(file, ids.elements(), ids.size());
    }

    public static CorpusStream readFrom(Path file) throws IOException {
        return new CorpusStream(IntArrayFile.read(file));
    }
}
