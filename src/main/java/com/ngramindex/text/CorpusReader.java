package com.ngramindex.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

public interface CorpusReader {

    /**
     * 按语料顺序逐句解析输入，并把每个句子交给 consumer。
     *
     * @return 读取的句子数
     */
    int read(BufferedReader input, Consumer<Sentence> consumer) throws IOException;
}
