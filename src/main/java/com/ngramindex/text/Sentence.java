package com.ngramindex.text;

import java.util.List;

/**
 * 语料中的一个句子，id 从 1 开始按语料顺序编号。
 */
public record Sentence(int id, List<Token> tokens) {
    public Sentence {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens不能为null");
        }
        tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }
}
